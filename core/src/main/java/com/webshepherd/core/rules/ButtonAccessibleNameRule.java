package com.webshepherd.core.rules;

import com.webshepherd.core.document.HtmlDocument;
import com.webshepherd.core.document.HtmlElement;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.Severity;
import com.webshepherd.core.model.WcagLevel;

import java.util.List;

/** 4.1.2 Name, Role, Value: 버튼의 접근 가능한 이름 */
public final class ButtonAccessibleNameRule extends AbstractRule {

    public static final String CODE = "BUTTON_NAME_MISSING";

    public ButtonAccessibleNameRule() {
        super(CODE, "4.1.2", WcagLevel.AA, Principle.OPERABLE);
    }

    @Override
    public List<Finding> evaluate(HtmlDocument doc) {
        List<HtmlElement> buttons = doc.buttons();
        int unnamed = 0;
        String first = null;
        for (HtmlElement b : buttons) {
            if (hasName(b)) continue;
            if (unnamed++ == 0) first = b.snippet();
        }

        if (unnamed > 0) {
            return List.of(finding(Severity.FAIL,
                    unnamed + " buttons missing accessible names",
                    "Add text content, value, aria-label, or title to buttons",
                    first, unnamed));
        }
        if (!buttons.isEmpty()) {
            return List.of(pass("All " + buttons.size() + " buttons have accessible names"));
        }
        return List.of(finding(Severity.PASS, "No buttons found on page", "N/A - No buttons to check"));
    }

    static boolean hasName(HtmlElement b) {
        return !b.text().isEmpty()
                || b.hasNonBlankAttr("value")
                || b.hasNonBlankAttr("aria-label")
                || b.hasNonBlankAttr("aria-labelledby")
                || b.hasNonBlankAttr("title");
    }
}
