package com.webshepherd.core.rules;

import com.webshepherd.core.document.HtmlDocument;
import com.webshepherd.core.document.HtmlElement;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.Severity;
import com.webshepherd.core.model.WcagLevel;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 3.3.2 Labels or Instructions
 * input/textarea/select 중 라벨이 없는 컨트롤을 센다. hidden/submit/button/reset 은 제외.
 */
public final class FormLabelRule extends AbstractRule {

    public static final String CODE = "FORM_LABEL_MISSING";

    private static final Set<String> SKIPPED_TYPES = Set.of("hidden", "submit", "button", "reset");

    public FormLabelRule() {
        super(CODE, "3.3.2", WcagLevel.AA, Principle.OPERABLE);
    }

    @Override
    public List<Finding> evaluate(HtmlDocument doc) {
        List<HtmlElement> inputs = doc.inputs();
        int unlabeled = 0;
        String first = null;
        for (HtmlElement in : inputs) {
            String type = in.attr("type").orElse("text").toLowerCase(Locale.ROOT);
            if (SKIPPED_TYPES.contains(type)) continue;
            if (isLabelled(doc, in)) continue;
            if (unlabeled++ == 0) first = in.snippet();
        }

        if (unlabeled > 0) {
            return List.of(finding(Severity.FAIL,
                    unlabeled + " form inputs missing labels",
                    "Add <label> elements with 'for' attribute, or use aria-label",
                    first, unlabeled));
        }
        if (!inputs.isEmpty()) {
            return List.of(pass("All " + inputs.size() + " form inputs have labels"));
        }
        return List.of(finding(Severity.PASS, "No form inputs found on page", "N/A - No inputs to check"));
    }

    static boolean isLabelled(HtmlDocument doc, HtmlElement in) {
        Optional<String> id = in.attr("id").filter(s -> !s.isEmpty());
        if (id.isPresent() && !doc.labelsFor(id.get()).isEmpty()) return true;

        Optional<HtmlElement> parent = in.parent();
        if (parent.isPresent() && "label".equals(parent.get().tagName())) return true;

        return in.hasNonBlankAttr("aria-label")
                || in.hasNonBlankAttr("aria-labelledby")
                || in.hasNonBlankAttr("title");
    }
}
