package com.webshepherd.core.rules;

import com.webshepherd.core.document.HtmlDocument;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.Severity;
import com.webshepherd.core.model.WcagLevel;

import java.util.List;
import java.util.Optional;

/**
 * 2.4.2 Page Titled
 * 없음/공백 → Fail, trim 후 3자 미만 → Warning.
 */
public final class PageTitleRule extends AbstractRule {

    public static final String CODE = "PAGE_TITLE_MISSING";
    static final int MIN_LENGTH = 3;

    public PageTitleRule() {
        super(CODE, "2.4.2", WcagLevel.AA, Principle.OPERABLE);
    }

    @Override
    public List<Finding> evaluate(HtmlDocument doc) {
        Optional<String> title = doc.title();
        if (title.isEmpty()) {
            return List.of(finding(Severity.FAIL,
                    "Page has no <title> element",
                    "Add a descriptive <title> element in the <head> section"));
        }
        String t = title.get();
        if (t.isEmpty()) {
            return List.of(finding(Severity.FAIL,
                    "Page title is empty",
                    "Provide a descriptive, meaningful page title",
                    "<title></title>", 1));
        }
        if (t.length() < MIN_LENGTH) {
            return List.of(finding(Severity.WARNING,
                    "Page title is very short: '" + t + "'",
                    "Provide a more descriptive page title (at least a few words)",
                    "<title>" + t + "</title>", 1));
        }
        return List.of(pass("Page has title: '" + t + "'"));
    }
}
