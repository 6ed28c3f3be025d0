package com.webshepherd.core.rules;

import com.webshepherd.core.document.HtmlDocument;
import com.webshepherd.core.document.HtmlElement;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.Severity;
import com.webshepherd.core.model.WcagLevel;

import java.util.ArrayList;
import java.util.List;

/** 2.4.6 Headings and Labels: h1 은 정확히 1개 */
public final class SingleH1Rule extends AbstractRule {

    public static final String CODE = "H1_MISSING_OR_MULTIPLE";

    public SingleH1Rule() {
        super(CODE, "2.4.6", WcagLevel.AA, Principle.UNDERSTANDABLE);
    }

    @Override
    public List<Finding> evaluate(HtmlDocument doc) {
        List<HtmlElement> h1s = doc.elementsByTag("h1");
        if (h1s.isEmpty()) {
            return List.of(finding(Severity.WARNING,
                    "No <h1> element found on page",
                    "Add a single <h1> element to serve as the main page heading"));
        }
        if (h1s.size() > 1) {
            List<String> texts = new ArrayList<>();
            for (HtmlElement h : h1s.subList(0, Math.min(3, h1s.size()))) {
                texts.add(clip(h.text(), 30));
            }
            return List.of(finding(Severity.WARNING,
                    "Multiple <h1> elements found (" + h1s.size() + "): " + String.join(", ", texts),
                    "Use only one <h1> per page for the main heading",
                    h1s.get(1).snippet(), h1s.size()));
        }
        return List.of(pass("Page has one <h1>: '" + clip(h1s.get(0).text(), 50) + "'"));
    }

    private static String clip(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
