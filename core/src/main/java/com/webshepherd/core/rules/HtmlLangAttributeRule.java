package com.webshepherd.core.rules;

import com.webshepherd.core.document.HtmlDocument;
import com.webshepherd.core.document.HtmlElement;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.Severity;
import com.webshepherd.core.model.WcagLevel;

import java.util.List;
import java.util.Optional;

/** 3.1.1 Language of Page */
public final class HtmlLangAttributeRule extends AbstractRule {

    public static final String CODE = "HTML_LANG_MISSING";

    public HtmlLangAttributeRule() {
        super(CODE, "3.1.1", WcagLevel.AA, Principle.UNDERSTANDABLE);
    }

    @Override
    public List<Finding> evaluate(HtmlDocument doc) {
        Optional<HtmlElement> html = doc.htmlElement();
        if (html.isEmpty()) {
            return List.of(finding(Severity.FAIL,
                    "No <html> tag found",
                    "Ensure document has a valid <html> tag with lang attribute"));
        }
        String lang = html.get().attr("lang").orElse("");
        if (lang.isEmpty()) {
            return List.of(finding(Severity.FAIL,
                    "<html> tag missing lang attribute",
                    "Add lang attribute to <html> tag (e.g., <html lang='en'>)",
                    html.get().snippet(), 1));
        }
        return List.of(pass("Page language is set to '" + lang + "'"));
    }
}
