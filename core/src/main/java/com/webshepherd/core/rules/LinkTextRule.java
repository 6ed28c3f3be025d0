package com.webshepherd.core.rules;

import com.webshepherd.core.document.HtmlDocument;
import com.webshepherd.core.document.HtmlElement;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.Severity;
import com.webshepherd.core.model.WcagLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 2.4.4 Link Purpose (In Context)
 * - 유효 텍스트 = 자체 텍스트 → aria-label → 내부 첫 img 의 alt (각각 trim).
 * - 유효 텍스트 없음 → Fail, 모호한 문구와 정확히 일치(소문자) → Warning.
 * 둘 다 있으면 Fail, Warning 순으로 2건.
 */
public final class LinkTextRule extends AbstractRule {

    public static final String CODE = "LINK_TEXT_EMPTY";

    static final Set<String> VAGUE_TEXTS = Set.of("click here", "read more", "more", "here", "link");

    public LinkTextRule() {
        super(CODE, "2.4.4", WcagLevel.AA, Principle.OPERABLE);
    }

    @Override
    public List<Finding> evaluate(HtmlDocument doc) {
        List<HtmlElement> links = doc.links();
        int empty = 0, vague = 0;
        String firstEmpty = null, firstVague = null;

        for (HtmlElement a : links) {
            String text = effectiveText(a);
            if (text.isEmpty()) {
                if (empty++ == 0) firstEmpty = a.snippet();
            } else if (VAGUE_TEXTS.contains(text.toLowerCase(Locale.ROOT))) {
                if (vague++ == 0) firstVague = a.snippet();
            }
        }

        List<Finding> out = new ArrayList<>(2);
        if (empty > 0) {
            out.add(finding(Severity.FAIL,
                    empty + " links have no text or accessible name",
                    "Add descriptive text or aria-label to links",
                    firstEmpty, empty));
        }
        if (vague > 0) {
            out.add(finding(Severity.WARNING,
                    vague + " links have vague text (e.g., 'click here')",
                    "Use descriptive link text that makes sense out of context",
                    firstVague, vague));
        }
        if (!out.isEmpty()) return List.copyOf(out);

        if (!links.isEmpty()) {
            return List.of(pass("All " + links.size() + " links have meaningful text"));
        }
        return List.of(finding(Severity.PASS, "No links found on page", "N/A - No links to check"));
    }

    static String effectiveText(HtmlElement a) {
        String own = a.text();
        if (!own.isEmpty()) return own;
        String aria = a.attr("aria-label").orElse("").trim();
        if (!aria.isEmpty()) return aria;
        return a.firstDescendant("img")
                .flatMap(img -> img.attr("alt"))
                .map(String::trim)
                .orElse("");
    }
}
