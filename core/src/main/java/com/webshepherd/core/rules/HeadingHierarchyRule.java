package com.webshepherd.core.rules;

import com.webshepherd.core.document.HtmlDocument;
import com.webshepherd.core.document.HtmlElement;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.Severity;
import com.webshepherd.core.model.WcagLevel;

import java.util.List;

/**
 * 1.3.1 Info and Relationships: 헤딩 레벨 건너뛰기.
 * 첫 헤딩이 h1 이 아니면 1건, 이후 이전 레벨 +1 을 넘는 점프마다 1건.
 * 내려가는 건(h3 → h2) 문제 삼지 않는다.
 */
public final class HeadingHierarchyRule extends AbstractRule {

    public static final String CODE = "HEADING_SKIP_LEVEL";

    public HeadingHierarchyRule() {
        super(CODE, "1.3.1", WcagLevel.AA, Principle.UNDERSTANDABLE);
    }

    @Override
    public List<Finding> evaluate(HtmlDocument doc) {
        List<HtmlElement> headings = doc.headings();
        if (headings.isEmpty()) {
            return List.of(finding(Severity.WARNING,
                    "No heading elements found on page",
                    "Add heading structure (h1-h6) to organize content"));
        }

        int issues = 0;
        String first = null;
        int prev = 0;
        for (int i = 0; i < headings.size(); i++) {
            HtmlElement h = headings.get(i);
            int level = levelOf(h);
            boolean bad = (i == 0) ? level != 1 : level > prev + 1;
            if (bad && issues++ == 0) first = h.snippet();
            prev = level;
        }

        if (issues > 0) {
            return List.of(finding(Severity.WARNING,
                    "Heading hierarchy has " + issues + " issues",
                    "Use sequential heading levels (h1 -> h2 -> h3) without skipping",
                    first, issues));
        }
        return List.of(pass("Heading hierarchy is correct (" + headings.size() + " headings)"));
    }

    /** 태그명의 숫자(h3 → 3) */
    static int levelOf(HtmlElement h) {
        return h.tagName().charAt(1) - '0';
    }
}
