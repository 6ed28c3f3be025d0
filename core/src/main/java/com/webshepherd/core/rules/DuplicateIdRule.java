package com.webshepherd.core.rules;

import com.webshepherd.core.document.HtmlDocument;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.Severity;
import com.webshepherd.core.model.WcagLevel;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * 4.1.1 Parsing: id 중복.
 * 중복된 값마다 1회만 센다(같은 id 가 5번 나와도 count 1).
 */
public final class DuplicateIdRule extends AbstractRule {

    public static final String CODE = "DUPLICATE_ID";
    static final int MAX_LISTED = 5;

    public DuplicateIdRule() {
        super(CODE, "4.1.1", WcagLevel.AA, Principle.ROBUST);
    }

    @Override
    public List<Finding> evaluate(HtmlDocument doc) {
        List<String> ids = doc.allIds();
        Set<String> seen = new HashSet<>();
        Set<String> dups = new LinkedHashSet<>(); // 처음 중복된 순서
        for (String id : ids) {
            if (!seen.add(id)) dups.add(id);
        }

        if (!dups.isEmpty()) {
            StringJoiner listed = new StringJoiner(", ");
            int n = 0;
            for (String d : dups) {
                if (n++ == MAX_LISTED) break;
                listed.add("'" + d + "'");
            }
            return List.of(finding(Severity.FAIL,
                    dups.size() + " duplicate IDs found: " + listed,
                    "Ensure all ID attributes are unique within the document",
                    null, dups.size()));
        }
        if (!ids.isEmpty()) {
            return List.of(pass("All " + ids.size() + " IDs are unique"));
        }
        return List.of(finding(Severity.PASS, "No ID attributes found", "N/A - No IDs to check"));
    }
}
