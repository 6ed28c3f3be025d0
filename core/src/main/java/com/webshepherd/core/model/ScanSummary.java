package com.webshepherd.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Finding 집계 결과(카운터 + 점수). 불변. */
public final class ScanSummary {
    private final int totalChecks;
    private final int passedChecks;
    private final int warnings;
    private final int failures;
    private final double score;
    private final Map<Principle, Integer> principleIssues;

    public ScanSummary(int passedChecks, int warnings, int failures, double score,
                       Map<Principle, Integer> principleIssues) {
        this.passedChecks = passedChecks;
        this.warnings = warnings;
        this.failures = failures;
        this.totalChecks = passedChecks + warnings + failures;
        this.score = score;
        EnumMap<Principle, Integer> copy = new EnumMap<>(Principle.class);
        for (Principle p : Principle.values()) {
            Integer v = (principleIssues == null ? null : principleIssues.get(p));
            copy.put(p, v == null ? 0 : v);
        }
        this.principleIssues = Collections.unmodifiableMap(copy);
    }

    public int getTotalChecks() { return totalChecks; }
    public int getPassedChecks() { return passedChecks; }
    public int getWarnings() { return warnings; }
    public int getFailures() { return failures; }
    public double getScore() { return score; }

    /** 네 원칙 모두 키로 존재(0 포함). */
    public Map<Principle, Integer> getPrincipleIssues() { return principleIssues; }

    public int issuesFor(Principle p) { return principleIssues.get(p); }
}
