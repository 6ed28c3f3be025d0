package com.webshepherd.core.scanner;

import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.ScanSummary;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Finding 목록 → 카운터 + 점수.
 * score = ((passed + 0.5 * warnings) / total) * 100, 소수 1자리. total 0 이면 100.0.
 */
public final class ScoreAggregator {

    private ScoreAggregator() {}

    public static ScanSummary summarize(List<Finding> findings) {
        Objects.requireNonNull(findings, "findings");
        int passed = 0, warnings = 0, failures = 0;
        Map<Principle, Integer> byPrinciple = new EnumMap<>(Principle.class);
        for (Finding f : findings) {
            switch (f.getSeverity()) {
                case PASS -> passed++;
                case WARNING -> warnings++;
                case FAIL -> failures++;
            }
            if (f.getSeverity().isIssue()) {
                byPrinciple.merge(f.getPrinciple(), 1, Integer::sum);
            }
        }
        return new ScanSummary(passed, warnings, failures, score(passed, warnings, passed + warnings + failures), byPrinciple);
    }

    static double score(int passed, int warnings, int total) {
        if (total == 0) return 100.0;
        double raw = ((passed + 0.5 * warnings) / total) * 100;
        return round1(raw);
    }

    /** 이진값 그대로 half-even 반올림(소수 1자리) */
    public static double round1(double v) {
        return new BigDecimal(v).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
    }
}
