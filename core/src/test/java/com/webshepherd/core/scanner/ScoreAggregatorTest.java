package com.webshepherd.core.scanner;

import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.ScanSummary;
import com.webshepherd.core.model.Severity;
import com.webshepherd.core.model.WcagLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreAggregatorTest {

    static Finding f(Severity s, Principle p) {
        return Finding.builder().ruleCode("R").severity(s).message("m").remediation("r")
                .wcagReference("1.1.1").wcagLevel(WcagLevel.AA).principle(p).build();
    }

    @Test
    void no_findings_is_a_vacuous_hundred() {
        ScanSummary s = ScoreAggregator.summarize(List.of());

        assertThat(s.getScore()).isEqualTo(100.0);
        assertThat(s.getTotalChecks()).isZero();
        assertThat(s.getPrincipleIssues()).containsOnlyKeys(Principle.values()).allSatisfy((k, v) -> assertThat(v).isZero());
    }

    @Test
    void warnings_earn_half_credit_failures_none() {
        List<Finding> fs = List.of(
                f(Severity.PASS, Principle.PERCEIVABLE),
                f(Severity.PASS, Principle.OPERABLE),
                f(Severity.WARNING, Principle.OPERABLE),
                f(Severity.FAIL, Principle.ROBUST));

        ScanSummary s = ScoreAggregator.summarize(fs);

        assertThat(s.getScore()).isEqualTo(62.5);
        assertThat(s.getPassedChecks()).isEqualTo(2);
        assertThat(s.getWarnings()).isEqualTo(1);
        assertThat(s.getFailures()).isEqualTo(1);
        assertThat(s.getTotalChecks()).isEqualTo(4);
    }

    @Test
    void principle_counters_ignore_passes() {
        ScanSummary s = ScoreAggregator.summarize(List.of(
                f(Severity.PASS, Principle.ROBUST),
                f(Severity.WARNING, Principle.UNDERSTANDABLE),
                f(Severity.FAIL, Principle.UNDERSTANDABLE),
                f(Severity.FAIL, Principle.PERCEIVABLE)));

        assertThat(s.issuesFor(Principle.ROBUST)).isZero();
        assertThat(s.issuesFor(Principle.UNDERSTANDABLE)).isEqualTo(2);
        assertThat(s.issuesFor(Principle.PERCEIVABLE)).isEqualTo(1);
        assertThat(s.issuesFor(Principle.OPERABLE)).isZero();
    }

    @Test
    void score_rounds_to_one_decimal() {
        // 2/3 → 66.666.. → 66.7
        assertThat(ScoreAggregator.score(2, 0, 3)).isEqualTo(66.7);
        // (7 + 1.5)/11 → 77.2727.. → 77.3
        assertThat(ScoreAggregator.score(7, 3, 11)).isEqualTo(77.3);
        assertThat(ScoreAggregator.score(0, 0, 5)).isEqualTo(0.0);
        assertThat(ScoreAggregator.score(0, 1, 1)).isEqualTo(50.0);
    }

    @Test
    void half_even_on_the_exact_binary_value() {
        // 0.25 은 이진수로 정확 → 짝수 쪽(0.2)
        assertThat(ScoreAggregator.round1(0.25)).isEqualTo(0.2);
        assertThat(ScoreAggregator.round1(0.35)).isEqualTo(0.3); // 0.35 ≈ 0.34999...
        assertThat(ScoreAggregator.round1(87.55)).isEqualTo(87.5); // 87.55 ≈ 87.549999...
    }

    @Test
    void score_stays_in_range_for_any_mix() {
        for (int p = 0; p <= 6; p++) {
            for (int w = 0; w <= 6; w++) {
                for (int x = 0; x <= 6; x++) {
                    List<Finding> fs = new ArrayList<>();
                    for (int i = 0; i < p; i++) fs.add(f(Severity.PASS, Principle.ROBUST));
                    for (int i = 0; i < w; i++) fs.add(f(Severity.WARNING, Principle.ROBUST));
                    for (int i = 0; i < x; i++) fs.add(f(Severity.FAIL, Principle.ROBUST));
                    ScanSummary s = ScoreAggregator.summarize(fs);
                    assertThat(s.getScore()).isBetween(0.0, 100.0);
                    assertThat(s.getPassedChecks() + s.getWarnings() + s.getFailures()).isEqualTo(fs.size());
                }
            }
        }
    }
}
