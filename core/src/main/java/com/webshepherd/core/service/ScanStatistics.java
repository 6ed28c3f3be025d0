package com.webshepherd.core.service;

import com.webshepherd.core.api.ScanRecordStore;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.ScanRecord;
import com.webshepherd.core.scanner.ScoreAggregator;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 저장된 레코드로부터 전체 통계를 계산한다(룰 재실행 없음).
 * 흔한 이슈는 Warning/Fail Finding 건수 기준이며 Finding.count 로 가중하지 않는다.
 */
public final class ScanStatistics {

    /** 흔한 이슈 상위 N */
    public static final int TOP_ISSUES = 10;

    private final Clock clock;

    public ScanStatistics(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Snapshot compute(ScanRecordStore store) {
        return compute(store.findAll());
    }

    public Snapshot compute(Collection<ScanRecord> records) {
        Objects.requireNonNull(records, "records");
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));

        int total = records.size();
        int todayCount = 0;
        double scoreSum = 0;
        int scored = 0;
        Map<String, Integer> issues = new HashMap<>();

        for (ScanRecord r : records) {
            if (r.getCreatedAt().atZone(ZoneOffset.UTC).toLocalDate().equals(today)) todayCount++;
            if (r.getScore() != null) {
                scoreSum += r.getScore();
                scored++;
            }
            for (Finding f : r.getFindings()) {
                if (f.getSeverity().isIssue()) issues.merge(f.getRuleCode(), 1, Integer::sum);
            }
        }

        double avg = scored == 0 ? 0.0 : ScoreAggregator.round1(scoreSum / scored);

        List<IssueCount> common = new ArrayList<>(issues.size());
        issues.forEach((code, n) -> common.add(new IssueCount(code, n)));
        common.sort(Comparator.comparingInt((IssueCount c) -> c.count).reversed()
                .thenComparing(c -> c.ruleCode));

        return new Snapshot(total, todayCount, avg,
                List.copyOf(common.subList(0, Math.min(TOP_ISSUES, common.size()))));
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final int totalScans;
        public final int scansToday;
        public final double averageScore;
        public final List<IssueCount> commonIssues;

        public Snapshot(int totalScans, int scansToday, double averageScore, List<IssueCount> commonIssues) {
            this.totalScans = totalScans;
            this.scansToday = scansToday;
            this.averageScore = averageScore;
            this.commonIssues = commonIssues;
        }
    }

    public static final class IssueCount {
        public final String ruleCode;
        public final int count;

        public IssueCount(String ruleCode, int count) {
            this.ruleCode = ruleCode;
            this.count = count;
        }

        @Override
        public String toString() { return ruleCode + "=" + count; }
    }
}
