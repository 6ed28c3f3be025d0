package com.webshepherd.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 스캔 1회의 외부 결과 레코드(불변 스냅샷).
 *
 * 상태 전이는 새 인스턴스를 돌려준다: pending → toScanning → toComplete | toFailed.
 * 종료 상태에서의 전이는 IllegalStateException. 전이 호출은 ScanService만 한다.
 */
public final class ScanRecord {
    private final String scanId;
    private final String url;
    private final ScanStatus status;
    private final Double score;                 // COMPLETE 에서만 non-null
    private final List<Finding> findings;       // 룰 카탈로그 순서 → 룰 내부 방출 순서
    private final ScanSummary summary;          // COMPLETE 에서만 non-null
    private final Instant createdAt;
    private final Instant completedAt;          // 종료 상태에서만 non-null
    private final String errorMessage;          // FAILED 에서만 non-null

    private ScanRecord(String scanId, String url, ScanStatus status, Double score,
                       List<Finding> findings, ScanSummary summary,
                       Instant createdAt, Instant completedAt, String errorMessage) {
        this.scanId = scanId;
        this.url = url;
        this.status = status;
        this.score = score;
        this.findings = findings;
        this.summary = summary;
        this.createdAt = createdAt;
        this.completedAt = completedAt;
        this.errorMessage = errorMessage;
    }

    public static ScanRecord pending(String scanId, String url, Instant createdAt) {
        Objects.requireNonNull(scanId, "scanId");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(createdAt, "createdAt");
        return new ScanRecord(scanId, url, ScanStatus.PENDING, null, List.of(), null,
                createdAt, null, null);
    }

    public ScanRecord toScanning() {
        require(ScanStatus.PENDING, ScanStatus.SCANNING);
        return new ScanRecord(scanId, url, ScanStatus.SCANNING, null, List.of(), null,
                createdAt, null, null);
    }

    /** 점수/Finding/카운터/완료시각을 한 번에 기록한다. */
    public ScanRecord toComplete(List<Finding> findings, ScanSummary summary, Instant completedAt) {
        require(ScanStatus.SCANNING, ScanStatus.COMPLETE);
        Objects.requireNonNull(findings, "findings");
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(completedAt, "completedAt");
        if (summary.getTotalChecks() != findings.size()) {
            throw new IllegalArgumentException("summary.totalChecks(" + summary.getTotalChecks()
                    + ") != findings.size(" + findings.size() + ")");
        }
        return new ScanRecord(scanId, url, ScanStatus.COMPLETE, summary.getScore(),
                List.copyOf(findings), summary, createdAt, completedAt, null);
    }

    public ScanRecord toFailed(String errorMessage, Instant completedAt) {
        if (status.isTerminal()) {
            throw new IllegalStateException("scan " + scanId + " already " + status + "; cannot move to FAILED");
        }
        Objects.requireNonNull(completedAt, "completedAt");
        String msg = (errorMessage == null || errorMessage.isBlank()) ? "Scan failed" : errorMessage;
        return new ScanRecord(scanId, url, ScanStatus.FAILED, null, List.of(), null,
                createdAt, completedAt, msg);
    }

    private void require(ScanStatus from, ScanStatus to) {
        if (status != from) {
            throw new IllegalStateException("scan " + scanId + " is " + status + "; cannot move to " + to);
        }
    }

    // ----- getters -----
    public String getScanId() { return scanId; }
    public String getUrl() { return url; }
    public ScanStatus getStatus() { return status; }
    public Double getScore() { return score; }
    public List<Finding> getFindings() { return findings; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getCompletedAt() { return completedAt; }
    public String getErrorMessage() { return errorMessage; }

    public int getTotalChecks() { return summary == null ? 0 : summary.getTotalChecks(); }
    public int getPassedChecks() { return summary == null ? 0 : summary.getPassedChecks(); }
    public int getWarnings() { return summary == null ? 0 : summary.getWarnings(); }
    public int getFailures() { return summary == null ? 0 : summary.getFailures(); }

    public int getPerceivableIssues() { return issues(Principle.PERCEIVABLE); }
    public int getOperableIssues() { return issues(Principle.OPERABLE); }
    public int getUnderstandableIssues() { return issues(Principle.UNDERSTANDABLE); }
    public int getRobustIssues() { return issues(Principle.ROBUST); }

    private int issues(Principle p) { return summary == null ? 0 : summary.issuesFor(p); }

    /** completedAt - createdAt (ms). 종료 전이면 null. */
    public Long getDurationMs() {
        if (completedAt == null) return null;
        return Duration.between(createdAt, completedAt).toMillis();
    }

    @Override
    public String toString() {
        return "ScanRecord{" + scanId + ", " + url + ", " + status
                + (score != null ? ", score=" + score : "")
                + (errorMessage != null ? ", error=" + errorMessage : "") + "}";
    }
}
