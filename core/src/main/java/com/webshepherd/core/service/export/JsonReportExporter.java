package com.webshepherd.core.service.export;

import static com.webshepherd.core.service.export.ReportNaming.context;
import static com.webshepherd.core.service.export.ReportNaming.jsonPath;
import static com.webshepherd.core.service.export.ReportNaming.reportsDir;
import static com.webshepherd.core.util.Json.quote;

import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.ScanRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

/**
 * 스캔 레코드 JSON Exporter.
 * 필드명은 snake_case, 시각은 ISO-8601(UTC). 값은 레코드 그대로 옮기고 다시 계산하지 않는다.
 */
public class JsonReportExporter implements ReportExporter {

    @Override
    public Path export(Path baseDir, ScanRecord record) throws IOException {
        var ctx = context(baseDir, record.getUrl(), record.getCreatedAt());
        Files.createDirectories(reportsDir(ctx));
        Path outFile = jsonPath(ctx);

        Files.writeString(outFile, toJson(record), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return outFile;
    }

    public String toJson(ScanRecord r) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("{\n")
          .append("  \"scan_id\": ").append(quote(r.getScanId())).append(",\n")
          .append("  \"url\": ").append(quote(r.getUrl())).append(",\n")
          .append("  \"status\": ").append(quote(r.getStatus().wireName())).append(",\n")
          .append("  \"score\": ").append(r.getScore() == null ? "null" : String.valueOf(r.getScore())).append(",\n")
          .append("  \"total_checks\": ").append(r.getTotalChecks()).append(",\n")
          .append("  \"passed_checks\": ").append(r.getPassedChecks()).append(",\n")
          .append("  \"warnings\": ").append(r.getWarnings()).append(",\n")
          .append("  \"failures\": ").append(r.getFailures()).append(",\n")
          .append("  \"perceivable_issues\": ").append(r.getPerceivableIssues()).append(",\n")
          .append("  \"operable_issues\": ").append(r.getOperableIssues()).append(",\n")
          .append("  \"understandable_issues\": ").append(r.getUnderstandableIssues()).append(",\n")
          .append("  \"robust_issues\": ").append(r.getRobustIssues()).append(",\n")
          .append("  \"created_at\": ").append(iso(r.getCreatedAt())).append(",\n")
          .append("  \"completed_at\": ").append(iso(r.getCompletedAt())).append(",\n")
          .append("  \"scan_duration_ms\": ").append(r.getDurationMs() == null ? "null" : String.valueOf(r.getDurationMs())).append(",\n")
          .append("  \"error_message\": ").append(quote(r.getErrorMessage())).append(",\n");

        // findings
        List<Finding> findings = r.getFindings();
        sb.append("  \"findings\": [");
        if (!findings.isEmpty()) sb.append('\n');
        for (int i = 0; i < findings.size(); i++) {
            sb.append("    ").append(finding(findings.get(i)));
            if (i < findings.size() - 1) sb.append(",");
            sb.append("\n");
        }
        if (!findings.isEmpty()) sb.append("  ");
        sb.append("]\n");

        sb.append("}\n");
        return sb.toString();
    }

    private static String finding(Finding f) {
        return new StringBuilder(256)
            .append("{")
            .append("\"rule_code\": ").append(quote(f.getRuleCode())).append(", ")
            .append("\"severity\": ").append(quote(f.getSeverity().wireName())).append(", ")
            .append("\"message\": ").append(quote(f.getMessage())).append(", ")
            .append("\"element\": ").append(quote(f.getElement())).append(", ")
            .append("\"wcag_reference\": ").append(quote(f.getWcagReference())).append(", ")
            .append("\"wcag_level\": ").append(quote(f.getWcagLevel().name())).append(", ")
            .append("\"principle\": ").append(quote(f.getPrinciple().displayName())).append(", ")
            .append("\"remediation\": ").append(quote(f.getRemediation())).append(", ")
            .append("\"count\": ").append(f.getCount())
            .append("}")
            .toString();
    }

    private static String iso(Instant t) {
        return t == null ? "null" : quote(t.toString());
    }
}
