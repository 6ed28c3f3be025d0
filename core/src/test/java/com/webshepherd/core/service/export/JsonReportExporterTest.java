package com.webshepherd.core.service.export;

import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.ScanRecord;
import com.webshepherd.core.model.Severity;
import com.webshepherd.core.model.WcagLevel;
import com.webshepherd.core.scanner.ScoreAggregator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReportExporterTest {

    static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir Path tmp;

    static ScanRecord completed() {
        List<Finding> fs = List.of(
                Finding.builder().ruleCode("IMG_ALT_MISSING").severity(Severity.FAIL)
                        .message("2 images missing alt attribute").remediation("Add alt")
                        .element("<img src=\"a.png\">").wcagReference("1.1.1").wcagLevel(WcagLevel.AA)
                        .principle(Principle.PERCEIVABLE).count(2).build(),
                Finding.builder().ruleCode("HTML_LANG_MISSING").severity(Severity.PASS)
                        .message("Page language is set to 'en'").remediation("N/A - Check passed")
                        .wcagReference("3.1.1").wcagLevel(WcagLevel.AA).principle(Principle.UNDERSTANDABLE).build());
        return ScanRecord.pending("abc123def456", "https://example.com/", T0).toScanning()
                .toComplete(fs, ScoreAggregator.summarize(fs), T0.plusMillis(420));
    }

    @Test
    void complete_record_json_carries_counters_and_findings() {
        String json = new JsonReportExporter().toJson(completed());

        assertThat(json)
                .contains("\"scan_id\": \"abc123def456\"")
                .contains("\"status\": \"complete\"")
                .contains("\"score\": 50.0")
                .contains("\"total_checks\": 2")
                .contains("\"perceivable_issues\": 1")
                .contains("\"understandable_issues\": 0")
                .contains("\"created_at\": \"2026-03-01T10:00:00Z\"")
                .contains("\"scan_duration_ms\": 420")
                .contains("\"error_message\": null")
                .contains("\"element\": \"<img src=\\\"a.png\\\">\"")
                .contains("\"principle\": \"Perceivable\"")
                .contains("\"wcag_level\": \"AA\"")
                .contains("\"count\": 2");
        assertThat(json.indexOf("IMG_ALT_MISSING")).isLessThan(json.indexOf("HTML_LANG_MISSING"));
        assertThat(json.indexOf("\"scan_id\"")).isLessThan(json.indexOf("\"findings\""));
    }

    @Test
    void failed_record_json_has_null_score_and_empty_findings() {
        ScanRecord failed = ScanRecord.pending("f", "https://example.com/", T0).toScanning()
                .toFailed("Request timed out", T0.plusSeconds(10));

        String json = new JsonReportExporter().toJson(failed);

        assertThat(json)
                .contains("\"status\": \"failed\"")
                .contains("\"score\": null")
                .contains("\"error_message\": \"Request timed out\"")
                .contains("\"findings\": []");
    }

    @Test
    void export_writes_under_reports_host_dir() throws Exception {
        Path out = new JsonReportExporter().export(tmp, completed());

        assertThat(out).isEqualTo(tmp.resolve("reports").resolve("example.com")
                .resolve("scan-example.com-20260301-100000.json"));
        assertThat(Files.readString(out, StandardCharsets.UTF_8)).startsWith("{").contains("abc123def456");
    }
}
