package com.webshepherd.core.service.export;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** 보고서 경로 규칙: <base>/reports/<host>/scan-<slug>-<ts>.json */
public final class ReportNaming {

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private ReportNaming() {}

    public static ReportContext context(Path baseDir, String target, Instant startedAt) {
        Path out = (baseDir == null ? Paths.get("out") : baseDir);
        return new ReportContext(out, extractHost(target), makeSlug(target),
                startedAt == null ? Instant.now() : startedAt);
    }

    public static String timestamp(ReportContext ctx) { return TS_FMT.format(ctx.startedAt()); }
    public static Path reportsDir(ReportContext ctx) { return ctx.baseDir().resolve("reports").resolve(ctx.host()); }
    public static Path jsonPath(ReportContext ctx) { return reportsDir(ctx).resolve(filePrefix(ctx) + ".json"); }

    public static String filePrefix(ReportContext ctx) {
        return "scan-" + ctx.slug() + "-" + timestamp(ctx);
    }

    public record ReportContext(Path baseDir, String host, String slug, Instant startedAt) {}

    // ===== helpers =====
    static String extractHost(String target) {
        try {
            String h = URI.create(target).getHost();
            return (h == null ? "unknown-host" : h.toLowerCase(Locale.ROOT)).replaceAll("[^a-z0-9._-]", "-");
        } catch (IllegalArgumentException | NullPointerException e) {
            return "unknown-host";
        }
    }

    static String makeSlug(String url) {
        if (url == null || url.isBlank()) return "no-url";
        String s = url.toLowerCase(Locale.ROOT).replaceFirst("^https?://", "");
        s = s.replaceAll("[^a-z0-9._/-]", "-").replaceAll("-{2,}", "-");
        if (s.length() > 60) s = s.substring(0, 60);
        s = s.replace('/', '-').replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "no-url" : s;
    }
}
