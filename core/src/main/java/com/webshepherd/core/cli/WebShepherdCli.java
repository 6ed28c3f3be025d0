package com.webshepherd.core.cli;

import com.webshepherd.core.model.ScanConfig;
import com.webshepherd.core.model.ScanRecord;
import com.webshepherd.core.model.ScanStatus;
import com.webshepherd.core.service.ScanService;
import com.webshepherd.core.service.ScanStatistics;
import com.webshepherd.core.service.export.JsonReportExporter;
import com.webshepherd.core.util.LoggingConfigurator;
import com.webshepherd.core.util.UrlGuard;
import com.webshepherd.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * 명령행 진입점.
 * <pre>
 * webshepherd [--config scan.yml] [--out dir] &lt;url&gt;...
 * </pre>
 * --config 가 없으면 현재 디렉터리의 scan.yml 을 (있을 때만) 읽는다.
 * 종료 코드: 0 모두 COMPLETE, 1 하나라도 거부/실패, 2 사용법 오류.
 */
public final class WebShepherdCli {

    private static final Logger LOG = LoggerFactory.getLogger(WebShepherdCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SCAN_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: webshepherd [--config scan.yml] [--out dir] <url>...";

    private WebShepherdCli() {}

    public static void main(String[] args) {
        LoggingConfigurator.init(Path.of("logs"), Level.INFO, 1_000_000, 3);
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        return run(args, out, err, ScanService::new, Path.of(""));
    }

    /** 서비스 팩토리와 작업 디렉터리 주입(테스트용). --config 가 없으면 workDir/scan.yml 을 찾는다. */
    static int run(String[] args, PrintStream out, PrintStream err,
                   Function<ScanConfig, ScanService> services, Path workDir) {
        Options opts;
        try {
            opts = Options.parse(args);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (opts.help) {
            out.println(USAGE);
            return EXIT_OK;
        }

        ScanConfig cfg;
        try {
            cfg = (opts.config != null) ? YamlConfigLoader.load(opts.config) : YamlConfigLoader.loadDefault(workDir);
            if (opts.outDir != null) cfg.setOutputDir(opts.outDir);
            cfg.validate();
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        boolean anyFailed = false;
        List<URI> targets = new ArrayList<>();
        for (String raw : opts.urls) {
            try {
                targets.add(UrlGuard.requirePublic(raw));
            } catch (IllegalArgumentException e) {
                err.println("REJECTED " + raw + ": " + e.getMessage());
                anyFailed = true;
            }
        }

        ScanService service = services.apply(cfg);
        List<ScanRecord> records = service.scanAll(targets);

        JsonReportExporter exporter = new JsonReportExporter();
        for (ScanRecord r : records) {
            String report;
            try {
                report = exporter.export(cfg.getOutputDir(), r).toString();
            } catch (IOException e) {
                LOG.warn("Report export failed for {}: {}", r.getScanId(), e.toString());
                report = "(export failed: " + e.getMessage() + ")";
                anyFailed = true;
            }
            out.println(summaryLine(r) + " -> " + report);
            if (r.getStatus() != ScanStatus.COMPLETE) anyFailed = true;
        }

        if (!records.isEmpty()) {
            ScanStatistics.Snapshot s = new ScanStatistics(Clock.systemUTC()).compute(service.getStore());
            out.println(String.format(Locale.ROOT, "Scanned %d, average score %.1f, common issues %s",
                    s.totalScans, s.averageScore, s.commonIssues));
        }
        return anyFailed ? EXIT_SCAN_FAILED : EXIT_OK;
    }

    static String summaryLine(ScanRecord r) {
        if (r.getStatus() == ScanStatus.COMPLETE) {
            return String.format(Locale.ROOT, "COMPLETE %s score=%.1f checks=%d pass=%d warn=%d fail=%d",
                    r.getUrl(), r.getScore(), r.getTotalChecks(), r.getPassedChecks(),
                    r.getWarnings(), r.getFailures());
        }
        return "FAILED " + r.getUrl() + " error=" + r.getErrorMessage();
    }

    // ---------- 인자 파싱 ----------

    static final class UsageException extends Exception {
        UsageException(String message) { super(message); }
    }

    static final class Options {
        Path config;
        Path outDir;
        boolean help;
        final List<String> urls = new ArrayList<>();

        static Options parse(String[] args) throws UsageException {
            Options o = new Options();
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "-h", "--help" -> o.help = true;
                    case "--config" -> o.config = Path.of(value(args, ++i, a));
                    case "--out" -> o.outDir = Path.of(value(args, ++i, a));
                    default -> {
                        if (a.startsWith("-")) throw new UsageException("Unknown option: " + a);
                        o.urls.add(a);
                    }
                }
            }
            if (!o.help && o.urls.isEmpty()) throw new UsageException("No URL specified");
            return o;
        }

        private static String value(String[] args, int i, String opt) throws UsageException {
            if (i >= args.length || args[i].startsWith("--")) {
                throw new UsageException("Missing value for " + opt);
            }
            return args[i];
        }
    }
}
