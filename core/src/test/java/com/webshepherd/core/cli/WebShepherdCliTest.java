package com.webshepherd.core.cli;

import com.webshepherd.core.api.IFetcher;
import com.webshepherd.core.http.FetchException;
import com.webshepherd.core.http.FetchFailure;
import com.webshepherd.core.model.FetchedPage;
import com.webshepherd.core.model.ScanConfig;
import com.webshepherd.core.service.InMemoryScanRecordStore;
import com.webshepherd.core.service.ScanService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class WebShepherdCliTest {

    static final String PAGE = "<html lang=en><head><title>Example shop</title></head><body>"
            + "<h1>Shop</h1><img src=a.png></body></html>";

    @TempDir Path tmp;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBuf, true, StandardCharsets.UTF_8);
    private final PrintStream err = new PrintStream(errBuf, true, StandardCharsets.UTF_8);

    /** example.com 은 페이지, 그 외 호스트는 네트워크 오류 */
    static final IFetcher FAKE = url -> {
        if (!"example.com".equals(url.getHost())) {
            throw new FetchException(FetchFailure.NETWORK_ERROR, "Connection refused");
        }
        return FetchedPage.builder().requestedUrl(url).finalUrl(url).statusCode(200)
                .contentType("text/html").body(PAGE).bodyBytes(PAGE.length()).build();
    };

    static final Function<ScanConfig, ScanService> SERVICES =
            cfg -> new ScanService(cfg, FAKE, new InMemoryScanRecordStore());

    private int run(String... args) {
        return WebShepherdCli.run(args, out, err, SERVICES, tmp.resolve("work"));
    }

    private String stdout() { return outBuf.toString(StandardCharsets.UTF_8); }
    private String stderr() { return errBuf.toString(StandardCharsets.UTF_8); }

    @Test
    void help_prints_usage() {
        assertThat(run("--help")).isEqualTo(WebShepherdCli.EXIT_OK);
        assertThat(stdout()).contains("Usage:");
    }

    @Test
    void usage_errors_exit_two() {
        assertThat(run()).isEqualTo(WebShepherdCli.EXIT_USAGE);
        assertThat(stderr()).contains("No URL specified");

        assertThat(run("--bogus", "https://example.com/")).isEqualTo(WebShepherdCli.EXIT_USAGE);
        assertThat(run("--out")).isEqualTo(WebShepherdCli.EXIT_USAGE);
        assertThat(stderr()).contains("Unknown option: --bogus").contains("Missing value for --out");
    }

    @Test
    void missing_config_file_is_a_usage_error() {
        assertThat(run("--config", tmp.resolve("none.yml").toString(), "https://example.com/"))
                .isEqualTo(WebShepherdCli.EXIT_USAGE);
        assertThat(stderr()).contains("not found");
    }

    @Test
    void successful_scan_writes_report_and_summary() throws Exception {
        int code = run("--out", tmp.toString(), "https://example.com/");

        assertThat(code).isEqualTo(WebShepherdCli.EXIT_OK);
        assertThat(stdout()).contains("COMPLETE https://example.com/ score=")
                .contains("checks=10")
                .contains("Scanned 1, average score")
                .contains("IMG_ALT_MISSING=1");
        try (Stream<Path> files = Files.list(tmp.resolve("reports").resolve("example.com"))) {
            assertThat(files).singleElement().satisfies(p ->
                    assertThat(p.getFileName().toString()).startsWith("scan-example.com-").endsWith(".json"));
        }
    }

    @Test
    void rejected_and_failed_targets_exit_one() {
        int code = run("--out", tmp.toString(), "http://192.168.1.1/", "https://offline.test/", "https://example.com/");

        assertThat(code).isEqualTo(WebShepherdCli.EXIT_SCAN_FAILED);
        assertThat(stderr()).contains("REJECTED http://192.168.1.1/: Cannot scan localhost or private IP addresses");
        assertThat(stdout()).contains("FAILED https://offline.test/ error=Connection refused")
                .contains("COMPLETE https://example.com/");
    }

    @Test
    void scan_yml_in_the_working_directory_is_used_without_config_flag() throws Exception {
        Path work = Files.createDirectories(tmp.resolve("work"));
        Path outDir = tmp.resolve("yml-out");
        Files.writeString(work.resolve("scan.yml"), "concurrency: 1\noutput:\n  dir: \"" + outDir + "\"\n");

        int code = run("https://example.com/");

        assertThat(code).isEqualTo(WebShepherdCli.EXIT_OK);
        assertThat(outDir.resolve("reports").resolve("example.com")).isDirectory();
    }

    @Test
    void invalid_scan_yml_in_the_working_directory_is_a_usage_error() throws Exception {
        Path work = Files.createDirectories(tmp.resolve("work"));
        Files.writeString(work.resolve("scan.yml"), "concurrency: -2\n");

        assertThat(run("https://example.com/")).isEqualTo(WebShepherdCli.EXIT_USAGE);
        assertThat(stderr()).contains("concurrency");
    }
}
