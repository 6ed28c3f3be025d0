package com.webshepherd.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 스캔 설정 (scan.yml 매핑 대상). 순수 설정 보관용.
 * 전역 상태가 아니라 HtmlFetcher/ScanService 생성자에 값으로 넘긴다.
 */
public final class ScanConfig {

    public static final String DEFAULT_USER_AGENT =
            "WebShepherd/1.0 (WCAG Accessibility Checker; +https://yorik.space/webshepherd)";
    public static final String DEFAULT_ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    public static final String DEFAULT_ACCEPT_LANGUAGE = "en-US,en;q=0.9,de;q=0.8";

    private static final long MIB = 1024L * 1024L;

    // ---------- 페처 한도 ----------
    private Duration timeout = Duration.ofSeconds(10); // 리다이렉트 포함 전체 교환 벽시계 한도
    private int maxRedirects = 5;
    private long maxBodyBytes = 5 * MIB;
    private String userAgent = DEFAULT_USER_AGENT;
    private String acceptLanguage = DEFAULT_ACCEPT_LANGUAGE;

    // ---------- 실행/출력 ----------
    private int concurrency = 4;         // scanAll 동시 스캔 상한
    private Path outputDir = Path.of("out");

    // ---------- getters ----------
    public Duration getTimeout() { return timeout; }
    public int getMaxRedirects() { return maxRedirects; }
    public long getMaxBodyBytes() { return maxBodyBytes; }
    public String getUserAgent() { return userAgent; }
    public String getAcceptLanguage() { return acceptLanguage; }
    public int getConcurrency() { return concurrency; }
    public Path getOutputDir() { return outputDir; }

    // ---------- fluent setters (범위 검사는 validate) ----------
    public ScanConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public ScanConfig setMaxRedirects(int maxRedirects) { this.maxRedirects = maxRedirects; return this; }
    public ScanConfig setMaxBodyBytes(long maxBodyBytes) { this.maxBodyBytes = maxBodyBytes; return this; }
    public ScanConfig setMaxHtmlSizeMb(int mb) { this.maxBodyBytes = mb * MIB; return this; }
    public ScanConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public ScanConfig setAcceptLanguage(String acceptLanguage) { this.acceptLanguage = acceptLanguage; return this; }
    public ScanConfig setConcurrency(int concurrency) { this.concurrency = concurrency; return this; }
    public ScanConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }

    // ---------- validate ----------
    public void validate() {
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (maxRedirects < 0) throw new IllegalArgumentException("maxRedirects must be >= 0");
        if (maxBodyBytes < 1) throw new IllegalArgumentException("maxBodyBytes must be >= 1");
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("userAgent must not be blank");
        Objects.requireNonNull(acceptLanguage, "acceptLanguage");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        Objects.requireNonNull(outputDir, "outputDir");
    }

    // ---------- helpers ----------
    public static ScanConfig defaults() { return new ScanConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public ScanConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(ms);
        return this;
    }
}
