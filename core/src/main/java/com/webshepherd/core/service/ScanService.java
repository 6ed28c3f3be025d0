package com.webshepherd.core.service;

import com.webshepherd.core.api.IFetcher;
import com.webshepherd.core.api.ScanRecordStore;
import com.webshepherd.core.document.DocumentParseException;
import com.webshepherd.core.document.HtmlDocument;
import com.webshepherd.core.document.HtmlParser;
import com.webshepherd.core.http.FetchException;
import com.webshepherd.core.http.HtmlFetcher;
import com.webshepherd.core.model.FetchedPage;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.ScanConfig;
import com.webshepherd.core.model.ScanRecord;
import com.webshepherd.core.model.ScanSummary;
import com.webshepherd.core.rules.RuleCatalogue;
import com.webshepherd.core.scanner.RuleEngine;
import com.webshepherd.core.scanner.RuleEvaluationException;
import com.webshepherd.core.scanner.ScoreAggregator;
import com.webshepherd.core.util.ProgressListener;
import com.webshepherd.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 스캔 오케스트레이터:
 *  - fetch → parse → rules → aggregate → 레코드 확정
 *  - 레코드 상태 전이와 저장소 쓰기는 여기서만 한다
 *  - 하위 컴포넌트의 모든 예외는 FAILED 레코드로 바뀐다(호출자에게 던지지 않음)
 *  - DI 생성자는 테스트 주입용
 */
public final class ScanService {

    private static final Logger LOG = LoggerFactory.getLogger(ScanService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanService.class);

    private final ScanConfig config;
    private final IFetcher fetcher;
    private final HtmlParser parser;
    private final RuleCatalogue catalogue;
    private final RuleEngine engine = new RuleEngine();
    private final ScanRecordStore store;
    private final Clock clock;
    private final Supplier<String> ids;

    /** 기본 구현 */
    public ScanService(ScanConfig config) {
        this(config, new HtmlFetcher(config), new InMemoryScanRecordStore());
    }

    public ScanService(ScanConfig config, IFetcher fetcher, ScanRecordStore store) {
        this(config, fetcher, new HtmlParser(), RuleCatalogue.defaults(), store,
                Clock.systemUTC(), ScanService::newScanId);
    }

    /** DI/테스트용 */
    public ScanService(ScanConfig config, IFetcher fetcher, HtmlParser parser, RuleCatalogue catalogue,
                       ScanRecordStore store, Clock clock, Supplier<String> ids) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.catalogue = Objects.requireNonNull(catalogue, "catalogue");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    /** UUID 앞 12자(하이픈 제외 hex) */
    static String newScanId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    /* =========================
       단건 스캔
       ========================= */

    /**
     * URL 하나를 스캔해 종료 상태(COMPLETE/FAILED) 레코드를 돌려준다.
     * URL 검증(스킴/사설 IP)은 호출자 책임.
     */
    public ScanRecord scan(URI url) {
        Objects.requireNonNull(url, "url");
        // 가장 최근의 비종료 스냅샷. 실패 전이는 항상 여기서 출발한다.
        ScanRecord live = ScanRecord.pending(ids.get(), url.toString(), clock.instant());

        try {
            store.save(live);
            live = live.toScanning();
            store.save(live);
            LOG.info("Scan start: id={}, url={}", live.getScanId(), url);
            SLOG.info("scan-start", "scanId", live.getScanId(), "url", url.toString());

            FetchedPage page = fetcher.fetch(url);
            HtmlDocument doc = parser.parse(page.getBody());
            List<Finding> findings = engine.run(catalogue, doc);
            ScanSummary summary = ScoreAggregator.summarize(findings);

            ScanRecord done = live.toComplete(findings, summary, clock.instant());
            store.save(done);
            LOG.info("Scan complete: id={}, score={}, checks={}, warnings={}, failures={}",
                    done.getScanId(), done.getScore(), done.getTotalChecks(), done.getWarnings(), done.getFailures());
            SLOG.info("scan-complete",
                    "scanId", done.getScanId(),
                    "score", done.getScore(),
                    "totalChecks", done.getTotalChecks(),
                    "durationMs", done.getDurationMs());
            return done;

        } catch (FetchException e) {
            return fail(live, e.getMessage(), e, "fetch:" + e.getKind());
        } catch (DocumentParseException e) {
            return fail(live, e.getMessage(), e, "parse");
        } catch (RuleEvaluationException e) {
            return fail(live, e.getMessage(), e, "rule:" + e.getRuleCode());
        } catch (RuntimeException | StackOverflowError | AssertionError e) {
            // 예상 못 한 결함도 레코드를 SCANNING 에 남겨두지 않는다
            return fail(live, e.toString(), e, "internal");
        }
    }

    private ScanRecord fail(ScanRecord live, String message, Throwable cause, String stage) {
        ScanRecord failed = live.toFailed(message, clock.instant());
        try {
            store.save(failed);
        } catch (RuntimeException saveError) {
            // 저장소가 거부해도 호출자는 종료 레코드를 받는다
            LOG.error("Could not store failed record {}: {}", failed.getScanId(), saveError.toString());
        }
        LOG.warn("Scan failed: id={}, stage={}, error={}", failed.getScanId(), stage, failed.getErrorMessage());
        SLOG.error("scan-failed", cause,
                "scanId", failed.getScanId(),
                "stage", stage,
                "durationMs", failed.getDurationMs());
        return failed;
    }

    /* =========================
       배치 스캔
       ========================= */

    public List<ScanRecord> scanAll(List<URI> urls) {
        return scanAll(urls, ProgressListener.NONE);
    }

    /**
     * 서로 독립인 스캔을 고정 스레드풀(동시성=concurrency)에서 돌린다.
     * 결과는 입력 순서. 각 스캔은 자체 fetch/문서/레코드를 가진다.
     */
    public List<ScanRecord> scanAll(List<URI> urls, ProgressListener listener) {
        Objects.requireNonNull(urls, "urls");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final int total = urls.size();
        if (total == 0) {
            pl.onProgress(1.0, "scan", 0, 0);
            return List.of();
        }

        final int cc = Math.min(Math.max(1, config.getConcurrency()), total);
        LOG.info("Batch start: urls={}, cc={}", total, cc);

        ExecutorService exec = Executors.newFixedThreadPool(cc, new NamedThreadFactory("scan-worker"));
        final AtomicInteger done = new AtomicInteger(0);
        final List<Future<ScanRecord>> futures = new ArrayList<>(total);
        pl.onProgress(0.0, "scan", 0, total);

        try {
            for (URI url : urls) {
                futures.add(exec.submit(() -> {
                    ScanRecord r = scan(url);
                    int d = done.incrementAndGet();
                    try {
                        pl.onProgress(Math.min(1.0, (double) d / total), "scan", d, total);
                    } catch (RuntimeException e) {
                        LOG.debug("progress listener failed: {}", e.toString());
                    }
                    return r;
                }));
            }

            List<ScanRecord> results = new ArrayList<>(total);
            for (Future<ScanRecord> f : futures) {
                try {
                    results.add(f.get());
                } catch (ExecutionException e) {
                    // scan() 은 던지지 않는다. 여기 오면 구현 결함.
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    throw new IllegalStateException("scan task failed", cause);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while collecting results");
                }
            }
            LOG.info("Batch done: urls={}, completed={}", total,
                    results.stream().filter(r -> r.getScore() != null).count());
            return results;
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /* =========================
       게터 / 유틸
       ========================= */

    public ScanRecordStore getStore() { return store; }

    public ScanConfig getConfig() { return config; }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
