package com.webshepherd.core.http;

import com.webshepherd.core.api.IFetcher;
import com.webshepherd.core.model.FetchedPage;
import com.webshepherd.core.model.ScanConfig;
import com.webshepherd.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 한도가 걸린 HTML 페처.
 * - GET 1회(리다이렉트는 직접 추적, 홉 수 제한)
 * - 전체 교환(리다이렉트 포함) 벽시계 타임아웃
 * - HTML 미디어 타입만 허용, 본문 크기 상한 초과 시 잘라내지 않고 실패
 * - 재시도 없음. 호출 간 상태 없음.
 */
public class HtmlFetcher implements IFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HtmlFetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(HtmlFetcher.class);

    private static final Set<Integer> REDIRECT_CODES = Set.of(301, 302, 303, 307, 308);
    private static final Set<String> HTML_TYPES = Set.of("text/html", "application/xhtml+xml");

    /** 테스트/모킹용 송신 훅: 한 홉을 보내고 응답을 돌려준다. */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req,
                                  HttpResponse.BodyHandler<byte[]> handler,
                                  Duration remaining) throws Exception;
    }

    private final ScanConfig config;
    private final HttpSender sender;

    public HtmlFetcher(ScanConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER) // 홉 수를 직접 센다
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = (req, handler, remaining) -> sendBounded(client, req, handler, remaining);
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HtmlFetcher(ScanConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchedPage fetch(URI url) throws FetchException {
        Objects.requireNonNull(url, "url");
        final long start = System.nanoTime();
        final long deadline = start + config.getTimeout().toNanos();

        LOG.info("Fetching URL: {}", url);
        URI current = url;
        int hops = 0;
        while (true) {
            Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
            if (remaining.isNegative() || remaining.isZero()) {
                throw timeout(url);
            }

            HttpResponse<byte[]> resp = sendOnce(url, current, remaining);
            int status = resp.statusCode();

            if (REDIRECT_CODES.contains(status)) {
                if (hops >= config.getMaxRedirects()) {
                    LOG.warn("Too many redirects for {} (max {})", url, config.getMaxRedirects());
                    throw new FetchException(FetchFailure.TOO_MANY_REDIRECTS,
                            "Too many redirects (max " + config.getMaxRedirects() + ")");
                }
                current = resolveLocation(current, resp.headers());
                hops++;
                continue;
            }

            if (status < 200 || status > 299) {
                LOG.warn("HTTP error {} for {}", status, url);
                throw FetchException.httpStatus(status);
            }

            String contentType = resp.headers().firstValue("Content-Type").orElse("");
            if (!isHtml(contentType)) {
                throw new FetchException(FetchFailure.UNSUPPORTED_CONTENT_TYPE,
                        "Invalid content type: " + contentType + ". Expected text/html");
            }

            byte[] body = resp.body() == null ? new byte[0] : resp.body();
            if (body.length > config.getMaxBodyBytes()) {
                throw tooLarge(body.length);
            }

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            String text = new String(body, charsetOf(contentType));
            LOG.info("Fetched {} KB from {} in {} ms", String.format(Locale.ROOT, "%.1f", body.length / 1024.0), url, elapsedMs);
            SLOG.info("fetch-done",
                    "url", String.valueOf(url),
                    "finalUrl", String.valueOf(current),
                    "bytes", body.length,
                    "redirects", hops,
                    "ms", elapsedMs);

            return FetchedPage.builder()
                    .requestedUrl(url)
                    .finalUrl(current)
                    .statusCode(status)
                    .contentType(contentType)
                    .body(text)
                    .bodyBytes(body.length)
                    .redirects(hops)
                    .responseTimeMs(elapsedMs)
                    .build();
        }
    }

    // ------------ 한 홉 ------------

    private HttpResponse<byte[]> sendOnce(URI original, URI target, Duration remaining) throws FetchException {
        HttpRequest req = HttpRequest.newBuilder(target)
                .timeout(remaining)
                .header("User-Agent", config.getUserAgent())
                .header("Accept", ScanConfig.DEFAULT_ACCEPT)
                .header("Accept-Language", config.getAcceptLanguage())
                .GET()
                .build();
        try {
            return sender.send(req, new BoundedBodyHandler(config.getMaxBodyBytes()), remaining);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchFailure.NETWORK_ERROR, "Fetch interrupted: " + original, ie);
        } catch (Exception e) {
            throw translate(original, unwrap(e));
        }
    }

    /** sendAsync + 남은 시간만큼 대기. 초과/인터럽트 시 future 를 취소해 연결을 반납한다. */
    private static HttpResponse<byte[]> sendBounded(HttpClient client, HttpRequest req,
                                                    HttpResponse.BodyHandler<byte[]> handler,
                                                    Duration remaining) throws Exception {
        CompletableFuture<HttpResponse<byte[]>> f = client.sendAsync(req, handler);
        try {
            return f.get(Math.max(1, remaining.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            f.cancel(true);
            throw e;
        }
    }

    private FetchException translate(URI url, Throwable t) {
        if (t instanceof FetchException fe) return fe;
        if (t instanceof BodyTooLargeException big) return tooLarge(big.observed);
        if (t instanceof HttpTimeoutException || t instanceof TimeoutException) return timeout(url);
        LOG.error("Request error for {}: {}", url, t.toString());
        String detail = (t.getMessage() == null || t.getMessage().isBlank())
                ? t.getClass().getSimpleName() : t.getMessage();
        return new FetchException(FetchFailure.NETWORK_ERROR, "Failed to fetch URL: " + detail, t);
    }

    private FetchException timeout(URI url) {
        LOG.error("Timeout fetching {}", url);
        return new FetchException(FetchFailure.TIMEOUT,
                "Request timeout after " + config.getTimeout().toMillis() + " ms");
    }

    private FetchException tooLarge(long observed) {
        return new FetchException(FetchFailure.CONTENT_TOO_LARGE,
                String.format(Locale.ROOT, "Content too large: %.1f MB (max: %.1f MB)",
                        observed / 1024.0 / 1024.0, config.getMaxBodyBytes() / 1024.0 / 1024.0));
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof ExecutionException || cur instanceof java.util.concurrent.CompletionException)
                && cur.getCause() != null) {
            cur = cur.getCause();
        }
        // HttpClient 가 구독자 예외를 IOException 으로 (여러 겹) 감쌀 수 있음
        for (Throwable c = cur; c != null; c = c.getCause()) {
            if (c instanceof BodyTooLargeException big) return big;
            if (c.getCause() == c) break;
        }
        return cur;
    }

    private static URI resolveLocation(URI current, HttpHeaders headers) throws FetchException {
        String loc = headers.firstValue("Location").orElse("").trim();
        if (loc.isEmpty()) {
            throw new FetchException(FetchFailure.NETWORK_ERROR, "Redirect without Location header from " + current);
        }
        URI next;
        try {
            next = current.resolve(loc);
        } catch (IllegalArgumentException e) {
            throw new FetchException(FetchFailure.NETWORK_ERROR, "Invalid redirect Location: " + loc, e);
        }
        String scheme = next.getScheme() == null ? "" : next.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new FetchException(FetchFailure.NETWORK_ERROR, "Redirect to unsupported scheme: " + loc);
        }
        return next;
    }

    // ------------ 미디어 타입 / 문자셋 ------------

    static boolean isHtml(String contentType) {
        return HTML_TYPES.contains(mediaType(contentType));
    }

    static String mediaType(String contentType) {
        if (contentType == null) return "";
        int semi = contentType.indexOf(';');
        String mt = (semi >= 0 ? contentType.substring(0, semi) : contentType);
        return mt.trim().toLowerCase(Locale.ROOT);
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) return StandardCharsets.UTF_8;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.regionMatches(true, 0, "charset=", 0, 8)) {
                String name = p.substring(8).trim().replace("\"", "").replace("'", "");
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) { // IllegalCharsetName / UnsupportedCharset
                    LOG.debug("Unknown charset '{}', using UTF-8", name);
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    // ------------ 본문 한도 ------------

    /** 본문 상한 초과 신호(구독자 → sendAsync future) */
    static final class BodyTooLargeException extends IOException {
        private static final long serialVersionUID = 1L;
        final long observed;
        BodyTooLargeException(long observed, long limit) {
            super("body exceeds " + limit + " bytes (observed >= " + observed + ")");
            this.observed = observed;
        }
    }

    /**
     * 리다이렉트/에러/비-HTML 응답은 본문을 버리고,
     * HTML 응답은 상한까지만 모은다(Content-Length 선언 초과 시 즉시 실패).
     */
    static final class BoundedBodyHandler implements HttpResponse.BodyHandler<byte[]> {
        private final long limit;

        BoundedBodyHandler(long limit) { this.limit = limit; }

        @Override
        public HttpResponse.BodySubscriber<byte[]> apply(HttpResponse.ResponseInfo info) {
            int sc = info.statusCode();
            String ct = info.headers().firstValue("Content-Type").orElse("");
            if (sc < 200 || sc > 299 || !isHtml(ct)) {
                return HttpResponse.BodySubscribers.replacing(new byte[0]);
            }
            long declared = info.headers().firstValueAsLong("Content-Length").orElse(-1L);
            return new LimitedBodySubscriber(limit, declared);
        }
    }

    static final class LimitedBodySubscriber implements HttpResponse.BodySubscriber<byte[]> {
        private final long limit;
        private final long declared;
        private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
        private final CompletableFuture<byte[]> result = new CompletableFuture<>();
        private Flow.Subscription subscription;
        private long received;

        LimitedBodySubscriber(long limit, long declared) {
            this.limit = limit;
            this.declared = declared;
        }

        @Override public CompletionStage<byte[]> getBody() { return result; }

        @Override
        public void onSubscribe(Flow.Subscription s) {
            this.subscription = s;
            if (declared > limit) {
                s.cancel();
                result.completeExceptionally(new BodyTooLargeException(declared, limit));
                return;
            }
            s.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(List<ByteBuffer> items) {
            if (result.isDone()) return;
            for (ByteBuffer b : items) {
                int n = b.remaining();
                received += n;
                if (received > limit) {
                    subscription.cancel();
                    result.completeExceptionally(new BodyTooLargeException(received, limit));
                    return;
                }
                byte[] chunk = new byte[n];
                b.get(chunk);
                buf.write(chunk, 0, n);
            }
        }

        @Override public void onError(Throwable t) { result.completeExceptionally(t); }

        @Override public void onComplete() { result.complete(buf.toByteArray()); }
    }
}
