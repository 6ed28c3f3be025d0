package com.webshepherd.core.model;

import java.net.URI;
import java.util.Objects;

/** 페처가 돌려주는 HTML 문서 텍스트 + 응답 메타 */
public final class FetchedPage {
    private final URI requestedUrl;
    private final URI finalUrl;       // 리다이렉트 추적 후 최종 URL
    private final int statusCode;
    private final String contentType;
    private final String body;
    private final long bodyBytes;
    private final int redirects;
    private final long responseTimeMs;

    private FetchedPage(Builder b) {
        this.requestedUrl = b.requestedUrl;
        this.finalUrl = (b.finalUrl == null ? b.requestedUrl : b.finalUrl);
        this.statusCode = b.statusCode;
        this.contentType = b.contentType;
        this.body = (b.body == null) ? "" : b.body;
        this.bodyBytes = b.bodyBytes;
        this.redirects = b.redirects;
        this.responseTimeMs = b.responseTimeMs;
    }

    public URI getRequestedUrl() { return requestedUrl; }
    public URI getFinalUrl() { return finalUrl; }
    public int getStatusCode() { return statusCode; }
    public String getContentType() { return contentType; }
    public String getBody() { return body; }
    public long getBodyBytes() { return bodyBytes; }
    public int getRedirects() { return redirects; }
    public long getResponseTimeMs() { return responseTimeMs; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI requestedUrl;
        private URI finalUrl;
        private int statusCode;
        private String contentType;
        private String body;
        private long bodyBytes;
        private int redirects;
        private long responseTimeMs;

        public Builder requestedUrl(URI requestedUrl) { this.requestedUrl = requestedUrl; return this; }
        public Builder finalUrl(URI finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder bodyBytes(long bodyBytes) { this.bodyBytes = bodyBytes; return this; }
        public Builder redirects(int redirects) { this.redirects = redirects; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }

        public FetchedPage build() {
            Objects.requireNonNull(requestedUrl, "requestedUrl");
            return new FetchedPage(this);
        }
    }
}
