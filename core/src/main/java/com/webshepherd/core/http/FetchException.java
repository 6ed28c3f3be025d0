package com.webshepherd.core.http;

import java.util.Objects;

/** HtmlFetcher 실패. kind 로 분류하고, HTTP_STATUS 일 때만 statusCode 가 의미 있다. */
public class FetchException extends Exception {

    private static final long serialVersionUID = 1L;

    private final FetchFailure kind;
    private final int statusCode;

    public FetchException(FetchFailure kind, String message) {
        this(kind, message, -1, null);
    }

    public FetchException(FetchFailure kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    private FetchException(FetchFailure kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.statusCode = statusCode;
    }

    public static FetchException httpStatus(int statusCode) {
        return new FetchException(FetchFailure.HTTP_STATUS, "HTTP " + statusCode, statusCode, null);
    }

    public FetchFailure getKind() { return kind; }

    /** HTTP_STATUS 가 아니면 -1 */
    public int getStatusCode() { return statusCode; }
}
