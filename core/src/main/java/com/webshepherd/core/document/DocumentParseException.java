package com.webshepherd.core.document;

/** 기본/완화 파싱 전략이 모두 트리를 만들지 못한 경우에만 던진다. */
public class DocumentParseException extends Exception {
    private static final long serialVersionUID = 1L;

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
