package com.webshepherd.core.http;

/** 페치 실패 분류. 모두 해당 페치 시도에 대해 종료 사유(재시도 없음). */
public enum FetchFailure {
    TIMEOUT,
    TOO_MANY_REDIRECTS,
    HTTP_STATUS,
    UNSUPPORTED_CONTENT_TYPE,
    CONTENT_TOO_LARGE,
    NETWORK_ERROR
}
