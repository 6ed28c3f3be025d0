package com.webshepherd.core.model;

/**
 * Finding 판정 등급. 집계(카운트)에만 쓰이고 정렬/비교 용도로 쓰지 않는다.
 */
public enum Severity {
    PASS("pass"),
    WARNING("warning"),
    FAIL("fail");

    private final String wireName;

    Severity(String wireName) { this.wireName = wireName; }

    /** 리포트(JSON) 표기값 */
    public String wireName() { return wireName; }

    /** WARNING/FAIL 이면 true (원칙별 이슈 카운트 대상) */
    public boolean isIssue() { return this != PASS; }
}
