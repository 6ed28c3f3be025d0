package com.webshepherd.core.model;

/**
 * 스캔 상태 머신: PENDING → SCANNING → {COMPLETE, FAILED}.
 * 종료 상태는 재진입 불가.
 */
public enum ScanStatus {
    PENDING("pending"),
    SCANNING("scanning"),
    COMPLETE("complete"),
    FAILED("failed");

    private final String wireName;

    ScanStatus(String wireName) { this.wireName = wireName; }

    public String wireName() { return wireName; }

    public boolean isTerminal() { return this == COMPLETE || this == FAILED; }
}
