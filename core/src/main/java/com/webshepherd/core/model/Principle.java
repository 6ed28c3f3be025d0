package com.webshepherd.core.model;

/** WCAG 최상위 4원칙. 원칙별 이슈 버킷은 이 네 개로 고정. */
public enum Principle {
    PERCEIVABLE("Perceivable"),
    OPERABLE("Operable"),
    UNDERSTANDABLE("Understandable"),
    ROBUST("Robust");

    private final String displayName;

    Principle(String displayName) { this.displayName = displayName; }

    public String displayName() { return displayName; }
}
