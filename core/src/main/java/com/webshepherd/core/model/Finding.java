package com.webshepherd.core.model;

import java.util.Objects;

/**
 * 룰 1회 평가의 판정 1건.
 * 같은 종류의 위반 N개는 Finding 1개(count = N)로 요약된다. 요소 단위로 펼치지 않는다.
 */
public final class Finding {
    private final String ruleCode;
    private final Severity severity;
    private final String message;
    private final String remediation;
    private final String element;        // 대표 위반 요소 스니펫(잘린 값), nullable
    private final String wcagReference;  // 예: "1.1.1"
    private final WcagLevel wcagLevel;
    private final Principle principle;
    private final int count;

    private Finding(Builder b) {
        this.ruleCode = b.ruleCode;
        this.severity = b.severity;
        this.message = (b.message == null ? "" : b.message);
        this.remediation = (b.remediation == null ? "" : b.remediation);
        this.element = b.element;
        this.wcagReference = b.wcagReference;
        this.wcagLevel = b.wcagLevel;
        this.principle = b.principle;
        this.count = b.count;
    }

    public String getRuleCode() { return ruleCode; }
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public String getRemediation() { return remediation; }
    public String getElement() { return element; }
    public String getWcagReference() { return wcagReference; }
    public WcagLevel getWcagLevel() { return wcagLevel; }
    public Principle getPrinciple() { return principle; }
    public int getCount() { return count; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Finding f)) return false;
        return count == f.count
                && ruleCode.equals(f.ruleCode)
                && severity == f.severity
                && message.equals(f.message)
                && remediation.equals(f.remediation)
                && Objects.equals(element, f.element)
                && wcagReference.equals(f.wcagReference)
                && wcagLevel == f.wcagLevel
                && principle == f.principle;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleCode, severity, message, remediation, element,
                wcagReference, wcagLevel, principle, count);
    }

    @Override
    public String toString() {
        return "[" + ruleCode + "/" + severity + " x" + count + "] " + message;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String ruleCode;
        private Severity severity;
        private String message;
        private String remediation;
        private String element;
        private String wcagReference;
        private WcagLevel wcagLevel;
        private Principle principle;
        private int count = 1;

        public Builder ruleCode(String ruleCode) { this.ruleCode = ruleCode; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder message(String message) { this.message = message; return this; }
        public Builder remediation(String remediation) { this.remediation = remediation; return this; }
        public Builder element(String element) { this.element = element; return this; }
        public Builder wcagReference(String wcagReference) { this.wcagReference = wcagReference; return this; }
        public Builder wcagLevel(WcagLevel wcagLevel) { this.wcagLevel = wcagLevel; return this; }
        public Builder principle(Principle principle) { this.principle = principle; return this; }
        public Builder count(int count) { this.count = count; return this; }

        public Finding build() {
            Objects.requireNonNull(ruleCode, "ruleCode");
            Objects.requireNonNull(severity, "severity");
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(remediation, "remediation");
            Objects.requireNonNull(wcagReference, "wcagReference");
            Objects.requireNonNull(wcagLevel, "wcagLevel");
            Objects.requireNonNull(principle, "principle");
            if (count < 1) throw new IllegalArgumentException("count must be >= 1");
            return new Finding(this);
        }
    }
}
