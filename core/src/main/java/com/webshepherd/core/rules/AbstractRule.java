package com.webshepherd.core.rules;

import com.webshepherd.core.api.IRule;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.Severity;
import com.webshepherd.core.model.WcagLevel;

/**
 * 고정 메타데이터(코드/WCAG 참조/레벨/원칙)를 들고, 모든 Finding 에 같은 값을 찍어주는 베이스.
 */
public abstract class AbstractRule implements IRule {

    static final String PASSED = "N/A - Check passed";

    private final String ruleCode;
    private final String wcagReference;
    private final WcagLevel wcagLevel;
    private final Principle principle;

    protected AbstractRule(String ruleCode, String wcagReference, WcagLevel wcagLevel, Principle principle) {
        this.ruleCode = ruleCode;
        this.wcagReference = wcagReference;
        this.wcagLevel = wcagLevel;
        this.principle = principle;
    }

    @Override public final String ruleCode() { return ruleCode; }
    @Override public final String wcagReference() { return wcagReference; }
    @Override public final WcagLevel wcagLevel() { return wcagLevel; }
    @Override public final Principle principle() { return principle; }

    protected final Finding finding(Severity severity, String message, String remediation,
                                    String element, int count) {
        return Finding.builder()
                .ruleCode(ruleCode)
                .severity(severity)
                .message(message)
                .remediation(remediation)
                .element(element)
                .wcagReference(wcagReference)
                .wcagLevel(wcagLevel)
                .principle(principle)
                .count(count)
                .build();
    }

    protected final Finding finding(Severity severity, String message, String remediation) {
        return finding(severity, message, remediation, null, 1);
    }

    protected final Finding pass(String message) {
        return finding(Severity.PASS, message, PASSED);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + ruleCode + " " + wcagReference + "]";
    }
}
