package com.webshepherd.core.scanner;

/** 룰 하나가 예외를 던졌거나 결과를 내지 못함. 스캔 전체를 FAILED 로 만든다. */
public class RuleEvaluationException extends Exception {

    private final String ruleCode;

    public RuleEvaluationException(String ruleCode, String message) {
        super(message);
        this.ruleCode = ruleCode;
    }

    public RuleEvaluationException(String ruleCode, String message, Throwable cause) {
        super(message, cause);
        this.ruleCode = ruleCode;
    }

    public String getRuleCode() { return ruleCode; }
}
