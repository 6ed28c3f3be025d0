package com.webshepherd.core.scanner;

import com.webshepherd.core.api.IRule;
import com.webshepherd.core.document.HtmlDocument;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.rules.RuleCatalogue;
import com.webshepherd.core.util.StructuredLog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 카탈로그 순서대로 모든 룰을 실행하고 결과를 이어 붙인다.
 * 중간에 멈추지 않으며, 룰 하나의 예외(또는 빈 결과)는 스캔 전체 실패로 올린다.
 */
public final class RuleEngine {

    private static final StructuredLog SLOG = StructuredLog.get(RuleEngine.class);

    public List<Finding> run(RuleCatalogue catalogue, HtmlDocument doc) throws RuleEvaluationException {
        Objects.requireNonNull(catalogue, "catalogue");
        Objects.requireNonNull(doc, "doc");

        List<Finding> out = new ArrayList<>();
        for (IRule rule : catalogue) {
            String code = rule.ruleCode();
            List<Finding> produced;
            try {
                produced = rule.evaluate(doc);
            } catch (RuntimeException | StackOverflowError | AssertionError | LinkageError e) {
                // 깊은 재귀/단언/클래스 로딩 오류도 룰 결함으로 본다. 그 외 VM 오류는 그대로 올린다.
                throw new RuleEvaluationException(code,
                        "Rule " + code + " failed: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()), e);
            }
            if (produced == null || produced.isEmpty()) {
                throw new RuleEvaluationException(code, "Rule " + code + " produced no findings");
            }
            for (Finding f : produced) {
                if (f == null) throw new RuleEvaluationException(code, "Rule " + code + " produced a null finding");
                out.add(f);
            }
            SLOG.debug("rule-evaluated", "rule", code, "findings", produced.size());
        }
        return Collections.unmodifiableList(out);
    }
}
