package com.webshepherd.core.rules;

import com.webshepherd.core.api.IRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 고정 순서의 룰 목록. 등록 순서가 곧 Finding 순서다.
 * 메타데이터 검증은 등록 시점에 한다(스캔 중에는 하지 않는다).
 */
public final class RuleCatalogue implements Iterable<IRule> {

    private final List<IRule> rules;

    private RuleCatalogue(List<IRule> rules) {
        this.rules = rules;
    }

    /** 기본 카탈로그(10개) */
    public static RuleCatalogue defaults() {
        return of(
                new ImageAltTextRule(),
                new HtmlLangAttributeRule(),
                new PageTitleRule(),
                new FormLabelRule(),
                new ButtonAccessibleNameRule(),
                new LinkTextRule(),
                new HeadingHierarchyRule(),
                new SingleH1Rule(),
                new DuplicateIdRule(),
                new AriaRoleValidRule()
        );
    }

    public static RuleCatalogue of(IRule... rules) {
        Objects.requireNonNull(rules, "rules");
        return of(List.of(rules));
    }

    /**
     * @throws IllegalArgumentException 코드 공백/중복, 원칙·레벨 누락, WCAG 참조 공백
     */
    public static RuleCatalogue of(List<? extends IRule> rules) {
        Objects.requireNonNull(rules, "rules");
        Set<String> codes = new HashSet<>();
        List<IRule> copy = new ArrayList<>(rules.size());
        for (IRule r : rules) {
            Objects.requireNonNull(r, "rule");
            String code = r.ruleCode();
            if (code == null || code.isBlank()) {
                throw new IllegalArgumentException("rule code must not be blank: " + r.getClass().getName());
            }
            if (!codes.add(code)) {
                throw new IllegalArgumentException("duplicate rule code: " + code);
            }
            if (r.principle() == null) {
                throw new IllegalArgumentException("rule " + code + " has no principle");
            }
            if (r.wcagLevel() == null) {
                throw new IllegalArgumentException("rule " + code + " has no WCAG level");
            }
            if (r.wcagReference() == null || r.wcagReference().isBlank()) {
                throw new IllegalArgumentException("rule " + code + " has no WCAG reference");
            }
            copy.add(r);
        }
        return new RuleCatalogue(Collections.unmodifiableList(copy));
    }

    public List<IRule> rules() { return rules; }

    public int size() { return rules.size(); }

    @Override
    public Iterator<IRule> iterator() { return rules.iterator(); }
}
