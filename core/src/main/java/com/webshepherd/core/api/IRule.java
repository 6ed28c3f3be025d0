package com.webshepherd.core.api;

import com.webshepherd.core.document.HtmlDocument;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.WcagLevel;

import java.util.List;

/**
 * 룰 최소 계약: 문서를 받아 Finding 리스트를 돌려준다.
 * 구현은 상태가 없고 부수효과가 없어야 하며, 항상 1개 이상의 Finding 을 돌려준다.
 */
public interface IRule {
    String ruleCode();
    String wcagReference();
    WcagLevel wcagLevel();
    Principle principle();

    List<Finding> evaluate(HtmlDocument doc);
}
