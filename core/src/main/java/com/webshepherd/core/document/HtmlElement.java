package com.webshepherd.core.document;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Objects;
import java.util.Optional;

/**
 * 파싱된 요소 하나에 대한 읽기 전용 뷰.
 * 속성 "없음"(Optional.empty)과 "빈 문자열"은 구분한다: alt="" 는 장식 이미지 표시, alt 없음은 위반.
 */
public final class HtmlElement {

    /** Finding.element 스니펫 최대 길이 */
    public static final int SNIPPET_MAX = 100;

    private final Element el;

    HtmlElement(Element el) {
        this.el = Objects.requireNonNull(el, "el");
    }

    /** 소문자 태그명 (예: "img", "h2") */
    public String tagName() { return el.normalName(); }

    public Optional<String> attr(String name) {
        return el.hasAttr(name) ? Optional.of(el.attr(name)) : Optional.empty();
    }

    public boolean hasAttr(String name) { return el.hasAttr(name); }

    /** 속성이 있고 공백이 아닌 값이면 true */
    public boolean hasNonBlankAttr(String name) {
        return el.hasAttr(name) && !el.attr(name).isBlank();
    }

    /** 하위 텍스트 전체(공백 정규화 + trim) */
    public String text() { return el.text().trim(); }

    /** 부모 요소. 루트(html)의 부모(Document)는 요소로 취급하지 않는다. */
    public Optional<HtmlElement> parent() {
        Element p = el.parent();
        if (p == null || p instanceof Document) return Optional.empty();
        return Optional.of(new HtmlElement(p));
    }

    /** 자기 자신을 제외한 첫 번째 하위 요소(문서 순서) */
    public Optional<HtmlElement> firstDescendant(String tag) {
        for (Element e : el.getElementsByTag(tag)) {
            if (e != el) return Optional.of(new HtmlElement(e));
        }
        return Optional.empty();
    }

    /** 요소 직렬화 앞부분(최대 SNIPPET_MAX 자). 문서 전체를 내보내지 않는다. */
    public String snippet() {
        return truncate(el.outerHtml(), SNIPPET_MAX);
    }

    static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HtmlElement other && other.el == el;
    }

    @Override
    public int hashCode() { return System.identityHashCode(el); }

    @Override
    public String toString() { return snippet(); }
}
