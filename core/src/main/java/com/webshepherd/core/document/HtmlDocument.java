package com.webshepherd.core.document;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 스캔 1회 동안 쓰는 불변 문서 뷰.
 *
 * 모든 룰이 같은 인스턴스를 읽는다. 뷰는 호출 시마다 트리에서 새로 계산해 수정 불가 리스트로 돌려주며,
 * 룰 사이에 공유되는 가변 캐시는 두지 않는다. 트리는 생성 후 수정하지 않는다.
 * 순서는 별도 언급이 없으면 문서 순서.
 */
public final class HtmlDocument {

    private final Document doc;
    private final boolean lenient;

    private HtmlDocument(Document doc, boolean lenient) {
        this.doc = doc;
        this.lenient = lenient;
    }

    static HtmlDocument wrap(Document doc, boolean lenient) {
        Objects.requireNonNull(doc, "doc");
        doc.outputSettings().prettyPrint(false); // 스니펫은 원문 모양 그대로
        return new HtmlDocument(doc, lenient);
    }

    /** 완화 파서(폴백)로 만들어졌으면 true. Finding 에는 반영하지 않는다. */
    public boolean parsedLeniently() { return lenient; }

    // ---------- 단일 값 ----------

    /** 첫 번째 title 요소의 trim 텍스트. title 요소가 없으면 empty. */
    public Optional<String> title() {
        Element t = doc.selectFirst("title");
        return t == null ? Optional.empty() : Optional.of(t.text().trim());
    }

    /** 루트 html 요소 */
    public Optional<HtmlElement> htmlElement() {
        Element html = doc.selectFirst("html");
        return html == null ? Optional.empty() : Optional.of(new HtmlElement(html));
    }

    // ---------- 시맨틱 뷰 ----------

    public List<HtmlElement> images()   { return select("img"); }
    public List<HtmlElement> links()    { return select("a"); }
    public List<HtmlElement> forms()    { return select("form"); }
    public List<HtmlElement> headings() { return select("h1, h2, h3, h4, h5, h6"); }
    public List<HtmlElement> inputs()   { return select("input, textarea, select"); }

    /** button 요소 전체 다음에 input[type=button] */
    public List<HtmlElement> buttons() {
        List<HtmlElement> out = new ArrayList<>(select("button"));
        out.addAll(select("input[type=button]"));
        return Collections.unmodifiableList(out);
    }

    public List<HtmlElement> elementsByTag(String tag) {
        return wrapAll(doc.getElementsByTag(tag));
    }

    /** role 속성 값이 정확히 일치하는 요소 */
    public List<HtmlElement> elementsWithRole(String role) {
        List<HtmlElement> out = new ArrayList<>();
        for (Element e : doc.getElementsByAttribute("role")) {
            if (e.attr("role").equals(role)) out.add(new HtmlElement(e));
        }
        return Collections.unmodifiableList(out);
    }

    /** 해당 속성을 가진(값 무관) 모든 요소 */
    public List<HtmlElement> elementsWithAttribute(String name) {
        List<HtmlElement> out = new ArrayList<>();
        for (Element e : doc.getAllElements()) {
            if (e.hasAttr(name)) out.add(new HtmlElement(e));
        }
        return Collections.unmodifiableList(out);
    }

    /** 모든 id 속성 값(중복 포함). 중복 판정은 호출자 몫. */
    public List<String> allIds() {
        List<String> ids = new ArrayList<>();
        for (Element e : doc.getAllElements()) {
            if (e.hasAttr("id")) ids.add(e.attr("id"));
        }
        return Collections.unmodifiableList(ids);
    }

    /** for 속성이 주어진 id 와 같은 label 요소 */
    public List<HtmlElement> labelsFor(String id) {
        List<HtmlElement> out = new ArrayList<>();
        if (id == null) return out;
        for (Element label : doc.getElementsByTag("label")) {
            if (label.hasAttr("for") && label.attr("for").equals(id)) out.add(new HtmlElement(label));
        }
        return Collections.unmodifiableList(out);
    }

    // ---------- helpers ----------

    private List<HtmlElement> select(String css) {
        return wrapAll(doc.select(css));
    }

    private static List<HtmlElement> wrapAll(Elements els) {
        List<HtmlElement> out = new ArrayList<>(els.size());
        for (Element e : els) out.add(new HtmlElement(e));
        return Collections.unmodifiableList(out);
    }
}
