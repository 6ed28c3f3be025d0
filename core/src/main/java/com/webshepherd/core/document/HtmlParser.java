package com.webshepherd.core.document;

import com.webshepherd.core.util.StructuredLog;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * HTML 텍스트 → HtmlDocument.
 * 깨진 마크업도 최선의 트리로 받아들인다. 기본 파서가 실패하면 완화 전략으로 한 번 더 시도하고,
 * 둘 다 실패할 때만 DocumentParseException.
 */
public final class HtmlParser {

    private static final Logger LOG = LoggerFactory.getLogger(HtmlParser.class);
    private static final StructuredLog SLOG = StructuredLog.get(HtmlParser.class);

    /** 파싱 전략 한 가지(테스트에서 교체 가능) */
    @FunctionalInterface
    public interface ParseStrategy {
        Document parse(String html);
    }

    /** jsoup HTML5 트리 빌더 */
    static final ParseStrategy STANDARD = Jsoup::parse;

    /** 제어문자 제거 후 body-fragment 로 파싱 */
    static final ParseStrategy LENIENT = html -> Jsoup.parseBodyFragment(stripControlChars(html));

    private final ParseStrategy primary;
    private final ParseStrategy fallback;

    public HtmlParser() {
        this(STANDARD, LENIENT);
    }

    HtmlParser(ParseStrategy primary, ParseStrategy fallback) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public HtmlDocument parse(String html) throws DocumentParseException {
        String src = (html == null ? "" : html);
        try {
            Document doc = primary.parse(src);
            LOG.debug("Parsed HTML ({} chars)", src.length());
            return HtmlDocument.wrap(doc, false);
        } catch (RuntimeException primaryFailure) {
            LOG.warn("Primary HTML parse failed ({}); retrying with lenient parser", primaryFailure.toString());
            SLOG.warn("parse-degraded", "chars", src.length(), "cause", primaryFailure.toString());
            try {
                Document doc = fallback.parse(src);
                return HtmlDocument.wrap(doc, true);
            } catch (RuntimeException fallbackFailure) {
                fallbackFailure.addSuppressed(primaryFailure);
                throw new DocumentParseException("Failed to parse HTML: " + fallbackFailure.getMessage(), fallbackFailure);
            }
        }
    }

    /** 탭/개행/캐리지리턴을 제외한 C0 제어문자 제거 */
    static String stripControlChars(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') continue;
            sb.append(c);
        }
        return sb.toString();
    }
}
