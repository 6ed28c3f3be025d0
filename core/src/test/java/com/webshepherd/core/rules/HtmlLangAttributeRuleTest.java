package com.webshepherd.core.rules;

import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Severity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlLangAttributeRuleTest {

    private final HtmlLangAttributeRule rule = new HtmlLangAttributeRule();

    @Test
    void html_without_lang_fails_with_snippet() {
        assertThat(rule.evaluate(Docs.html("<html><body></body></html>"))).singleElement().satisfies(f -> {
            assertThat(f.getSeverity()).isEqualTo(Severity.FAIL);
            assertThat(f.getMessage()).isEqualTo("<html> tag missing lang attribute");
            assertThat(f.getElement()).startsWith("<html>");
        });
    }

    @Test
    void empty_lang_fails() {
        Finding f = rule.evaluate(Docs.html("<html lang=\"\"><body></body></html>")).get(0);
        assertThat(f.getSeverity()).isEqualTo(Severity.FAIL);
    }

    @Test
    void lang_set_passes() {
        assertThat(rule.evaluate(Docs.html("<html lang=\"en\"><body></body></html>"))).singleElement().satisfies(f -> {
            assertThat(f.getSeverity()).isEqualTo(Severity.PASS);
            assertThat(f.getMessage()).isEqualTo("Page language is set to 'en'");
        });
    }
}
