package com.webshepherd.core.rules;

import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Severity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateIdRuleTest {

    private final DuplicateIdRule rule = new DuplicateIdRule();

    @Test
    void each_duplicated_value_counts_once() {
        assertThat(rule.evaluate(Docs.html("<div id=x></div><p id=x></p><span id=x></span>"))).singleElement().satisfies(f -> {
            assertThat(f.getSeverity()).isEqualTo(Severity.FAIL);
            assertThat(f.getCount()).isEqualTo(1);
            assertThat(f.getMessage()).isEqualTo("1 duplicate IDs found: 'x'");
        });
    }

    @Test
    void message_lists_at_most_five_in_first_duplicate_order() {
        StringBuilder html = new StringBuilder();
        for (String id : new String[]{"g", "f", "e", "d", "c", "b", "a"}) {
            html.append("<i id=").append(id).append("></i><b id=").append(id).append("></b>");
        }

        Finding f = rule.evaluate(Docs.html(html.toString())).get(0);

        assertThat(f.getCount()).isEqualTo(7);
        assertThat(f.getMessage()).isEqualTo("7 duplicate IDs found: 'g', 'f', 'e', 'd', 'c'");
    }

    @Test
    void unique_ids_pass_and_no_ids_pass() {
        assertThat(rule.evaluate(Docs.html("<i id=a></i><i id=b></i>"))).singleElement()
                .extracting(Finding::getMessage).isEqualTo("All 2 IDs are unique");
        assertThat(rule.evaluate(Docs.html("<i></i>"))).singleElement()
                .extracting(Finding::getMessage).isEqualTo("No ID attributes found");
    }
}
