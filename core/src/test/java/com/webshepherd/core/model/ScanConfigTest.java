package com.webshepherd.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanConfigTest {

    @Test
    void defaults_match_documented_limits() {
        ScanConfig c = ScanConfig.defaults();
        c.validate();

        assertThat(c.getTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(c.getMaxRedirects()).isEqualTo(5);
        assertThat(c.getMaxBodyBytes()).isEqualTo(5L * 1024 * 1024);
        assertThat(c.getUserAgent()).startsWith("WebShepherd/1.0");
    }

    @Test
    void fluent_setters_keep_raw_values() {
        ScanConfig c = ScanConfig.defaults().setMaxHtmlSizeMb(2).setConcurrency(6).setTimeoutMs(750);

        assertThat(c.getMaxBodyBytes()).isEqualTo(2L * 1024 * 1024);
        assertThat(c.getConcurrency()).isEqualTo(6);
        assertThat(c.getTimeoutMs()).isEqualTo(750);
    }

    @Test
    void out_of_range_values_fail_validation_instead_of_being_clamped() {
        assertThatThrownBy(() -> ScanConfig.defaults().setMaxHtmlSizeMb(0).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxBodyBytes");
        assertThatThrownBy(() -> ScanConfig.defaults().setConcurrency(-2).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("concurrency");
        assertThatThrownBy(() -> ScanConfig.defaults().setTimeoutMs(0).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("timeout");
    }

    @Test
    void validate_rejects_bad_values() {
        assertThatThrownBy(() -> ScanConfig.defaults().setMaxRedirects(-1).validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScanConfig.defaults().setUserAgent(" ").validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScanConfig.defaults().setTimeout(Duration.ZERO).validate())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
