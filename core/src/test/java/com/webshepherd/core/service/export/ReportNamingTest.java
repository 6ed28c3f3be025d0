package com.webshepherd.core.service.export;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ReportNamingTest {

    @Test
    void json_path_is_built_from_host_slug_and_utc_timestamp() {
        var ctx = ReportNaming.context(Path.of("out"), "https://Example.com/shop/cart?id=7",
                Instant.parse("2026-03-01T09:05:07Z"));

        assertThat(ReportNaming.timestamp(ctx)).isEqualTo("20260301-090507");
        assertThat(ReportNaming.jsonPath(ctx)).isEqualTo(
                Path.of("out", "reports", "example.com", "scan-example.com-shop-cart-id-7-20260301-090507.json"));
    }

    @Test
    void host_and_slug_fallbacks() {
        assertThat(ReportNaming.extractHost("not a url")).isEqualTo("unknown-host");
        assertThat(ReportNaming.extractHost("mailto:x@y")).isEqualTo("unknown-host");
        assertThat(ReportNaming.makeSlug(null)).isEqualTo("no-url");
        assertThat(ReportNaming.makeSlug("https://")).isEqualTo("no-url");
        assertThat(ReportNaming.makeSlug("https://example.com/")).isEqualTo("example.com");
    }

    @Test
    void long_urls_are_clipped() {
        String slug = ReportNaming.makeSlug("https://example.com/" + "a".repeat(200));
        assertThat(slug.length()).isLessThanOrEqualTo(60);
    }
}
