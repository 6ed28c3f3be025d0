package com.webshepherd.core.util;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlGuardTest {

    @Test
    void public_http_and_https_pass() {
        assertThat(UrlGuard.requirePublic(" https://example.com/a?b=1 ")).isEqualTo(URI.create("https://example.com/a?b=1"));
        assertThat(UrlGuard.isPublic("http://8.8.8.8/")).isTrue();
        assertThat(UrlGuard.isPublic("https://172.32.0.1/")).isTrue();
    }

    @Test
    void rejects_with_reason() {
        assertThatThrownBy(() -> UrlGuard.requirePublic("")).hasMessage("URL must not be blank");
        assertThatThrownBy(() -> UrlGuard.requirePublic("ftp://example.com/")).hasMessage("URL must use http or https");
        assertThatThrownBy(() -> UrlGuard.requirePublic("example.com")).hasMessage("URL must use http or https");
        assertThatThrownBy(() -> UrlGuard.requirePublic("http://exa mple.com/")).hasMessageStartingWith("Invalid URL");
        assertThatThrownBy(() -> UrlGuard.requirePublic("http:///path")).hasMessage("URL must include a host");
        assertThatThrownBy(() -> UrlGuard.requirePublic("http://localhost:8080/"))
                .hasMessage("Cannot scan localhost or private IP addresses");
    }

    @Test
    void private_and_loopback_ranges() {
        assertThat(UrlGuard.isLocalOrPrivate("127.0.0.1")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("10.1.2.3")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("172.16.0.1")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("172.31.255.255")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("192.168.0.10")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("169.254.169.254")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("[::1]")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("app.LOCALHOST")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("172.15.0.1")).isFalse();
        assertThat(UrlGuard.isLocalOrPrivate("example.com")).isFalse();
    }

    @Test
    void ipv6_local_ranges_and_mapped_loopback_are_rejected() {
        assertThat(UrlGuard.isLocalOrPrivate("[fd12:3456:789a::1]")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("[fc00::1]")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("[fe80::1]")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("[::ffff:127.0.0.1]")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("[::ffff:192.168.1.5]")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("[::]")).isTrue();
        assertThat(UrlGuard.isLocalOrPrivate("0:0:0:0:0:0:0:1")).isTrue();

        assertThat(UrlGuard.isLocalOrPrivate("[2001:4860:4860::8888]")).isFalse();
        assertThat(UrlGuard.isLocalOrPrivate("[::ffff:8.8.8.8]")).isFalse();

        assertThatThrownBy(() -> UrlGuard.requirePublic("http://[fe80::1]/"))
                .hasMessage("Cannot scan localhost or private IP addresses");
        assertThat(UrlGuard.isPublic("https://[2606:4700:4700::1111]/")).isTrue();
    }
}
