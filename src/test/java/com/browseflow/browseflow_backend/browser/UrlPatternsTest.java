package com.browseflow.browseflow_backend.browser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlPatternsTest {

    @Test
    void shouldMatchPlainPatternAsSubstring() {
        assertThat(UrlPatterns.matches("https://shop.test/checkout?step=2", "/checkout")).isTrue();
        assertThat(UrlPatterns.matches("https://shop.test/cart", "/checkout")).isFalse();
    }

    @Test
    void shouldTreatSlashDelimitedPatternAsRegex() {
        assertThat(UrlPatterns.matches("https://shop.test/orders/42", "/orders\\/\\d+$/")).isTrue();
        assertThat(UrlPatterns.matches("https://shop.test/orders/new", "/orders\\/\\d+$/")).isFalse();
    }

    @Test
    void shouldRejectInvalidRegex() {
        assertThatThrownBy(() -> UrlPatterns.matches("https://x.test", "/([/"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid URL pattern");
    }

    @Test
    void shouldNotMatchNullUrl() {
        assertThat(UrlPatterns.matches(null, "x")).isFalse();
    }
}
