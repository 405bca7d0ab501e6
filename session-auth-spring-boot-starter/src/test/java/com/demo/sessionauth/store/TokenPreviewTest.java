package com.demo.sessionauth.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenPreviewTest {

    @Test
    void truncatesLongTokens() {
        assertThat(TokenPreview.of("eyJhbGciOiJIUzI1NiJ9.payload.signature")).isEqualTo("eyJhbGciOiJIUzI1NiJ9...");
        assertThat(TokenPreview.of("short")).isEqualTo("short");
        assertThat(TokenPreview.of(null)).isEqualTo("null");
    }
}
