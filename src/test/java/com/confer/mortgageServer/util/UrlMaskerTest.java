package com.confer.mortgageServer.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlMaskerTest {

    @Test
    void masksSignedQueryString() {
        assertThat(UrlMasker.mask("https://storage.googleapis.com/b/le.pdf?X-Goog-Signature=abc&X-Goog-Credential=key"))
                .isEqualTo("https://storage.googleapis.com/b/le.pdf?****");
    }

    @Test
    void masksFragment() {
        assertThat(UrlMasker.mask("https://s3.amazonaws.com/le.pdf#token=abc"))
                .isEqualTo("https://s3.amazonaws.com/le.pdf?****");
    }

    @Test
    void leavesPlainUrlAlone() {
        assertThat(UrlMasker.mask("https://s3.amazonaws.com/le.pdf")).isEqualTo("https://s3.amazonaws.com/le.pdf");
    }

    @Test
    void nullIsMasked() {
        assertThat(UrlMasker.mask(null)).isEqualTo("****");
    }
}
