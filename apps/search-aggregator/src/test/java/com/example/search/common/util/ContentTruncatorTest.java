package com.example.search.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ContentTruncator")
class ContentTruncatorTest {

    @Test
    @DisplayName("Should cut a 250 character snippet to 200 characters plus ellipsis")
    void longSnippet() {
        String snippet = ContentTruncator.snippet("x".repeat(250));

        assertThat(snippet).hasSize(203).endsWith("...");
        assertThat(snippet.substring(0, 200)).isEqualTo("x".repeat(200));
    }

    @Test
    @DisplayName("Should leave a 150 character snippet unchanged")
    void shortSnippet() {
        String original = "y".repeat(150);

        assertThat(ContentTruncator.snippet(original)).isEqualTo(original);
    }

    @Test
    @DisplayName("Should leave an exactly 200 character snippet unchanged")
    void boundarySnippet() {
        String original = "z".repeat(200);

        assertThat(ContentTruncator.snippet(original)).isEqualTo(original);
    }

    @Test
    @DisplayName("Should not split a surrogate pair at the cut point")
    void surrogatePair() {
        String original = "a".repeat(199) + "\uD83D\uDE00" + "b".repeat(10);

        String snippet = ContentTruncator.snippet(original);

        assertThat(snippet).isEqualTo("a".repeat(199) + "...");
    }

    @Test
    @DisplayName("Should cap content at the UTF-8 byte limit without splitting characters")
    void utf8Cap() {
        String original = "\u00e9".repeat(10); // 2 bytes each

        String capped = ContentTruncator.capUtf8Bytes(original, 5);

        assertThat(capped).isEqualTo("\u00e9\u00e9");
        assertThat(capped.getBytes(StandardCharsets.UTF_8).length).isLessThanOrEqualTo(5);
    }

    @Test
    @DisplayName("Should keep content under the byte limit untouched")
    void utf8UnderLimit() {
        assertThat(ContentTruncator.capUtf8Bytes("hello", 10_000)).isEqualTo("hello");
    }
}
