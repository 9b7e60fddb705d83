package com.example.search.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TimestampParser")
class TimestampParserTest {

    @Test
    @DisplayName("Should parse a UTC timestamp with Z suffix")
    void zuluSuffix() {
        assertThat(TimestampParser.parseOrMin("2024-03-01T10:15:30.123Z"))
                .isEqualTo(Instant.parse("2024-03-01T10:15:30.123Z"));
    }

    @Test
    @DisplayName("Should apply an explicit offset")
    void explicitOffset() {
        assertThat(TimestampParser.parseOrMin("2024-03-01T12:15:30+02:00"))
                .isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
    }

    @Test
    @DisplayName("Should read a timestamp without offset as UTC")
    void localTimestamp() {
        assertThat(TimestampParser.parseOrMin("2024-03-01T10:15:30.5"))
                .isEqualTo(Instant.parse("2024-03-01T10:15:30.500Z"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"yesterday", "2024-13-45", "   "})
    @DisplayName("Should map missing or unparseable values to Instant.MIN")
    void unparseable(String value) {
        assertThat(TimestampParser.parseOrMin(value)).isEqualTo(Instant.MIN);
    }
}
