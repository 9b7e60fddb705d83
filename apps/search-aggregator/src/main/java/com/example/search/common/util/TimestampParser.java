package com.example.search.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parses the ISO-8601 timestamps sources report. Values without an offset are read as UTC;
 * unparseable or missing values map to {@link Instant#MIN} so they sort as oldest.
 */
public final class TimestampParser {

    private TimestampParser() {}

    @NonNull
    public static Instant parseOrMin(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return Instant.MIN;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return Instant.MIN;
        }
    }
}
