package com.example.search.source.model;

import com.example.search.aggregation.exception.MalformedInputException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.NonNull;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed set of document sources. Declaration order is the default fan-out order
 * and the tie-break order when merging recent updates.
 */
public enum SourceId {
    GDRIVE("gdrive"),
    NOTION("notion"),
    SLACK("slack"),
    CONFLUENCE("confluence");

    private static final String READ_SCOPE_SUFFIX = ":read";

    private final String key;

    SourceId(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @NonNull
    public String readScope() {
        return key + READ_SCOPE_SUFFIX;
    }

    /**
     * Resolves a source from its wire key (case-insensitive).
     *
     * @throws MalformedInputException if the key names no known source
     */
    @JsonCreator
    @NonNull
    public static SourceId fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new MalformedInputException("Source identifier is empty");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(source -> source.key.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new MalformedInputException("Unknown source identifier: " + key));
    }

    @Override
    public String toString() {
        return key;
    }
}
