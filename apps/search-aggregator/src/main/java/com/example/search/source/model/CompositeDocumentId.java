package com.example.search.source.model;

import com.example.search.aggregation.exception.MalformedInputException;
import org.springframework.lang.NonNull;

/**
 * Document identifier of the form {@code <source>:<native-id>}.
 * Only the first colon separates; native ids may contain further colons.
 */
public record CompositeDocumentId(@NonNull SourceId source, @NonNull String nativeId) {

    private static final char DELIMITER = ':';

    @NonNull
    public static CompositeDocumentId parse(String value) {
        if (value == null || value.isBlank()) {
            throw new MalformedInputException("Document id is empty");
        }
        int split = value.indexOf(DELIMITER);
        if (split <= 0 || split == value.length() - 1) {
            throw new MalformedInputException("Document id must have the form <source>:<id>: " + value);
        }
        SourceId source = SourceId.fromKey(value.substring(0, split));
        return new CompositeDocumentId(source, value.substring(split + 1));
    }

    @NonNull
    public static String format(@NonNull SourceId source, @NonNull String nativeId) {
        return source.key() + DELIMITER + nativeId;
    }

    @Override
    public String toString() {
        return format(source, nativeId);
    }
}
