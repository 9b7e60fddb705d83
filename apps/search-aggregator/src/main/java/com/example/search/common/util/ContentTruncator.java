package com.example.search.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.nio.charset.StandardCharsets;

/**
 * Size limits applied to text that leaves a source adapter.
 */
public final class ContentTruncator {

    public static final int SNIPPET_MAX_CHARS = 200;
    public static final String ELLIPSIS = "...";
    public static final int DEFAULT_CONTENT_MAX_BYTES = 10_000;

    private ContentTruncator() {}

    /**
     * Truncates a snippet to {@value #SNIPPET_MAX_CHARS} characters and appends {@value #ELLIPSIS}.
     * Snippets at or under the limit are returned unchanged.
     */
    @NonNull
    public static String snippet(@Nullable String value) {
        if (value == null) {
            return "";
        }
        if (value.length() <= SNIPPET_MAX_CHARS) {
            return value;
        }
        int end = SNIPPET_MAX_CHARS;
        if (Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end) + ELLIPSIS;
    }

    /**
     * Caps text at {@code maxBytes} of UTF-8 without splitting a multi-byte sequence.
     */
    @NonNull
    public static String capUtf8Bytes(@Nullable String value, int maxBytes) {
        if (value == null) {
            return "";
        }
        if (maxBytes <= 0) {
            return "";
        }
        // a char never encodes to more than 3 bytes
        if ((long) value.length() * 3 <= maxBytes) {
            return value;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= maxBytes) {
            return value;
        }
        int cut = maxBytes;
        while (cut > 0 && isContinuationByte(bytes[cut])) {
            cut--;
        }
        return new String(bytes, 0, cut, StandardCharsets.UTF_8);
    }

    private static boolean isContinuationByte(byte b) {
        return (b & 0xC0) == 0x80;
    }
}
