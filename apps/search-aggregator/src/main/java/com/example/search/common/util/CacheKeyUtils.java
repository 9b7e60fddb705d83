package com.example.search.common.util;

import com.example.search.cache.CacheKind;
import com.example.search.source.model.SourceId;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Utility methods for result cache keys.
 * A key is the SHA-256 of the canonicalized operation inputs, so unordered inputs
 * (source sets, document id batches) hash identically in any order, and the caller id is
 * always part of the digest.
 */
public final class CacheKeyUtils {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final char FIELD_SEPARATOR = '|';

    private CacheKeyUtils() {}

    @NonNull
    public static String searchKey(
            @NonNull String query,
            @NonNull Collection<SourceId> sources,
            int maxResults,
            @NonNull String callerId) {
        return digest(CacheKind.SEARCH,
                normalizeQuery(query),
                canonicalSources(sources),
                Integer.toString(maxResults),
                callerId);
    }

    @NonNull
    public static String updatesKey(
            @NonNull Collection<SourceId> sources,
            int days,
            int maxResults,
            @NonNull String callerId) {
        return digest(CacheKind.UPDATES,
                canonicalSources(sources),
                Integer.toString(days),
                Integer.toString(maxResults),
                callerId);
    }

    @NonNull
    public static String documentKey(@NonNull String documentId, @NonNull String callerId) {
        return digest(CacheKind.DOCUMENT, documentId, callerId);
    }

    @NonNull
    public static String summaryKey(
            @NonNull Collection<String> documentIds,
            int maxLength,
            @NonNull String callerId) {
        return digest(CacheKind.SUMMARIZE,
                canonicalStrings(documentIds),
                Integer.toString(maxLength),
                callerId);
    }

    /**
     * Trims the query and collapses inner whitespace runs. Case is preserved.
     */
    @NonNull
    public static String normalizeQuery(@Nullable String query) {
        if (query == null) {
            return "";
        }
        return WHITESPACE.matcher(query.trim()).replaceAll(" ");
    }

    /**
     * Sorted, de-duplicated, comma-joined source keys.
     */
    @NonNull
    public static String canonicalSources(@NonNull Collection<SourceId> sources) {
        return String.join(",", sources.stream()
                .filter(Objects::nonNull)
                .map(SourceId::key)
                .distinct()
                .sorted()
                .toList());
    }

    @NonNull
    static String canonicalStrings(@NonNull Collection<String> values) {
        List<String> sorted = values.stream()
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
        StringBuilder joined = new StringBuilder();
        for (String value : sorted) {
            appendField(joined, value);
        }
        return joined.toString();
    }

    /**
     * Digests the kind and components. Each component is length-prefixed so that
     * separators inside values cannot make two different tuples collide.
     */
    @NonNull
    public static String digest(@NonNull CacheKind kind, @NonNull String... components) {
        StringBuilder canonical = new StringBuilder(kind.name());
        for (String component : components) {
            canonical.append(FIELD_SEPARATOR);
            appendField(canonical, component == null ? "" : component);
        }
        return sha256Hex(canonical.toString());
    }

    private static void appendField(StringBuilder target, String value) {
        target.append(value.length()).append(':').append(value);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
