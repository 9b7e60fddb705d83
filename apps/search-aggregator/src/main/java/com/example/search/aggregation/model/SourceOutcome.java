package com.example.search.aggregation.model;

import com.example.search.source.model.SourceId;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Result of one fan-out branch: the source's items, or the reason it contributed none.
 */
public record SourceOutcome<T>(
        @NonNull SourceId source,
        @NonNull Status status,
        @NonNull List<T> results,
        @Nullable String failureReason
) {
    public enum Status {
        SUCCEEDED,
        FAILED,
        TIMED_OUT
    }

    public SourceOutcome {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static <T> SourceOutcome<T> success(SourceId source, List<T> results) {
        return new SourceOutcome<>(source, Status.SUCCEEDED, results, null);
    }

    public static <T> SourceOutcome<T> failure(SourceId source, String reason) {
        return new SourceOutcome<>(source, Status.FAILED, List.of(), reason);
    }

    public static <T> SourceOutcome<T> timeout(SourceId source) {
        return new SourceOutcome<>(source, Status.TIMED_OUT, List.of(), "timed out");
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }
}
