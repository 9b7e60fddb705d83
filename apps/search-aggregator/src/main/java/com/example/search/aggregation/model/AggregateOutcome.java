package com.example.search.aggregation.model;

import com.example.search.source.model.SourceId;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Per-source outcomes of one fan-out, kept in requested source order.
 */
public record AggregateOutcome<T>(@NonNull List<SourceOutcome<T>> outcomes) {

    public AggregateOutcome {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static <T> AggregateOutcome<T> empty() {
        return new AggregateOutcome<>(List.of());
    }

    /**
     * Results of the successful sources concatenated in outcome order.
     */
    @NonNull
    public List<T> concatenated() {
        List<T> merged = new ArrayList<>();
        for (SourceOutcome<T> outcome : outcomes) {
            merged.addAll(outcome.results());
        }
        return merged;
    }

    /**
     * Concatenated results, stably sorted, then cut to {@code limit}.
     */
    @NonNull
    public List<T> merged(@NonNull Comparator<? super T> order, int limit) {
        List<T> merged = concatenated();
        merged.sort(order);
        return truncate(merged, limit);
    }

    /**
     * Concatenated results cut to {@code limit}, keeping source order.
     */
    @NonNull
    public List<T> merged(int limit) {
        return truncate(concatenated(), limit);
    }

    @NonNull
    public List<SourceId> failedSources() {
        return outcomes.stream()
                .filter(outcome -> !outcome.succeeded())
                .map(SourceOutcome::source)
                .toList();
    }

    /**
     * True when at least one source was attempted and none succeeded.
     */
    public boolean allFailed() {
        return !outcomes.isEmpty() && outcomes.stream().noneMatch(SourceOutcome::succeeded);
    }

    private static <T> List<T> truncate(List<T> items, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        if (items.size() <= limit) {
            return List.copyOf(items);
        }
        return List.copyOf(items.subList(0, limit));
    }
}
