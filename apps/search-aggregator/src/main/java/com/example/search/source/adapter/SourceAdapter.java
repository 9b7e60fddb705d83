package com.example.search.source.adapter;

import com.example.search.source.model.DocumentContent;
import com.example.search.source.model.RecentUpdate;
import com.example.search.source.model.SearchResult;
import com.example.search.source.model.SourceId;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Uniform capability over one document source, bound to a single caller's credentials.
 *
 * <p>Implementations signal failures as errors on the returned {@link Mono}:
 * {@link com.example.search.source.exception.AdapterException} for upstream faults,
 * {@link com.example.search.aggregation.exception.DocumentNotFoundException} and
 * {@link com.example.search.aggregation.exception.DocumentAccessDeniedException} for
 * single-document lookups. Transient upstream faults should be retried inside the adapter
 * before they are signalled. The caller bounds each call with its own timeout.</p>
 */
public interface SourceAdapter {

    @NonNull
    SourceId source();

    /**
     * Searches the source. Results are in the source's own relevance order.
     */
    @NonNull
    Mono<List<SearchResult>> search(@NonNull String query, int maxResults);

    /**
     * Fetches one document by its native (un-prefixed) id.
     */
    @NonNull
    Mono<DocumentContent> getDocument(@NonNull String nativeId);

    /**
     * Lists documents touched in the last {@code days} days.
     */
    @NonNull
    Mono<List<RecentUpdate>> getRecentUpdates(int days);
}
