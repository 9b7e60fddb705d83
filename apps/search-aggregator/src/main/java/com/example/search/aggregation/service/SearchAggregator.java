package com.example.search.aggregation.service;

import com.example.search.aggregation.exception.DocumentAccessDeniedException;
import com.example.search.aggregation.exception.DocumentNotFoundException;
import com.example.search.aggregation.exception.MalformedInputException;
import com.example.search.aggregation.exception.UnauthenticatedException;
import com.example.search.aggregation.model.AggregateOutcome;
import com.example.search.aggregation.model.SourceOutcome;
import com.example.search.authz.service.PermissionFilter;
import com.example.search.cache.AggregationCacheService;
import com.example.search.common.util.CacheKeyUtils;
import com.example.search.common.util.StringSanitizer;
import com.example.search.common.util.TimestampParser;
import com.example.search.config.properties.AggregatorProperties;
import com.example.search.identity.model.IdentityContext;
import com.example.search.observability.metrics.AdapterMetrics;
import com.example.search.source.adapter.SourceAdapter;
import com.example.search.source.adapter.SourceAdapterRegistry;
import com.example.search.source.exception.AdapterException;
import com.example.search.source.model.CompositeDocumentId;
import com.example.search.source.model.DocumentContent;
import com.example.search.source.model.RecentUpdate;
import com.example.search.source.model.SearchResult;
import com.example.search.source.model.SourceId;
import com.example.search.source.model.SummaryResult;
import com.example.search.summary.Summarizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Fans a request out to the caller's permitted sources, merges what comes back and
 * memoizes the merged result per caller.
 *
 * <p>Multi-source operations never fail because one source failed: a failing or slow
 * source contributes nothing and the rest of the response is returned. Single-document
 * lookups propagate their failure.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchAggregator {

    static final String OP_SEARCH = "search";
    static final String OP_UPDATES = "updates";
    static final String OP_DOCUMENT = "document";

    /** Largest summary batch accepted. */
    public static final int MAX_SUMMARY_DOCUMENTS = 50;
    static final int SUMMARY_FETCH_CONCURRENCY = 4;

    /**
     * Newest first; equal timestamps fall back to source declaration order.
     */
    static final Comparator<RecentUpdate> NEWEST_FIRST = Comparator
            .comparing((RecentUpdate update) -> TimestampParser.parseOrMin(update.lastModified()),
                    Comparator.reverseOrder())
            .thenComparing(RecentUpdate::source, Comparator.nullsLast(Comparator.naturalOrder()));

    private final SourceAdapterRegistry adapterRegistry;
    private final PermissionFilter permissionFilter;
    private final AggregationCacheService caches;
    private final Summarizer summarizer;
    private final AggregatorProperties properties;
    private final AdapterMetrics adapterMetrics;

    /**
     * Searches the requested sources and returns the first {@code maxResults} hits,
     * concatenated in requested source order.
     *
     * @param sources requested sources; {@code null} or empty means the configured default set
     */
    @NonNull
    public Mono<List<SearchResult>> search(
            @NonNull String query,
            @Nullable List<SourceId> sources,
            int maxResults,
            @NonNull IdentityContext identity) {

        return Mono.defer(() -> {
            requireAuthenticated(identity);
            List<SourceId> permitted = permittedSources(identity, sources);
            log.info("Search query='{}' sources={} maxResults={}",
                    StringSanitizer.forLog(query), permitted, maxResults);
            if (permitted.isEmpty()) {
                return Mono.just(List.<SearchResult>of());
            }

            String key = CacheKeyUtils.searchKey(query, permitted, maxResults, identity.callerId());
            Optional<List<SearchResult>> cached = caches.search().get(key);
            if (cached.isPresent()) {
                log.info("Returning cached search results for query='{}'", StringSanitizer.forLog(query));
                return Mono.just(cached.get());
            }

            return fanOut(identity, permitted, OP_SEARCH, adapter -> adapter.search(query, maxResults))
                    .map(outcome -> {
                        List<SearchResult> merged = outcome.merged(maxResults);
                        storeUnlessAllFailed(outcome, () -> caches.search().put(key, merged));
                        return merged;
                    });
        });
    }

    /**
     * Lists recent activity across the requested sources, newest first, cut to {@code maxResults}.
     */
    @NonNull
    public Mono<List<RecentUpdate>> getRecentUpdates(
            @Nullable List<SourceId> sources,
            int days,
            int maxResults,
            @NonNull IdentityContext identity) {

        return Mono.defer(() -> {
            requireAuthenticated(identity);
            List<SourceId> permitted = permittedSources(identity, sources);
            log.info("Recent updates days={} sources={} maxResults={}", days, permitted, maxResults);
            if (permitted.isEmpty()) {
                return Mono.just(List.<RecentUpdate>of());
            }

            String key = CacheKeyUtils.updatesKey(permitted, days, maxResults, identity.callerId());
            Optional<List<RecentUpdate>> cached = caches.updates().get(key);
            if (cached.isPresent()) {
                log.info("Returning cached updates for last {} days", days);
                return Mono.just(cached.get());
            }

            return fanOut(identity, permitted, OP_UPDATES, adapter -> adapter.getRecentUpdates(days))
                    .map(outcome -> {
                        List<RecentUpdate> merged = outcome.merged(NEWEST_FIRST, maxResults);
                        storeUnlessAllFailed(outcome, () -> caches.updates().put(key, merged));
                        return merged;
                    });
        });
    }

    /**
     * Fetches one document by composite id from its single source.
     *
     * @throws MalformedInputException        (as error signal) for a malformed id or unsupported source
     * @throws DocumentAccessDeniedException  (as error signal) when the caller lacks the source scope
     *                                        or the source refuses access
     * @throws DocumentNotFoundException      (as error signal) when the source has no such document
     */
    @NonNull
    public Mono<DocumentContent> getDocument(@NonNull String documentId, @NonNull IdentityContext identity) {
        return Mono.defer(() -> {
            requireAuthenticated(identity);
            CompositeDocumentId id = CompositeDocumentId.parse(documentId);
            SourceAdapter adapter = resolveSingle(identity, id);

            String key = CacheKeyUtils.documentKey(id.toString(), identity.callerId());
            return caches.documents().getOrLoad(key, fetchDocument(adapter, id));
        });
    }

    /**
     * Fetches each document, skipping the ones that fail, and summarizes the rest.
     * Duplicate ids are fetched once, at most {@value #SUMMARY_FETCH_CONCURRENCY} at a time.
     */
    @NonNull
    public Mono<SummaryResult> summarize(
            @NonNull List<String> documentIds,
            int maxLength,
            @NonNull IdentityContext identity) {

        return Mono.defer(() -> {
            requireAuthenticated(identity);
            List<String> distinctIds = List.copyOf(new LinkedHashSet<>(documentIds));
            if (distinctIds.size() > MAX_SUMMARY_DOCUMENTS) {
                throw new MalformedInputException(String.format(
                        "At most %d documents can be summarized at once, got %d",
                        MAX_SUMMARY_DOCUMENTS, distinctIds.size()));
            }
            log.info("Summarizing {} documents (maxLength={})", distinctIds.size(), maxLength);

            String key = CacheKeyUtils.summaryKey(distinctIds, maxLength, identity.callerId());
            Optional<SummaryResult> cached = caches.documents().get(key);
            if (cached.isPresent()) {
                log.info("Returning cached summary for {} documents", distinctIds.size());
                return Mono.just(cached.get());
            }

            return Flux.fromIterable(distinctIds)
                    .flatMapSequential(id -> getDocument(id, identity)
                                    .map(Optional::of)
                                    .onErrorResume(e -> {
                                        log.warn("Skipping document {} in summary: {}",
                                                StringSanitizer.forLog(id), e.getMessage());
                                        return Mono.just(Optional.empty());
                                    }),
                            SUMMARY_FETCH_CONCURRENCY)
                    .collectList()
                    .flatMap(fetches -> {
                        List<DocumentContent> documents = fetches.stream()
                                .flatMap(Optional::stream)
                                .toList();
                        boolean anyFetched = !documents.isEmpty() || distinctIds.isEmpty();
                        return summarizer.summarize(documents, maxLength)
                                .doOnNext(summary -> {
                                    if (anyFetched) {
                                        caches.documents().put(key, summary);
                                    }
                                });
                    });
        });
    }

    private <T> Mono<AggregateOutcome<T>> fanOut(
            IdentityContext identity,
            List<SourceId> sources,
            String operation,
            Function<SourceAdapter, Mono<List<T>>> call) {

        Map<SourceId, SourceAdapter> adapters = adapterRegistry.resolve(identity, sources);
        List<SourceId> supported = new ArrayList<>(sources.size());
        for (SourceId source : sources) {
            if (adapters.containsKey(source)) {
                supported.add(source);
            } else {
                log.warn("No adapter available for {}, skipping source", source);
                adapterMetrics.recordSkipped(source, "unsupported");
            }
        }
        if (supported.isEmpty()) {
            return Mono.just(AggregateOutcome.empty());
        }

        // all branches subscribe together; flatMapSequential re-emits in source order
        return Flux.fromIterable(supported)
                .flatMapSequential(source -> invoke(source, adapters.get(source), operation, call),
                        supported.size())
                .collectList()
                .map(outcomes -> new AggregateOutcome<>(outcomes))
                .doOnNext(outcome -> {
                    if (!outcome.failedSources().isEmpty()) {
                        log.warn("{} completed with failed sources: {}", operation, outcome.failedSources());
                    }
                });
    }

    private <T> Mono<SourceOutcome<T>> invoke(
            SourceId source,
            SourceAdapter adapter,
            String operation,
            Function<SourceAdapter, Mono<List<T>>> call) {

        return Mono.defer(() -> {
            long startedAt = System.nanoTime();
            return Mono.defer(() -> call.apply(adapter))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(properties.adapterTimeout())
                    .map(results -> SourceOutcome.success(source, results))
                    .defaultIfEmpty(SourceOutcome.success(source, List.of()))
                    .onErrorResume(TimeoutException.class, e -> {
                        log.warn("{} on {} timed out after {}", operation, source, properties.adapterTimeout());
                        return Mono.just(SourceOutcome.timeout(source));
                    })
                    .onErrorResume(e -> {
                        log.warn("{} on {} failed: {}", operation, source, e.getMessage());
                        return Mono.just(SourceOutcome.failure(source, e.getMessage()));
                    })
                    .doOnNext(outcome -> {
                        log.debug("{} on {} returned {} items", operation, source, outcome.results().size());
                        adapterMetrics.recordCall(source, operation, outcome.status(),
                                Duration.ofNanos(System.nanoTime() - startedAt));
                    });
        });
    }

    private Mono<DocumentContent> fetchDocument(SourceAdapter adapter, CompositeDocumentId id) {
        return Mono.defer(() -> adapter.getDocument(id.nativeId()))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(properties.adapterTimeout())
                .onErrorMap(TimeoutException.class, e -> AdapterException.timeout(id.source(), e))
                .switchIfEmpty(Mono.error(() -> new DocumentNotFoundException(id.source(), id.toString())))
                .map(document -> document.withContentCappedAt(properties.documentMaxBytes()))
                .doOnError(e -> log.warn("{} on {} failed for {}: {}",
                        OP_DOCUMENT, id.source(), StringSanitizer.forLog(id.toString()), e.getMessage()));
    }

    private SourceAdapter resolveSingle(IdentityContext identity, CompositeDocumentId id) {
        if (!permissionFilter.isAllowed(identity, id.source())) {
            adapterMetrics.recordSkipped(id.source(), "permission_denied");
            throw new DocumentAccessDeniedException(id.source(), id.toString());
        }
        return adapterRegistry.resolve(identity, id.source())
                .orElseThrow(() -> new MalformedInputException("Unsupported source: " + id.source()));
    }

    private List<SourceId> permittedSources(IdentityContext identity, @Nullable Collection<SourceId> requested) {
        Collection<SourceId> effective = requested == null || requested.isEmpty()
                ? properties.defaultSources()
                : requested;
        List<SourceId> distinct = List.copyOf(new LinkedHashSet<>(effective));
        List<SourceId> permitted = permissionFilter.permittedSources(identity, distinct);
        if (permitted.size() < distinct.size()) {
            distinct.stream()
                    .filter(source -> !permitted.contains(source))
                    .forEach(source -> adapterMetrics.recordSkipped(source, "permission_denied"));
        }
        return permitted;
    }

    private static void requireAuthenticated(IdentityContext identity) {
        if (identity == null || !identity.isAuthenticated()) {
            throw new UnauthenticatedException("User is not authenticated");
        }
    }

    private static void storeUnlessAllFailed(AggregateOutcome<?> outcome, Runnable store) {
        if (outcome.allFailed()) {
            log.warn("All sources failed ({}), result not cached", outcome.failedSources());
            return;
        }
        store.run();
    }
}
