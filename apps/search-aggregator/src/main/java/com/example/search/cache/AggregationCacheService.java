package com.example.search.cache;

import com.example.search.config.properties.AggregatorProperties;
import com.example.search.observability.CacheMetricsService;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import static com.example.search.config.properties.AggregatorProperties.DOCUMENT_CACHE;
import static com.example.search.config.properties.AggregatorProperties.SEARCH_CACHE;
import static com.example.search.config.properties.AggregatorProperties.UPDATES_CACHE;

/**
 * Owns the three result stores. Each has its own TTL and capacity.
 * Summaries share the document store under their own key kind.
 */
@Slf4j
@Service
public class AggregationCacheService {

    private final ResultCache searchCache;
    private final ResultCache documentCache;
    private final ResultCache updatesCache;

    @Autowired
    public AggregationCacheService(AggregatorProperties properties, CacheMetricsService metricsService) {
        this(properties, metricsService, Ticker.systemTicker());
    }

    public AggregationCacheService(
            AggregatorProperties properties,
            CacheMetricsService metricsService,
            Ticker ticker) {

        AggregatorProperties.CacheProperties cacheProperties = properties.cache();
        boolean enabled = cacheProperties.isEnabled();

        this.searchCache = new ResultCache(SEARCH_CACHE,
                cacheProperties.search().ttl(), cacheProperties.search().maxEntries(),
                enabled, ticker, metricsService);
        this.documentCache = new ResultCache(DOCUMENT_CACHE,
                cacheProperties.document().ttl(), cacheProperties.document().maxEntries(),
                enabled, ticker, metricsService);
        this.updatesCache = new ResultCache(UPDATES_CACHE,
                cacheProperties.updates().ttl(), cacheProperties.updates().maxEntries(),
                enabled, ticker, metricsService);

        if (!enabled) {
            log.warn("Result caching is disabled; every request will fan out to the sources");
        }
    }

    @NonNull
    public ResultCache search() {
        return searchCache;
    }

    @NonNull
    public ResultCache documents() {
        return documentCache;
    }

    @NonNull
    public ResultCache updates() {
        return updatesCache;
    }

    public void invalidateAll() {
        searchCache.invalidateAll();
        documentCache.invalidateAll();
        updatesCache.invalidateAll();
    }
}
