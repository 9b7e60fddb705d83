package com.example.search.config.properties;

import com.example.search.common.util.ContentTruncator;
import com.example.search.source.model.SourceId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.NonNull;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for the aggregation engine: per-adapter timeout, default source set,
 * result caches and the document content cap.
 */
@ConfigurationProperties(prefix = "app.aggregator")
public record AggregatorProperties(
        @NonNull Duration adapterTimeout,
        @NonNull List<SourceId> defaultSources,
        @NonNull CacheProperties cache,
        int documentMaxBytes
) {
    public AggregatorProperties {
        if (adapterTimeout == null || adapterTimeout.isZero() || adapterTimeout.isNegative()) {
            adapterTimeout = Duration.ofSeconds(5);
        }
        if (defaultSources == null || defaultSources.isEmpty()) {
            defaultSources = List.of(SourceId.values());
        } else {
            defaultSources = List.copyOf(defaultSources);
        }
        if (cache == null) {
            cache = CacheProperties.defaults();
        }
        if (documentMaxBytes <= 0) {
            documentMaxBytes = ContentTruncator.DEFAULT_CONTENT_MAX_BYTES;
        }
    }

    /**
     * Result cache configuration. Each operation kind has its own store.
     */
    public record CacheProperties(
            Boolean enabled,
            @NonNull StoreProperties search,
            @NonNull StoreProperties document,
            @NonNull StoreProperties updates
    ) {
        public CacheProperties {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (search == null) {
                search = new StoreProperties(Duration.ofSeconds(300), 100);
            }
            if (document == null) {
                document = new StoreProperties(Duration.ofSeconds(600), 100);
            }
            if (updates == null) {
                updates = new StoreProperties(Duration.ofSeconds(300), 50);
            }
        }

        public static CacheProperties defaults() {
            return new CacheProperties(true, null, null, null);
        }

        public boolean isEnabled() {
            return enabled;
        }
    }

    /**
     * TTL and capacity of a single store.
     */
    public record StoreProperties(
            @NonNull Duration ttl,
            int maxEntries
    ) {
        public StoreProperties {
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                ttl = Duration.ofSeconds(300);
            }
            if (maxEntries <= 0) {
                maxEntries = 100;
            }
        }
    }

    /**
     * Cache name constants.
     */
    public static final String SEARCH_CACHE = "aggregator:search";
    public static final String DOCUMENT_CACHE = "aggregator:document";
    public static final String UPDATES_CACHE = "aggregator:updates";
}
