package com.example.search.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Result cache metrics, tagged by cache name.
 * Exposes metrics via Micrometer for Prometheus scraping.
 */
@Slf4j
@Service
public class CacheMetricsService {

    private static final String METRIC_PREFIX = "aggregator.cache";
    private static final String TAG_CACHE_NAME = "cache";
    private static final String TAG_RESULT = "result";
    private static final String TAG_CAUSE = "cause";

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public CacheMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordHit(String cacheName) {
        lookupCounter(cacheName, "hit").increment();
    }

    public void recordMiss(String cacheName) {
        lookupCounter(cacheName, "miss").increment();
    }

    /**
     * Record an entry leaving the cache for a reason other than an explicit put.
     *
     * @param cause Caffeine removal cause, e.g. {@code SIZE} or {@code EXPIRED}
     */
    public void recordEviction(String cacheName, String cause) {
        counters.computeIfAbsent(cacheName + ":eviction:" + cause, k ->
                Counter.builder(METRIC_PREFIX + ".evictions")
                        .description("Entries evicted from the result cache")
                        .tags(TAG_CACHE_NAME, cacheName, TAG_CAUSE, cause)
                        .register(meterRegistry)
        ).increment();
    }

    public void registerSizeGauge(String cacheName, Supplier<Number> sizeSupplier) {
        Gauge.builder(METRIC_PREFIX + ".size", sizeSupplier)
                .description("Estimated number of entries in the result cache")
                .tag(TAG_CACHE_NAME, cacheName)
                .register(meterRegistry);
        log.debug("Registered size gauge for cache: {}", cacheName);
    }

    /**
     * Current hit rate for a cache (hits / (hits + misses)).
     */
    public double getHitRate(String cacheName) {
        Counter hits = counters.get(cacheName + ":lookup:hit");
        Counter misses = counters.get(cacheName + ":lookup:miss");
        if (hits == null || misses == null) {
            return 0.0;
        }
        double total = hits.count() + misses.count();
        return total > 0 ? hits.count() / total : 0.0;
    }

    private Counter lookupCounter(String cacheName, String result) {
        return counters.computeIfAbsent(cacheName + ":lookup:" + result, k ->
                Counter.builder(METRIC_PREFIX + ".lookups")
                        .description("Result cache lookups by outcome")
                        .tags(TAG_CACHE_NAME, cacheName, TAG_RESULT, result)
                        .register(meterRegistry)
        );
    }
}
