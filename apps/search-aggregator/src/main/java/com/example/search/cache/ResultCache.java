package com.example.search.cache;

import com.example.search.observability.CacheMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * One TTL-bounded, capacity-bounded result store backed by Caffeine.
 * Values are stored whole and are immutable, so concurrent readers never see a partial entry.
 */
@Slf4j
public class ResultCache {

    private final String name;
    private final boolean enabled;
    private final Cache<String, Object> cache;
    private final CacheMetricsService metricsService;

    public ResultCache(
            @NonNull String name,
            @NonNull Duration ttl,
            int maxEntries,
            boolean enabled,
            @NonNull Ticker ticker,
            @NonNull CacheMetricsService metricsService) {

        this.name = name;
        this.enabled = enabled;
        this.metricsService = metricsService;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .ticker(ticker)
                .executor(Runnable::run)
                .removalListener((String key, Object value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        metricsService.recordEviction(name, cause.name());
                    }
                })
                .build();

        metricsService.registerSizeGauge(name, cache::estimatedSize);
        log.info("Result cache {} initialized (enabled={}, ttl={}, max-entries={})", name, enabled, ttl, maxEntries);
    }

    /**
     * Returns the live value for the key. Expired entries are never returned.
     */
    @NonNull
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(@NonNull String key) {
        if (!enabled) {
            return Optional.empty();
        }
        Object cached = cache.getIfPresent(key);
        if (cached == null) {
            log.debug("Cache miss for key: {}:{}", name, key);
            metricsService.recordMiss(name);
            return Optional.empty();
        }
        log.debug("Cache hit for key: {}:{}", name, key);
        metricsService.recordHit(name);
        return Optional.of((T) cached);
    }

    /**
     * Inserts or overwrites. At capacity Caffeine evicts by its size policy.
     */
    public void put(@NonNull String key, @NonNull Object value) {
        if (!enabled) {
            return;
        }
        cache.put(key, value);
    }

    /**
     * Read-through: serves a live entry, otherwise subscribes to the loader and stores its
     * value when {@code cacheable} accepts it.
     */
    @NonNull
    public <T> Mono<T> getOrLoad(
            @NonNull String key,
            @NonNull Mono<T> loader,
            @NonNull Predicate<? super T> cacheable) {

        return Mono.defer(() -> this.<T>get(key)
                .map(Mono::just)
                .orElseGet(() -> loader.doOnNext(value -> {
                    if (cacheable.test(value)) {
                        put(key, value);
                    } else {
                        log.debug("Not caching value for key: {}:{}", name, key);
                    }
                })));
    }

    @NonNull
    public <T> Mono<T> getOrLoad(@NonNull String key, @NonNull Mono<T> loader) {
        return getOrLoad(key, loader, value -> true);
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.info("Cleared all entries from cache {}", name);
    }

    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public boolean isEnabled() {
        return enabled;
    }
}
