package com.example.search.cache;

import com.example.search.observability.CacheMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResultCache")
class ResultCacheTest {

    private static final Duration TTL = Duration.ofSeconds(300);

    private SimpleMeterRegistry meterRegistry;
    private CacheMetricsService metricsService;
    private FakeTicker ticker;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new CacheMetricsService(meterRegistry);
        ticker = new FakeTicker();
    }

    private ResultCache cache(int maxEntries, boolean enabled) {
        return new ResultCache("test", TTL, maxEntries, enabled, ticker, metricsService);
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("Should return the value while the entry is live")
        void liveEntry() {
            ResultCache cache = cache(10, true);
            cache.put("k", List.of("a"));

            ticker.advance(TTL.minusSeconds(1));

            assertThat(cache.<List<String>>get("k")).contains(List.of("a"));
        }

        @Test
        @DisplayName("Should never return an entry past its TTL")
        void expiredEntry() {
            ResultCache cache = cache(10, true);
            cache.put("k", List.of("a"));

            ticker.advance(TTL.plusNanos(1));

            assertThat(cache.get("k")).isEmpty();
        }

        @Test
        @DisplayName("Should restart the TTL when a key is overwritten")
        void overwriteRefreshes() {
            ResultCache cache = cache(10, true);
            cache.put("k", "old");
            ticker.advance(Duration.ofSeconds(200));
            cache.put("k", "new");
            ticker.advance(Duration.ofSeconds(200));

            assertThat(cache.<String>get("k")).contains("new");
        }
    }

    @Nested
    @DisplayName("Capacity")
    class Capacity {

        @Test
        @DisplayName("Should stay within its entry limit and count evictions")
        void evictsAtCapacity() {
            ResultCache cache = cache(2, true);

            cache.put("a", "1");
            cache.put("b", "2");
            cache.put("c", "3");
            cache.put("d", "4");

            assertThat(cache.estimatedSize()).isLessThanOrEqualTo(2);
            assertThat(meterRegistry.find("aggregator.cache.evictions").counter()).isNotNull();
        }
    }

    @Nested
    @DisplayName("Disabled")
    class Disabled {

        @Test
        @DisplayName("Should store nothing and always miss")
        void disabledCache() {
            ResultCache cache = cache(10, false);

            cache.put("k", "v");

            assertThat(cache.isEnabled()).isFalse();
            assertThat(cache.get("k")).isEmpty();
            assertThat(cache.estimatedSize()).isZero();
        }

        @Test
        @DisplayName("Should invoke the loader on every read-through")
        void loaderAlwaysRuns() {
            ResultCache cache = cache(10, false);
            AtomicInteger loads = new AtomicInteger();
            Mono<String> loader = Mono.fromSupplier(() -> "v" + loads.incrementAndGet());

            StepVerifier.create(cache.getOrLoad("k", loader)).expectNext("v1").verifyComplete();
            StepVerifier.create(cache.getOrLoad("k", loader)).expectNext("v2").verifyComplete();
        }
    }

    @Nested
    @DisplayName("Read-through")
    class ReadThrough {

        @Test
        @DisplayName("Should load once and serve the stored value afterwards")
        void loadsOnce() {
            ResultCache cache = cache(10, true);
            AtomicInteger loads = new AtomicInteger();
            Mono<String> loader = Mono.fromSupplier(() -> "v" + loads.incrementAndGet());

            StepVerifier.create(cache.getOrLoad("k", loader)).expectNext("v1").verifyComplete();
            StepVerifier.create(cache.getOrLoad("k", loader)).expectNext("v1").verifyComplete();

            assertThat(loads).hasValue(1);
            assertThat(metricsService.getHitRate("test")).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Should not store values the predicate rejects")
        void predicateRejects() {
            ResultCache cache = cache(10, true);

            StepVerifier.create(cache.getOrLoad("k", Mono.just(""), value -> !value.isEmpty()))
                    .expectNext("")
                    .verifyComplete();

            assertThat(cache.get("k")).isEmpty();
        }

        @Test
        @DisplayName("Should not store anything when the loader fails")
        void loaderFails() {
            ResultCache cache = cache(10, true);

            StepVerifier.create(cache.getOrLoad("k", Mono.<String>error(new IllegalStateException("boom"))))
                    .expectError(IllegalStateException.class)
                    .verify();

            assertThat(cache.get("k")).isEmpty();
        }
    }

    @Test
    @DisplayName("invalidateAll should empty the store")
    void invalidateAll() {
        ResultCache cache = cache(10, true);
        cache.put("a", "1");
        cache.put("b", "2");

        cache.invalidateAll();

        assertThat(cache.estimatedSize()).isZero();
    }
}
