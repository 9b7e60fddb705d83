package com.example.search.source.retry;

import com.example.search.common.util.RetryUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff, wrapped around an adapter's outbound calls.
 *
 * @param maxAttempts total attempts including the first call
 */
public record RetryPolicy(
        int maxAttempts,
        @NonNull Duration initialBackoff,
        @NonNull Duration maxBackoff
) {
    private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxAttempts <= 0) {
            maxAttempts = 3;
        }
        if (initialBackoff == null) {
            initialBackoff = Duration.ofMillis(200);
        }
        if (maxBackoff == null) {
            maxBackoff = Duration.ofSeconds(2);
        }
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(1));
    }

    /**
     * Builds the Reactor retry spec. Exhaustion rethrows the last failure unchanged.
     *
     * @param operation label used in retry log lines
     */
    @NonNull
    public RetryBackoffSpec toRetry(@NonNull String operation) {
        return Retry.backoff(maxAttempts - 1L, initialBackoff)
                .maxBackoff(maxBackoff)
                .filter(RetryUtils.retryablePredicate())
                .doBeforeRetry(signal -> LOG.warn(
                        "Retrying {}, attempt {}: {}",
                        operation, signal.totalRetries() + 2, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
