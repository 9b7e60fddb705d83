package com.example.search.common.util;

import com.example.search.source.exception.AdapterException;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Utility methods for retry logic in source adapter calls.
 * Centralizes retry conditions for consistent behavior.
 */
public final class RetryUtils {

    private static final int TOO_MANY_REQUESTS = 429;

    private RetryUtils() {}

    /**
     * Determines if an exception is retryable based on common patterns.
     * Retryable conditions:
     * - AdapterException of kind TRANSIENT
     * - WebClientResponseException with 5xx or 429 status
     * - WebClientRequestException (connection refused, reset, DNS)
     * - TimeoutException
     *
     * @param throwable the exception to check
     * @return true if the exception is retryable
     */
    public static boolean isRetryable(@NonNull Throwable throwable) {
        if (throwable instanceof AdapterException ex) {
            return ex.isTransient();
        }
        if (throwable instanceof WebClientResponseException ex) {
            return ex.getStatusCode().is5xxServerError() || ex.getStatusCode().value() == TOO_MANY_REQUESTS;
        }
        if (throwable instanceof WebClientRequestException) {
            return true;
        }
        return throwable instanceof TimeoutException;
    }

    /**
     * Returns a predicate for use with Retry.filter().
     *
     * @return a predicate that returns true for retryable exceptions
     */
    @NonNull
    public static Predicate<Throwable> retryablePredicate() {
        return RetryUtils::isRetryable;
    }
}
