package com.example.search.aggregation.exception;

/**
 * Thrown when an operation is invoked without an authenticated identity.
 * No adapter is called and the cache is not consulted.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}
