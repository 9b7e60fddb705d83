package com.example.search.aggregation.exception;

/**
 * Input rejected before any I/O: a composite id without a source prefix or an unknown source.
 */
public class MalformedInputException extends RuntimeException {

    public MalformedInputException(String message) {
        super(message);
    }
}
