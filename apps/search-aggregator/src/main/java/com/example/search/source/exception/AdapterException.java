package com.example.search.source.exception;

import com.example.search.source.model.SourceId;

/**
 * Failure talking to a source. Only the adapter's retry policy distinguishes the kinds;
 * the aggregator drops the source from the result either way.
 */
public class AdapterException extends RuntimeException {

    public enum Kind {
        TRANSIENT,
        PERMANENT
    }

    private final SourceId source;
    private final Kind kind;
    private final int statusCode;

    public AdapterException(SourceId source, Kind kind, String message) {
        super(String.format("%s adapter error: %s", source, message));
        this.source = source;
        this.kind = kind;
        this.statusCode = -1;
    }

    public AdapterException(SourceId source, int statusCode, String message) {
        super(String.format("%s API returned %d: %s", source, statusCode, message));
        this.source = source;
        this.kind = kindForStatus(statusCode);
        this.statusCode = statusCode;
    }

    public AdapterException(SourceId source, Kind kind, String message, Throwable cause) {
        super(String.format("%s adapter error: %s", source, message), cause);
        this.source = source;
        this.kind = kind;
        this.statusCode = -1;
    }

    public static AdapterException timeout(SourceId source, Throwable cause) {
        return new AdapterException(source, Kind.TRANSIENT, "timed out", cause);
    }

    public SourceId getSource() {
        return source;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    private static Kind kindForStatus(int statusCode) {
        return statusCode >= 500 || statusCode == 429 ? Kind.TRANSIENT : Kind.PERMANENT;
    }
}
