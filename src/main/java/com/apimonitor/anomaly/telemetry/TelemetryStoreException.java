package com.apimonitor.anomaly.telemetry;

/**
 * Failure talking to the telemetry store. {@link #isRetryable()} separates transient
 * failures (connection problems, 5xx, 429) from ones a retry cannot fix.
 */
public class TelemetryStoreException extends RuntimeException {

    private final boolean retryable;
    private final int statusCode;

    public TelemetryStoreException(String message, boolean retryable, int statusCode, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.statusCode = statusCode;
    }

    public static TelemetryStoreException permanent(String message, Throwable cause) {
        return new TelemetryStoreException(message, false, 0, cause);
    }

    public boolean isRetryable() {
        return retryable;
    }

    /** HTTP status returned by the store, or 0 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
