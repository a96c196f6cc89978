package com.apimonitor.anomaly.telemetry;

import java.util.function.Predicate;

/**
 * Retry predicate for the {@code telemetry-store} Resilience4j instance: only transient
 * store failures are retried.
 */
public class RetryableStoreFailure implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof TelemetryStoreException && ((TelemetryStoreException) throwable).isRetryable();
    }
}
