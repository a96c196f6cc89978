package com.apimonitor.anomaly.detection.domain;

/**
 * The (service, endpoint) pair identifying one monitored unit.
 */
public record AggregateKey(String service, String endpoint) {

    /** Document key used when baselines are written to the store, e.g. {@code user-service:/api/users}. */
    public String asDocumentKey() {
        return service + ":" + endpoint;
    }

    @Override
    public String toString() {
        return service + "/" + endpoint;
    }
}
