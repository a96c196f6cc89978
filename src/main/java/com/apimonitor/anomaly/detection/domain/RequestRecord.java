package com.apimonitor.anomaly.detection.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One API request as recorded in the telemetry store. Only records with a positive
 * response time ever reach the aggregator.
 */
@Value
@Builder
public class RequestRecord {

    Instant timestamp;
    String service;
    String endpoint;
    /** May be null when the log line carried no status. */
    Integer statusCode;
    /** Milliseconds. */
    double responseTime;
    String environment;
    String environmentType;
    String httpMethod;
    String requestId;

    public AggregateKey key() {
        return new AggregateKey(service, endpoint);
    }

    /** Status 400 and above counts as an error; a missing status does not. */
    public boolean isError() {
        return statusCode != null && statusCode >= 400;
    }
}
