package com.apimonitor.anomaly.detection.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Anomaly raised by the scorer. Written once to the anomaly index and, when critical,
 * to the alert channels. Serialized in snake_case to match the index mapping.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Anomaly {

    AnomalyType type;
    String service;
    String endpoint;
    /** Set for response-time anomalies. */
    Double avgResponseTime;
    Double p95ResponseTime;
    /** Set for error-rate anomalies. */
    Double errorRate;
    /** Errors in the recent window; threshold error-rate path only. */
    Integer errorCount;
    /** Requests above the latency threshold; threshold response-time path only. */
    Integer violationCount;
    int requestCount;
    Instant timestamp;
    Severity severity;
    DetectorKind detector;
    Double baselineValue;
    Double thresholdValue;
    /** Current value divided by the baseline value, when a baseline exists. */
    Double deviation;
    String environment;
    String environmentType;

    public AggregateKey key() {
        return new AggregateKey(service, endpoint);
    }

    @JsonIgnore
    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
