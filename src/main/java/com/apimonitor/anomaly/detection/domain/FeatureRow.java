package com.apimonitor.anomaly.detection.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Summary statistics for one (service, endpoint) over one aggregation window.
 * Recomputed every pass; a newer row supersedes an older one.
 */
@Value
@Builder
public class FeatureRow {

    AggregateKey key;
    double avgResponseTime;
    double medianResponseTime;
    double p95ResponseTime;
    double p99ResponseTime;
    /** Fraction of requests with status >= 400, in [0, 1]. */
    double errorRate;
    int requestCount;
    /** Status code to number of requests. Requests without a status are not counted. */
    Map<Integer, Long> statusCodes;

    /** Reads a feature by the name used in {@code TrainedModel#getFeatureNames()}. */
    public double feature(String name) {
        switch (name) {
            case "avg_response_time":
                return avgResponseTime;
            case "median_response_time":
                return medianResponseTime;
            case "p95_response_time":
                return p95ResponseTime;
            case "p99_response_time":
                return p99ResponseTime;
            case "error_rate":
                return errorRate;
            default:
                throw new IllegalArgumentException("Unknown feature: " + name);
        }
    }
}
