package com.apimonitor.anomaly.detection.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Last known statistics for a (service, endpoint). Only used as the reference point
 * when grading how severe an anomaly is, never for training.
 */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Baseline {

    double avgResponseTime;
    double medianResponseTime;
    double p95ResponseTime;
    double p99ResponseTime;
    double errorRate;
    int requestCount;
    Map<Integer, Long> statusCodes;
    Instant updatedAt;

    public static Baseline from(FeatureRow row, Instant updatedAt) {
        return Baseline.builder()
                .avgResponseTime(row.getAvgResponseTime())
                .medianResponseTime(row.getMedianResponseTime())
                .p95ResponseTime(row.getP95ResponseTime())
                .p99ResponseTime(row.getP99ResponseTime())
                .errorRate(row.getErrorRate())
                .requestCount(row.getRequestCount())
                .statusCodes(row.getStatusCodes())
                .updatedAt(updatedAt)
                .build();
    }
}
