package com.apimonitor.anomaly.detection.domain;

import java.util.Map;

public record StatusCodeSummary(AggregateKey key, Map<Integer, Long> statusCodes, int requestCount) {
}
