package com.apimonitor.anomaly.detection.domain;

public record ErrorRateRow(AggregateKey key, double errorRate, int requestCount) {
}
