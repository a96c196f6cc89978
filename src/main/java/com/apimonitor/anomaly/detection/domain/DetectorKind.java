package com.apimonitor.anomaly.detection.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which detection path produced an anomaly.
 */
public enum DetectorKind {
    /** Outlier model trained on historical aggregates. */
    ML_MODEL("ml_model"),
    /** Fixed latency / error-rate threshold over raw recent records. */
    THRESHOLD("threshold");

    private final String wireName;

    DetectorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Parses the lower-case name used in documents and query parameters. */
    public static DetectorKind fromWireName(String value) {
        for (DetectorKind candidate : values()) {
            if (candidate.wireName().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown detector: " + value);
    }
}
