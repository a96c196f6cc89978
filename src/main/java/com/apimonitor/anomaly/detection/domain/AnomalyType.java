package com.apimonitor.anomaly.detection.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Signal an anomaly was raised on. Also names the per-signal model slot.
 */
public enum AnomalyType {
    RESPONSE_TIME("response_time"),
    ERROR_RATE("error_rate");

    private final String wireName;

    AnomalyType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Parses the lower-case name used in documents and query parameters. */
    public static AnomalyType fromWireName(String value) {
        for (AnomalyType candidate : values()) {
            if (candidate.wireName().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: " + value);
    }
}
