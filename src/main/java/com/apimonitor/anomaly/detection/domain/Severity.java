package com.apimonitor.anomaly.detection.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity band of an anomaly. Only {@link #CRITICAL} is forwarded to webhook and paging channels.
 */
public enum Severity {
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses the lower-case name used in documents and query parameters. */
    public static Severity fromWireName(String value) {
        for (Severity candidate : values()) {
            if (candidate.wireName().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
