package com.apimonitor.anomaly.persistence;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field mappings the anomaly index is created with.
 */
public final class IndexMappings {

    private static final String KEYWORD = "keyword";
    private static final String FLOAT = "float";

    private IndexMappings() {
    }

    public static Map<String, Object> anomalyIndex() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("timestamp", type("date"));
        properties.put("type", type(KEYWORD));
        properties.put("service", type(KEYWORD));
        properties.put("endpoint", type(KEYWORD));
        properties.put("avg_response_time", type(FLOAT));
        properties.put("p95_response_time", type(FLOAT));
        properties.put("p99_response_time", type(FLOAT));
        properties.put("error_rate", type(FLOAT));
        properties.put("error_count", type("integer"));
        properties.put("violation_count", type("integer"));
        properties.put("request_count", type("integer"));
        properties.put("severity", type(KEYWORD));
        properties.put("detector", type(KEYWORD));
        properties.put("environment", type(KEYWORD));
        properties.put("environment_type", type(KEYWORD));
        properties.put("threshold_value", type(FLOAT));
        properties.put("baseline_value", type(FLOAT));
        properties.put("deviation", type(FLOAT));
        return Map.of("mappings", Map.of("properties", properties));
    }

    private static Map<String, String> type(String type) {
        return Map.of("type", type);
    }
}
