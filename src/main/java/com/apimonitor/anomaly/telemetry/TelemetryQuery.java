package com.apimonitor.anomaly.telemetry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@code _search} body for pulling request records: a time range on
 * {@code @timestamp}, only documents with a positive {@code response_time}, optional
 * service allow/deny lists, ascending time order.
 */
public final class TelemetryQuery {

    public static final String TIMESTAMP_FIELD = "@timestamp";

    static final List<String> SOURCE_FIELDS = List.of(
            TIMESTAMP_FIELD, "service", "endpoint", "status_code", "response_time",
            "environment", "request_id", "environment_type", "http_method");

    private TelemetryQuery() {
    }

    public static Map<String, Object> build(Instant start, Instant end, int size,
                                            List<String> includedServices, List<String> excludedServices) {
        List<Object> must = new ArrayList<>();
        must.add(Map.of("range", Map.of(TIMESTAMP_FIELD, Map.of("gte", start.toString(), "lte", end.toString()))));
        must.add(Map.of("exists", Map.of("field", "response_time")));
        if (includedServices != null && !includedServices.isEmpty()) {
            must.add(Map.of("terms", Map.of("service", includedServices)));
        }

        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("must", must);
        bool.put("filter", List.of(Map.of("range", Map.of("response_time", Map.of("gt", 0)))));
        // must_not is applied after the allow-list, so a service on both lists is excluded
        if (excludedServices != null && !excludedServices.isEmpty()) {
            bool.put("must_not", List.of(Map.of("terms", Map.of("service", excludedServices))));
        }

        Map<String, Object> query = new LinkedHashMap<>();
        query.put("size", size);
        query.put("sort", List.of(Map.of(TIMESTAMP_FIELD, Map.of("order", "asc"))));
        query.put("query", Map.of("bool", bool));
        query.put("_source", SOURCE_FIELDS);
        return query;
    }
}
