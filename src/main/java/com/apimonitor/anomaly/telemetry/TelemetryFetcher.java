package com.apimonitor.anomaly.telemetry;

import com.apimonitor.anomaly.config.DetectorProperties;
import com.apimonitor.anomaly.detection.domain.RequestRecord;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Pulls request records for a trailing time window from the telemetry store.
 * Returns an empty list when the store is unavailable; callers cannot tell that apart
 * from a window with no traffic.
 */
@Slf4j
@Component
public class TelemetryFetcher {

    static final String RETRY_INSTANCE = "telemetry-store";

    private final TelemetryStoreClient client;
    private final RetryRegistry retryRegistry;
    private final Clock clock;
    private final DetectorProperties.Store store;
    private final DetectorProperties.Filters filters;
    private final int maxSamples;

    public TelemetryFetcher(TelemetryStoreClient client, RetryRegistry retryRegistry,
                            DetectorProperties properties, Clock clock) {
        this.client = client;
        this.retryRegistry = retryRegistry;
        this.clock = clock;
        this.store = properties.store();
        this.filters = properties.filters();
        this.maxSamples = properties.analysis().maxSamples();
    }

    public List<RequestRecord> fetch(Duration window) {
        Instant now = clock.instant();
        Instant start = now.minus(window);
        log.info("Fetching request records from {} to {} (index={})", start, now, store.logsIndex());

        Map<String, Object> query = TelemetryQuery.build(start, now, maxSamples,
                filters.includedServices(), filters.excludedServices());
        Retry retry = retryRegistry.retry(RETRY_INSTANCE);
        Supplier<JsonNode> search = Retry.decorateSupplier(retry, () -> client.search(store.logsIndex(), query));

        JsonNode response;
        try {
            response = search.get();
        } catch (TelemetryStoreException e) {
            log.error("Error fetching request records from {} (retryable={}): {}",
                    store.logsIndex(), e.isRetryable(), e.getMessage());
            return Collections.emptyList();
        } catch (RuntimeException e) {
            log.error("Unexpected error fetching request records from {}", store.logsIndex(), e);
            return Collections.emptyList();
        }

        JsonNode hits = response == null ? null : response.path("hits").path("hits");
        if (hits == null || !hits.isArray() || hits.isEmpty()) {
            log.warn("No request records found in {}", store.logsIndex());
            return Collections.emptyList();
        }

        List<RequestRecord> records = new ArrayList<>(hits.size());
        int dropped = 0;
        for (JsonNode hit : hits) {
            RequestRecord record = toRecord(hit.path("_source"));
            if (record == null) {
                dropped++;
            } else {
                records.add(record);
            }
        }
        log.info("Fetched {} request records ({} dropped without a usable response time)", records.size(), dropped);
        if (!records.isEmpty()) {
            logServiceSummary(records);
        }
        return records;
    }

    /** Maps one {@code _source}; null when the response time is missing or not positive. */
    static RequestRecord toRecord(JsonNode source) {
        JsonNode responseTime = source.get("response_time");
        if (responseTime == null || responseTime.isNull()) {
            return null;
        }
        double millis = responseTime.isNumber() ? responseTime.doubleValue() : parseDouble(responseTime.asText());
        if (!(millis > 0)) {
            return null;
        }
        return RequestRecord.builder()
                .timestamp(parseTimestamp(text(source, TelemetryQuery.TIMESTAMP_FIELD)))
                .service(text(source, "service"))
                .endpoint(text(source, "endpoint"))
                .statusCode(statusCode(source.get("status_code")))
                .responseTime(millis)
                .environment(text(source, "environment"))
                .environmentType(source.hasNonNull("environment_type") ? source.get("environment_type").asText() : "unknown")
                .httpMethod(text(source, "http_method"))
                .requestId(text(source, "request_id"))
                .build();
    }

    private static void logServiceSummary(List<RequestRecord> records) {
        Map<String, Long> counts = records.stream()
                .collect(Collectors.groupingBy(r -> String.valueOf(r.getService()), TreeMap::new, Collectors.counting()));
        Map<String, String> averages = records.stream()
                .collect(Collectors.groupingBy(r -> String.valueOf(r.getService()), TreeMap::new,
                        Collectors.collectingAndThen(Collectors.averagingDouble(RequestRecord::getResponseTime),
                                avg -> String.format(Locale.ROOT, "%.2f", avg))));
        log.info("Service distribution: {}", counts);
        log.info("Average response times by service: {}", averages);
    }

    private static String text(JsonNode source, String field) {
        JsonNode node = source.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Integer statusCode(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.intValue();
        }
        try {
            return Integer.parseInt(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double parseDouble(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static Instant parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                log.debug("Unparseable record timestamp: {}", value);
                return null;
            }
        }
    }
}
