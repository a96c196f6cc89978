package com.apimonitor.anomaly.telemetry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for TelemetryQuery.
 */
class TelemetryQueryTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant END = Instant.parse("2024-05-01T10:06:00Z");

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode build(List<String> included, List<String> excluded) {
        Map<String, Object> query = TelemetryQuery.build(START, END, 500, included, excluded);
        return mapper.valueToTree(query);
    }

    @Test
    void buildsRangeExistsAndPositiveResponseTimeFilter() {
        JsonNode query = build(List.of(), List.of());

        assertThat(query.path("size").asInt()).isEqualTo(500);
        assertThat(query.path("sort").get(0).path("@timestamp").path("order").asText()).isEqualTo("asc");
        JsonNode must = query.path("query").path("bool").path("must");
        assertThat(must).hasSize(2);
        assertThat(must.get(0).path("range").path("@timestamp").path("gte").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(must.get(0).path("range").path("@timestamp").path("lte").asText()).isEqualTo("2024-05-01T10:06:00Z");
        assertThat(must.get(1).path("exists").path("field").asText()).isEqualTo("response_time");
        assertThat(query.path("query").path("bool").path("filter").get(0)
                .path("range").path("response_time").path("gt").asInt()).isZero();
        assertThat(query.path("query").path("bool").has("must_not")).isFalse();
        assertThat(query.path("_source")).extracting(JsonNode::asText).contains("@timestamp", "service", "response_time");
    }

    @Test
    void allowAndDenyListsCompose() {
        JsonNode bool = build(List.of("user-service", "payment-service"), List.of("payment-service")).path("query").path("bool");

        assertThat(bool.path("must")).hasSize(3);
        assertThat(bool.path("must").get(2).path("terms").path("service"))
                .extracting(JsonNode::asText).containsExactly("user-service", "payment-service");
        assertThat(bool.path("must_not").get(0).path("terms").path("service"))
                .extracting(JsonNode::asText).containsExactly("payment-service");
    }

    @Test
    void nullListsMeanNoServiceFilter() {
        JsonNode bool = build(null, null).path("query").path("bool");

        assertThat(bool.path("must")).hasSize(2);
        assertThat(bool.has("must_not")).isFalse();
    }
}
