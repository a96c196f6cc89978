package com.apimonitor.anomaly.detection.domain;

import com.apimonitor.anomaly.telemetry.TelemetryStoreClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the Anomaly document shape.
 */
class AnomalyTest {

    private final ObjectMapper mapper = TelemetryStoreClient.documentMapper();

    @Test
    void documentCarriesOnlyIndexedFields() throws Exception {
        Anomaly anomaly = Anomaly.builder()
                .type(AnomalyType.ERROR_RATE)
                .service("checkout")
                .endpoint("/pay")
                .errorRate(0.4)
                .errorCount(16)
                .requestCount(40)
                .timestamp(Instant.parse("2024-05-01T10:06:00Z"))
                .severity(Severity.CRITICAL)
                .detector(DetectorKind.THRESHOLD)
                .thresholdValue(0.1)
                .environment("production")
                .environmentType("production")
                .build();

        JsonNode document = mapper.readTree(mapper.writeValueAsString(anomaly));
        List<String> fields = new ArrayList<>();
        document.fieldNames().forEachRemaining(fields::add);

        assertThat(anomaly.isCritical()).isTrue();
        assertThat(fields).containsExactlyInAnyOrder("type", "service", "endpoint", "error_rate", "error_count",
                "request_count", "timestamp", "severity", "detector", "threshold_value", "environment",
                "environment_type");
        assertThat(document.get("timestamp").asText()).isEqualTo("2024-05-01T10:06:00Z");
        assertThat(document.get("severity").asText()).isEqualTo("critical");
    }

    @Test
    void criticalFlagFollowsSeverity() {
        assertThat(Anomaly.builder().severity(Severity.HIGH).build().isCritical()).isFalse();
        assertThat(Anomaly.builder().build().isCritical()).isFalse();
    }
}
