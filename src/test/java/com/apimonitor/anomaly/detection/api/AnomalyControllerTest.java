package com.apimonitor.anomaly.detection.api;

import com.apimonitor.anomaly.detection.baseline.BaselineStore;
import com.apimonitor.anomaly.detection.domain.AggregateKey;
import com.apimonitor.anomaly.detection.domain.Anomaly;
import com.apimonitor.anomaly.detection.domain.AnomalyType;
import com.apimonitor.anomaly.detection.domain.Baseline;
import com.apimonitor.anomaly.detection.domain.DetectorKind;
import com.apimonitor.anomaly.detection.domain.Severity;
import com.apimonitor.anomaly.detection.engine.ModelTrainer;
import com.apimonitor.anomaly.detection.engine.TrainedModel;
import com.apimonitor.anomaly.detection.store.AnomalyFilter;
import com.apimonitor.anomaly.detection.store.RecentAnomaliesStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for AnomalyController.
 */
@WebMvcTest(controllers = AnomalyController.class)
class AnomalyControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:06:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RecentAnomaliesStore recentAnomaliesStore;

    @MockitoBean
    private BaselineStore baselineStore;

    @MockitoBean
    private ModelTrainer modelTrainer;

    @MockitoBean
    private Clock clock;

    @Test
    void listAnomaliesReturnsSnakeCaseJson() throws Exception {
        Anomaly anomaly = Anomaly.builder()
                .type(AnomalyType.RESPONSE_TIME)
                .service("checkout")
                .endpoint("/pay")
                .avgResponseTime(9000.0)
                .p95ResponseTime(9500.0)
                .requestCount(40)
                .violationCount(2)
                .timestamp(NOW)
                .severity(Severity.CRITICAL)
                .detector(DetectorKind.THRESHOLD)
                .build();
        when(recentAnomaliesStore.capacity()).thenReturn(100);
        when(recentAnomaliesStore.find(AnomalyFilter.ANY, 50)).thenReturn(List.of(anomaly));

        mockMvc.perform(get("/api/v1/anomalies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].type").value("response_time"))
                .andExpect(jsonPath("$[0].avg_response_time").value(9000.0))
                .andExpect(jsonPath("$[0].violation_count").value(2))
                .andExpect(jsonPath("$[0].severity").value("critical"))
                .andExpect(jsonPath("$[0].detector").value("threshold"))
                .andExpect(jsonPath("$[0].error_rate").doesNotExist())
                .andExpect(jsonPath("$[0].critical").doesNotExist());
    }

    @Test
    void filtersArePassedToStore() throws Exception {
        when(recentAnomaliesStore.capacity()).thenReturn(100);
        when(recentAnomaliesStore.find(any(), anyInt())).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/anomalies")
                        .param("limit", "10")
                        .param("type", "error_rate")
                        .param("severity", "high")
                        .param("detector", "ml_model")
                        .param("service", "checkout"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        verify(recentAnomaliesStore).find(
                eq(new AnomalyFilter(AnomalyType.ERROR_RATE, Severity.HIGH, DetectorKind.ML_MODEL, "checkout")), eq(10));
    }

    @Test
    void unknownSeverityIsBadRequest() throws Exception {
        when(recentAnomaliesStore.capacity()).thenReturn(100);

        mockMvc.perform(get("/api/v1/anomalies").param("severity", "urgent"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));

        verify(recentAnomaliesStore, never()).find(any(), anyInt());
    }

    @Test
    void summaryCountsEverySeverity() throws Exception {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        counts.put(Severity.MEDIUM, 0L);
        counts.put(Severity.HIGH, 3L);
        counts.put(Severity.CRITICAL, 1L);
        when(recentAnomaliesStore.countBySeverity()).thenReturn(counts);

        mockMvc.perform(get("/api/v1/anomalies/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.medium").value(0))
                .andExpect(jsonPath("$.high").value(3))
                .andExpect(jsonPath("$.critical").value(1));
    }

    @Test
    void limitOutOfRangeIsBadRequest() throws Exception {
        when(recentAnomaliesStore.capacity()).thenReturn(100);

        mockMvc.perform(get("/api/v1/anomalies").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));

        mockMvc.perform(get("/api/v1/anomalies").param("limit", "101"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/anomalies").param("limit", "many"))
                .andExpect(status().isBadRequest());

        verify(recentAnomaliesStore, never()).find(any(), anyInt());
    }

    @Test
    void baselinesAreKeyedByServiceAndEndpoint() throws Exception {
        Baseline baseline = Baseline.builder()
                .avgResponseTime(120.5)
                .errorRate(0.02)
                .requestCount(200)
                .statusCodes(Map.of(200, 196L, 500, 4L))
                .updatedAt(NOW)
                .build();
        when(baselineStore.snapshot()).thenReturn(Map.of(new AggregateKey("checkout", "/pay"), baseline));

        mockMvc.perform(get("/api/v1/baselines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['checkout:/pay'].avg_response_time").value(120.5))
                .andExpect(jsonPath("$['checkout:/pay'].error_rate").value(0.02))
                .andExpect(jsonPath("$['checkout:/pay'].status_codes['500']").value(4));
    }

    @Test
    void modelsReportsTrainingState() throws Exception {
        TrainedModel model = TrainedModel.builder()
                .signal(AnomalyType.RESPONSE_TIME)
                .algorithm("isolation_forest")
                .featureNames(List.of("avg_response_time", "p95_response_time"))
                .trainedAt(NOW)
                .sampleCount(42)
                .build();
        when(clock.instant()).thenReturn(NOW);
        when(modelTrainer.model(AnomalyType.RESPONSE_TIME)).thenReturn(Optional.of(model));
        when(modelTrainer.model(AnomalyType.ERROR_RATE)).thenReturn(Optional.empty());
        when(modelTrainer.lastTrainingTime()).thenReturn(Optional.of(NOW));
        when(modelTrainer.isRetrainDue(any())).thenReturn(false);

        mockMvc.perform(get("/api/v1/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.retrain_due").value(false))
                .andExpect(jsonPath("$.last_training_time").value("2024-05-01T10:06:00Z"))
                .andExpect(jsonPath("$.models.length()").value(1))
                .andExpect(jsonPath("$.models[0].signal").value("response_time"))
                .andExpect(jsonPath("$.models[0].algorithm").value("isolation_forest"))
                .andExpect(jsonPath("$.models[0].sample_count").value(42))
                .andExpect(jsonPath("$.models[0].feature_names[1]").value("p95_response_time"));
    }
}
