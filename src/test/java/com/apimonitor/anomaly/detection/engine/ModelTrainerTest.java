package com.apimonitor.anomaly.detection.engine;

import com.apimonitor.anomaly.TestProperties;
import com.apimonitor.anomaly.detection.domain.AggregateKey;
import com.apimonitor.anomaly.detection.domain.AnomalyType;
import com.apimonitor.anomaly.detection.domain.ErrorRateRow;
import com.apimonitor.anomaly.detection.domain.FeatureRow;
import com.apimonitor.anomaly.detection.domain.RequestRecord;
import com.apimonitor.anomaly.detection.domain.StatusCodeSummary;
import com.apimonitor.anomaly.detection.features.AggregationResult;
import com.apimonitor.anomaly.detection.features.FeatureAggregator;
import com.apimonitor.anomaly.detection.ml.IsolationForest;
import com.apimonitor.anomaly.detection.ml.LocalOutlierFactor;
import com.apimonitor.anomaly.telemetry.TelemetryFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ModelTrainer.
 */
@ExtendWith(MockitoExtension.class)
class ModelTrainerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private TelemetryFetcher fetcher;

    @Mock
    private FeatureAggregator aggregator;

    private ModelTrainer trainer;

    @BeforeEach
    void setUp() {
        trainer = new ModelTrainer(fetcher, aggregator, TestProperties.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    static FeatureRow row(String endpoint, double avg, double p95, double errorRate) {
        return FeatureRow.builder()
                .key(new AggregateKey("svc", endpoint))
                .avgResponseTime(avg)
                .medianResponseTime(avg)
                .p95ResponseTime(p95)
                .p99ResponseTime(p95)
                .errorRate(errorRate)
                .requestCount(100)
                .statusCodes(Map.of(200, 100L))
                .build();
    }

    static List<FeatureRow> normalRows(int n, long seed) {
        Random random = new Random(seed);
        List<FeatureRow> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            rows.add(row("/e" + i, 100 + random.nextDouble() * 20, 150 + random.nextDouble() * 30,
                    0.01 + random.nextDouble() * 0.01));
        }
        return rows;
    }

    private static AggregationResult result(List<FeatureRow> rows) {
        List<ErrorRateRow> errorRows = new ArrayList<>();
        List<StatusCodeSummary> summaries = new ArrayList<>();
        for (FeatureRow r : rows) {
            errorRows.add(new ErrorRateRow(r.getKey(), r.getErrorRate(), r.getRequestCount()));
            summaries.add(new StatusCodeSummary(r.getKey(), r.getStatusCodes(), r.getRequestCount()));
        }
        return new AggregationResult(rows, errorRows, summaries);
    }

    private static List<RequestRecord> someRecords() {
        return List.of(RequestRecord.builder().service("svc").endpoint("/e").responseTime(100).build());
    }

    @Test
    void trainsBothSignalsAndRecordsCompletion() {
        when(fetcher.fetch(Duration.ofHours(24))).thenReturn(someRecords());
        when(aggregator.aggregate(anyList())).thenReturn(result(normalRows(30, 1)));

        trainer.train();

        TrainedModel responseTime = trainer.model(AnomalyType.RESPONSE_TIME).orElseThrow();
        TrainedModel errorRate = trainer.model(AnomalyType.ERROR_RATE).orElseThrow();
        assertThat(responseTime.getDetector()).isInstanceOf(IsolationForest.class);
        assertThat(responseTime.getFeatureNames()).containsExactly("avg_response_time", "p95_response_time");
        assertThat(responseTime.getSampleCount()).isEqualTo(30);
        assertThat(responseTime.getTrainedAt()).isEqualTo(NOW);
        assertThat(errorRate.getDetector()).isInstanceOf(LocalOutlierFactor.class);
        assertThat(((LocalOutlierFactor) errorRate.getDetector()).getNeighbors()).isEqualTo(15);
        assertThat(trainer.lastTrainingTime()).contains(NOW);
    }

    @Test
    void noDataLeavesModelsAndTimestampUntouched() {
        when(fetcher.fetch(Duration.ofHours(24))).thenReturn(List.of());

        trainer.train();

        assertThat(trainer.model(AnomalyType.RESPONSE_TIME)).isEmpty();
        assertThat(trainer.lastTrainingTime()).isEmpty();
        assertThat(trainer.isRetrainDue(NOW)).isTrue();
        verify(aggregator, never()).aggregate(anyList());
    }

    @Test
    void singleRowIsInsufficient() {
        when(fetcher.fetch(Duration.ofHours(24))).thenReturn(someRecords());
        when(aggregator.aggregate(anyList())).thenReturn(result(normalRows(1, 1)));

        trainer.train();

        assertThat(trainer.model(AnomalyType.RESPONSE_TIME)).isEmpty();
        assertThat(trainer.model(AnomalyType.ERROR_RATE)).isEmpty();
        assertThat(trainer.lastTrainingTime()).isEmpty();
    }

    @Test
    void failedRetrainKeepsPreviousModels() {
        when(fetcher.fetch(Duration.ofHours(24))).thenReturn(someRecords(), List.of());
        when(aggregator.aggregate(anyList())).thenReturn(result(normalRows(10, 2)));
        trainer.train();
        TrainedModel first = trainer.model(AnomalyType.RESPONSE_TIME).orElseThrow();

        trainer.train();

        assertThat(trainer.model(AnomalyType.RESPONSE_TIME)).containsSame(first);
    }

    @Test
    void failingSignalDoesNotBlockTheOther() {
        when(fetcher.fetch(Duration.ofHours(24))).thenReturn(someRecords());
        when(aggregator.aggregate(anyList())).thenReturn(result(normalRows(20, 4)));
        ModelTrainer partial = spy(trainer);
        lenient().doThrow(new IllegalStateException("fit failed"))
                .when(partial).fit(eq(AnomalyType.RESPONSE_TIME), anyList());

        partial.train();

        assertThat(partial.model(AnomalyType.RESPONSE_TIME)).isEmpty();
        assertThat(partial.model(AnomalyType.ERROR_RATE)).isPresent();
        assertThat(partial.lastTrainingTime()).contains(NOW);
    }

    @Test
    void failingRetrainOfOneSignalKeepsItsPreviousModel() {
        when(fetcher.fetch(Duration.ofHours(24))).thenReturn(someRecords());
        when(aggregator.aggregate(anyList())).thenReturn(result(normalRows(20, 4)), result(normalRows(20, 9)));
        ModelTrainer partial = spy(trainer);
        lenient().doCallRealMethod().doThrow(new IllegalStateException("fit failed"))
                .when(partial).fit(eq(AnomalyType.RESPONSE_TIME), anyList());
        partial.train();
        TrainedModel firstResponseTime = partial.model(AnomalyType.RESPONSE_TIME).orElseThrow();
        TrainedModel firstErrorRate = partial.model(AnomalyType.ERROR_RATE).orElseThrow();

        partial.train();

        assertThat(partial.model(AnomalyType.RESPONSE_TIME)).containsSame(firstResponseTime);
        assertThat(partial.model(AnomalyType.ERROR_RATE).orElseThrow()).isNotSameAs(firstErrorRate);
    }

    @Test
    void retrainIsDueOnceIntervalElapsed() {
        when(fetcher.fetch(Duration.ofHours(24))).thenReturn(someRecords());
        when(aggregator.aggregate(anyList())).thenReturn(result(normalRows(10, 3)));
        trainer.train();

        assertThat(trainer.isRetrainDue(NOW.plus(Duration.ofHours(5)))).isFalse();
        assertThat(trainer.isRetrainDue(NOW.plus(Duration.ofHours(6)))).isTrue();
    }

    @Test
    void neighborCountIsHalfTheRowsWithinBounds() {
        assertThat(ModelTrainer.neighborsFor(2)).isEqualTo(5);
        assertThat(ModelTrainer.neighborsFor(30)).isEqualTo(15);
        assertThat(ModelTrainer.neighborsFor(100)).isEqualTo(20);
    }
}
