package com.apimonitor.anomaly.detection.engine;

import com.apimonitor.anomaly.config.DetectorProperties;
import com.apimonitor.anomaly.detection.domain.AggregateKey;
import com.apimonitor.anomaly.detection.domain.Anomaly;
import com.apimonitor.anomaly.detection.domain.AnomalyType;
import com.apimonitor.anomaly.detection.domain.Baseline;
import com.apimonitor.anomaly.detection.domain.DetectorKind;
import com.apimonitor.anomaly.detection.domain.FeatureRow;
import com.apimonitor.anomaly.detection.domain.RequestRecord;
import com.apimonitor.anomaly.detection.features.AggregationResult;
import com.apimonitor.anomaly.detection.features.FeatureAggregator;
import com.apimonitor.anomaly.detection.features.ResponseTimeStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Scores the recent window two ways: against the trained models, and against fixed
 * latency and error-rate thresholds. Both paths can flag the same key; the results are
 * not de-duplicated. Baselines only grade severity.
 */
@Slf4j
@Service
public class AnomalyScorer {

    /** Error-rate model decision scores below this are anomalous. */
    static final double ERROR_RATE_DECISION_CUTOFF = -0.5;

    private final ModelTrainer trainer;
    private final Clock clock;
    private final double responseTimeThreshold;
    private final double errorRateThreshold;
    private final int minDataPoints;

    public AnomalyScorer(ModelTrainer trainer, DetectorProperties properties, Clock clock) {
        this.trainer = trainer;
        this.clock = clock;
        this.responseTimeThreshold = properties.thresholds().responseTimeMs();
        this.errorRateThreshold = properties.thresholds().errorRate();
        this.minDataPoints = properties.analysis().minDataPoints();
    }

    public List<Anomaly> scoreWithModels(AggregationResult recent, Map<AggregateKey, Baseline> baselines) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (recent.isEmpty()) {
            log.warn("Insufficient recent data for model-based detection");
            return anomalies;
        }
        Instant now = clock.instant();
        List<FeatureRow> rows = recent.featureRows();

        Optional<TrainedModel> responseTimeModel = trainer.model(AnomalyType.RESPONSE_TIME);
        if (responseTimeModel.isPresent()) {
            try {
                boolean[] outliers = responseTimeModel.get().getDetector()
                        .predictOutliers(responseTimeModel.get().standardize(rows));
                for (int i = 0; i < rows.size(); i++) {
                    if (outliers[i]) {
                        anomalies.add(modelResponseTimeAnomaly(rows.get(i), baselines.get(rows.get(i).getKey()), now));
                    }
                }
            } catch (RuntimeException e) {
                log.error("Error detecting response time anomalies", e);
            }
        }

        Optional<TrainedModel> errorRateModel = trainer.model(AnomalyType.ERROR_RATE);
        if (errorRateModel.isPresent()) {
            try {
                double[] scores = errorRateModel.get().getDetector()
                        .decisionFunction(errorRateModel.get().standardize(rows));
                for (int i = 0; i < rows.size(); i++) {
                    if (scores[i] < ERROR_RATE_DECISION_CUTOFF) {
                        anomalies.add(modelErrorRateAnomaly(rows.get(i), baselines.get(rows.get(i).getKey()), now));
                    }
                }
            } catch (RuntimeException e) {
                log.error("Error detecting error rate anomalies", e);
            }
        }
        return anomalies;
    }

    /**
     * Fixed-threshold checks straight on the records. Keys with fewer than the minimum number
     * of records in the window are not checked.
     */
    public List<Anomaly> scoreThresholds(List<RequestRecord> recent, Map<AggregateKey, Baseline> baselines) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (recent.isEmpty()) {
            return anomalies;
        }
        Instant now = clock.instant();
        Map<AggregateKey, List<RequestRecord>> groups = FeatureAggregator.groupByKey(recent);

        for (Map.Entry<AggregateKey, List<RequestRecord>> group : groups.entrySet()) {
            if (group.getValue().size() < minDataPoints) {
                continue;
            }
            double[] slow = group.getValue().stream()
                    .mapToDouble(RequestRecord::getResponseTime)
                    .filter(rt -> rt > responseTimeThreshold)
                    .toArray();
            if (slow.length > 0) {
                anomalies.add(thresholdResponseTimeAnomaly(group.getKey(), slow, group.getValue().size(),
                        baselines.get(group.getKey()), now));
            }
        }

        for (Map.Entry<AggregateKey, List<RequestRecord>> group : groups.entrySet()) {
            int total = group.getValue().size();
            if (total < minDataPoints) {
                continue;
            }
            int errors = (int) group.getValue().stream().filter(RequestRecord::isError).count();
            double errorRate = (double) errors / total;
            if (errorRate > errorRateThreshold) {
                anomalies.add(thresholdErrorRateAnomaly(group.getKey(), errorRate, errors, total,
                        baselines.get(group.getKey()), now));
            }
        }
        return anomalies;
    }

    private Anomaly modelResponseTimeAnomaly(FeatureRow row, Baseline baseline, Instant now) {
        double baselineAvg = baseline != null ? baseline.getAvgResponseTime() : 0;
        Anomaly anomaly = Anomaly.builder()
                .type(AnomalyType.RESPONSE_TIME)
                .service(row.getKey().service())
                .endpoint(row.getKey().endpoint())
                .avgResponseTime(row.getAvgResponseTime())
                .p95ResponseTime(row.getP95ResponseTime())
                .requestCount(row.getRequestCount())
                .timestamp(now)
                .severity(SeverityClassifier.modelResponseTime(row.getAvgResponseTime(), baselineAvg))
                .detector(DetectorKind.ML_MODEL)
                .baselineValue(baselineAvg > 0 ? baselineAvg : null)
                .deviation(baselineAvg > 0 ? row.getAvgResponseTime() / baselineAvg : null)
                .build();
        log.info("ML model detected response time anomaly: {} - {}ms ({})", row.getKey(),
                String.format(Locale.ROOT, "%.2f", row.getAvgResponseTime()), anomaly.getSeverity().wireName());
        return anomaly;
    }

    private Anomaly modelErrorRateAnomaly(FeatureRow row, Baseline baseline, Instant now) {
        double baselineRate = baseline != null ? baseline.getErrorRate() : 0;
        Anomaly anomaly = Anomaly.builder()
                .type(AnomalyType.ERROR_RATE)
                .service(row.getKey().service())
                .endpoint(row.getKey().endpoint())
                .errorRate(row.getErrorRate())
                .requestCount(row.getRequestCount())
                .timestamp(now)
                .severity(SeverityClassifier.modelErrorRate(row.getErrorRate(), baselineRate))
                .detector(DetectorKind.ML_MODEL)
                .baselineValue(baselineRate > 0 ? baselineRate : null)
                .deviation(baselineRate > 0 ? row.getErrorRate() / baselineRate : null)
                .build();
        log.info("ML model detected error rate anomaly: {} - {} ({})", row.getKey(),
                String.format(Locale.ROOT, "%.4f", row.getErrorRate()), anomaly.getSeverity().wireName());
        return anomaly;
    }

    private Anomaly thresholdResponseTimeAnomaly(AggregateKey key, double[] slow, int total,
                                                 Baseline baseline, Instant now) {
        double mean = ResponseTimeStatistics.mean(slow);
        double baselineAvg = baseline != null ? baseline.getAvgResponseTime() : 0;
        Anomaly anomaly = Anomaly.builder()
                .type(AnomalyType.RESPONSE_TIME)
                .service(key.service())
                .endpoint(key.endpoint())
                .avgResponseTime(mean)
                .p95ResponseTime(ResponseTimeStatistics.percentile(slow, 95.0))
                .violationCount(slow.length)
                .requestCount(total)
                .timestamp(now)
                .severity(SeverityClassifier.thresholdResponseTime(mean, baselineAvg))
                .detector(DetectorKind.THRESHOLD)
                .thresholdValue(responseTimeThreshold)
                .baselineValue(baselineAvg > 0 ? baselineAvg : null)
                .deviation(baselineAvg > 0 ? mean / baselineAvg : null)
                .build();
        log.info("Threshold detected response time anomaly: {} - {}ms over {} of {} requests ({})", key,
                String.format(Locale.ROOT, "%.2f", mean), slow.length, total, anomaly.getSeverity().wireName());
        return anomaly;
    }

    private Anomaly thresholdErrorRateAnomaly(AggregateKey key, double errorRate, int errors, int total,
                                              Baseline baseline, Instant now) {
        double baselineRate = baseline != null ? baseline.getErrorRate() : 0;
        Anomaly anomaly = Anomaly.builder()
                .type(AnomalyType.ERROR_RATE)
                .service(key.service())
                .endpoint(key.endpoint())
                .errorRate(errorRate)
                .errorCount(errors)
                .requestCount(total)
                .timestamp(now)
                .severity(SeverityClassifier.thresholdErrorRate(errorRate, baselineRate))
                .detector(DetectorKind.THRESHOLD)
                .thresholdValue(errorRateThreshold)
                .baselineValue(baselineRate > 0 ? baselineRate : null)
                .deviation(baselineRate > 0 ? errorRate / baselineRate : null)
                .build();
        log.info("Threshold detected error rate anomaly: {} - {} ({})", key,
                String.format(Locale.ROOT, "%.4f", errorRate), anomaly.getSeverity().wireName());
        return anomaly;
    }
}
