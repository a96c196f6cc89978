package com.apimonitor.anomaly.detection.engine;

import com.apimonitor.anomaly.config.DetectorProperties;
import com.apimonitor.anomaly.detection.domain.AnomalyType;
import com.apimonitor.anomaly.detection.domain.FeatureRow;
import com.apimonitor.anomaly.detection.domain.RequestRecord;
import com.apimonitor.anomaly.detection.features.AggregationResult;
import com.apimonitor.anomaly.detection.features.FeatureAggregator;
import com.apimonitor.anomaly.detection.ml.IsolationForest;
import com.apimonitor.anomaly.detection.ml.LocalOutlierFactor;
import com.apimonitor.anomaly.detection.ml.OutlierDetector;
import com.apimonitor.anomaly.detection.ml.StandardScaler;
import com.apimonitor.anomaly.telemetry.TelemetryFetcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fits one outlier model per signal on the historical window: an isolation forest over
 * average and p95 response time, and a local outlier factor over error rate. A signal that
 * fails to train keeps its previous model.
 */
@Slf4j
@Service
public class ModelTrainer {

    static final List<String> RESPONSE_TIME_FEATURES = List.of("avg_response_time", "p95_response_time");
    static final List<String> ERROR_RATE_FEATURES = List.of("error_rate");
    static final int MIN_TRAINING_ROWS = 2;

    private final TelemetryFetcher fetcher;
    private final FeatureAggregator aggregator;
    private final DetectorProperties.Analysis analysis;
    private final Clock clock;
    private final Map<AnomalyType, AtomicReference<TrainedModel>> models = new EnumMap<>(AnomalyType.class);
    private volatile Instant lastTrainingTime;

    public ModelTrainer(TelemetryFetcher fetcher, FeatureAggregator aggregator,
                        DetectorProperties properties, Clock clock) {
        this.fetcher = fetcher;
        this.aggregator = aggregator;
        this.analysis = properties.analysis();
        this.clock = clock;
        for (AnomalyType signal : AnomalyType.values()) {
            models.put(signal, new AtomicReference<>());
        }
    }

    public void train() {
        log.info("Training anomaly detection models on the last {}", analysis.historicalWindow());
        List<RequestRecord> records = fetcher.fetch(analysis.historicalWindow());
        if (records.isEmpty()) {
            log.warn("No request records available for model training");
            return;
        }
        AggregationResult result = aggregator.aggregate(records);
        if (result.size() < MIN_TRAINING_ROWS) {
            log.warn("Insufficient data for model training: {} aggregate rows (need {})",
                    result.size(), MIN_TRAINING_ROWS);
            return;
        }

        trainSignal(AnomalyType.RESPONSE_TIME, result.featureRows());
        trainSignal(AnomalyType.ERROR_RATE, result.featureRows());
        lastTrainingTime = clock.instant();
    }

    public Optional<TrainedModel> model(AnomalyType signal) {
        return Optional.ofNullable(models.get(signal).get());
    }

    public Optional<Instant> lastTrainingTime() {
        return Optional.ofNullable(lastTrainingTime);
    }

    /** True before the first completed training and once the retrain interval has elapsed since it. */
    public boolean isRetrainDue(Instant now) {
        Instant last = lastTrainingTime;
        return last == null || !now.isBefore(last.plus(analysis.retrainInterval()));
    }

    private void trainSignal(AnomalyType signal, List<FeatureRow> rows) {
        try {
            TrainedModel model = fit(signal, rows);
            models.get(signal).set(model);
            log.info("{} model ({}) trained on {} aggregate rows", signal.wireName(), model.getAlgorithm(), rows.size());
        } catch (RuntimeException e) {
            log.error("Error training {} model; keeping the previous one", signal.wireName(), e);
        }
    }

    TrainedModel fit(AnomalyType signal, List<FeatureRow> rows) {
        if (rows.size() < MIN_TRAINING_ROWS) {
            throw new IllegalArgumentException("Need at least " + MIN_TRAINING_ROWS + " rows to train " + signal.wireName());
        }
        List<String> features = signal == AnomalyType.RESPONSE_TIME ? RESPONSE_TIME_FEATURES : ERROR_RATE_FEATURES;
        StandardScaler scaler = new StandardScaler();
        double[][] scaled = scaler.fitTransform(TrainedModel.featureMatrix(rows, features));

        OutlierDetector detector;
        String algorithm;
        if (signal == AnomalyType.RESPONSE_TIME) {
            detector = new IsolationForest(analysis.estimators(), analysis.contamination(), analysis.randomSeed());
            algorithm = "isolation_forest";
        } else {
            detector = new LocalOutlierFactor(neighborsFor(rows.size()), analysis.contamination());
            algorithm = "local_outlier_factor";
        }
        detector.fit(scaled);

        return TrainedModel.builder()
                .signal(signal)
                .algorithm(algorithm)
                .detector(detector)
                .scaler(scaler)
                .featureNames(features)
                .trainedAt(clock.instant())
                .sampleCount(rows.size())
                .build();
    }

    /** Half the training rows, kept between 5 and 20. */
    static int neighborsFor(int rows) {
        return Math.max(5, Math.min(20, rows / 2));
    }
}
