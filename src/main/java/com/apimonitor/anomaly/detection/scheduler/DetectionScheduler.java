package com.apimonitor.anomaly.detection.scheduler;

import com.apimonitor.anomaly.config.DetectorProperties;
import com.apimonitor.anomaly.detection.baseline.BaselineStore;
import com.apimonitor.anomaly.detection.domain.AggregateKey;
import com.apimonitor.anomaly.detection.domain.Anomaly;
import com.apimonitor.anomaly.detection.domain.Baseline;
import com.apimonitor.anomaly.detection.domain.RequestRecord;
import com.apimonitor.anomaly.detection.engine.AnomalyScorer;
import com.apimonitor.anomaly.detection.engine.ModelTrainer;
import com.apimonitor.anomaly.detection.features.AggregationResult;
import com.apimonitor.anomaly.detection.features.FeatureAggregator;
import com.apimonitor.anomaly.detection.messaging.AlertDispatcher;
import com.apimonitor.anomaly.persistence.service.AnomalyPersistenceService;
import com.apimonitor.anomaly.persistence.service.BaselinePersistenceService;
import com.apimonitor.anomaly.telemetry.TelemetryFetcher;
import com.apimonitor.anomaly.telemetry.TelemetryStoreClient;
import com.apimonitor.anomaly.telemetry.TelemetryStoreException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives detection on one dedicated thread: verifies the store and trains once at startup,
 * then runs a fetch, score, dispatch and retrain cycle every analysis interval. A failed
 * cycle is logged and retried after the cool-down; only a failed startup stops the process.
 */
@Slf4j
@Component
public class DetectionScheduler implements SmartLifecycle {

    static final String CYCLE_ID = "cycleId";
    static final long MIN_DELAY_MS = 1000;

    private final TelemetryStoreClient storeClient;
    private final TelemetryFetcher fetcher;
    private final FeatureAggregator aggregator;
    private final BaselineStore baselineStore;
    private final BaselinePersistenceService baselinePersistence;
    private final AnomalyPersistenceService anomalyPersistence;
    private final ModelTrainer trainer;
    private final AnomalyScorer scorer;
    private final AlertDispatcher dispatcher;
    private final DetectorProperties properties;
    private final Clock clock;
    private final Runnable onStartupFailure;

    private volatile ScheduledExecutorService executor;
    private volatile boolean running;

    @Autowired
    public DetectionScheduler(TelemetryStoreClient storeClient, TelemetryFetcher fetcher, FeatureAggregator aggregator,
                              BaselineStore baselineStore, BaselinePersistenceService baselinePersistence,
                              AnomalyPersistenceService anomalyPersistence, ModelTrainer trainer,
                              AnomalyScorer scorer, AlertDispatcher dispatcher, DetectorProperties properties,
                              Clock clock, ConfigurableApplicationContext context) {
        this(storeClient, fetcher, aggregator, baselineStore, baselinePersistence, anomalyPersistence,
                trainer, scorer, dispatcher, properties, clock, () -> exit(context));
    }

    DetectionScheduler(TelemetryStoreClient storeClient, TelemetryFetcher fetcher, FeatureAggregator aggregator,
                       BaselineStore baselineStore, BaselinePersistenceService baselinePersistence,
                       AnomalyPersistenceService anomalyPersistence, ModelTrainer trainer,
                       AnomalyScorer scorer, AlertDispatcher dispatcher, DetectorProperties properties,
                       Clock clock, Runnable onStartupFailure) {
        this.storeClient = storeClient;
        this.fetcher = fetcher;
        this.aggregator = aggregator;
        this.baselineStore = baselineStore;
        this.baselinePersistence = baselinePersistence;
        this.anomalyPersistence = anomalyPersistence;
        this.trainer = trainer;
        this.scorer = scorer;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.clock = clock;
        this.onStartupFailure = onStartupFailure;
    }

    @Override
    public void start() {
        executor = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "anomaly-detection"));
        running = true;
        executor.execute(() -> {
            boolean started;
            try {
                started = startup();
            } catch (RuntimeException e) {
                log.error("Unexpected error during startup", e);
                started = false;
            }
            if (started) {
                runAndReschedule();
            } else {
                log.error("Anomaly detection startup failed. Exiting.");
                running = false;
                onStartupFailure.run();
            }
        });
    }

    @Override
    public void stop() {
        running = false;
        ScheduledExecutorService current = executor;
        if (current == null) {
            return;
        }
        current.shutdownNow();
        try {
            if (!current.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Detection thread did not stop within 10 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Anomaly detection stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Verifies store access, creates the anomaly index, restores baselines, trains the
     * initial models and records a startup event.
     *
     * @return false if the store is unreachable or the anomaly index cannot be created;
     *         other failures propagate and are treated as fatal by {@link #start()}
     */
    boolean startup() {
        DetectorProperties.Store store = properties.store();
        log.info("Starting API anomaly detection service (store={}, index={})", store.baseUrl(), store.logsIndex());
        try {
            if (!storeClient.ping()) {
                log.error("Cannot connect to telemetry store at {}", store.baseUrl());
                return false;
            }
            if (!storeClient.indexExists(store.logsIndex())) {
                log.warn("No indices found matching {}", store.logsIndex());
            }
            anomalyPersistence.ensureIndex();
        } catch (TelemetryStoreException e) {
            log.error("Error checking telemetry store", e);
            return false;
        }
        log.info("Telemetry store connection verified");

        int restored = baselineStore.restore(baselinePersistence.load());
        if (restored > 0) {
            log.info("Restored {} saved baselines", restored);
        }
        trainer.train();
        anomalyPersistence.recordServiceEvent(startupEvent());
        return true;
    }

    /** One fetch, score, dispatch and retrain pass. */
    void runCycle() {
        MDC.put(CYCLE_ID, UUID.randomUUID().toString().substring(0, 8));
        try {
            log.info("Running anomaly detection cycle");
            List<Anomaly> anomalies = new ArrayList<>();
            List<RequestRecord> recent = fetcher.fetch(properties.analysis().recentWindow());
            if (recent.isEmpty()) {
                log.warn("No recent request records available for anomaly detection");
            } else {
                Map<AggregateKey, Baseline> baselines = baselineStore.snapshot();
                AggregationResult aggregation = aggregator.aggregate(recent);

                List<Anomaly> modelAnomalies = scorer.scoreWithModels(aggregation, baselines);
                if (!modelAnomalies.isEmpty()) {
                    log.info("Detected {} ML-based anomalies", modelAnomalies.size());
                }
                List<Anomaly> thresholdAnomalies = scorer.scoreThresholds(recent, baselines);
                if (!thresholdAnomalies.isEmpty()) {
                    log.info("Found {} threshold anomalies", thresholdAnomalies.size());
                }
                anomalies.addAll(modelAnomalies);
                anomalies.addAll(thresholdAnomalies);
            }

            if (anomalies.isEmpty()) {
                log.info("No anomalies detected");
            } else {
                log.info("Detected {} total anomalies", anomalies.size());
                dispatcher.dispatch(anomalies);
            }

            if (trainer.isRetrainDue(clock.instant())) {
                log.info("Retraining anomaly detection models on fresh data");
                trainer.train();
            }
        } finally {
            MDC.remove(CYCLE_ID);
        }
    }

    private void runAndReschedule() {
        if (!running) {
            return;
        }
        long delay;
        long started = clock.millis();
        try {
            runCycle();
            long elapsed = clock.millis() - started;
            log.info("Anomaly detection cycle completed in {} ms", elapsed);
            delay = nextDelayMillis(properties.analysis().interval(), elapsed);
        } catch (RuntimeException e) {
            log.error("Error in anomaly detection cycle", e);
            delay = properties.analysis().errorCooldown().toMillis();
        }
        if (running) {
            try {
                executor.schedule(this::runAndReschedule, delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Detection executor shut down; not scheduling another cycle");
            }
        }
    }

    /** Keeps cycle starts one interval apart, but never waits less than a second. */
    static long nextDelayMillis(Duration interval, long elapsedMillis) {
        return Math.max(MIN_DELAY_MS, interval.toMillis() - elapsedMillis);
    }

    Map<String, Object> startupEvent() {
        DetectorProperties.Analysis analysis = properties.analysis();
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("ANALYSIS_INTERVAL", analysis.interval().toSeconds());
        config.put("HISTORICAL_WINDOW", analysis.historicalWindow().toHours());
        config.put("ANOMALY_THRESHOLD", analysis.contamination());
        config.put("MIN_DATA_POINTS", analysis.minDataPoints());

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", "service_event");
        event.put("event", "startup");
        event.put("service", "anomaly-detection");
        event.put("timestamp", clock.instant().toString());
        event.put("environment", properties.alerting().environment());
        event.put("version", properties.alerting().version());
        event.put("config", config);
        return event;
    }

    /** Closes the context from a separate thread so that {@link #stop()} can join the detection thread. */
    private static void exit(ConfigurableApplicationContext context) {
        Thread exiter = new Thread(() -> System.exit(SpringApplication.exit(context, () -> 1)), "anomaly-detection-exit");
        exiter.start();
    }
}
