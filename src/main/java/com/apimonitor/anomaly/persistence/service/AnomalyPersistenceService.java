package com.apimonitor.anomaly.persistence.service;

import com.apimonitor.anomaly.config.DetectorProperties;
import com.apimonitor.anomaly.detection.domain.Anomaly;
import com.apimonitor.anomaly.persistence.IndexMappings;
import com.apimonitor.anomaly.telemetry.TelemetryStoreClient;
import com.apimonitor.anomaly.telemetry.TelemetryStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Writes anomalies and detector lifecycle events to the anomaly index.
 */
@Slf4j
@Service
public class AnomalyPersistenceService {

    private final TelemetryStoreClient client;
    private final String anomaliesIndex;

    public AnomalyPersistenceService(TelemetryStoreClient client, DetectorProperties properties) {
        this.client = client;
        this.anomaliesIndex = properties.store().anomaliesIndex();
    }

    /**
     * Creates the anomaly index with its mapping if it does not exist yet.
     *
     * @throws TelemetryStoreException if the store cannot be reached or rejects the mapping
     */
    public void ensureIndex() {
        if (client.indexExists(anomaliesIndex)) {
            log.debug("Index {} already exists", anomaliesIndex);
            return;
        }
        log.info("Creating {} index", anomaliesIndex);
        client.createIndex(anomaliesIndex, IndexMappings.anomalyIndex());
    }

    /**
     * Appends one anomaly document.
     *
     * @return false if the write failed; the failure is logged
     */
    public boolean persist(Anomaly anomaly) {
        try {
            client.index(anomaliesIndex, anomaly);
            log.info("Anomaly indexed: {} anomaly for {}/{} severity={} detector={}",
                    anomaly.getType().wireName(), anomaly.getService(), anomaly.getEndpoint(),
                    anomaly.getSeverity().wireName(), anomaly.getDetector().wireName());
            return true;
        } catch (TelemetryStoreException e) {
            log.error("Failed to index {} anomaly for {}/{}: {}", anomaly.getType().wireName(),
                    anomaly.getService(), anomaly.getEndpoint(), e.getMessage());
            return false;
        }
    }

    /** Best-effort write of a {@code service_event} document (e.g. startup). */
    public void recordServiceEvent(Map<String, Object> event) {
        try {
            client.index(anomaliesIndex, event);
        } catch (TelemetryStoreException e) {
            log.error("Failed to record service event {}: {}", event.get("event"), e.getMessage());
        }
    }
}
