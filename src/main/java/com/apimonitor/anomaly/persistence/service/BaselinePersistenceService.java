package com.apimonitor.anomaly.persistence.service;

import com.apimonitor.anomaly.config.DetectorProperties;
import com.apimonitor.anomaly.detection.domain.AggregateKey;
import com.apimonitor.anomaly.detection.domain.Baseline;
import com.apimonitor.anomaly.telemetry.TelemetryStoreClient;
import com.apimonitor.anomaly.telemetry.TelemetryStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the whole baseline map in a single store document, overwritten after every
 * aggregation pass. Both directions are best-effort.
 */
@Slf4j
@Service
public class BaselinePersistenceService {

    private final TelemetryStoreClient client;
    private final String index;
    private final String documentId;

    public BaselinePersistenceService(TelemetryStoreClient client, DetectorProperties properties) {
        this.client = client;
        this.index = properties.store().baselinesIndex();
        this.documentId = properties.store().baselineDocumentId();
    }

    public void save(Map<AggregateKey, Baseline> baselines, Instant updatedAt) {
        Map<String, Baseline> byDocumentKey = new LinkedHashMap<>();
        baselines.forEach((key, baseline) -> byDocumentKey.put(key.asDocumentKey(), baseline));
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("baselines", byDocumentKey);
        document.put("updated_at", updatedAt.toString());
        try {
            client.put(index, documentId, document);
            log.debug("Saved {} baselines to {}/{}", byDocumentKey.size(), index, documentId);
        } catch (TelemetryStoreException e) {
            log.error("Failed to save baselines: {}", e.getMessage());
        }
    }

    /**
     * Reads the last saved baseline map. Empty when nothing was saved yet or the store
     * is unavailable.
     */
    public Map<AggregateKey, Baseline> load() {
        Optional<JsonNode> document;
        try {
            document = client.get(index, documentId);
        } catch (TelemetryStoreException e) {
            log.warn("Could not load saved baselines: {}", e.getMessage());
            return Collections.emptyMap();
        }
        if (document.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<AggregateKey, Baseline> baselines = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = document.get().path("baselines").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            Optional<AggregateKey> key = parseKey(entry.getKey());
            if (key.isEmpty()) {
                log.warn("Skipping saved baseline with malformed key {}", entry.getKey());
                continue;
            }
            try {
                baselines.put(key.get(), client.getObjectMapper().treeToValue(entry.getValue(), Baseline.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable saved baseline for {}: {}", entry.getKey(), e.getOriginalMessage());
            }
        }
        return baselines;
    }

    static Optional<AggregateKey> parseKey(String documentKey) {
        int separator = documentKey.indexOf(':');
        if (separator <= 0 || separator == documentKey.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new AggregateKey(documentKey.substring(0, separator), documentKey.substring(separator + 1)));
    }
}
