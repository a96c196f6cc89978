package com.apimonitor.anomaly.detection.api;

import com.apimonitor.anomaly.detection.baseline.BaselineStore;
import com.apimonitor.anomaly.detection.domain.Anomaly;
import com.apimonitor.anomaly.detection.domain.AnomalyType;
import com.apimonitor.anomaly.detection.domain.Baseline;
import com.apimonitor.anomaly.detection.engine.ModelTrainer;
import com.apimonitor.anomaly.detection.store.AnomalyFilter;
import com.apimonitor.anomaly.detection.store.RecentAnomaliesStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only view of what the detector currently knows: recently dispatched anomalies,
 * per-endpoint baselines and the trained models.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Anomalies", description = "Detected anomalies, baselines and model status")
public class AnomalyController {

    private final RecentAnomaliesStore recentAnomaliesStore;
    private final BaselineStore baselineStore;
    private final ModelTrainer modelTrainer;
    private final Clock clock;

    @GetMapping("/anomalies")
    @Operation(summary = "List recent anomalies",
            description = "Recently dispatched anomalies, newest first, optionally filtered by type, minimum severity, detector and service (in-memory buffer)")
    public ResponseEntity<List<Anomaly>> listAnomalies(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String detector,
            @RequestParam(required = false) String service) {
        int capacity = recentAnomaliesStore.capacity();
        if (limit < 1 || limit > capacity) {
            throw new IllegalArgumentException("limit must be between 1 and " + capacity);
        }
        AnomalyFilter filter = AnomalyFilter.fromWireNames(type, severity, detector, service);
        return ResponseEntity.ok(recentAnomaliesStore.find(filter, limit));
    }

    @GetMapping("/anomalies/summary")
    @Operation(summary = "Recent anomaly counts", description = "Number of buffered anomalies per severity")
    public ResponseEntity<Map<String, Long>> summarizeAnomalies() {
        Map<String, Long> counts = new LinkedHashMap<>();
        recentAnomaliesStore.countBySeverity().forEach((severity, count) -> counts.put(severity.wireName(), count));
        return ResponseEntity.ok(counts);
    }

    @GetMapping("/baselines")
    @Operation(summary = "Current baselines", description = "Latest statistics per service:endpoint used to grade severity")
    public ResponseEntity<Map<String, Baseline>> listBaselines() {
        Map<String, Baseline> baselines = new TreeMap<>();
        baselineStore.snapshot().forEach((key, baseline) -> baselines.put(key.asDocumentKey(), baseline));
        return ResponseEntity.ok(baselines);
    }

    @GetMapping("/models")
    @Operation(summary = "Model status", description = "Trained outlier models per signal and when they were trained")
    public ResponseEntity<ModelsResponseDto> models() {
        List<ModelStatusDto> models = new ArrayList<>();
        for (AnomalyType signal : AnomalyType.values()) {
            modelTrainer.model(signal).map(ModelStatusDto::from).ifPresent(models::add);
        }
        return ResponseEntity.ok(new ModelsResponseDto(
                modelTrainer.lastTrainingTime().orElse(null),
                modelTrainer.isRetrainDue(clock.instant()),
                models));
    }
}
