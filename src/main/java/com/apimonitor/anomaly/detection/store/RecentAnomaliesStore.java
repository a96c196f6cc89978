package com.apimonitor.anomaly.detection.store;

import com.apimonitor.anomaly.config.DetectorProperties;
import com.apimonitor.anomaly.detection.domain.Anomaly;
import com.apimonitor.anomaly.detection.domain.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Bounded, newest-first buffer of dispatched anomalies behind the status API. Holds
 * {@code detector.alerting.recent-capacity} entries; the anomaly index keeps the full history.
 */
@Component
public class RecentAnomaliesStore {

    private final int capacity;
    private final Deque<Anomaly> recent = new ArrayDeque<>();

    public RecentAnomaliesStore(DetectorProperties properties) {
        this.capacity = properties.alerting().recentCapacity();
    }

    public synchronized void add(Anomaly anomaly) {
        if (recent.size() == capacity) {
            recent.removeLast();
        }
        recent.addFirst(anomaly);
    }

    /** Up to {@code limit} matching anomalies, newest first. */
    public synchronized List<Anomaly> find(AnomalyFilter filter, int limit) {
        return recent.stream()
                .filter(filter::matches)
                .limit(limit)
                .collect(Collectors.toList());
    }

    /** Buffered anomalies per severity; bands with none are reported as zero. */
    public synchronized Map<Severity, Long> countBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        for (Anomaly anomaly : recent) {
            if (anomaly.getSeverity() != null) {
                counts.merge(anomaly.getSeverity(), 1L, Long::sum);
            }
        }
        return counts;
    }

    public int capacity() {
        return capacity;
    }
}
