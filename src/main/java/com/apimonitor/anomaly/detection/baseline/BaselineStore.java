package com.apimonitor.anomaly.detection.baseline;

import com.apimonitor.anomaly.detection.domain.AggregateKey;
import com.apimonitor.anomaly.detection.domain.Baseline;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-key baselines in memory. Entries are created on first sufficient observation,
 * replaced on every later one and never removed. Read by the status API from request
 * threads while the detection thread writes.
 */
@Component
public class BaselineStore {

    private final Map<AggregateKey, Baseline> baselines = new ConcurrentHashMap<>();

    public Optional<Baseline> get(AggregateKey key) {
        return Optional.ofNullable(baselines.get(key));
    }

    public void upsert(AggregateKey key, Baseline baseline) {
        baselines.put(key, baseline);
    }

    /** Copy of the current map; later writes do not show through. */
    public Map<AggregateKey, Baseline> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(baselines));
    }

    /** Loads previously saved baselines. Keys already known in memory are kept. */
    public int restore(Map<AggregateKey, Baseline> saved) {
        int restored = 0;
        for (Map.Entry<AggregateKey, Baseline> entry : saved.entrySet()) {
            if (baselines.putIfAbsent(entry.getKey(), entry.getValue()) == null) {
                restored++;
            }
        }
        return restored;
    }

    public int size() {
        return baselines.size();
    }
}
