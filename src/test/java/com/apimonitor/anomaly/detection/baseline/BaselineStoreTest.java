package com.apimonitor.anomaly.detection.baseline;

import com.apimonitor.anomaly.detection.domain.AggregateKey;
import com.apimonitor.anomaly.detection.domain.Baseline;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for BaselineStore.
 */
class BaselineStoreTest {

    private static final AggregateKey KEY = new AggregateKey("svc", "/e");

    private static Baseline baseline(double avg) {
        return Baseline.builder().avgResponseTime(avg).updatedAt(Instant.parse("2024-05-01T10:00:00Z")).build();
    }

    @Test
    void snapshotIsNotAffectedByLaterWrites() {
        BaselineStore store = new BaselineStore();
        store.upsert(KEY, baseline(100));

        Map<AggregateKey, Baseline> snapshot = store.snapshot();
        store.upsert(KEY, baseline(900));

        assertThat(snapshot.get(KEY).getAvgResponseTime()).isEqualTo(100);
        assertThat(store.get(KEY)).map(Baseline::getAvgResponseTime).contains(900.0);
    }

    @Test
    void restoreDoesNotOverwriteFresherEntries() {
        BaselineStore store = new BaselineStore();
        store.upsert(KEY, baseline(100));

        int restored = store.restore(Map.of(KEY, baseline(500), new AggregateKey("svc", "/other"), baseline(50)));

        assertThat(restored).isEqualTo(1);
        assertThat(store.get(KEY)).map(Baseline::getAvgResponseTime).contains(100.0);
        assertThat(store.size()).isEqualTo(2);
    }
}
