package com.apimonitor.anomaly.detection.features;

import com.apimonitor.anomaly.config.DetectorProperties;
import com.apimonitor.anomaly.detection.baseline.BaselineStore;
import com.apimonitor.anomaly.detection.domain.AggregateKey;
import com.apimonitor.anomaly.detection.domain.Baseline;
import com.apimonitor.anomaly.detection.domain.ErrorRateRow;
import com.apimonitor.anomaly.detection.domain.FeatureRow;
import com.apimonitor.anomaly.detection.domain.RequestRecord;
import com.apimonitor.anomaly.detection.domain.StatusCodeSummary;
import com.apimonitor.anomaly.persistence.service.BaselinePersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups request records by (service, endpoint) and turns every group that has enough
 * samples into a {@link FeatureRow}. Each emitted row also replaces that key's baseline,
 * and the whole baseline map is saved after every pass.
 */
@Slf4j
@Component
public class FeatureAggregator {

    static final Comparator<AggregateKey> KEY_ORDER =
            Comparator.comparing(AggregateKey::service).thenComparing(AggregateKey::endpoint);

    private final BaselineStore baselineStore;
    private final BaselinePersistenceService baselinePersistence;
    private final Clock clock;
    private final int minDataPoints;

    public FeatureAggregator(BaselineStore baselineStore, BaselinePersistenceService baselinePersistence,
                             DetectorProperties properties, Clock clock) {
        this.baselineStore = baselineStore;
        this.baselinePersistence = baselinePersistence;
        this.clock = clock;
        this.minDataPoints = properties.analysis().minDataPoints();
    }

    public AggregationResult aggregate(List<RequestRecord> records) {
        if (records == null || records.isEmpty()) {
            log.warn("No request records to aggregate");
            return AggregationResult.empty();
        }

        List<FeatureRow> featureRows = new ArrayList<>();
        List<ErrorRateRow> errorRateRows = new ArrayList<>();
        List<StatusCodeSummary> statusCodeSummaries = new ArrayList<>();
        Instant now = clock.instant();

        for (Map.Entry<AggregateKey, List<RequestRecord>> group : groupByKey(records).entrySet()) {
            AggregateKey key = group.getKey();
            List<RequestRecord> members = group.getValue();
            if (members.size() < minDataPoints) {
                log.info("Skipping {} - only {} data points (need {})", key, members.size(), minDataPoints);
                continue;
            }
            FeatureRow row = summarize(key, members);
            baselineStore.upsert(key, Baseline.from(row, now));
            log.info("Metrics {}: avg={}ms p95={}ms error_rate={}", key,
                    String.format(Locale.ROOT, "%.2f", row.getAvgResponseTime()),
                    String.format(Locale.ROOT, "%.2f", row.getP95ResponseTime()),
                    String.format(Locale.ROOT, "%.4f", row.getErrorRate()));

            featureRows.add(row);
            errorRateRows.add(new ErrorRateRow(key, row.getErrorRate(), row.getRequestCount()));
            statusCodeSummaries.add(new StatusCodeSummary(key, row.getStatusCodes(), row.getRequestCount()));
        }

        baselinePersistence.save(baselineStore.snapshot(), now);
        return new AggregationResult(
                Collections.unmodifiableList(featureRows),
                Collections.unmodifiableList(errorRateRows),
                Collections.unmodifiableList(statusCodeSummaries));
    }

    /**
     * Summary statistics for one group. Callers enforce the minimum group size.
     */
    static FeatureRow summarize(AggregateKey key, List<RequestRecord> members) {
        double[] responseTimes = members.stream().mapToDouble(RequestRecord::getResponseTime).toArray();
        long errors = members.stream().filter(RequestRecord::isError).count();
        Map<Integer, Long> statusCodes = new TreeMap<>();
        for (RequestRecord record : members) {
            if (record.getStatusCode() != null) {
                statusCodes.merge(record.getStatusCode(), 1L, Long::sum);
            }
        }
        return FeatureRow.builder()
                .key(key)
                .avgResponseTime(ResponseTimeStatistics.mean(responseTimes))
                .medianResponseTime(ResponseTimeStatistics.median(responseTimes))
                .p95ResponseTime(ResponseTimeStatistics.percentile(responseTimes, 95.0))
                .p99ResponseTime(ResponseTimeStatistics.percentile(responseTimes, 99.0))
                .errorRate((double) errors / members.size())
                .requestCount(members.size())
                .statusCodes(Collections.unmodifiableMap(statusCodes))
                .build();
    }

    /** Groups in key order. Records without a service or endpoint belong to no group. */
    public static Map<AggregateKey, List<RequestRecord>> groupByKey(List<RequestRecord> records) {
        Map<AggregateKey, List<RequestRecord>> groups = new TreeMap<>(KEY_ORDER);
        for (RequestRecord record : records) {
            if (record.getService() == null || record.getEndpoint() == null) {
                continue;
            }
            groups.computeIfAbsent(record.key(), k -> new ArrayList<>()).add(record);
        }
        return groups;
    }
}
