package com.apimonitor.anomaly.detection.features;

import com.apimonitor.anomaly.detection.domain.ErrorRateRow;
import com.apimonitor.anomaly.detection.domain.FeatureRow;
import com.apimonitor.anomaly.detection.domain.StatusCodeSummary;

import java.util.List;

/**
 * Output of one aggregation pass. All three lists hold the same keys in the same order.
 */
public record AggregationResult(List<FeatureRow> featureRows,
                                List<ErrorRateRow> errorRateRows,
                                List<StatusCodeSummary> statusCodeSummaries) {

    public static AggregationResult empty() {
        return new AggregationResult(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return featureRows.isEmpty();
    }

    public int size() {
        return featureRows.size();
    }
}
