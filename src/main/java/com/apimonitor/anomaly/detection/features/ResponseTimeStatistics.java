package com.apimonitor.anomaly.detection.features;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Response-time summary statistics. Percentiles interpolate linearly between the two
 * nearest ranks (the R-7 estimator), so p50 <= p95 <= p99 holds for any sample.
 */
public final class ResponseTimeStatistics {

    private ResponseTimeStatistics() {
    }

    public static double mean(double[] values) {
        requireNonEmpty(values);
        return StatUtils.mean(values);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    /**
     * @param p percentile in (0, 100]
     */
    public static double percentile(double[] values, double p) {
        requireNonEmpty(values);
        Percentile estimator = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        return estimator.evaluate(values, p);
    }

    private static void requireNonEmpty(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("At least one value is required");
        }
    }
}
