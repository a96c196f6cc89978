package com.apimonitor.anomaly.detection.ml;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

final class Samples {

    private Samples() {
    }

    static int requireMatrix(double[][] samples, int minRows) {
        if (samples == null || samples.length < minRows) {
            throw new IllegalArgumentException("Need at least " + minRows + " samples, got "
                    + (samples == null ? 0 : samples.length));
        }
        int width = samples[0].length;
        if (width == 0) {
            throw new IllegalArgumentException("Samples must have at least one feature");
        }
        for (double[] row : samples) {
            if (row.length != width) {
                throw new IllegalArgumentException("All samples must have " + width + " features");
            }
        }
        return width;
    }

    static void requireWidth(double[][] samples, int width) {
        for (double[] row : samples) {
            if (row.length != width) {
                throw new IllegalArgumentException("Expected " + width + " features, got " + row.length);
            }
        }
    }

    /** Linear-interpolation percentile, p in (0, 100]. */
    static double percentile(double[] values, double p) {
        return new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(values, p);
    }

    static double euclidean(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
