package com.apimonitor.anomaly.detection.ml;

import java.util.Arrays;

/**
 * Centers each feature on its mean and divides by its population standard deviation.
 * A feature that is constant in the fitted data keeps a scale of 1.
 */
public class StandardScaler {

    private double[] mean;
    private double[] scale;

    public StandardScaler fit(double[][] samples) {
        int width = Samples.requireMatrix(samples, 1);
        double[] sums = new double[width];
        for (double[] row : samples) {
            for (int j = 0; j < width; j++) {
                sums[j] += row[j];
            }
        }
        double[] means = new double[width];
        for (int j = 0; j < width; j++) {
            means[j] = sums[j] / samples.length;
        }
        double[] scales = new double[width];
        for (int j = 0; j < width; j++) {
            double squares = 0;
            for (double[] row : samples) {
                double d = row[j] - means[j];
                squares += d * d;
            }
            double std = Math.sqrt(squares / samples.length);
            scales[j] = std == 0 || !Double.isFinite(std) ? 1.0 : std;
        }
        this.mean = means;
        this.scale = scales;
        return this;
    }

    public double[][] transform(double[][] samples) {
        if (mean == null) {
            throw new IllegalStateException("StandardScaler is not fitted");
        }
        Samples.requireWidth(samples, mean.length);
        double[][] out = new double[samples.length][];
        for (int i = 0; i < samples.length; i++) {
            out[i] = new double[mean.length];
            for (int j = 0; j < mean.length; j++) {
                out[i][j] = (samples[i][j] - mean[j]) / scale[j];
            }
        }
        return out;
    }

    public double[][] fitTransform(double[][] samples) {
        return fit(samples).transform(samples);
    }

    public double[] getMean() {
        return mean == null ? null : Arrays.copyOf(mean, mean.length);
    }

    public double[] getScale() {
        return scale == null ? null : Arrays.copyOf(scale, scale.length);
    }
}
