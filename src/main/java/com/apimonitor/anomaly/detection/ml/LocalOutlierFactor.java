package com.apimonitor.anomaly.detection.ml;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Local outlier factor in novelty mode: fitted on reference data, then asked about unseen
 * points. A point whose local reachability density is much lower than that of its k nearest
 * reference neighbours gets a large factor; scores are the negated factor, so inliers sit
 * near -1. The decision offset is the contamination percentile of the training scores.
 */
public class LocalOutlierFactor implements OutlierDetector {

    private static final double DENSITY_EPSILON = 1e-10;

    private final int requestedNeighbors;
    private final double contamination;

    private double[][] reference;
    private int neighbors;
    private double[] kDistance;
    private double[] localDensity;
    private double offset;

    public LocalOutlierFactor(int neighbors, double contamination) {
        if (neighbors < 1) {
            throw new IllegalArgumentException("neighbors must be positive");
        }
        if (!(contamination > 0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5]");
        }
        this.requestedNeighbors = neighbors;
        this.contamination = contamination;
    }

    @Override
    public void fit(double[][] samples) {
        Samples.requireMatrix(samples, 2);
        int n = samples.length;
        int k = Math.min(requestedNeighbors, n - 1);
        double[][] data = Arrays.stream(samples).map(double[]::clone).toArray(double[][]::new);

        int[][] neighborIndex = new int[n][];
        double[][] neighborDistance = new double[n][];
        double[] kDist = new double[n];
        for (int i = 0; i < n; i++) {
            neighborIndex[i] = nearest(data, data[i], k, i);
            neighborDistance[i] = distances(data, data[i], neighborIndex[i]);
            kDist[i] = neighborDistance[i][k - 1];
        }
        double[] lrd = new double[n];
        for (int i = 0; i < n; i++) {
            lrd[i] = density(neighborIndex[i], neighborDistance[i], kDist);
        }
        double[] trainingScores = new double[n];
        for (int i = 0; i < n; i++) {
            trainingScores[i] = -factor(neighborIndex[i], lrd[i], lrd);
        }

        this.reference = data;
        this.neighbors = k;
        this.kDistance = kDist;
        this.localDensity = lrd;
        this.offset = Samples.percentile(trainingScores, 100.0 * contamination);
    }

    @Override
    public double[] scoreSamples(double[][] samples) {
        requireFitted();
        Samples.requireWidth(samples, reference[0].length);
        double[] scores = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            int[] index = nearest(reference, samples[i], neighbors, -1);
            double[] distance = distances(reference, samples[i], index);
            double lrd = density(index, distance, kDistance);
            scores[i] = -factor(index, lrd, localDensity);
        }
        return scores;
    }

    @Override
    public double[] decisionFunction(double[][] samples) {
        double[] scores = scoreSamples(samples);
        for (int i = 0; i < scores.length; i++) {
            scores[i] -= offset;
        }
        return scores;
    }

    @Override
    public boolean isFitted() {
        return reference != null;
    }

    /** Neighbour count actually used; the requested count capped at one less than the training size. */
    public int getNeighbors() {
        return neighbors;
    }

    public double getOffset() {
        return offset;
    }

    private static double density(int[] index, double[] distance, double[] kDist) {
        double reach = 0;
        for (int j = 0; j < index.length; j++) {
            reach += Math.max(kDist[index[j]], distance[j]);
        }
        return 1.0 / (reach / index.length + DENSITY_EPSILON);
    }

    private static double factor(int[] index, double lrd, double[] referenceDensity) {
        double sum = 0;
        for (int j : index) {
            sum += referenceDensity[j];
        }
        return sum / index.length / lrd;
    }

    /** Indices of the k closest reference points, nearest first; ties broken by index. */
    private static int[] nearest(double[][] data, double[] point, int k, int exclude) {
        double[] d = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            d[i] = Samples.euclidean(data[i], point);
        }
        return IntStream.range(0, data.length)
                .filter(i -> i != exclude)
                .boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> d[i]).thenComparingInt(i -> i))
                .limit(k)
                .mapToInt(Integer::intValue)
                .toArray();
    }

    private static double[] distances(double[][] data, double[] point, int[] index) {
        double[] out = new double[index.length];
        for (int j = 0; j < index.length; j++) {
            out[j] = Samples.euclidean(data[index[j]], point);
        }
        return out;
    }

    private void requireFitted() {
        if (!isFitted()) {
            throw new IllegalStateException("LocalOutlierFactor is not fitted");
        }
    }
}
