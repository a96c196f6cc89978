package com.apimonitor.anomaly.detection.ml;

/**
 * Unsupervised outlier model over standardized feature vectors (one row per sample).
 * A model is fitted once and then only read, so a fitted instance can be shared between threads.
 */
public interface OutlierDetector {

    /**
     * Fits the model on the given samples.
     *
     * @throws IllegalArgumentException if there are fewer than two samples or rows differ in width
     */
    void fit(double[][] samples);

    /**
     * Raw normality score per sample; lower means more abnormal.
     */
    double[] scoreSamples(double[][] samples);

    /**
     * Score shifted by the contamination offset learned during {@link #fit}; negative means outlier.
     */
    double[] decisionFunction(double[][] samples);

    /** True for each sample the model considers an outlier. */
    default boolean[] predictOutliers(double[][] samples) {
        double[] decision = decisionFunction(samples);
        boolean[] outliers = new boolean[decision.length];
        for (int i = 0; i < decision.length; i++) {
            outliers[i] = decision[i] < 0;
        }
        return outliers;
    }

    boolean isFitted();
}
