package com.apimonitor.anomaly.detection.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest: random axis-aligned splits isolate outliers in fewer steps than inliers.
 * Each tree grows on a subsample of at most 256 points drawn without replacement, up to a
 * depth of {@code ceil(log2(subsample))}. The anomaly score of a point is
 * {@code -2^(-E[h(x)] / c(subsample))}, and the decision offset is the contamination
 * percentile of the training scores. Seeded, so two fits on the same data agree.
 */
public class IsolationForest implements OutlierDetector {

    static final int MAX_SUBSAMPLE = 256;
    private static final double EULER_GAMMA = 0.5772156649;

    private final int estimators;
    private final double contamination;
    private final long seed;

    private List<Node> trees = Collections.emptyList();
    private int subsampleSize;
    private int width;
    private double offset;

    public IsolationForest(int estimators, double contamination, long seed) {
        if (estimators < 1) {
            throw new IllegalArgumentException("estimators must be positive");
        }
        if (!(contamination > 0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5]");
        }
        this.estimators = estimators;
        this.contamination = contamination;
        this.seed = seed;
    }

    @Override
    public void fit(double[][] samples) {
        int features = Samples.requireMatrix(samples, 2);
        Random random = new Random(seed);
        int psi = Math.min(MAX_SUBSAMPLE, samples.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));

        List<Node> grown = new ArrayList<>(estimators);
        for (int t = 0; t < estimators; t++) {
            grown.add(grow(subsample(samples, psi, random), 0, maxDepth, features, random));
        }
        this.trees = grown;
        this.subsampleSize = psi;
        this.width = features;
        this.offset = Samples.percentile(scoreSamples(samples), 100.0 * contamination);
    }

    @Override
    public double[] scoreSamples(double[][] samples) {
        requireFitted();
        Samples.requireWidth(samples, width);
        double normalizer = averagePathLength(subsampleSize);
        double[] scores = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            double total = 0;
            for (Node tree : trees) {
                total += pathLength(tree, samples[i]);
            }
            double meanDepth = total / trees.size();
            scores[i] = -Math.pow(2.0, -meanDepth / normalizer);
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
        return !trees.isEmpty();
    }

    public double getOffset() {
        return offset;
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of n points,
     * used both to normalise depths and to extend a path that ends in a multi-point leaf.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    private static double[][] subsample(double[][] samples, int size, Random random) {
        int[] index = new int[samples.length];
        for (int i = 0; i < index.length; i++) {
            index[i] = i;
        }
        double[][] picked = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(index.length - i);
            int tmp = index[i];
            index[i] = index[j];
            index[j] = tmp;
            picked[i] = samples[index[i]];
        }
        return picked;
    }

    private static Node grow(double[][] data, int depth, int maxDepth, int features, Random random) {
        if (depth >= maxDepth || data.length <= 1) {
            return Node.leaf(data.length);
        }
        List<Integer> splittable = new ArrayList<>(features);
        double[] min = new double[features];
        double[] max = new double[features];
        for (int f = 0; f < features; f++) {
            min[f] = Double.POSITIVE_INFINITY;
            max[f] = Double.NEGATIVE_INFINITY;
            for (double[] row : data) {
                min[f] = Math.min(min[f], row[f]);
                max[f] = Math.max(max[f], row[f]);
            }
            if (max[f] > min[f]) {
                splittable.add(f);
            }
        }
        if (splittable.isEmpty()) {
            return Node.leaf(data.length);
        }
        int feature = splittable.get(random.nextInt(splittable.size()));
        double threshold = min[feature] + random.nextDouble() * (max[feature] - min[feature]);

        List<double[]> left = new ArrayList<>();
        List<double[]> right = new ArrayList<>();
        for (double[] row : data) {
            if (row[feature] <= threshold) {
                left.add(row);
            } else {
                right.add(row);
            }
        }
        return Node.split(feature, threshold,
                grow(left.toArray(new double[0][]), depth + 1, maxDepth, features, random),
                grow(right.toArray(new double[0][]), depth + 1, maxDepth, features, random));
    }

    private static double pathLength(Node node, double[] sample) {
        int depth = 0;
        Node current = node;
        while (!current.isLeaf()) {
            current = sample[current.feature] <= current.threshold ? current.left : current.right;
            depth++;
        }
        return depth + averagePathLength(current.size);
    }

    private void requireFitted() {
        if (!isFitted()) {
            throw new IllegalStateException("IsolationForest is not fitted");
        }
    }

    private static final class Node {
        final int feature;
        final double threshold;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double threshold, Node left, Node right, int size) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0, null, null, size);
        }

        static Node split(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
