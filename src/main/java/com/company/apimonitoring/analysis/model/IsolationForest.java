package com.company.apimonitoring.analysis.model;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation-style density model. Points that random axis-aligned splits isolate quickly
 * get an anomaly score close to 1; typical points score around 0.5 or below.
 * <p>
 * The outlier cut-off is the (1 - contamination) quantile of the training scores.
 * Seeded, so the same training data always yields the same model.
 */
public class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final int treeCount;
    private final int maxSamples;
    private final double contamination;
    private final long seed;

    private List<Node> trees = new ArrayList<>();
    private int sampleSize;
    private double threshold = Double.MAX_VALUE;

    public IsolationForest(double contamination) {
        this(100, 256, contamination, 42L);
    }

    public IsolationForest(int treeCount, int maxSamples, double contamination, long seed) {
        if (contamination <= 0.0 || contamination >= 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5): " + contamination);
        }
        this.treeCount = treeCount;
        this.maxSamples = maxSamples;
        this.contamination = contamination;
        this.seed = seed;
    }

    public IsolationForest fit(double[][] data) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit on an empty data set");
        }
        Random random = new Random(seed);
        sampleSize = Math.min(maxSamples, data.length);
        int heightLimit = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));

        List<Node> fitted = new ArrayList<>(treeCount);
        for (int t = 0; t < treeCount; t++) {
            double[][] sample = sample(data, sampleSize, random);
            fitted.add(build(sample, 0, heightLimit, random));
        }
        trees = fitted;

        double[] trainingScores = score(data);
        threshold = new Percentile().evaluate(trainingScores, (1.0 - contamination) * 100.0);
        return this;
    }

    public double[] score(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = score(data[i]);
        }
        return scores;
    }

    public double score(double[] point) {
        if (trees.isEmpty()) {
            throw new IllegalStateException("Model has not been fitted");
        }
        double total = 0.0;
        for (Node tree : trees) {
            total += pathLength(point, tree, 0);
        }
        double normalizer = averagePathLength(sampleSize);
        if (normalizer <= 0.0) {
            return 0.5;
        }
        return Math.pow(2.0, -(total / trees.size()) / normalizer);
    }

    public boolean isOutlier(double score) {
        return score > threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    private double[][] sample(double[][] data, int size, Random random) {
        if (size == data.length) {
            return data;
        }
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int swap = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[swap];
            indices[swap] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    private Node build(double[][] rows, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }
        int features = rows[0].length;
        List<Integer> candidates = new ArrayList<>();
        for (int f = 0; f < features; f++) {
            if (min(rows, f) < max(rows, f)) {
                candidates.add(f);
            }
        }
        if (candidates.isEmpty()) {
            return Node.leaf(rows.length);
        }

        int feature = candidates.get(random.nextInt(candidates.size()));
        double lo = min(rows, feature);
        double hi = max(rows, feature);
        double split = lo + random.nextDouble() * (hi - lo);

        double[][] left = Arrays.stream(rows).filter(r -> r[feature] < split).toArray(double[][]::new);
        double[][] right = Arrays.stream(rows).filter(r -> r[feature] >= split).toArray(double[][]::new);
        return Node.split(feature, split,
                build(left, depth + 1, heightLimit, random),
                build(right, depth + 1, heightLimit, random));
    }

    private double pathLength(double[] point, Node node, int depth) {
        if (node.leaf) {
            return depth + averagePathLength(node.size);
        }
        Node next = point[node.feature] < node.split ? node.left : node.right;
        return pathLength(point, next, depth + 1);
    }

    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static double min(double[][] rows, int feature) {
        double min = Double.POSITIVE_INFINITY;
        for (double[] row : rows) {
            min = Math.min(min, row[feature]);
        }
        return min;
    }

    private static double max(double[][] rows, int feature) {
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : rows) {
            max = Math.max(max, row[feature]);
        }
        return max;
    }

    private static final class Node {
        private final boolean leaf;
        private final int size;
        private final int feature;
        private final double split;
        private final Node left;
        private final Node right;

        private Node(boolean leaf, int size, int feature, double split, Node left, Node right) {
            this.leaf = leaf;
            this.size = size;
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
        }

        static Node leaf(int size) {
            return new Node(true, size, -1, 0.0, null, null);
        }

        static Node split(int feature, double split, Node left, Node right) {
            return new Node(false, 0, feature, split, left, right);
        }
    }
}
