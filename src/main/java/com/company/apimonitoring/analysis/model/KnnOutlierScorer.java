package com.company.apimonitoring.analysis.model;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.Arrays;

/**
 * Nearest-neighbour distance scoring over a one-dimensional series.
 * <p>
 * Values are standardized (zero mean, unit deviation) and each point is scored with the
 * distance to its k-th nearest neighbour. Isolated points get large scores; points inside a
 * dense cluster score close to zero. A series with no variance has no outliers.
 */
public class KnnOutlierScorer {

    public static final int DEFAULT_NEIGHBOURS = 5;

    private final int neighbours;

    public KnnOutlierScorer() {
        this(DEFAULT_NEIGHBOURS);
    }

    public KnnOutlierScorer(int neighbours) {
        if (neighbours < 1) {
            throw new IllegalArgumentException("neighbours must be positive: " + neighbours);
        }
        this.neighbours = neighbours;
    }

    public double[] score(double[] values) {
        double[] scores = new double[values.length];
        if (values.length < 2) {
            return scores;
        }

        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        double mean = stats.getMean();
        double std = stats.getPopulationVariance() > 0 ? Math.sqrt(stats.getPopulationVariance()) : 0.0;
        if (std == 0.0) {
            return scores;
        }

        double[] standardized = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            standardized[i] = (values[i] - mean) / std;
        }

        int k = Math.min(neighbours, values.length - 1);
        double[] distances = new double[values.length - 1];
        for (int i = 0; i < standardized.length; i++) {
            int idx = 0;
            for (int j = 0; j < standardized.length; j++) {
                if (i != j) {
                    distances[idx++] = Math.abs(standardized[i] - standardized[j]);
                }
            }
            Arrays.sort(distances);
            scores[i] = distances[k - 1];
        }
        return scores;
    }
}
