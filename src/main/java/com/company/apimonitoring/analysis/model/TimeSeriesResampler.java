package com.company.apimonitoring.analysis.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Buckets irregular samples onto a fixed grid. Each bucket holds the mean of its samples;
 * empty buckets carry the previous bucket's value forward.
 */
public final class TimeSeriesResampler {

    private TimeSeriesResampler() {
    }

    public static Grid resample(List<Instant> timestamps, double[] values, Duration step) {
        if (timestamps.isEmpty() || timestamps.size() != values.length) {
            throw new IllegalArgumentException("timestamps and values must be non-empty and aligned");
        }
        long stepMillis = step.toMillis();
        long first = floor(timestamps.get(0).toEpochMilli(), stepMillis);
        long last = floor(timestamps.get(timestamps.size() - 1).toEpochMilli(), stepMillis);
        int buckets = (int) ((last - first) / stepMillis) + 1;

        double[] sums = new double[buckets];
        int[] counts = new int[buckets];
        for (int i = 0; i < values.length; i++) {
            int bucket = (int) ((floor(timestamps.get(i).toEpochMilli(), stepMillis) - first) / stepMillis);
            sums[bucket] += values[i];
            counts[bucket]++;
        }

        double[] grid = new double[buckets];
        double carry = Double.NaN;
        for (int b = 0; b < buckets; b++) {
            if (counts[b] > 0) {
                carry = sums[b] / counts[b];
            }
            grid[b] = carry;
        }
        return new Grid(Instant.ofEpochMilli(first), step, grid);
    }

    private static long floor(long epochMillis, long stepMillis) {
        return Math.floorDiv(epochMillis, stepMillis) * stepMillis;
    }

    public static final class Grid {
        private final Instant start;
        private final Duration step;
        private final double[] values;

        Grid(Instant start, Duration step, double[] values) {
            this.start = start;
            this.step = step;
            this.values = values;
        }

        public Instant getStart() {
            return start;
        }

        public Instant getEnd() {
            return start.plus(step.multipliedBy(values.length - 1L));
        }

        public double[] getValues() {
            return values;
        }
    }
}
