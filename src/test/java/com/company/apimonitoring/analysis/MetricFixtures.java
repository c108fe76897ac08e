package com.company.apimonitoring.analysis;

import com.company.apimonitoring.domain.ApiMetric;
import com.company.apimonitoring.domain.ApiSource;
import com.company.apimonitoring.domain.enums.Environment;
import org.apache.commons.math3.distribution.NormalDistribution;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

final class MetricFixtures {

    static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");
    static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private MetricFixtures() {
    }

    static ApiSource source(String apiId) {
        return ApiSource.builder()
                .id(apiId)
                .name(apiId)
                .environment(Environment.AWS)
                .active(true)
                .build();
    }

    static ApiMetric metric(String apiId, String endpoint, Environment environment, Instant timestamp,
                            double responseTime, boolean success) {
        return ApiMetric.builder()
                .id(apiId + "-" + environment + "-" + timestamp.toEpochMilli())
                .apiId(apiId)
                .endpoint(endpoint)
                .method("GET")
                .environment(environment)
                .timestamp(timestamp)
                .responseTime(responseTime)
                .statusCode(success ? 200 : 500)
                .success(success)
                .build();
    }

    /**
     * One sample per step starting at {@code start}, latencies taken in order.
     */
    static List<ApiMetric> series(String apiId, String endpoint, Environment environment,
                                  Instant start, Duration step, double[] latencies) {
        List<ApiMetric> metrics = new ArrayList<>();
        for (int i = 0; i < latencies.length; i++) {
            metrics.add(metric(apiId, endpoint, environment, start.plus(step.multipliedBy(i)), latencies[i], true));
        }
        return metrics;
    }

    /**
     * {@code count} samples with a constant latency; the first {@code failures} are errors.
     */
    static List<ApiMetric> withFailures(String apiId, String endpoint, Environment environment,
                                        Instant start, Duration step, int count, int failures, double latency) {
        List<ApiMetric> metrics = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            metrics.add(metric(apiId, endpoint, environment, start.plus(step.multipliedBy(i)), latency, i >= failures));
        }
        return metrics;
    }

    static double[] constant(int count, double value) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = value;
        }
        return values;
    }

    /**
     * Values around {@code center} with a small repeating jitter of +-2.
     */
    static double[] jittered(int count, double center) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = center - 2.0 + (i % 5);
        }
        return values;
    }

    static double[] gaussian(int count, double center, double sigma, Random random) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = center + sigma * random.nextGaussian();
        }
        return values;
    }

    /**
     * Normal quantiles at (i + 0.5) / count in shuffled order. The sample mean is exactly {@code center}.
     */
    static double[] normalQuantiles(int count, double center, double sigma, long seed) {
        NormalDistribution normal = new NormalDistribution(center, sigma);
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            values.add(normal.inverseCumulativeProbability((i + 0.5) / count));
        }
        Collections.shuffle(values, new Random(seed));
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
