package com.company.apimonitoring.analysis;

import com.company.apimonitoring.analysis.model.IsolationForest;
import com.company.apimonitoring.domain.Anomaly;
import com.company.apimonitoring.domain.ApiMetric;
import com.company.apimonitoring.domain.ApiSource;
import com.company.apimonitoring.domain.Prediction;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Multi-signal pattern checks per (api, endpoint, method): isolated latencies within the
 * window and 5 minute buckets with an elevated error rate. Detection only.
 */
public class PatternAnalyzer extends AbstractAnalyzer {

    public static final String NAME = "pattern";

    static final int MIN_DATA_POINTS = 20;
    static final double CONTAMINATION = 0.1;
    static final double RESPONSE_TIME_SEVERITY = 0.8;
    static final double ERROR_PATTERN_SEVERITY = 0.9;
    static final double ERROR_PATTERN_THRESHOLD = 0.1;
    static final double ERROR_PATTERN_EXPECTED = 0.05;
    static final Duration ERROR_WINDOW = Duration.ofMinutes(5);

    public PatternAnalyzer(ApiSource apiSource, Clock clock) {
        super(apiSource, clock);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getMinDataPoints() {
        return MIN_DATA_POINTS;
    }

    @Override
    protected List<Anomaly> doDetectAnomalies(List<ApiMetric> metrics) {
        List<Anomaly> anomalies = new ArrayList<>();
        Map<String, List<ApiMetric>> groups = MetricGroups.groupBy(metrics,
                m -> m.getApiId() + ":" + m.getEndpoint() + ":" + m.getMethod());
        for (Map.Entry<String, List<ApiMetric>> group : groups.entrySet()) {
            anomalies.addAll(responseTimePatterns(group.getKey(), group.getValue()));
            anomalies.addAll(errorPatterns(group.getKey(), group.getValue()));
        }
        return anomalies;
    }

    List<Anomaly> responseTimePatterns(String groupKey, List<ApiMetric> group) {
        List<ApiMetric> timed = MetricGroups.withResponseTime(group);
        if (timed.size() < MIN_DATA_POINTS) {
            return Collections.emptyList();
        }
        double[] latencies = MetricGroups.responseTimes(timed);
        DescriptiveStatistics stats = new DescriptiveStatistics(latencies);
        double mean = stats.getMean();
        double threshold = mean + 2.0 * stats.getStandardDeviation();

        double[][] rows = new double[latencies.length][];
        for (int i = 0; i < latencies.length; i++) {
            rows[i] = new double[]{latencies[i]};
        }
        IsolationForest model = new IsolationForest(CONTAMINATION).fit(rows);

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < rows.length; i++) {
            if (!model.isOutlier(model.score(rows[i]))) {
                continue;
            }
            ApiMetric metric = timed.get(i);
            Map<String, Object> context = new HashMap<>();
            context.put("endpoint", metric.getEndpoint());
            context.put("method", metric.getMethod());
            context.put("group", groupKey);

            anomalies.add(createAnomaly(
                    apiIdFor(metric),
                    Anomaly.RESPONSE_TIME_PATTERN,
                    RESPONSE_TIME_SEVERITY,
                    "Response time pattern anomaly detected for " + groupKey,
                    latencies[i],
                    mean,
                    threshold,
                    metric.getEnvironment(),
                    metric.getTimestamp(),
                    context));
        }
        return anomalies;
    }

    List<Anomaly> errorPatterns(String groupKey, List<ApiMetric> group) {
        long windowMillis = ERROR_WINDOW.toMillis();
        Map<Long, int[]> windows = new TreeMap<>();
        for (ApiMetric metric : group) {
            long start = Math.floorDiv(metric.getTimestamp().toEpochMilli(), windowMillis) * windowMillis;
            int[] counts = windows.computeIfAbsent(start, k -> new int[2]);
            counts[0]++;
            if (metric.isError()) {
                counts[1]++;
            }
        }

        ApiMetric first = group.get(0);
        List<Anomaly> anomalies = new ArrayList<>();
        for (Map.Entry<Long, int[]> window : windows.entrySet()) {
            int total = window.getValue()[0];
            int errors = window.getValue()[1];
            double rate = (double) errors / total;
            if (rate <= ERROR_PATTERN_THRESHOLD) {
                continue;
            }
            Map<String, Object> context = new HashMap<>();
            context.put("endpoint", first.getEndpoint());
            context.put("method", first.getMethod());
            context.put("total_requests", total);
            context.put("error_count", errors);

            anomalies.add(createAnomaly(
                    apiIdFor(first),
                    Anomaly.ERROR_RATE_PATTERN,
                    ERROR_PATTERN_SEVERITY,
                    "High error rate detected for " + groupKey,
                    rate,
                    ERROR_PATTERN_EXPECTED,
                    ERROR_PATTERN_THRESHOLD,
                    first.getEnvironment(),
                    Instant.ofEpochMilli(window.getKey()),
                    context));
        }
        return anomalies;
    }

    @Override
    protected List<Prediction> doPredictIssues(List<ApiMetric> metrics) {
        return Collections.emptyList();
    }
}
