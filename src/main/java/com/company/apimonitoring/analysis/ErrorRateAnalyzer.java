package com.company.apimonitoring.analysis;

import com.company.apimonitoring.domain.Anomaly;
import com.company.apimonitoring.domain.ApiMetric;
import com.company.apimonitoring.domain.ApiSource;
import com.company.apimonitoring.domain.Prediction;
import com.company.apimonitoring.domain.enums.Trend;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class ErrorRateAnalyzer extends AbstractAnalyzer {

    public static final String NAME = "error_rate";

    static final int MIN_DATA_POINTS = 20;
    static final double ERROR_RATE_THRESHOLD = 0.05;
    static final double EXPECTED_ERROR_RATE = 0.01;
    static final double SEVERITY_SCALE = 5.0;
    static final int MIN_WINDOW_POINTS = 10;
    static final double GROWTH_FACTOR = 1.5;
    static final double MIN_PREDICTABLE_RATE = 0.02;
    static final double MAX_CONFIDENCE = 0.9;

    public ErrorRateAnalyzer(ApiSource apiSource, Clock clock) {
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
        for (List<ApiMetric> group : MetricGroups.byMethodAndEndpoint(metrics).values()) {
            if (group.size() < MIN_DATA_POINTS) {
                continue;
            }
            double errorRate = MetricGroups.errorRate(group);
            if (errorRate <= ERROR_RATE_THRESHOLD) {
                continue;
            }

            ApiMetric first = group.get(0);
            ApiMetric last = group.get(group.size() - 1);
            Map<String, Object> context = new HashMap<>();
            context.put("endpoint", first.getEndpoint());
            context.put("method", first.getMethod());
            context.put("error_count", MetricGroups.errorCount(group));
            context.put("total_count", group.size());
            context.put("time_range", first.getTimestamp() + " to " + last.getTimestamp());

            anomalies.add(createAnomaly(
                    apiIdFor(first),
                    Anomaly.HIGH_ERROR_RATE,
                    errorRate * SEVERITY_SCALE,
                    String.format(Locale.ROOT, "High error rate detected for %s %s", first.getMethod(), first.getEndpoint()),
                    errorRate,
                    EXPECTED_ERROR_RATE,
                    ERROR_RATE_THRESHOLD,
                    first.getEnvironment(),
                    last.getTimestamp(),
                    context));
        }
        return anomalies;
    }

    @Override
    protected List<Prediction> doPredictIssues(List<ApiMetric> metrics) {
        List<Prediction> predictions = new ArrayList<>();
        Instant now = now();
        Instant oneHourAgo = now.minus(Duration.ofHours(1));
        Instant twoHoursAgo = now.minus(Duration.ofHours(2));

        for (List<ApiMetric> group : MetricGroups.byMethodAndEndpoint(metrics).values()) {
            if (group.size() < MIN_DATA_POINTS) {
                continue;
            }
            List<ApiMetric> recent = group.stream()
                    .filter(m -> !m.getTimestamp().isBefore(oneHourAgo))
                    .collect(Collectors.toList());
            List<ApiMetric> previous = group.stream()
                    .filter(m -> !m.getTimestamp().isBefore(twoHoursAgo) && m.getTimestamp().isBefore(oneHourAgo))
                    .collect(Collectors.toList());
            if (recent.size() < MIN_WINDOW_POINTS || previous.size() < MIN_WINDOW_POINTS) {
                continue;
            }

            double recentRate = MetricGroups.errorRate(recent);
            double previousRate = MetricGroups.errorRate(previous);
            if (recentRate < previousRate * GROWTH_FACTOR || recentRate <= MIN_PREDICTABLE_RATE) {
                continue;
            }

            double change = recentRate - previousRate;
            double predictedRate = Math.min(1.0, recentRate + change);
            double confidence = Math.min(MAX_CONFIDENCE, 0.5 + recentRate / 0.1);

            ApiMetric first = group.get(0);
            Map<String, Object> context = new HashMap<>();
            context.put("endpoint", first.getEndpoint());
            context.put("method", first.getMethod());
            context.put("recent_error_rate", recentRate);
            context.put("previous_error_rate", previousRate);
            context.put("rate_change", change);
            context.put("recent_sample_size", recent.size());
            context.put("previous_sample_size", previous.size());

            predictions.add(createPrediction(
                    apiIdFor(first),
                    Prediction.ERROR_RATE,
                    confidence,
                    now.plus(Duration.ofHours(1)),
                    String.format(Locale.ROOT, "Error rate trending upward for %s %s", first.getMethod(), first.getEndpoint()),
                    predictedRate,
                    recentRate,
                    Trend.INCREASING,
                    first.getEnvironment(),
                    context));
            log.debug("Error rate for {} rising from {} to {}", MetricGroups.endpointKey(first), previousRate, recentRate);
        }
        return predictions;
    }
}
