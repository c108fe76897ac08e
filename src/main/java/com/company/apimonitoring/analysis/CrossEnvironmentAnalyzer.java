package com.company.apimonitoring.analysis;

import com.company.apimonitoring.domain.Anomaly;
import com.company.apimonitoring.domain.ApiMetric;
import com.company.apimonitoring.domain.Prediction;
import com.company.apimonitoring.domain.enums.Environment;
import com.company.apimonitoring.domain.enums.Trend;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Global analyzer comparing the same (api, endpoint) across deployment environments:
 * latency and error-rate discrepancies, degradations spreading from one environment
 * to the next, and predictions along the deployment topology.
 */
@Slf4j
public class CrossEnvironmentAnalyzer extends AbstractAnalyzer {

    public static final String NAME = "cross_environment";

    static final int MIN_DATA_POINTS = 20;
    static final int HISTORY_CAPACITY = 1000;
    static final double RESPONSE_TIME_DIFF_THRESHOLD = 0.3;
    static final double RESPONSE_TIME_THRESHOLD_FACTOR = 1.3;
    static final double ERROR_RATE_THRESHOLD = 0.05;
    static final double ERROR_RATE_RATIO = 2.0;
    static final double RESPONSE_TIME_CHANGE_FACTOR = 1.5;
    static final double PROPAGATION_SEVERITY = 0.8;
    static final Duration RECENT_WINDOW = Duration.ofHours(1);
    static final Duration PROPAGATION_WINDOW = Duration.ofMinutes(30);
    static final Duration PREDICTION_WINDOW = Duration.ofMinutes(30);
    static final double PREDICTION_ERROR_RATE = 0.1;
    static final double MIN_PREDICTION_CONFIDENCE = 0.6;

    static final String CHANGE_ERROR_RATE = "error_rate";
    static final String CHANGE_RESPONSE_TIME = "response_time";

    private final Map<String, BoundedHistory<ApiMetric>> histories = new ConcurrentHashMap<>();

    public CrossEnvironmentAnalyzer(Clock clock) {
        super(null, clock);
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
        for (List<ApiMetric> endpointMetrics : groupByApiAndEndpoint(metrics).values()) {
            Map<Environment, List<ApiMetric>> byEnvironment = groupByEnvironment(endpointMetrics);
            if (byEnvironment.size() < 2) {
                continue;
            }
            anomalies.addAll(detectDiscrepancies(byEnvironment));
            anomalies.addAll(detectPropagation(byEnvironment));
            updateHistory(byEnvironment);
        }
        return anomalies;
    }

    @Override
    protected List<Prediction> doPredictIssues(List<ApiMetric> metrics) {
        List<Prediction> predictions = new ArrayList<>();
        for (List<ApiMetric> endpointMetrics : groupByApiAndEndpoint(metrics).values()) {
            Map<Environment, List<ApiMetric>> byEnvironment = groupByEnvironment(endpointMetrics);
            if (byEnvironment.size() < 2) {
                continue;
            }
            predictions.addAll(predictPropagation(byEnvironment));
        }
        return predictions;
    }

    List<Anomaly> detectDiscrepancies(Map<Environment, List<ApiMetric>> byEnvironment) {
        List<Environment> viable = viableEnvironments(byEnvironment);
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < viable.size(); i++) {
            for (int j = i + 1; j < viable.size(); j++) {
                List<ApiMetric> first = byEnvironment.get(viable.get(i));
                List<ApiMetric> second = byEnvironment.get(viable.get(j));
                Anomaly responseTime = responseTimeDiscrepancy(first, second);
                if (responseTime != null) {
                    anomalies.add(responseTime);
                }
                Anomaly errorRate = errorRateDiscrepancy(first, second);
                if (errorRate != null) {
                    anomalies.add(errorRate);
                }
            }
        }
        return anomalies;
    }

    private Anomaly responseTimeDiscrepancy(List<ApiMetric> first, List<ApiMetric> second) {
        double rt1 = MetricGroups.meanResponseTime(first);
        double rt2 = MetricGroups.meanResponseTime(second);
        double average = (rt1 + rt2) / 2.0;
        if (average <= 0.0) {
            return null;
        }
        double relativeDiff = Math.abs(rt1 - rt2) / average;
        if (relativeDiff <= RESPONSE_TIME_DIFF_THRESHOLD) {
            return null;
        }

        List<ApiMetric> slower = rt1 > rt2 ? first : second;
        List<ApiMetric> faster = rt1 > rt2 ? second : first;
        double slowerRt = Math.max(rt1, rt2);
        double fasterRt = Math.min(rt1, rt2);
        ApiMetric reference = slower.get(slower.size() - 1);
        Environment slowerEnv = reference.getEnvironment();
        Environment fasterEnv = faster.get(0).getEnvironment();

        Map<String, Object> context = new HashMap<>();
        context.put("endpoint", reference.getEndpoint());
        context.put("method", reference.getMethod());
        context.put("comparison_environment", fasterEnv.getValue());
        context.put("relative_difference", String.format(Locale.ROOT, "%.2f", relativeDiff));
        context.put("slower_environment_rt", String.format(Locale.ROOT, "%.2fms", slowerRt));
        context.put("faster_environment_rt", String.format(Locale.ROOT, "%.2fms", fasterRt));

        return createAnomaly(
                reference.getApiId(),
                Anomaly.CROSS_ENV_RESPONSE_TIME,
                relativeDiff,
                String.format(Locale.ROOT, "Response time discrepancy between %s and %s environments for %s %s",
                        slowerEnv, fasterEnv, reference.getMethod(), reference.getEndpoint()),
                slowerRt,
                fasterRt,
                fasterRt * RESPONSE_TIME_THRESHOLD_FACTOR,
                slowerEnv,
                reference.getTimestamp(),
                context);
    }

    private Anomaly errorRateDiscrepancy(List<ApiMetric> first, List<ApiMetric> second) {
        double er1 = MetricGroups.errorRate(first);
        double er2 = MetricGroups.errorRate(second);
        if (er1 > ERROR_RATE_THRESHOLD && er1 > er2 * ERROR_RATE_RATIO) {
            return errorRateAnomaly(first, er1, second, er2);
        }
        if (er2 > ERROR_RATE_THRESHOLD && er2 > er1 * ERROR_RATE_RATIO) {
            return errorRateAnomaly(second, er2, first, er1);
        }
        return null;
    }

    private Anomaly errorRateAnomaly(List<ApiMetric> worse, double worseRate,
                                     List<ApiMetric> other, double otherRate) {
        ApiMetric reference = worse.get(worse.size() - 1);
        Environment worseEnv = reference.getEnvironment();
        Environment otherEnv = other.get(0).getEnvironment();

        Map<String, Object> context = new HashMap<>();
        context.put("endpoint", reference.getEndpoint());
        context.put("method", reference.getMethod());
        context.put("comparison_environment", otherEnv.getValue());
        context.put("high_error_rate", String.format(Locale.ROOT, "%.2f%%", worseRate * 100));
        context.put("comparison_error_rate", String.format(Locale.ROOT, "%.2f%%", otherRate * 100));

        // severity uses the raw rate here, unlike the per-API error rate analyzer
        return createAnomaly(
                reference.getApiId(),
                Anomaly.CROSS_ENV_ERROR_RATE,
                worseRate,
                String.format(Locale.ROOT, "Higher error rate in %s compared to %s for %s %s",
                        worseEnv, otherEnv, reference.getMethod(), reference.getEndpoint()),
                worseRate,
                otherRate,
                Math.max(ERROR_RATE_THRESHOLD, otherRate * ERROR_RATE_RATIO),
                worseEnv,
                reference.getTimestamp(),
                context);
    }

    List<Anomaly> detectPropagation(Map<Environment, List<ApiMetric>> byEnvironment) {
        Instant recentStart = now().minus(RECENT_WINDOW);
        Map<Environment, EnvironmentChange> changes = new EnumMap<>(Environment.class);

        for (Map.Entry<Environment, List<ApiMetric>> entry : byEnvironment.entrySet()) {
            BoundedHistory<ApiMetric> history = histories.get(historyKey(entry.getValue().get(0)));
            if (history == null || history.size() == 0) {
                continue;
            }
            List<ApiMetric> recent = entry.getValue().stream()
                    .filter(m -> !m.getTimestamp().isBefore(recentStart))
                    .collect(Collectors.toList());
            if (recent.isEmpty()) {
                continue;
            }
            List<ApiMetric> historical = history.snapshot();
            double historicalErrorRate = MetricGroups.errorRate(historical);
            double historicalRt = MetricGroups.meanResponseTime(historical);
            double recentErrorRate = MetricGroups.errorRate(recent);
            double recentRt = MetricGroups.meanResponseTime(recent);

            Set<String> changeTypes = new LinkedHashSet<>();
            if (recentErrorRate > historicalErrorRate * ERROR_RATE_RATIO && recentErrorRate > ERROR_RATE_THRESHOLD) {
                changeTypes.add(CHANGE_ERROR_RATE);
            }
            if (historicalRt > 0.0 && recentRt > historicalRt * RESPONSE_TIME_CHANGE_FACTOR) {
                changeTypes.add(CHANGE_RESPONSE_TIME);
            }
            if (!changeTypes.isEmpty()) {
                changes.put(entry.getKey(), new EnvironmentChange(
                        entry.getKey(), changeTypes, recent.get(0), recentErrorRate, recentRt));
            }
        }

        List<Anomaly> anomalies = new ArrayList<>();
        if (changes.size() < 2) {
            return anomalies;
        }
        List<EnvironmentChange> ordered = changes.values().stream()
                .sorted(Comparator.comparing(EnvironmentChange::firstSeen))
                .collect(Collectors.toList());

        for (int i = 0; i < ordered.size() - 1; i++) {
            EnvironmentChange source = ordered.get(i);
            EnvironmentChange target = ordered.get(i + 1);
            long elapsedSeconds = Duration.between(source.firstSeen(), target.firstSeen()).getSeconds();
            if (elapsedSeconds > PROPAGATION_WINDOW.getSeconds()) {
                continue;
            }
            Set<String> common = new LinkedHashSet<>(source.changeTypes);
            common.retainAll(target.changeTypes);
            if (common.isEmpty()) {
                continue;
            }
            anomalies.add(propagationAnomaly(source, target, common, elapsedSeconds));
        }
        return anomalies;
    }

    private Anomaly propagationAnomaly(EnvironmentChange source, EnvironmentChange target,
                                       Set<String> common, long elapsedSeconds) {
        ApiMetric reference = target.firstMetric;
        String label = common.stream()
                .map(CrossEnvironmentAnalyzer::titleCase)
                .collect(Collectors.joining(" And "));

        Map<String, Object> context = new HashMap<>();
        context.put("endpoint", reference.getEndpoint());
        context.put("method", reference.getMethod());
        context.put("source_environment", source.environment.getValue());
        context.put("propagation_time_seconds", elapsedSeconds);
        context.put("change_type", new ArrayList<>(common));
        context.put("source_timestamp", source.firstSeen().toString());
        context.put("target_timestamp", target.firstSeen().toString());

        double value = common.contains(CHANGE_RESPONSE_TIME) ? target.responseTime : target.errorRate;
        return createAnomaly(
                reference.getApiId(),
                Anomaly.CROSS_ENV_PROPAGATION,
                PROPAGATION_SEVERITY,
                String.format(Locale.ROOT, "%s issue propagating from %s to %s for %s %s", label,
                        source.environment, target.environment, reference.getMethod(), reference.getEndpoint()),
                value,
                null,
                null,
                target.environment,
                target.firstSeen(),
                context);
    }

    List<Prediction> predictPropagation(Map<Environment, List<ApiMetric>> byEnvironment) {
        List<Environment> viable = viableEnvironments(byEnvironment);
        List<Prediction> predictions = new ArrayList<>();
        if (viable.size() < 2) {
            return predictions;
        }
        Instant now = now();
        Instant recentStart = now.minus(PREDICTION_WINDOW);

        for (Environment source : viable) {
            List<ApiMetric> sourceMetrics = byEnvironment.get(source);
            List<ApiMetric> recent = sourceMetrics.stream()
                    .filter(m -> !m.getTimestamp().isBefore(recentStart))
                    .collect(Collectors.toList());
            if (recent.isEmpty()) {
                continue;
            }
            boolean errorIssue = MetricGroups.errorRate(recent) > PREDICTION_ERROR_RATE;
            boolean latencyIssue = MetricGroups.meanResponseTime(recent)
                    > MetricGroups.meanResponseTime(sourceMetrics) * RESPONSE_TIME_CHANGE_FACTOR;
            if (!errorIssue && !latencyIssue) {
                continue;
            }

            for (Environment target : viable) {
                int stepDiff = target.getTopologyStage() - source.getTopologyStage();
                if (target == source || stepDiff <= 0) {
                    continue;
                }
                double confidence = Math.max(MIN_PREDICTION_CONFIDENCE, 1.0 - stepDiff * 0.1);
                List<ApiMetric> targetMetrics = byEnvironment.get(target);
                if (errorIssue) {
                    predictions.add(propagationPrediction(Prediction.CROSS_ENV_ERROR_PROPAGATION, "Error rate",
                            source, target, sourceMetrics, confidence, now,
                            MetricGroups.errorRate(sourceMetrics), MetricGroups.errorRate(targetMetrics)));
                }
                if (latencyIssue) {
                    predictions.add(propagationPrediction(Prediction.CROSS_ENV_RESPONSE_TIME_PROPAGATION, "Response time",
                            source, target, sourceMetrics, confidence, now,
                            MetricGroups.meanResponseTime(sourceMetrics), MetricGroups.meanResponseTime(targetMetrics)));
                }
            }
        }
        return predictions;
    }

    private Prediction propagationPrediction(String type, String label, Environment source, Environment target,
                                             List<ApiMetric> sourceMetrics, double confidence, Instant now,
                                             double sourceValue, double targetValue) {
        ApiMetric reference = sourceMetrics.get(0);
        Map<String, Object> context = new HashMap<>();
        context.put("endpoint", reference.getEndpoint());
        context.put("method", reference.getMethod());
        context.put("source_environment", source.getValue());
        context.put("source_value", sourceValue);
        context.put("prediction_basis", "Recent " + label.toLowerCase(Locale.ROOT) + " increase in source environment");

        return createPrediction(
                reference.getApiId(),
                type,
                confidence,
                now.plus(PREDICTION_WINDOW),
                String.format(Locale.ROOT, "%s increase likely to propagate from %s to %s for %s %s",
                        label, source, target, reference.getMethod(), reference.getEndpoint()),
                sourceValue,
                targetValue,
                Trend.INCREASING,
                target,
                context);
    }

    @Override
    protected void resetState() {
        histories.clear();
    }

    private void updateHistory(Map<Environment, List<ApiMetric>> byEnvironment) {
        for (List<ApiMetric> envMetrics : byEnvironment.values()) {
            histories.computeIfAbsent(historyKey(envMetrics.get(0)),
                            k -> new BoundedHistory<>(HISTORY_CAPACITY, ApiMetric::getTimestamp))
                    .append(envMetrics);
        }
    }

    private List<Environment> viableEnvironments(Map<Environment, List<ApiMetric>> byEnvironment) {
        return byEnvironment.entrySet().stream()
                .filter(e -> e.getValue().size() >= MIN_DATA_POINTS)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static Map<String, List<ApiMetric>> groupByApiAndEndpoint(List<ApiMetric> metrics) {
        return MetricGroups.groupBy(metrics, m -> m.getApiId() + "|" + MetricGroups.endpointKey(m));
    }

    private static Map<Environment, List<ApiMetric>> groupByEnvironment(List<ApiMetric> metrics) {
        Map<Environment, List<ApiMetric>> grouped = new EnumMap<>(Environment.class);
        for (ApiMetric metric : metrics) {
            Environment env = metric.getEnvironment() != null ? metric.getEnvironment() : Environment.OTHER;
            grouped.computeIfAbsent(env, k -> new ArrayList<>()).add(metric);
        }
        return grouped;
    }

    private static String historyKey(ApiMetric metric) {
        return metric.getApiId() + "|" + MetricGroups.endpointKey(metric) + "|" + metric.getEnvironment();
    }

    private static String titleCase(String changeType) {
        String spaced = changeType.replace('_', ' ');
        StringBuilder sb = new StringBuilder(spaced.length());
        boolean upper = true;
        for (char c : spaced.toCharArray()) {
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = c == ' ';
        }
        return sb.toString();
    }

    private static final class EnvironmentChange {
        private final Environment environment;
        private final Set<String> changeTypes;
        private final ApiMetric firstMetric;
        private final double errorRate;
        private final double responseTime;

        EnvironmentChange(Environment environment, Set<String> changeTypes, ApiMetric firstMetric,
                          double errorRate, double responseTime) {
            this.environment = environment;
            this.changeTypes = changeTypes;
            this.firstMetric = firstMetric;
            this.errorRate = errorRate;
            this.responseTime = responseTime;
        }

        Instant firstSeen() {
            return firstMetric.getTimestamp();
        }
    }
}
