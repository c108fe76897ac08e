package com.company.apimonitoring.analysis;

import com.company.apimonitoring.analysis.model.AutoregressiveForecaster;
import com.company.apimonitoring.analysis.model.IsolationForest;
import com.company.apimonitoring.analysis.model.KnnOutlierScorer;
import com.company.apimonitoring.analysis.model.TimeSeriesResampler;
import com.company.apimonitoring.domain.Anomaly;
import com.company.apimonitoring.domain.ApiMetric;
import com.company.apimonitoring.domain.ApiSource;
import com.company.apimonitoring.domain.Prediction;
import com.company.apimonitoring.domain.enums.Trend;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Latency analysis per (method, endpoint): nearest-neighbour spike detection,
 * isolation-forest pattern change against a rolling history, and a 30 minute
 * autoregressive forecast.
 */
@Slf4j
public class ResponseTimeAnalyzer extends AbstractAnalyzer {

    public static final String NAME = "response_time";

    static final int MIN_DATA_POINTS = 30;
    static final double ANOMALY_SCORE_THRESHOLD = 0.95;
    static final double CONTAMINATION = 0.05;
    static final int HISTORY_CAPACITY = 1000;
    static final int LOCAL_WINDOW = 10;
    static final double SPIKE_THRESHOLD_FACTOR = 1.5;
    static final double PATTERN_CONTAMINATION = 0.1;
    static final int PATTERN_MIN_CONSECUTIVE = 3;
    static final double PATTERN_THRESHOLD_FACTOR = 1.3;
    static final int FORECAST_HORIZON_MINUTES = 30;
    static final double FORECAST_CONFIDENCE = 0.8;
    static final double STABLE_BAND = 0.2;
    static final int CURRENT_AVERAGE_POINTS = 10;

    private final KnnOutlierScorer spikeScorer = new KnnOutlierScorer();
    private final AutoregressiveForecaster forecaster = new AutoregressiveForecaster();
    private final Map<String, BoundedHistory<ApiMetric>> histories = new ConcurrentHashMap<>();

    public ResponseTimeAnalyzer(ApiSource apiSource, Clock clock) {
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
        Map<String, List<ApiMetric>> groups = MetricGroups.byMethodAndEndpoint(MetricGroups.withResponseTime(metrics));

        for (Map.Entry<String, List<ApiMetric>> group : groups.entrySet()) {
            List<ApiMetric> series = group.getValue();
            if (series.size() < MIN_DATA_POINTS) {
                continue;
            }
            anomalies.addAll(detectSpikes(series));
            anomalies.addAll(detectPatternChanges(group.getKey(), series));
            histories.computeIfAbsent(group.getKey(),
                            k -> new BoundedHistory<>(HISTORY_CAPACITY, ApiMetric::getTimestamp))
                    .append(series);
        }
        return anomalies;
    }

    List<Anomaly> detectSpikes(List<ApiMetric> series) {
        List<Anomaly> spikes = new ArrayList<>();
        double[] latencies = MetricGroups.responseTimes(series);
        double[] scores = spikeScorer.score(latencies);

        for (int i = 0; i < latencies.length; i++) {
            if (scores[i] <= ANOMALY_SCORE_THRESHOLD) {
                continue;
            }
            double expected = localMean(latencies, i);
            double observed = latencies[i];
            double threshold = expected * SPIKE_THRESHOLD_FACTOR;
            // A spike must clear the threshold it reports
            if (expected <= 0.0 || observed <= threshold) {
                continue;
            }

            ApiMetric metric = series.get(i);
            Map<String, Object> context = new HashMap<>();
            context.put("endpoint", metric.getEndpoint());
            context.put("method", metric.getMethod());
            context.put("status_code", metric.getStatusCode());
            context.put("timestamp", metric.getTimestamp().toString());
            context.put("outlier_score", scores[i]);
            context.put("contamination", CONTAMINATION);

            spikes.add(createAnomaly(
                    apiIdFor(metric),
                    Anomaly.RESPONSE_TIME_SPIKE,
                    (observed - expected) / expected,
                    String.format(Locale.ROOT, "Response time spike detected for %s %s", metric.getMethod(), metric.getEndpoint()),
                    observed,
                    expected,
                    threshold,
                    metric.getEnvironment(),
                    metric.getTimestamp(),
                    context));
        }
        return spikes;
    }

    List<Anomaly> detectPatternChanges(String groupKey, List<ApiMetric> series) {
        BoundedHistory<ApiMetric> history = histories.get(groupKey);
        if (history == null || history.size() < MIN_DATA_POINTS) {
            return new ArrayList<>();
        }
        List<ApiMetric> historical = history.snapshot();
        double historicalMean = MetricGroups.meanResponseTime(historical);

        IsolationForest model = new IsolationForest(PATTERN_CONTAMINATION).fit(features(historical));
        double[] scores = model.score(features(series));

        double[] current = MetricGroups.responseTimes(series);
        double recentMean = tailMean(current, CURRENT_AVERAGE_POINTS);

        List<Anomaly> changes = new ArrayList<>();
        int consecutive = 0;
        for (int i = 0; i < scores.length; i++) {
            if (!model.isOutlier(scores[i])) {
                consecutive = 0;
                continue;
            }
            consecutive++;
            if (consecutive < PATTERN_MIN_CONSECUTIVE) {
                continue;
            }
            ApiMetric metric = series.get(i);
            Map<String, Object> context = new HashMap<>();
            context.put("endpoint", metric.getEndpoint());
            context.put("method", metric.getMethod());
            context.put("timestamp", metric.getTimestamp().toString());
            context.put("anomaly_score", scores[i]);
            context.put("historical_mean", historicalMean);
            context.put("recent_mean", recentMean);

            changes.add(createAnomaly(
                    apiIdFor(metric),
                    Anomaly.RESPONSE_TIME_PATTERN_CHANGE,
                    scores[i],
                    String.format(Locale.ROOT, "Response time pattern change detected for %s %s",
                            metric.getMethod(), metric.getEndpoint()),
                    metric.getResponseTime(),
                    historicalMean,
                    historicalMean * PATTERN_THRESHOLD_FACTOR,
                    metric.getEnvironment(),
                    metric.getTimestamp(),
                    context));
        }
        return changes;
    }

    @Override
    protected List<Prediction> doPredictIssues(List<ApiMetric> metrics) {
        List<Prediction> predictions = new ArrayList<>();
        Map<String, List<ApiMetric>> groups = MetricGroups.byMethodAndEndpoint(MetricGroups.withResponseTime(metrics));

        for (List<ApiMetric> series : groups.values()) {
            if (series.size() < MIN_DATA_POINTS) {
                continue;
            }
            try {
                predictions.add(forecast(series));
            } catch (RuntimeException e) {
                log.error("Response time forecast failed for {} {}",
                        series.get(0).getMethod(), series.get(0).getEndpoint(), e);
            }
        }
        return predictions;
    }

    Prediction forecast(List<ApiMetric> series) {
        List<Instant> timestamps = series.stream().map(ApiMetric::getTimestamp).collect(Collectors.toList());
        double[] latencies = MetricGroups.responseTimes(series);
        TimeSeriesResampler.Grid grid = TimeSeriesResampler.resample(timestamps, latencies, Duration.ofMinutes(1));

        double[] forecast = forecaster.forecast(grid.getValues(), FORECAST_HORIZON_MINUTES);
        double predicted = forecast[FORECAST_HORIZON_MINUTES - 1];
        double current = tailMean(latencies, CURRENT_AVERAGE_POINTS);

        Trend trend;
        String description;
        if (current > 0.0 && predicted > current * (1.0 + STABLE_BAND)) {
            trend = Trend.INCREASING;
            description = String.format(Locale.ROOT, "Response time projected to increase by %.1f%% in %d minutes",
                    (predicted / current - 1.0) * 100.0, FORECAST_HORIZON_MINUTES);
        } else if (current > 0.0 && predicted < current * (1.0 - STABLE_BAND)) {
            trend = Trend.DECREASING;
            description = String.format(Locale.ROOT, "Response time projected to decrease by %.1f%% in %d minutes",
                    (1.0 - predicted / current) * 100.0, FORECAST_HORIZON_MINUTES);
        } else {
            trend = Trend.STABLE;
            description = String.format(Locale.ROOT, "Response time projected to remain stable in the next %d minutes",
                    FORECAST_HORIZON_MINUTES);
        }

        ApiMetric first = series.get(0);
        ApiMetric last = series.get(series.size() - 1);
        Map<String, Object> context = new HashMap<>();
        context.put("endpoint", first.getEndpoint());
        context.put("method", first.getMethod());
        context.put("analysis_time_range", first.getTimestamp() + " to " + last.getTimestamp());
        context.put("forecast_horizon_minutes", FORECAST_HORIZON_MINUTES);

        return createPrediction(
                apiIdFor(last),
                Prediction.RESPONSE_TIME,
                FORECAST_CONFIDENCE,
                grid.getEnd().plus(Duration.ofMinutes(FORECAST_HORIZON_MINUTES)),
                description,
                Math.max(0.0, predicted),
                current,
                trend,
                last.getEnvironment(),
                context);
    }

    @Override
    protected void resetState() {
        histories.clear();
    }

    int historySize(String groupKey) {
        BoundedHistory<ApiMetric> history = histories.get(groupKey);
        return history != null ? history.size() : 0;
    }

    /**
     * Mean of the points in [i - 10, i + 10) excluding i itself.
     */
    static double localMean(double[] values, int index) {
        int from = Math.max(0, index - LOCAL_WINDOW);
        int to = Math.min(values.length, index + LOCAL_WINDOW);
        double sum = 0.0;
        int count = 0;
        for (int j = from; j < to; j++) {
            if (j != index) {
                sum += values[j];
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    private static double tailMean(double[] values, int points) {
        int from = Math.max(0, values.length - points);
        double sum = 0.0;
        for (int i = from; i < values.length; i++) {
            sum += values[i];
        }
        return values.length == from ? 0.0 : sum / (values.length - from);
    }

    private static double[][] features(List<ApiMetric> metrics) {
        double[][] rows = new double[metrics.size()][];
        for (int i = 0; i < metrics.size(); i++) {
            ApiMetric metric = metrics.get(i);
            ZonedDateTime ts = metric.getTimestamp().atZone(ZoneOffset.UTC);
            rows[i] = new double[]{
                    metric.getResponseTime(),
                    ts.getHour(),
                    ts.getDayOfWeek().getValue() - 1,
                    metric.isError() ? 1.0 : 0.0,
                    metric.getStatusCode() != null ? metric.getStatusCode() / 100 : 0
            };
        }
        return rows;
    }
}
