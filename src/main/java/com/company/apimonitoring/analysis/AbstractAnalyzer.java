package com.company.apimonitoring.analysis;

import com.company.apimonitoring.domain.Anomaly;
import com.company.apimonitoring.domain.ApiMetric;
import com.company.apimonitoring.domain.ApiSource;
import com.company.apimonitoring.domain.Prediction;
import com.company.apimonitoring.domain.enums.Environment;
import com.company.apimonitoring.domain.enums.Trend;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Guards the minimum-sample rule and the catch-all failure boundary around the
 * dimension-specific detection logic, and builds anomalies/predictions with
 * generated ids and clamped scores.
 */
@Slf4j
public abstract class AbstractAnalyzer implements Analyzer {

    protected final Clock clock;
    protected volatile ApiSource apiSource;

    protected AbstractAnalyzer(ApiSource apiSource, Clock clock) {
        this.apiSource = apiSource;
        this.clock = clock;
    }

    @Override
    public final List<Anomaly> detectAnomalies(List<ApiMetric> metrics) {
        if (metrics == null || metrics.size() < getMinDataPoints()) {
            log.debug("Not enough data points for {} anomaly detection on api {}", getName(), apiLabel());
            return Collections.emptyList();
        }
        try {
            return doDetectAnomalies(metrics);
        } catch (Exception e) {
            log.error("{} failed to detect anomalies for api {}", getName(), apiLabel(), e);
            return Collections.emptyList();
        }
    }

    @Override
    public final List<Prediction> predictIssues(List<ApiMetric> metrics) {
        if (metrics == null || metrics.size() < getMinDataPoints()) {
            log.debug("Not enough data points for {} prediction on api {}", getName(), apiLabel());
            return Collections.emptyList();
        }
        try {
            return doPredictIssues(metrics);
        } catch (Exception e) {
            log.error("{} failed to predict issues for api {}", getName(), apiLabel(), e);
            return Collections.emptyList();
        }
    }

    @Override
    public void updateConfig(ApiSource source) {
        this.apiSource = source;
        log.info("{} configuration updated for api {}", getName(), apiLabel());
    }

    @Override
    public final void cleanup() {
        try {
            resetState();
        } catch (Exception e) {
            log.warn("{} cleanup for api {} did not complete", getName(), apiLabel(), e);
        }
    }

    public ApiSource getApiSource() {
        return apiSource;
    }

    protected abstract List<Anomaly> doDetectAnomalies(List<ApiMetric> metrics);

    protected abstract List<Prediction> doPredictIssues(List<ApiMetric> metrics);

    /**
     * Drops model state and histories.
     */
    protected void resetState() {
    }

    protected Instant now() {
        return clock.instant();
    }

    protected String apiIdFor(ApiMetric metric) {
        if (metric != null && metric.getApiId() != null) {
            return metric.getApiId();
        }
        ApiSource source = apiSource;
        return source != null ? source.getId() : null;
    }

    protected Anomaly createAnomaly(String apiId, String type, double severity, String description,
                                    double metricValue, Double expectedValue, Double threshold,
                                    Environment environment, Instant timestamp, Map<String, Object> context) {
        return Anomaly.builder()
                .id("anom-" + UUID.randomUUID())
                .apiId(apiId)
                .type(type)
                .severity(clamp(severity))
                .timestamp(timestamp != null ? timestamp : now())
                .description(description)
                .metricValue(metricValue)
                .expectedValue(expectedValue)
                .threshold(threshold)
                .environment(environment != null ? environment : Environment.OTHER)
                .context(context != null ? context : new HashMap<>())
                .processed(false)
                .build();
    }

    protected Prediction createPrediction(String apiId, String type, double confidence, Instant predictedFor,
                                          String description, double predictedValue, double currentValue,
                                          Trend trend, Environment environment, Map<String, Object> context) {
        return Prediction.builder()
                .id("pred-" + UUID.randomUUID())
                .apiId(apiId)
                .type(type)
                .confidence(clamp(confidence))
                .createdAt(now())
                .predictedFor(predictedFor)
                .description(description)
                .predictedValue(predictedValue)
                .currentValue(currentValue)
                .trend(trend != null ? trend : Trend.STABLE)
                .environment(environment != null ? environment : Environment.OTHER)
                .context(context != null ? context : new HashMap<>())
                .build();
    }

    protected static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private String apiLabel() {
        ApiSource source = apiSource;
        return source != null ? source.getId() : "*";
    }
}
