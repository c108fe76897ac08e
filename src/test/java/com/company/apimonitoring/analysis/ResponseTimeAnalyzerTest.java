package com.company.apimonitoring.analysis;

import com.company.apimonitoring.domain.Anomaly;
import com.company.apimonitoring.domain.ApiMetric;
import com.company.apimonitoring.domain.Prediction;
import com.company.apimonitoring.domain.enums.Environment;
import com.company.apimonitoring.domain.enums.Trend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static com.company.apimonitoring.analysis.MetricFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ResponseTimeAnalyzerTest {

    private static final Instant START = NOW.minus(Duration.ofMinutes(40));
    // Both windows sit inside one clock hour so only latency varies between samples
    private static final Instant HISTORY_START = Instant.parse("2024-01-15T11:00:00Z");
    private static final Instant CURRENT_START = HISTORY_START.plus(Duration.ofMinutes(15));

    private ResponseTimeAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ResponseTimeAnalyzer(source("users-api"), CLOCK);
    }

    @Test
    void detectAnomalies_InjectedSpikes_FlagsSpikesWithLocalExpectation() {
        // Given
        double[] latencies = jittered(30, 100.0);
        latencies[3] = 900.0;
        latencies[15] = 950.0;
        latencies[27] = 1000.0;
        List<ApiMetric> metrics = series("users-api", "/users", Environment.AWS, START, Duration.ofMinutes(1), latencies);

        // When
        List<Anomaly> spikes = analyzer.detectAnomalies(metrics).stream()
                .filter(a -> Anomaly.RESPONSE_TIME_SPIKE.equals(a.getType()))
                .collect(Collectors.toList());

        // Then
        Set<Double> flagged = spikes.stream().map(Anomaly::getMetricValue).collect(Collectors.toSet());
        assertTrue(flagged.containsAll(Set.of(900.0, 950.0, 1000.0)));
        assertTrue(spikes.size() <= 4);
        for (Anomaly spike : spikes) {
            assertEquals(100.0, spike.getExpectedValue(), 20.0);
            assertEquals(spike.getExpectedValue() * 1.5, spike.getThreshold(), 1e-9);
            assertTrue(spike.getSeverity() >= 0.0 && spike.getSeverity() <= 1.0);
            assertEquals("/users", spike.getContext().get("endpoint"));
            assertEquals(Environment.AWS, spike.getEnvironment());
        }
    }

    @Test
    void detectAnomalies_GaussianNoise_NoSpikes() {
        for (long seed = 0; seed < 50; seed++) {
            // Given
            ResponseTimeAnalyzer fresh = new ResponseTimeAnalyzer(source("users-api"), CLOCK);
            List<ApiMetric> metrics = series("users-api", "/users", Environment.AWS, START, Duration.ofMinutes(1),
                    gaussian(30, 100.0, 10.0, new Random(seed)));

            // When
            List<Anomaly> spikes = spikesOf(fresh.detectAnomalies(metrics));

            // Then
            assertTrue(spikes.isEmpty(), "seed " + seed + " flagged " + spikes.size() + " spikes");
        }
    }

    @Test
    void detectAnomalies_SpikesOverGaussianNoise_EveryFlaggedPointClearsThreshold() {
        for (long seed = 0; seed < 20; seed++) {
            // Given
            ResponseTimeAnalyzer fresh = new ResponseTimeAnalyzer(source("users-api"), CLOCK);
            double[] latencies = gaussian(30, 100.0, 10.0, new Random(seed));
            latencies[5] = 600.0;
            latencies[20] = 700.0;
            List<ApiMetric> metrics = series("users-api", "/users", Environment.AWS, START, Duration.ofMinutes(1), latencies);

            // When
            List<Anomaly> spikes = spikesOf(fresh.detectAnomalies(metrics));

            // Then
            Set<Double> flagged = spikes.stream().map(Anomaly::getMetricValue).collect(Collectors.toSet());
            assertEquals(Set.of(600.0, 700.0), flagged, "seed " + seed);
            for (Anomaly spike : spikes) {
                assertTrue(spike.getMetricValue() > spike.getThreshold());
            }
        }
    }

    @Test
    void detectAnomalies_SteadyLatency_NoSpikes() {
        List<ApiMetric> metrics = series("users-api", "/users", Environment.AWS, START, Duration.ofMinutes(1),
                jittered(30, 100.0));

        assertTrue(analyzer.detectAnomalies(metrics).isEmpty());
    }

    @Test
    void detectAnomalies_TooFewPoints_ReturnsEmpty() {
        double[] latencies = jittered(29, 100.0);
        latencies[10] = 5000.0;
        List<ApiMetric> metrics = series("users-api", "/users", Environment.AWS, START, Duration.ofMinutes(1), latencies);

        assertTrue(analyzer.detectAnomalies(metrics).isEmpty());
    }

    @Test
    void detectAnomalies_RepeatedWindow_HistoryIsNotDuplicated() {
        List<ApiMetric> metrics = series("users-api", "/users", Environment.AWS, START, Duration.ofMinutes(1),
                jittered(30, 100.0));

        analyzer.detectAnomalies(metrics);
        analyzer.detectAnomalies(metrics);

        assertEquals(30, analyzer.historySize("GET:/users"));
    }

    @Test
    void detectAnomalies_ThreeConsecutiveShiftedPoints_FlagsOnePatternChange() {
        // Given
        analyzer.detectAnomalies(series("users-api", "/users", Environment.AWS, HISTORY_START, Duration.ofSeconds(30),
                normalQuantiles(30, 100.0, 10.0, 7L)));
        double[] current = constant(30, 100.0);
        current[10] = 400.0;
        current[11] = 400.0;
        current[12] = 400.0;
        List<ApiMetric> metrics = series("users-api", "/users", Environment.AWS, CURRENT_START, Duration.ofSeconds(30), current);

        // When
        List<Anomaly> changes = patternChangesOf(analyzer.detectAnomalies(metrics));

        // Then
        assertEquals(1, changes.size());
        Anomaly change = changes.get(0);
        assertEquals(400.0, change.getMetricValue(), 1e-9);
        assertEquals(100.0, change.getExpectedValue(), 1e-6);
        assertEquals(change.getExpectedValue() * 1.3, change.getThreshold(), 1e-9);
        assertEquals(metrics.get(12).getTimestamp(), change.getTimestamp());
        assertEquals(Environment.AWS, change.getEnvironment());
    }

    @Test
    void detectAnomalies_TwoConsecutiveShiftedPoints_NoPatternChange() {
        // Given
        analyzer.detectAnomalies(series("users-api", "/users", Environment.AWS, HISTORY_START, Duration.ofSeconds(30),
                normalQuantiles(30, 100.0, 10.0, 7L)));
        double[] current = constant(30, 100.0);
        current[10] = 400.0;
        current[11] = 400.0;
        List<ApiMetric> metrics = series("users-api", "/users", Environment.AWS, CURRENT_START, Duration.ofSeconds(30), current);

        // When
        List<Anomaly> changes = patternChangesOf(analyzer.detectAnomalies(metrics));

        // Then
        assertTrue(changes.isEmpty());
    }

    @Test
    void detectAnomalies_WholeWindowShifted_FlagsPatternChangesAgainstHistory() {
        // Given
        analyzer.detectAnomalies(series("users-api", "/users", Environment.AWS, HISTORY_START, Duration.ofSeconds(30),
                normalQuantiles(30, 100.0, 10.0, 7L)));
        List<ApiMetric> metrics = series("users-api", "/users", Environment.AWS, CURRENT_START, Duration.ofSeconds(30),
                normalQuantiles(30, 400.0, 10.0, 11L));

        // When
        List<Anomaly> changes = patternChangesOf(analyzer.detectAnomalies(metrics));

        // Then
        assertEquals(28, changes.size());
        for (Anomaly change : changes) {
            assertTrue(change.getMetricValue() > change.getThreshold());
            assertEquals(100.0, change.getExpectedValue(), 1e-6);
        }
    }

    @Test
    void detectAnomalies_FirstWindow_NoPatternChangeWithoutHistory() {
        List<ApiMetric> metrics = series("users-api", "/users", Environment.AWS, CURRENT_START, Duration.ofSeconds(30),
                normalQuantiles(30, 400.0, 10.0, 11L));

        assertTrue(patternChangesOf(analyzer.detectAnomalies(metrics)).isEmpty());
    }

    @Test
    void cleanup_ClearsHistory() {
        analyzer.detectAnomalies(series("users-api", "/users", Environment.AWS, START, Duration.ofMinutes(1),
                jittered(30, 100.0)));

        analyzer.cleanup();

        assertEquals(0, analyzer.historySize("GET:/users"));
    }

    @Test
    void predictIssues_SteadyClimb_PredictsIncrease() {
        // Given
        double[] latencies = new double[30];
        for (int i = 0; i < latencies.length; i++) {
            latencies[i] = 100.0 + 10.0 * i;
        }
        List<ApiMetric> metrics = series("users-api", "/users", Environment.AWS, START, Duration.ofMinutes(1), latencies);

        // When
        List<Prediction> predictions = analyzer.predictIssues(metrics);

        // Then
        assertEquals(1, predictions.size());
        Prediction prediction = predictions.get(0);
        assertEquals(Prediction.RESPONSE_TIME, prediction.getType());
        assertEquals(Trend.INCREASING, prediction.getTrend());
        assertEquals(0.8, prediction.getConfidence(), 1e-9);
        assertEquals(345.0, prediction.getCurrentValue(), 1e-9);
        assertTrue(prediction.getPredictedValue() > 345.0 * 1.2);
        assertEquals(START.plus(Duration.ofMinutes(29 + 30)), prediction.getPredictedFor());
    }

    @Test
    void predictIssues_FlatLatency_PredictsStable() {
        List<ApiMetric> metrics = series("users-api", "/users", Environment.AWS, START, Duration.ofMinutes(1),
                constant(30, 120.0));

        Prediction prediction = analyzer.predictIssues(metrics).get(0);

        assertEquals(Trend.STABLE, prediction.getTrend());
        assertEquals(120.0, prediction.getPredictedValue(), 1e-6);
        assertTrue(prediction.getDescription().contains("remain stable"));
    }

    @Test
    void localMean_ExcludesCenterPoint() {
        double[] values = {10.0, 10.0, 1000.0, 10.0, 10.0};

        assertEquals(10.0, ResponseTimeAnalyzer.localMean(values, 2), 1e-9);
    }

    private static List<Anomaly> spikesOf(List<Anomaly> anomalies) {
        return ofType(anomalies, Anomaly.RESPONSE_TIME_SPIKE);
    }

    private static List<Anomaly> patternChangesOf(List<Anomaly> anomalies) {
        return ofType(anomalies, Anomaly.RESPONSE_TIME_PATTERN_CHANGE);
    }

    private static List<Anomaly> ofType(List<Anomaly> anomalies, String type) {
        return anomalies.stream()
                .filter(a -> type.equals(a.getType()))
                .collect(Collectors.toList());
    }
}
