package com.company.apimonitoring.analysis;

import com.company.apimonitoring.domain.Anomaly;
import com.company.apimonitoring.domain.ApiMetric;
import com.company.apimonitoring.domain.enums.Environment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.company.apimonitoring.analysis.MetricFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class PatternAnalyzerTest {

    // aligned to a 5 minute boundary
    private static final Instant WINDOW_START = Instant.parse("2024-01-15T11:00:00Z");

    private PatternAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new PatternAnalyzer(source("search-api"), CLOCK);
    }

    @Test
    void detectAnomalies_IsolatedLatency_FlaggedAsResponseTimePattern() {
        // Given
        double[] latencies = jittered(30, 100.0);
        latencies[12] = 1000.0;
        List<ApiMetric> metrics = series("search-api", "/search", Environment.AZURE, WINDOW_START,
                Duration.ofSeconds(20), latencies);

        // When
        List<Anomaly> patterns = analyzer.detectAnomalies(metrics).stream()
                .filter(a -> Anomaly.RESPONSE_TIME_PATTERN.equals(a.getType()))
                .collect(Collectors.toList());

        // Then
        assertTrue(patterns.stream().anyMatch(a -> a.getMetricValue() == 1000.0));
        assertTrue(patterns.size() <= 3);
        Anomaly outlier = patterns.stream().filter(a -> a.getMetricValue() == 1000.0).findFirst().orElseThrow();
        assertEquals(0.8, outlier.getSeverity(), 1e-9);
        assertTrue(outlier.getThreshold() > outlier.getExpectedValue());
        assertEquals("search-api:/search:GET", outlier.getContext().get("group"));
    }

    @Test
    void detectAnomalies_ErrorBurstInOneWindow_FlagsThatWindow() {
        // Given
        List<ApiMetric> metrics = new ArrayList<>();
        metrics.addAll(withFailures("search-api", "/search", Environment.AZURE, WINDOW_START,
                Duration.ofSeconds(20), 10, 0, 100.0));
        Instant burstStart = WINDOW_START.plus(Duration.ofMinutes(5));
        metrics.addAll(withFailures("search-api", "/search", Environment.AZURE, burstStart,
                Duration.ofSeconds(20), 10, 5, 100.0));

        // When
        List<Anomaly> errorPatterns = analyzer.detectAnomalies(metrics).stream()
                .filter(a -> Anomaly.ERROR_RATE_PATTERN.equals(a.getType()))
                .collect(Collectors.toList());

        // Then
        assertEquals(1, errorPatterns.size());
        Anomaly anomaly = errorPatterns.get(0);
        assertEquals(0.5, anomaly.getMetricValue(), 1e-9);
        assertEquals(0.9, anomaly.getSeverity(), 1e-9);
        assertEquals(0.05, anomaly.getExpectedValue(), 1e-9);
        assertEquals(0.1, anomaly.getThreshold(), 1e-9);
        assertEquals(burstStart, anomaly.getTimestamp());
        assertEquals(5, anomaly.getContext().get("error_count"));
    }

    @Test
    void detectAnomalies_TooFewPoints_ReturnsEmpty() {
        List<ApiMetric> metrics = withFailures("search-api", "/search", Environment.AZURE, WINDOW_START,
                Duration.ofSeconds(20), 19, 19, 100.0);

        assertTrue(analyzer.detectAnomalies(metrics).isEmpty());
    }

    @Test
    void predictIssues_AlwaysEmpty() {
        List<ApiMetric> metrics = withFailures("search-api", "/search", Environment.AZURE, WINDOW_START,
                Duration.ofSeconds(20), 30, 10, 100.0);

        assertTrue(analyzer.predictIssues(metrics).isEmpty());
    }
}
