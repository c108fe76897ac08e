package com.company.apimonitoring.service;

import com.company.apimonitoring.analysis.Analyzer;
import com.company.apimonitoring.analysis.AnalyzerFactory;
import com.company.apimonitoring.domain.Anomaly;
import com.company.apimonitoring.domain.ApiMetric;
import com.company.apimonitoring.domain.ApiSource;
import com.company.apimonitoring.domain.enums.Environment;
import com.company.apimonitoring.repository.AnomalyRepository;
import com.company.apimonitoring.repository.ApiMetricRepository;
import com.company.apimonitoring.repository.ApiSourceRepository;
import com.company.apimonitoring.repository.PredictionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnalysisSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");

    @Mock
    private ApiSourceRepository sourceRepository;

    @Mock
    private ApiMetricRepository metricRepository;

    @Mock
    private AnomalyRepository anomalyRepository;

    @Mock
    private PredictionRepository predictionRepository;

    @Mock
    private AnalyzerFactory analyzerFactory;

    @Mock
    private Analyzer globalAnalyzer;

    @Mock
    private Analyzer paymentsAnalyzer;

    @Mock
    private Analyzer ordersAnalyzer;

    private MeterRegistry meterRegistry;
    private AnalysisScheduler scheduler;

    private final ApiSource payments = source("payments");
    private final ApiSource orders = source("orders");

    @BeforeEach
    void setUp() {
        when(analyzerFactory.createGlobalAnalyzers()).thenReturn(List.of(globalAnalyzer));
        lenient().when(globalAnalyzer.getName()).thenReturn("cross_environment");
        lenient().when(paymentsAnalyzer.getName()).thenReturn("response_time");
        lenient().when(ordersAnalyzer.getName()).thenReturn("error_rate");
        meterRegistry = new SimpleMeterRegistry();
        scheduler = new AnalysisScheduler(sourceRepository, metricRepository, anomalyRepository,
                predictionRepository, analyzerFactory, Runnable::run, meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ApiSource source(String id) {
        return ApiSource.builder()
                .id(id)
                .name(id)
                .environment(Environment.AWS)
                .type("rest")
                .active(true)
                .build();
    }

    @Test
    void reconcileAnalyzers_NewAndRemovedSources_TracksActiveSet() {
        // Given
        when(sourceRepository.findActive())
                .thenReturn(List.of(payments, orders))
                .thenReturn(List.of(payments));
        when(analyzerFactory.createApiAnalyzers(eq(payments))).thenReturn(List.of(paymentsAnalyzer));
        when(analyzerFactory.createApiAnalyzers(eq(orders))).thenReturn(List.of(ordersAnalyzer));
        when(sourceRepository.findUpdatedSince(NOW)).thenReturn(List.of());

        // When
        scheduler.reconcileAnalyzers();
        Set<String> afterFirst = scheduler.monitoredApiIds();
        scheduler.reconcileAnalyzers();

        // Then
        assertEquals(Set.of("payments", "orders"), afterFirst);
        assertEquals(Set.of("payments"), scheduler.monitoredApiIds());
        assertEquals(1, scheduler.getActiveAnalyzerCount());
        verify(ordersAnalyzer).cleanup();
        verify(paymentsAnalyzer, never()).cleanup();
        verify(analyzerFactory, times(1)).createApiAnalyzers(payments);
    }

    @Test
    void reconcileAnalyzers_UpdatedSource_PushesConfig() {
        // Given
        ApiSource updated = source("payments");
        updated.setTimeoutSeconds(5);
        when(sourceRepository.findActive()).thenReturn(List.of(payments));
        when(analyzerFactory.createApiAnalyzers(any())).thenReturn(List.of(paymentsAnalyzer));
        when(sourceRepository.findUpdatedSince(NOW)).thenReturn(List.of(updated));

        // When
        scheduler.reconcileAnalyzers();
        scheduler.reconcileAnalyzers();

        // Then
        verify(paymentsAnalyzer).updateConfig(updated);
    }

    @Test
    void reconcileAnalyzers_StorageFailure_KeepsCurrentAnalyzers() {
        // Given
        when(sourceRepository.findActive())
                .thenReturn(List.of(payments))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        when(analyzerFactory.createApiAnalyzers(any())).thenReturn(List.of(paymentsAnalyzer));

        // When
        scheduler.reconcileAnalyzers();
        scheduler.reconcileAnalyzers();

        // Then
        assertEquals(Set.of("payments"), scheduler.monitoredApiIds());
        verify(paymentsAnalyzer, never()).cleanup();
        verify(sourceRepository, never()).findUpdatedSince(any());
    }

    @Test
    void runCycle_FailingAnalyzer_DoesNotAbortOthers() {
        // Given
        Anomaly anomaly = Anomaly.builder().id("anom-1").apiId("orders").type(Anomaly.HIGH_ERROR_RATE).build();
        List<ApiMetric> metrics = List.of(ApiMetric.builder().apiId("orders").build());
        when(sourceRepository.findActive()).thenReturn(List.of(payments, orders));
        when(analyzerFactory.createApiAnalyzers(eq(payments))).thenReturn(List.of(paymentsAnalyzer));
        when(analyzerFactory.createApiAnalyzers(eq(orders))).thenReturn(List.of(ordersAnalyzer));
        when(metricRepository.findMetrics(any(), any(), any(), any(), any(), any(), anyInt())).thenReturn(metrics);
        when(paymentsAnalyzer.detectAnomalies(metrics)).thenThrow(new IllegalStateException("model blew up"));
        when(ordersAnalyzer.detectAnomalies(metrics)).thenReturn(List.of(anomaly));
        when(ordersAnalyzer.predictIssues(metrics)).thenReturn(List.of());
        when(globalAnalyzer.detectAnomalies(metrics)).thenReturn(List.of());
        when(globalAnalyzer.predictIssues(metrics)).thenReturn(List.of());

        // When
        int stored = scheduler.runCycle();

        // Then
        assertEquals(1, stored);
        verify(anomalyRepository).saveAll(List.of(anomaly));
        verify(predictionRepository, never()).saveAll(anyList());
        assertEquals(1.0, meterRegistry.counter("apimonitoring.analysis.failures", "analyzer", "response_time").count());
        assertEquals(1.0, meterRegistry.counter("apimonitoring.anomalies.detected", "analyzer", "error_rate").count());
        assertEquals(1.0, meterRegistry.counter("apimonitoring.analysis.cycles").count());
    }

    @Test
    void runCycle_MetricStorageDown_ReturnsZero() {
        // Given
        when(sourceRepository.findActive()).thenReturn(List.of(payments));
        when(analyzerFactory.createApiAnalyzers(any())).thenReturn(List.of(paymentsAnalyzer));
        when(metricRepository.findMetrics(any(), any(), any(), any(), any(), any(), anyInt()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When
        int stored = scheduler.runCycle();

        // Then
        assertEquals(0, stored);
        verifyNoInteractions(anomalyRepository);
        assertEquals(1.0, meterRegistry.counter("apimonitoring.analysis.failures", "analyzer", "cross_environment").count());
    }

    @Test
    void shutdown_CleansUpAndSkipsLaterCycles() {
        // Given
        when(sourceRepository.findActive()).thenReturn(List.of(payments));
        when(analyzerFactory.createApiAnalyzers(any())).thenReturn(List.of(paymentsAnalyzer));
        scheduler.reconcileAnalyzers();

        // When
        scheduler.shutdown();
        int stored = scheduler.runCycle();

        // Then
        assertEquals(0, stored);
        verify(paymentsAnalyzer).cleanup();
        verify(globalAnalyzer).cleanup();
        assertEquals(0, scheduler.getActiveAnalyzerCount());
        verify(sourceRepository, times(1)).findActive();
    }
}
