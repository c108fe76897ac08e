package com.company.apimonitoring.service;

import com.company.apimonitoring.analysis.Analyzer;
import com.company.apimonitoring.analysis.AnalyzerFactory;
import com.company.apimonitoring.domain.Anomaly;
import com.company.apimonitoring.domain.ApiMetric;
import com.company.apimonitoring.domain.ApiSource;
import com.company.apimonitoring.domain.Prediction;
import com.company.apimonitoring.repository.AnomalyRepository;
import com.company.apimonitoring.repository.ApiMetricRepository;
import com.company.apimonitoring.repository.ApiSourceRepository;
import com.company.apimonitoring.repository.PredictionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Owns the analyzer set and runs one detection cycle per tick.
 * <p>
 * Each cycle reconciles the per-API analyzers with the stored API sources, then runs every
 * (API, analyzer) pair and every global analyzer concurrently over the trailing window.
 * A failing pair is logged and counted; it never aborts the cycle.
 */
@Service
@Slf4j
public class AnalysisScheduler {

    private final ApiSourceRepository sourceRepository;
    private final ApiMetricRepository metricRepository;
    private final AnomalyRepository anomalyRepository;
    private final PredictionRepository predictionRepository;
    private final AnalyzerFactory analyzerFactory;
    private final Executor analysisExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, List<Analyzer>> apiAnalyzers = new ConcurrentHashMap<>();
    private final List<Analyzer> globalAnalyzers;
    private final Set<CompletableFuture<Integer>> inFlight = ConcurrentHashMap.newKeySet();

    private volatile Instant lastConfigCheck;
    private volatile boolean shuttingDown;

    @Value("${apimonitoring.analysis.window-seconds:3600}")
    private long windowSeconds = 3600;

    @Value("${apimonitoring.analysis.cycle-timeout-seconds:120}")
    private long cycleTimeoutSeconds = 120;

    @Value("${apimonitoring.analysis.metric-limit:10000}")
    private int metricLimit = 10000;

    public AnalysisScheduler(ApiSourceRepository sourceRepository,
                             ApiMetricRepository metricRepository,
                             AnomalyRepository anomalyRepository,
                             PredictionRepository predictionRepository,
                             AnalyzerFactory analyzerFactory,
                             @Qualifier("analysisExecutor") Executor analysisExecutor,
                             MeterRegistry meterRegistry,
                             Clock clock) {
        this.sourceRepository = sourceRepository;
        this.metricRepository = metricRepository;
        this.anomalyRepository = anomalyRepository;
        this.predictionRepository = predictionRepository;
        this.analyzerFactory = analyzerFactory;
        this.analysisExecutor = analysisExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.globalAnalyzers = analyzerFactory.createGlobalAnalyzers();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadAnalyzers() {
        reconcileAnalyzers();
        log.info("Analysis scheduler started with {} monitored apis and {} global analyzers",
                apiAnalyzers.size(), globalAnalyzers.size());
    }

    /**
     * Runs one cycle: reconcile, fan out, wait up to the cycle timeout.
     *
     * @return anomalies stored by the pairs that finished in time
     */
    public int runCycle() {
        if (shuttingDown) {
            log.debug("Shutting down, analysis cycle skipped");
            return 0;
        }
        Instant startTime = clock.instant();
        MDC.put("cycleId", UUID.randomUUID().toString().substring(0, 8));
        try {
            reconcileAnalyzers();

            Instant end = clock.instant();
            Instant start = end.minus(Duration.ofSeconds(windowSeconds));

            List<CompletableFuture<Integer>> tasks = new ArrayList<>();
            for (Map.Entry<String, List<Analyzer>> entry : apiAnalyzers.entrySet()) {
                for (Analyzer analyzer : entry.getValue()) {
                    tasks.add(submit(entry.getKey(), analyzer, start, end));
                }
            }
            for (Analyzer analyzer : globalAnalyzers) {
                tasks.add(submit(null, analyzer, start, end));
            }

            awaitAll(tasks);

            int stored = tasks.stream()
                    .filter(task -> task.isDone() && !task.isCompletedExceptionally())
                    .mapToInt(CompletableFuture::join)
                    .sum();

            Duration executionTime = Duration.between(startTime, clock.instant());
            log.info("Analysis cycle completed: {} tasks over {} apis, {} anomalies stored in {}ms",
                    tasks.size(), apiAnalyzers.size(), stored, executionTime.toMillis());
            meterRegistry.counter("apimonitoring.analysis.cycles").increment();
            meterRegistry.timer("apimonitoring.analysis.duration").record(executionTime);
            return stored;

        } catch (Exception e) {
            log.error("Analysis cycle failed", e);
            return 0;
        } finally {
            MDC.remove("cycleId");
        }
    }

    /**
     * Adds analyzers for new sources, pushes config to changed ones and drops removed ones.
     * Storage failures leave the current analyzer set untouched.
     */
    void reconcileAnalyzers() {
        Instant checkTime = clock.instant();
        List<ApiSource> active;
        try {
            active = sourceRepository.findActive();
        } catch (DataAccessException e) {
            log.warn("Failed to load api sources, keeping {} analyzer sets: {}", apiAnalyzers.size(), e.getMessage());
            return;
        }

        Set<String> activeIds = new HashSet<>();
        for (ApiSource source : active) {
            activeIds.add(source.getId());
            apiAnalyzers.computeIfAbsent(source.getId(), id -> {
                log.info("Creating analyzers for api {}", id);
                return analyzerFactory.createApiAnalyzers(source);
            });
        }

        for (String apiId : new ArrayList<>(apiAnalyzers.keySet())) {
            if (!activeIds.contains(apiId)) {
                List<Analyzer> removed = apiAnalyzers.remove(apiId);
                if (removed != null) {
                    removed.forEach(Analyzer::cleanup);
                    log.info("Removed analyzers for api {}", apiId);
                }
            }
        }

        if (lastConfigCheck != null) {
            try {
                for (ApiSource source : sourceRepository.findUpdatedSince(lastConfigCheck)) {
                    List<Analyzer> analyzers = apiAnalyzers.get(source.getId());
                    if (analyzers != null) {
                        analyzers.forEach(analyzer -> analyzer.updateConfig(source));
                    }
                }
            } catch (DataAccessException e) {
                log.warn("Failed to load updated api sources: {}", e.getMessage());
                return;
            }
        }
        lastConfigCheck = checkTime;
    }

    private CompletableFuture<Integer> submit(String apiId, Analyzer analyzer, Instant start, Instant end) {
        String cycleId = MDC.get("cycleId");
        CompletableFuture<Integer> task = CompletableFuture.supplyAsync(() -> {
            if (cycleId != null) {
                MDC.put("cycleId", cycleId);
            }
            try {
                return analyze(apiId, analyzer, start, end);
            } finally {
                MDC.remove("cycleId");
            }
        }, analysisExecutor);
        inFlight.add(task);
        task.whenComplete((result, error) -> inFlight.remove(task));
        return task;
    }

    private int analyze(String apiId, Analyzer analyzer, Instant start, Instant end) {
        String label = apiId != null ? apiId : "global";
        try {
            List<ApiMetric> metrics = metricRepository.findMetrics(apiId, start, end, null, null, null, metricLimit);

            List<Anomaly> anomalies = analyzer.detectAnomalies(metrics);
            List<Prediction> predictions = analyzer.predictIssues(metrics);

            if (!anomalies.isEmpty()) {
                anomalyRepository.saveAll(anomalies);
                meterRegistry.counter("apimonitoring.anomalies.detected", "analyzer", analyzer.getName())
                        .increment(anomalies.size());
                log.info("{} detected {} anomalies for {}", analyzer.getName(), anomalies.size(), label);
            }
            if (!predictions.isEmpty()) {
                predictionRepository.saveAll(predictions);
                meterRegistry.counter("apimonitoring.predictions.generated", "analyzer", analyzer.getName())
                        .increment(predictions.size());
                log.info("{} generated {} predictions for {}", analyzer.getName(), predictions.size(), label);
            }
            return anomalies.size();

        } catch (DataAccessException e) {
            log.warn("{} skipped for {}, storage unavailable: {}", analyzer.getName(), label, e.getMessage());
            meterRegistry.counter("apimonitoring.analysis.failures", "analyzer", analyzer.getName()).increment();
            return 0;
        } catch (Exception e) {
            log.error("{} failed for {}", analyzer.getName(), label, e);
            meterRegistry.counter("apimonitoring.analysis.failures", "analyzer", analyzer.getName()).increment();
            return 0;
        }
    }

    private void awaitAll(List<CompletableFuture<Integer>> tasks) {
        if (tasks.isEmpty()) {
            return;
        }
        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]))
                    .get(cycleTimeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            long pending = tasks.stream().filter(task -> !task.isDone()).count();
            log.warn("Analysis cycle timed out after {}s with {} tasks still running", cycleTimeoutSeconds, pending);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for analysis tasks");
        } catch (ExecutionException e) {
            log.error("Unexpected analysis task failure", e.getCause());
        }
    }

    public int getActiveAnalyzerCount() {
        return apiAnalyzers.values().stream().mapToInt(List::size).sum();
    }

    Set<String> monitoredApiIds() {
        return apiAnalyzers.keySet().stream().collect(Collectors.toSet());
    }

    List<Analyzer> analyzersFor(String apiId) {
        return apiAnalyzers.get(apiId);
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        List<CompletableFuture<Integer>> pending = new ArrayList<>(inFlight);
        if (!pending.isEmpty()) {
            log.info("Waiting for {} analysis tasks before shutdown", pending.size());
            try {
                CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                        .get(cycleTimeoutSeconds, TimeUnit.SECONDS);
            } catch (TimeoutException | ExecutionException e) {
                log.warn("Analysis tasks did not drain cleanly: {}", e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        apiAnalyzers.values().forEach(analyzers -> analyzers.forEach(Analyzer::cleanup));
        globalAnalyzers.forEach(Analyzer::cleanup);
        apiAnalyzers.clear();
        log.info("Analysis scheduler stopped");
    }
}
