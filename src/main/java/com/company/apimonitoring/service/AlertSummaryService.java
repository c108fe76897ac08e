package com.company.apimonitoring.service;

import com.company.apimonitoring.domain.Alert;
import com.company.apimonitoring.domain.enums.AlertSeverity;
import com.company.apimonitoring.domain.enums.Environment;
import com.company.apimonitoring.dto.response.AlertSummaryResponse;
import com.company.apimonitoring.dto.response.ApiAlertCount;
import com.company.apimonitoring.repository.AnomalyRepository;
import com.company.apimonitoring.repository.PredictionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

/**
 * Dashboard read model: counts over active alerts, recent anomalies and upcoming predictions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertSummaryService {

    public static final String CACHE_NAME = "alertSummary";

    static final Duration RECENT_ANOMALY_WINDOW = Duration.ofHours(1);
    static final Duration PREDICTION_HORIZON = Duration.ofHours(24);
    static final double MIN_PREDICTION_CONFIDENCE = 0.7;
    static final int TOP_API_LIMIT = 5;

    private final AlertManager alertManager;
    private final AnomalyRepository anomalyRepository;
    private final PredictionRepository predictionRepository;
    private final Clock clock;

    @Cacheable(value = CACHE_NAME,
            key = "(#apiId ?: 'all') + '-' + (#environment != null ? #environment.value : 'all')")
    public AlertSummaryResponse getSummary(String apiId, Environment environment) {
        Instant now = clock.instant();
        List<Alert> active = alertManager.getActiveAlerts(apiId, environment);

        Map<String, Long> bySeverity = new LinkedHashMap<>();
        for (AlertSeverity severity : new AlertSeverity[]{
                AlertSeverity.CRITICAL, AlertSeverity.HIGH, AlertSeverity.MEDIUM, AlertSeverity.LOW}) {
            bySeverity.put(severity.getValue(), 0L);
        }
        Map<String, Long> byApi = new HashMap<>();
        TreeSet<String> environments = new TreeSet<>();
        for (Alert alert : active) {
            if (alert.getSeverity() != null) {
                bySeverity.merge(alert.getSeverity().getValue(), 1L, Long::sum);
            }
            alert.getApis().forEach(api -> byApi.merge(api, 1L, Long::sum));
            alert.getEnvironments().forEach(env -> environments.add(env.getValue()));
        }

        List<ApiAlertCount> topApis = byApi.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_API_LIMIT)
                .map(e -> ApiAlertCount.builder().apiId(e.getKey()).alertCount(e.getValue()).build())
                .collect(Collectors.toList());

        long recentAnomalies = countOrZero("Anomaly",
                () -> anomalyRepository.countSince(now.minus(RECENT_ANOMALY_WINDOW), apiId, environment));
        long predictions = countOrZero("Prediction", () -> predictionRepository.countUpcoming(
                now, now.plus(PREDICTION_HORIZON), MIN_PREDICTION_CONFIDENCE, apiId, environment));

        log.debug("Built alert summary for api={} environment={}: {} active alerts", apiId, environment, active.size());

        return AlertSummaryResponse.builder()
                .activeAlertsCount(active.size())
                .criticalAlertsCount(bySeverity.get(AlertSeverity.CRITICAL.getValue()))
                .highAlertsCount(bySeverity.get(AlertSeverity.HIGH.getValue()))
                .alertsBySeverity(bySeverity)
                .recentAnomaliesCount(recentAnomalies)
                .predictionsCount(predictions)
                .environments(new ArrayList<>(environments))
                .topAffectedApis(topApis)
                .generatedAt(now)
                .build();
    }

    private static long countOrZero(String store, LongSupplier count) {
        try {
            return count.getAsLong();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            log.warn("{} storage unavailable, reporting zero in summary: {}", store, e.getMessage());
            return 0L;
        }
    }
}
