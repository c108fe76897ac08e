package com.company.apimonitoring.service;

import com.company.apimonitoring.alerting.AlertFixtures;
import com.company.apimonitoring.domain.Alert;
import com.company.apimonitoring.domain.enums.AlertSeverity;
import com.company.apimonitoring.domain.enums.AlertStatus;
import com.company.apimonitoring.domain.enums.Environment;
import com.company.apimonitoring.dto.response.AlertSummaryResponse;
import com.company.apimonitoring.repository.AnomalyRepository;
import com.company.apimonitoring.repository.PredictionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertSummaryServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");

    @Mock
    private AlertManager alertManager;

    @Mock
    private AnomalyRepository anomalyRepository;

    @Mock
    private PredictionRepository predictionRepository;

    private AlertSummaryService summaryService;

    @BeforeEach
    void setUp() {
        summaryService = new AlertSummaryService(alertManager, anomalyRepository, predictionRepository,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void getSummary_CountsActiveAlertsBySeverityAndApi() {
        // Given
        Alert critical = AlertFixtures.alert("a1", AlertSeverity.CRITICAL, AlertStatus.OPEN);
        Alert high = AlertFixtures.alert("a2", AlertSeverity.HIGH, AlertStatus.ACKNOWLEDGED);
        Alert medium = AlertFixtures.alert("a3", AlertSeverity.MEDIUM, AlertStatus.OPEN).toBuilder()
                .apis(new ArrayList<>(List.of("orders")))
                .environments(new ArrayList<>(List.of(Environment.GCP)))
                .build();
        when(alertManager.getActiveAlerts(null, null)).thenReturn(List.of(critical, high, medium));
        when(anomalyRepository.countSince(eq(NOW.minus(Duration.ofHours(1))), isNull(), isNull())).thenReturn(4L);
        when(predictionRepository.countUpcoming(eq(NOW), eq(NOW.plus(Duration.ofHours(24))), eq(0.7),
                isNull(), isNull())).thenReturn(2L);

        // When
        AlertSummaryResponse summary = summaryService.getSummary(null, null);

        // Then
        assertEquals(3, summary.getActiveAlertsCount());
        assertEquals(1, summary.getCriticalAlertsCount());
        assertEquals(1, summary.getHighAlertsCount());
        assertEquals(0L, summary.getAlertsBySeverity().get("low"));
        assertEquals(List.of("critical", "high", "medium", "low"), new ArrayList<>(summary.getAlertsBySeverity().keySet()));
        assertEquals(List.of("aws", "gcp"), summary.getEnvironments());
        assertEquals("payments", summary.getTopAffectedApis().get(0).getApiId());
        assertEquals(2, summary.getTopAffectedApis().get(0).getAlertCount());
        assertEquals(4, summary.getRecentAnomaliesCount());
        assertEquals(2, summary.getPredictionsCount());
        assertEquals(NOW, summary.getGeneratedAt());
    }

    @Test
    void getSummary_TopApisLimitedToFive() {
        // Given
        List<Alert> alerts = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            alerts.add(AlertFixtures.alert("a" + i, AlertSeverity.LOW, AlertStatus.OPEN).toBuilder()
                    .apis(new ArrayList<>(List.of("api-" + i)))
                    .build());
        }
        when(alertManager.getActiveAlerts("api-0", Environment.AWS)).thenReturn(alerts);

        // When
        AlertSummaryResponse summary = summaryService.getSummary("api-0", Environment.AWS);

        // Then
        assertEquals(5, summary.getTopAffectedApis().size());
        assertEquals("api-0", summary.getTopAffectedApis().get(0).getApiId());
        verify(anomalyRepository).countSince(any(), eq("api-0"), eq(Environment.AWS));
    }

    @Test
    void getSummary_CountStoresUnavailable_ReportsZeroCounts() {
        // Given
        when(alertManager.getActiveAlerts(null, null))
                .thenReturn(List.of(AlertFixtures.alert("a1", AlertSeverity.HIGH, AlertStatus.OPEN)));
        when(anomalyRepository.countSince(any(), isNull(), isNull()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        when(predictionRepository.countUpcoming(any(), any(), anyDouble(), isNull(), isNull()))
                .thenThrow(new QueryTimeoutException("timed out"));

        // When
        AlertSummaryResponse summary = summaryService.getSummary(null, null);

        // Then
        assertEquals(1, summary.getActiveAlertsCount());
        assertEquals(0L, summary.getRecentAnomaliesCount());
        assertEquals(0L, summary.getPredictionsCount());
    }

    @Test
    void getSummary_CountQueryBroken_Propagates() {
        // Given
        when(alertManager.getActiveAlerts(null, null)).thenReturn(List.of());
        when(anomalyRepository.countSince(any(), isNull(), isNull()))
                .thenThrow(new BadSqlGrammarException("count", "SELECT", new SQLException("no such column")));

        // When / Then
        assertThrows(BadSqlGrammarException.class, () -> summaryService.getSummary(null, null));
    }
}
