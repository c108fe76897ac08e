package com.company.apimonitoring.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertSummaryResponse {
    private long activeAlertsCount;
    private long criticalAlertsCount;
    private long highAlertsCount;
    private Map<String, Long> alertsBySeverity;
    private long recentAnomaliesCount;
    private long predictionsCount;
    private List<String> environments;
    private List<ApiAlertCount> topAffectedApis;
    private Instant generatedAt;
}
