package com.company.apimonitoring.scheduled;

import com.company.apimonitoring.domain.Alert;
import com.company.apimonitoring.service.AlertManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Turns pending anomalies into alerts and notifications.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AlertProcessingJob {

    private final AlertManager alertManager;

    @Scheduled(
            fixedDelayString = "${apimonitoring.alerting.interval-ms:60000}",
            initialDelayString = "${apimonitoring.alerting.initial-delay-ms:20000}"
    )
    public void processPendingAnomalies() {
        MDC.put("cycleId", UUID.randomUUID().toString().substring(0, 8));
        try {
            List<Alert> alerts = alertManager.processPendingAnomalies();
            if (!alerts.isEmpty()) {
                log.info("Alerting cycle produced {} alerts", alerts.size());
            }
        } catch (Exception e) {
            log.error("Alerting cycle failed", e);
        } finally {
            MDC.remove("cycleId");
        }
    }
}
