package com.company.apimonitoring.scheduled;

import com.company.apimonitoring.service.AlertManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Optional: reopen snoozed alerts once their snooze_until has passed.
 * Off by default, snooze expiry is otherwise only recorded in metadata.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "apimonitoring.alerting.snooze-resume.enabled",
        havingValue = "true",
        matchIfMissing = false
)
public class SnoozeExpiryJob {

    private final AlertManager alertManager;

    @Scheduled(
            fixedDelayString = "${apimonitoring.alerting.snooze-resume.interval-ms:60000}",
            initialDelayString = "30000"
    )
    public void resumeExpiredSnoozes() {
        try {
            int resumed = alertManager.resumeExpiredSnoozes();
            if (resumed > 0) {
                log.info("Reopened {} alerts whose snooze expired", resumed);
            }
        } catch (Exception e) {
            log.error("Snooze expiry check failed", e);
        }
    }
}
