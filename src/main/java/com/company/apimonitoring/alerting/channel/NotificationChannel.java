package com.company.apimonitoring.alerting.channel;

import com.company.apimonitoring.domain.Alert;

/**
 * Delivery sink for alerts. Implementations report failure through the return value
 * and never throw.
 */
public interface NotificationChannel {

    String getName();

    boolean sendAlert(Alert alert);
}
