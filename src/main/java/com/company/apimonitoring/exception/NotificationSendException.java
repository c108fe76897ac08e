package com.company.apimonitoring.exception;

public class NotificationSendException extends RuntimeException {
    public NotificationSendException(String channel, String alertId, String reason) {
        super("Failed to deliver alert " + alertId + " via " + channel + ": " + reason);
    }
}
