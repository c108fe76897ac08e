package com.company.apimonitoring.exception;

/**
 * Generic failure of a lifecycle operation. The message is safe to return to callers;
 * the cause stays in the logs.
 */
public class AlertOperationException extends RuntimeException {
    public AlertOperationException(String operation, String alertId, Throwable cause) {
        super("Failed to " + operation + " alert " + alertId, cause);
    }
}
