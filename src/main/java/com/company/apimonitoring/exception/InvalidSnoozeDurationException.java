package com.company.apimonitoring.exception;

import java.time.Duration;

public class InvalidSnoozeDurationException extends RuntimeException {
    public InvalidSnoozeDurationException(Duration duration) {
        super("Snooze duration must be positive, got: " + duration);
    }
}
