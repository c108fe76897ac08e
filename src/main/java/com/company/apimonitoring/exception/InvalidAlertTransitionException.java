package com.company.apimonitoring.exception;

import com.company.apimonitoring.domain.enums.AlertStatus;

public class InvalidAlertTransitionException extends RuntimeException {
    public InvalidAlertTransitionException(String alertId, AlertStatus from, AlertStatus to) {
        super(String.format("Alert %s cannot move from %s to %s", alertId, from.getValue(), to.getValue()));
    }
}
