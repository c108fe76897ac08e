package com.company.apimonitoring.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum AlertStatus {
    OPEN("Alert is open and awaiting attention"),
    ACKNOWLEDGED("Alert has been acknowledged by an operator"),
    SNOOZED("Alert is snoozed until its resume time"),
    RESOLVED("Alert has been resolved");

    private final String description;

    AlertStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isFinal() {
        return this == RESOLVED;
    }

    public boolean isActive() {
        return this == OPEN || this == ACKNOWLEDGED;
    }

    public Set<AlertStatus> allowedTransitions() {
        switch (this) {
            case OPEN:
                return EnumSet.of(ACKNOWLEDGED, RESOLVED, SNOOZED);
            case ACKNOWLEDGED:
                return EnumSet.of(RESOLVED);
            case SNOOZED:
                return EnumSet.of(OPEN, ACKNOWLEDGED, RESOLVED);
            default:
                return EnumSet.noneOf(AlertStatus.class);
        }
    }

    public boolean canTransitionTo(AlertStatus target) {
        return target != null && allowedTransitions().contains(target);
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertStatus fromString(String status) {
        if (status == null) {
            return OPEN;
        }
        try {
            return AlertStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OPEN;
        }
    }
}
