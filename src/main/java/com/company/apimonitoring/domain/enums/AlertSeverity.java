package com.company.apimonitoring.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertSeverity {
    LOW(1, 0.0, "Low severity - minor deviation"),
    MEDIUM(2, 0.4, "Medium severity - requires attention"),
    HIGH(3, 0.7, "High severity - urgent attention needed"),
    CRITICAL(4, 0.9, "Critical severity - immediate action required");

    private final int level;
    private final double lowerBound;
    private final String description;

    AlertSeverity(int level, double lowerBound, String description) {
        this.level = level;
        this.lowerBound = lowerBound;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    public boolean isHigherThan(AlertSeverity other) {
        return this.level > other.level;
    }

    /**
     * Whether alerts of this severity are pushed to notification channels.
     */
    public boolean isNotifiable() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a continuous score to its bucket. Breakpoints are inclusive, so 0.9 is critical.
     */
    public static AlertSeverity fromScore(double score) {
        if (score >= CRITICAL.lowerBound) {
            return CRITICAL;
        }
        if (score >= HIGH.lowerBound) {
            return HIGH;
        }
        if (score >= MEDIUM.lowerBound) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonCreator
    public static AlertSeverity fromString(String severity) {
        if (severity == null) {
            return MEDIUM;
        }
        try {
            return AlertSeverity.valueOf(severity.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
