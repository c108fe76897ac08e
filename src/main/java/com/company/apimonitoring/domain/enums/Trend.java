package com.company.apimonitoring.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Trend {
    INCREASING,
    DECREASING,
    STABLE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Trend fromString(String trend) {
        if (trend == null) {
            return STABLE;
        }
        try {
            return Trend.valueOf(trend.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return STABLE;
        }
    }
}
