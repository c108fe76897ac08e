package com.company.apimonitoring.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Environment {
    ON_PREMISES("on-premises", 1),
    AWS("aws", 2),
    AZURE("azure", 2),
    GCP("gcp", 2),
    OTHER("other", 3);

    private final String value;
    private final int topologyStage;

    Environment(String value, int topologyStage) {
        this.value = value;
        this.topologyStage = topologyStage;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Position in the deployment topology: on-premises first, any single cloud next,
     * everything else (multi-cloud, unknown) last.
     */
    public int getTopologyStage() {
        return topologyStage;
    }

    /**
     * Stored rows may carry tags from older collectors; anything unrecognised maps to OTHER.
     */
    @JsonCreator
    public static Environment fromString(String environment) {
        if (environment == null) {
            return OTHER;
        }
        String normalized = environment.trim().toLowerCase(Locale.ROOT);
        for (Environment candidate : values()) {
            if (candidate.value.equals(normalized) || candidate.name().equalsIgnoreCase(normalized)) {
                return candidate;
            }
        }
        return OTHER;
    }

    @Override
    public String toString() {
        return value;
    }
}
