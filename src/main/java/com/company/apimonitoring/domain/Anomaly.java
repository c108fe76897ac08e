package com.company.apimonitoring.domain;

import com.company.apimonitoring.domain.enums.Environment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A single detection event. Only the processed flag changes after creation,
 * and only the alert manager flips it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Anomaly {

    public static final String RESPONSE_TIME_SPIKE = "response_time_spike";
    public static final String RESPONSE_TIME_PATTERN_CHANGE = "response_time_pattern_change";
    public static final String HIGH_ERROR_RATE = "high_error_rate";
    public static final String RESPONSE_TIME_PATTERN = "response_time_pattern";
    public static final String ERROR_RATE_PATTERN = "error_rate_pattern";
    public static final String CROSS_ENV_RESPONSE_TIME = "cross_environment_response_time";
    public static final String CROSS_ENV_ERROR_RATE = "cross_environment_error_rate";
    public static final String CROSS_ENV_PROPAGATION = "cross_environment_propagation";

    private String id;
    private String apiId;
    private String type;
    private double severity;
    private Instant timestamp;
    private String description;
    private double metricValue;
    private Double expectedValue;
    private Double threshold;
    private Environment environment;
    @Builder.Default
    private Map<String, Object> context = new HashMap<>();
    @Builder.Default
    private List<String> relatedAnomalies = new ArrayList<>();
    private boolean processed;

    public String contextString(String key) {
        Object value = context != null ? context.get(key) : null;
        return value != null ? value.toString() : null;
    }
}
