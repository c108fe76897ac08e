package com.company.apimonitoring.domain;

import com.company.apimonitoring.domain.enums.Environment;
import com.company.apimonitoring.domain.enums.Trend;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Prediction {

    public static final String RESPONSE_TIME = "response_time";
    public static final String ERROR_RATE = "error_rate";
    public static final String CROSS_ENV_ERROR_PROPAGATION = "cross_environment_error_propagation";
    public static final String CROSS_ENV_RESPONSE_TIME_PROPAGATION = "cross_environment_response_time_propagation";

    private String id;
    private String apiId;
    private String type;
    private double confidence;
    private Instant createdAt;
    private Instant predictedFor;
    private String description;
    private double predictedValue;
    private double currentValue;
    private Trend trend;
    private Environment environment;
    @Builder.Default
    private Map<String, Object> context = new HashMap<>();
}
