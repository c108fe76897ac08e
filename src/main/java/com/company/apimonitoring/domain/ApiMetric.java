package com.company.apimonitoring.domain;

import com.company.apimonitoring.domain.enums.Environment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One observed call against a monitored endpoint.
 * responseTime is absent when the call failed before a response arrived.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiMetric {
    private String id;
    private String apiId;
    private String endpoint;
    private String method;
    private Environment environment;
    private Instant timestamp;
    private Double responseTime;
    private Integer statusCode;
    private boolean success;
    private String errorMessage;

    public boolean isError() {
        return !success;
    }

    public boolean hasResponseTime() {
        return responseTime != null;
    }
}
