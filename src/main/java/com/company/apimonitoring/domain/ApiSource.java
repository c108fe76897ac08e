package com.company.apimonitoring.domain;

import com.company.apimonitoring.domain.enums.Environment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiSource {
    private String id;
    private String name;
    private String description;
    private String baseUrl;
    private Environment environment;
    private String type;
    private boolean active;
    private Double samplingRate;
    private Integer timeoutSeconds;
    private Instant createdAt;
    private Instant updatedAt;
}
