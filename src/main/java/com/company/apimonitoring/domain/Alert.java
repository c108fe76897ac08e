package com.company.apimonitoring.domain;

import com.company.apimonitoring.domain.enums.AlertSeverity;
import com.company.apimonitoring.domain.enums.AlertStatus;
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
 * User-facing incident built from one or more anomalies.
 * Severity is fixed at creation; afterwards only status and metadata change.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    public static final String META_SNOOZE_UNTIL = "snooze_until";
    public static final String META_SNOOZED_BY = "snoozed_by";
    public static final String META_SNOOZE_DURATION_MINUTES = "snooze_duration_minutes";
    public static final String META_UPDATED_BY = "updated_by";

    private String id;
    private String title;
    private String description;
    private AlertSeverity severity;
    private Instant createdAt;
    private Instant updatedAt;
    private AlertStatus status;
    @Builder.Default
    private List<String> anomalies = new ArrayList<>();
    @Builder.Default
    private List<String> apis = new ArrayList<>();
    @Builder.Default
    private List<Environment> environments = new ArrayList<>();
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
