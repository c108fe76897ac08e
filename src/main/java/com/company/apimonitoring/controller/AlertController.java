package com.company.apimonitoring.controller;

import com.company.apimonitoring.domain.Alert;
import com.company.apimonitoring.domain.enums.Environment;
import com.company.apimonitoring.dto.response.AlertSummaryResponse;
import com.company.apimonitoring.service.AlertManager;
import com.company.apimonitoring.service.AlertSummaryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Query alerts and drive their lifecycle")
@RequiredArgsConstructor
@Validated
@Slf4j
public class AlertController {

    private static final String DEFAULT_ACTOR = "api";
    private static final int MAX_ACTOR_LENGTH = 128;

    private final AlertManager alertManager;
    private final AlertSummaryService summaryService;
    private final MeterRegistry meterRegistry;

    @GetMapping("/active")
    @Operation(summary = "List open and acknowledged alerts", description = "Newest first, optionally filtered")
    public ResponseEntity<List<Alert>> getActiveAlerts(
            @RequestParam(required = false) String apiId,
            @Parameter(description = "on-premises, aws, azure, gcp or other")
            @RequestParam(required = false) String environment) {

        meterRegistry.counter("api.alerts.active.requests").increment();
        return ResponseEntity.ok(alertManager.getActiveAlerts(apiId, parseEnvironment(environment)));
    }

    @GetMapping("/summary")
    @Operation(
            summary = "Dashboard summary",
            description = "Active alert counts by severity, recent anomalies, upcoming predictions, top affected apis"
    )
    public ResponseEntity<AlertSummaryResponse> getSummary(
            @RequestParam(required = false) String apiId,
            @RequestParam(required = false) String environment) {

        meterRegistry.counter("api.alerts.summary.requests").increment();
        AlertSummaryResponse response = summaryService.getSummary(apiId, parseEnvironment(environment));

        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(30, TimeUnit.SECONDS).cachePrivate())
                .body(response);
    }

    @GetMapping("/{alertId}")
    @Operation(summary = "Get a single alert")
    public ResponseEntity<Alert> getAlert(@PathVariable String alertId) {
        return ResponseEntity.ok(alertManager.getAlert(alertId));
    }

    @PostMapping("/{alertId}/acknowledge")
    @Operation(summary = "Acknowledge an open or snoozed alert")
    public ResponseEntity<?> acknowledge(
            @PathVariable String alertId,
            @RequestParam(defaultValue = DEFAULT_ACTOR) @Size(min = 1, max = MAX_ACTOR_LENGTH) String user) {

        return toResponse(alertManager.acknowledge(alertId, user));
    }

    @PostMapping("/{alertId}/resolve")
    @Operation(summary = "Resolve an alert", description = "Resolved is terminal")
    public ResponseEntity<?> resolve(
            @PathVariable String alertId,
            @RequestParam(defaultValue = DEFAULT_ACTOR) @Size(min = 1, max = MAX_ACTOR_LENGTH) String user) {

        return toResponse(alertManager.resolve(alertId, user));
    }

    @PostMapping("/{alertId}/snooze")
    @Operation(
            summary = "Snooze an open alert",
            description = "Stores snooze_until = now + duration; the alert leaves the active list immediately"
    )
    public ResponseEntity<?> snooze(
            @PathVariable String alertId,
            @RequestParam long durationMinutes,
            @RequestParam(defaultValue = DEFAULT_ACTOR) @Size(min = 1, max = MAX_ACTOR_LENGTH) String user) {

        return toResponse(alertManager.snooze(alertId, Duration.ofMinutes(durationMinutes), user));
    }

    // Empty means storage was unavailable and nothing changed
    private ResponseEntity<?> toResponse(Optional<Alert> result) {
        if (result.isPresent()) {
            return ResponseEntity.ok(result.get());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("status", "deferred"));
    }

    private static Environment parseEnvironment(String environment) {
        return environment == null || environment.isBlank() ? null : Environment.fromString(environment);
    }
}
