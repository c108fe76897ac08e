package com.company.apimonitoring.service;

import com.company.apimonitoring.alerting.AlertGenerator;
import com.company.apimonitoring.alerting.NotificationDedupCache;
import com.company.apimonitoring.alerting.channel.NotificationChannel;
import com.company.apimonitoring.domain.Alert;
import com.company.apimonitoring.domain.Anomaly;
import com.company.apimonitoring.domain.enums.AlertStatus;
import com.company.apimonitoring.domain.enums.Environment;
import com.company.apimonitoring.event.AlertsChangedEvent;
import com.company.apimonitoring.exception.AlertNotFoundException;
import com.company.apimonitoring.exception.AlertOperationException;
import com.company.apimonitoring.exception.InvalidAlertTransitionException;
import com.company.apimonitoring.exception.InvalidSnoozeDurationException;
import com.company.apimonitoring.repository.AlertRepository;
import com.company.apimonitoring.repository.AnomalyRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/**
 * Owns the alerting cycle and every status change of a stored alert.
 * <p>
 * Cycle: unprocessed anomalies are grouped by (api id, type), turned into alerts, stored,
 * and only then marked processed. High and critical alerts not yet in the dedup cache are
 * pushed to every channel in parallel; one failing channel does not affect the others.
 * <p>
 * When storage is unreachable the cycle is skipped and lifecycle operations return an
 * empty result instead of failing.
 */
@Service
@Slf4j
public class AlertManager {

    private static final String SYSTEM_ACTOR = "system";

    private final AlertRepository alertRepository;
    private final AnomalyRepository anomalyRepository;
    private final AlertGenerator alertGenerator;
    private final List<NotificationChannel> channels;
    private final Executor notificationExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;
    private final Clock clock;
    private final NotificationDedupCache dedupCache = new NotificationDedupCache();

    @Value("${apimonitoring.alerting.batch-size:1000}")
    private int batchSize = 1000;

    @Value("${apimonitoring.alerting.active-limit:1000}")
    private int activeLimit = 1000;

    @Value("${apimonitoring.alerting.notification-timeout-seconds:30}")
    private long notificationTimeoutSeconds = 30;

    public AlertManager(AlertRepository alertRepository,
                        AnomalyRepository anomalyRepository,
                        AlertGenerator alertGenerator,
                        List<NotificationChannel> channels,
                        @Qualifier("notificationExecutor") Executor notificationExecutor,
                        ApplicationEventPublisher eventPublisher,
                        MeterRegistry meterRegistry,
                        Tracer tracer,
                        Clock clock) {
        this.alertRepository = alertRepository;
        this.anomalyRepository = anomalyRepository;
        this.alertGenerator = alertGenerator;
        this.channels = List.copyOf(channels);
        this.notificationExecutor = notificationExecutor;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.tracer = tracer;
        this.clock = clock;
        log.info("Alert manager initialized with channels {}",
                this.channels.stream().map(NotificationChannel::getName).collect(Collectors.toList()));
    }

    /**
     * Runs one alerting cycle.
     *
     * @return the alerts generated in this cycle
     */
    public List<Alert> processPendingAnomalies() {
        List<Anomaly> pending;
        try {
            pending = anomalyRepository.findUnprocessed(batchSize);
        } catch (DataAccessException e) {
            log.warn("Anomaly storage unavailable, skipping alerting cycle: {}", e.getMessage());
            return Collections.emptyList();
        }
        if (pending.isEmpty()) {
            log.debug("No unprocessed anomalies");
            return Collections.emptyList();
        }

        Map<String, List<Anomaly>> grouped = groupAnomalies(pending);
        List<Alert> alerts = alertGenerator.generateAlerts(grouped);

        try {
            alertRepository.saveAll(alerts);
            anomalyRepository.markProcessed(pending.stream().map(Anomaly::getId).collect(Collectors.toList()));
        } catch (DataAccessException e) {
            log.warn("Failed to store {} alerts, anomalies stay pending: {}", alerts.size(), e.getMessage());
            return Collections.emptyList();
        }

        alerts.forEach(alert -> meterRegistry.counter("apimonitoring.alerts.created",
                "severity", alert.getSeverity().getValue()).increment());
        eventPublisher.publishEvent(new AlertsChangedEvent(
                alerts.stream().map(Alert::getId).collect(Collectors.toList()), "creation"));
        log.info("Generated {} alerts from {} anomalies in {} groups", alerts.size(), pending.size(), grouped.size());

        for (Alert alert : alerts) {
            if (alert.getSeverity().isNotifiable()) {
                notifyOnce(alert);
            }
        }
        return alerts;
    }

    static Map<String, List<Anomaly>> groupAnomalies(List<Anomaly> anomalies) {
        Map<String, List<Anomaly>> grouped = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            grouped.computeIfAbsent(AlertGenerator.groupKey(anomaly), k -> new ArrayList<>()).add(anomaly);
        }
        return grouped;
    }

    /**
     * Sends the alert to every channel unless it was already sent during this run.
     *
     * @return number of channels that accepted the alert; 0 when skipped as a duplicate
     */
    public int notifyOnce(Alert alert) {
        if (!dedupCache.markNotified(alert.getId())) {
            log.debug("Alert {} already notified, skipping", alert.getId());
            return 0;
        }
        if (channels.isEmpty()) {
            log.debug("No notification channels configured for alert {}", alert.getId());
            return 0;
        }

        List<CompletableFuture<Boolean>> deliveries = channels.stream()
                .map(channel -> CompletableFuture.supplyAsync(() -> deliver(channel, alert), notificationExecutor))
                .collect(Collectors.toList());
        try {
            CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0]))
                    .get(notificationTimeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Notification of alert {} did not finish within {}s", alert.getId(), notificationTimeoutSeconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while notifying alert {}", alert.getId());
        } catch (ExecutionException e) {
            log.error("Unexpected notification failure for alert {}", alert.getId(), e.getCause());
        }

        int delivered = 0;
        for (CompletableFuture<Boolean> delivery : deliveries) {
            if (delivery.isDone() && !delivery.isCompletedExceptionally() && Boolean.TRUE.equals(delivery.join())) {
                delivered++;
            }
        }
        log.info("Alert {} delivered to {}/{} channels", alert.getId(), delivered, channels.size());
        return delivered;
    }

    private boolean deliver(NotificationChannel channel, Alert alert) {
        Span span = tracer.spanBuilder("alert.notification")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("alert.id", alert.getId());
            span.setAttribute("alert.severity", alert.getSeverity().getValue());
            span.setAttribute("notification.channel", channel.getName());

            boolean sent = channel.sendAlert(alert);
            if (sent) {
                meterRegistry.counter("apimonitoring.notifications.sent", "channel", channel.getName()).increment();
            } else {
                span.setStatus(StatusCode.ERROR, "Channel reported failure");
                meterRegistry.counter("apimonitoring.notifications.failed", "channel", channel.getName()).increment();
                log.warn("Channel {} failed to deliver alert {}", channel.getName(), alert.getId());
            }
            return sent;
        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Notification failed");
            meterRegistry.counter("apimonitoring.notifications.failed", "channel", channel.getName()).increment();
            log.error("Channel {} threw while delivering alert {}", channel.getName(), alert.getId(), e);
            return false;
        } finally {
            span.end();
        }
    }

    public Optional<Alert> acknowledge(String alertId, String actor) {
        return transition("acknowledge", alertId, actor, AlertStatus.ACKNOWLEDGED, (metadata, now) -> {
        });
    }

    public Optional<Alert> resolve(String alertId, String actor) {
        Optional<Alert> resolved = transition("resolve", alertId, actor, AlertStatus.RESOLVED, (metadata, now) -> {
        });
        resolved.ifPresent(alert -> dedupCache.remove(alertId));
        return resolved;
    }

    /**
     * Snoozes an alert until now + duration. The resume time is advisory metadata; the
     * alert leaves the active list immediately and may notify again on a new anomaly.
     */
    public Optional<Alert> snooze(String alertId, Duration duration, String actor) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new InvalidSnoozeDurationException(duration);
        }
        Optional<Alert> snoozed = transition("snooze", alertId, actor, AlertStatus.SNOOZED, (metadata, now) -> {
            metadata.put(Alert.META_SNOOZE_UNTIL, now.plus(duration).toString());
            metadata.put(Alert.META_SNOOZED_BY, actor);
            metadata.put(Alert.META_SNOOZE_DURATION_MINUTES, duration.toMinutes());
        });
        snoozed.ifPresent(alert -> dedupCache.remove(alertId));
        return snoozed;
    }

    /**
     * Moves snoozed alerts whose resume time has passed back to open.
     *
     * @return number of alerts reopened
     */
    public int resumeExpiredSnoozes() {
        List<Alert> snoozed;
        try {
            snoozed = alertRepository.findAlerts(EnumSet.of(AlertStatus.SNOOZED), null, null, null, batchSize);
        } catch (DataAccessException e) {
            log.warn("Alert storage unavailable, snooze expiry check skipped: {}", e.getMessage());
            return 0;
        }
        Instant now = clock.instant();
        int resumed = 0;
        for (Alert alert : snoozed) {
            Instant until = snoozeUntil(alert);
            if (until == null || until.isAfter(now)) {
                continue;
            }
            try {
                if (transition("resume", alert.getId(), SYSTEM_ACTOR, AlertStatus.OPEN, (metadata, ts) ->
                        metadata.put("resumed_at", ts.toString())).isPresent()) {
                    resumed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to resume snoozed alert {}", alert.getId(), e);
            }
        }
        return resumed;
    }

    public List<Alert> getActiveAlerts(String apiId, Environment environment) {
        try {
            return alertRepository.findAlerts(EnumSet.of(AlertStatus.OPEN, AlertStatus.ACKNOWLEDGED),
                    apiId, environment, null, activeLimit);
        } catch (DataAccessException e) {
            if (isStorageUnavailable(e)) {
                log.warn("Alert storage unavailable, returning no active alerts: {}", e.getMessage());
                return Collections.emptyList();
            }
            throw new AlertOperationException("list", "active", e);
        }
    }

    public Alert getAlert(String alertId) {
        try {
            return alertRepository.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
        } catch (DataAccessException e) {
            throw new AlertOperationException("read", alertId, e);
        }
    }

    int notifiedCount() {
        return dedupCache.size();
    }

    boolean wasNotified(String alertId) {
        return dedupCache.contains(alertId);
    }

    private Optional<Alert> transition(String operation, String alertId, String actor, AlertStatus target,
                                       BiConsumer<Map<String, Object>, Instant> metadataUpdate) {
        try {
            Alert alert = alertRepository.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
            if (!alert.getStatus().canTransitionTo(target)) {
                throw new InvalidAlertTransitionException(alertId, alert.getStatus(), target);
            }

            Instant now = clock.instant();
            Map<String, Object> metadata = new HashMap<>(alert.getMetadata());
            metadata.put(Alert.META_UPDATED_BY, actor);
            metadata.put("updated_at", now.toString());
            metadataUpdate.accept(metadata, now);

            Alert updated = alert.toBuilder()
                    .status(target)
                    .updatedAt(now)
                    .metadata(metadata)
                    .build();
            alertRepository.updateStatus(updated);

            eventPublisher.publishEvent(new AlertsChangedEvent(List.of(alertId), operation));
            log.info("Alert {} moved from {} to {} by {}", alertId,
                    alert.getStatus().getValue(), target.getValue(), actor);
            return Optional.of(updated);

        } catch (AlertNotFoundException | InvalidAlertTransitionException e) {
            log.warn("Cannot {} alert {}: {}", operation, alertId, e.getMessage());
            throw e;
        } catch (DataAccessException e) {
            if (isStorageUnavailable(e)) {
                log.warn("Alert storage unavailable, {} of alert {} skipped: {}", operation, alertId, e.getMessage());
                return Optional.empty();
            }
            throw new AlertOperationException(operation, alertId, e);
        } catch (RuntimeException e) {
            throw new AlertOperationException(operation, alertId, e);
        }
    }

    private static Instant snoozeUntil(Alert alert) {
        Object value = alert.getMetadata().get(Alert.META_SNOOZE_UNTIL);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            log.warn("Alert {} has unreadable snooze_until '{}'", alert.getId(), value);
            return null;
        }
    }

    private static boolean isStorageUnavailable(DataAccessException e) {
        return e instanceof DataAccessResourceFailureException || e instanceof TransientDataAccessException;
    }
}
