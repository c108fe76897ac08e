package com.company.apimonitoring.alerting.channel;

import com.company.apimonitoring.domain.Alert;
import com.company.apimonitoring.domain.enums.AlertSeverity;
import com.company.apimonitoring.exception.NotificationSendException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Chat-style incoming webhook. One JSON POST per alert; any 2xx answer is a delivery.
 */
@Slf4j
public class WebhookNotificationChannel implements NotificationChannel {

    public static final String NAME = "webhook";

    private static final DateTimeFormatter CREATED_AT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final RestTemplate restTemplate;
    private final String webhookUrl;
    private final CircuitBreaker circuitBreaker;

    public WebhookNotificationChannel(RestTemplate restTemplate, String webhookUrl, CircuitBreaker circuitBreaker) {
        this.restTemplate = restTemplate;
        this.webhookUrl = webhookUrl;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean sendAlert(Alert alert) {
        try {
            circuitBreaker.executeRunnable(() -> post(alert));
            log.info("Sent alert {} to {}", alert.getId(), NAME);
            return true;
        } catch (CallNotPermittedException e) {
            log.error("Circuit open, alert {} not sent to {}", alert.getId(), NAME);
            return false;
        } catch (NotificationSendException | RestClientException e) {
            log.error("Failed to send alert {} to {}: {}", alert.getId(), NAME, e.getMessage());
            return false;
        }
    }

    private void post(Alert alert) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> response = restTemplate.postForEntity(
                webhookUrl, new HttpEntity<>(formatAlert(alert), headers), String.class);
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new NotificationSendException(NAME, alert.getId(),
                    "unexpected status " + response.getStatusCode().value());
        }
    }

    Map<String, Object> formatAlert(Alert alert) {
        String severity = alert.getSeverity() != null ? alert.getSeverity().getValue() : "unknown";
        String status = alert.getStatus() != null ? alert.getStatus().getValue() : "unknown";

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", severityColor(alert.getSeverity()));
        attachment.put("title", "API Alert: " + alert.getTitle());
        attachment.put("title_link", "/alerts/" + alert.getId());
        attachment.put("text", alert.getDescription());
        attachment.put("fields", List.of(
                field("Severity", severity, true),
                field("Status", status, true),
                field("API", String.join(", ", alert.getApis()), true),
                field("Environment", joinEnvironments(alert), true),
                field("Created At", alert.getCreatedAt() != null ? CREATED_AT_FORMAT.format(alert.getCreatedAt()) : "", false)
        ));
        attachment.put("footer", "API Monitoring Service");
        if (alert.getCreatedAt() != null) {
            attachment.put("ts", alert.getCreatedAt().getEpochSecond());
        }

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("text", "*" + severity.toUpperCase(Locale.ROOT) + " Alert*: " + alert.getTitle());
        message.put("attachments", List.of(attachment));
        return message;
    }

    static String severityColor(AlertSeverity severity) {
        if (severity == null) {
            return "#808080";
        }
        switch (severity) {
            case CRITICAL:
                return "#FF0000";
            case HIGH:
                return "#FFA500";
            case MEDIUM:
                return "#FFFF00";
            default:
                return "#00FF00";
        }
    }

    private static Map<String, Object> field(String title, String value, boolean shortField) {
        Map<String, Object> field = new HashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", shortField);
        return field;
    }

    private static String joinEnvironments(Alert alert) {
        StringBuilder sb = new StringBuilder();
        alert.getEnvironments().forEach(env -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(env.getValue());
        });
        return sb.toString();
    }
}
