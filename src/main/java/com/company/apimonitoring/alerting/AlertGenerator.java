package com.company.apimonitoring.alerting;

import com.company.apimonitoring.domain.Alert;
import com.company.apimonitoring.domain.Anomaly;
import com.company.apimonitoring.domain.enums.AlertSeverity;
import com.company.apimonitoring.domain.enums.AlertStatus;
import com.company.apimonitoring.domain.enums.Environment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns anomalies grouped by (api id, type) into alerts. No I/O; the same groups always
 * produce the same alerts, ids included, since the id is derived from the member anomaly ids.
 */
@Component
@RequiredArgsConstructor
public class AlertGenerator {

    private final Clock clock;

    public static String groupKey(Anomaly anomaly) {
        return anomaly.getApiId() + ":" + anomaly.getType();
    }

    public List<Alert> generateAlerts(Map<String, List<Anomaly>> groupedAnomalies) {
        List<Alert> alerts = new ArrayList<>();
        for (List<Anomaly> group : groupedAnomalies.values()) {
            if (group != null && !group.isEmpty()) {
                alerts.add(createAlert(group));
            }
        }
        return alerts;
    }

    Alert createAlert(List<Anomaly> anomalies) {
        Anomaly first = anomalies.get(0);
        String apiId = first.getApiId();
        String type = first.getType();

        double maxSeverity = anomalies.stream().mapToDouble(Anomaly::getSeverity).max().orElse(0.0);
        Set<Environment> environments = affectedEnvironments(anomalies);
        Instant now = clock.instant();

        return Alert.builder()
                .id(alertId(anomalies))
                .title(title(anomalies, type, apiId, environments))
                .description(description(anomalies, type, apiId, environments))
                .severity(AlertSeverity.fromScore(maxSeverity))
                .createdAt(now)
                .updatedAt(now)
                .status(AlertStatus.OPEN)
                .anomalies(anomalies.stream().map(Anomaly::getId).collect(Collectors.toList()))
                .apis(new ArrayList<>(List.of(apiId)))
                .environments(new ArrayList<>(environments))
                .tags(tags(anomalies, type, environments))
                .metadata(metadata(anomalies, maxSeverity))
                .build();
    }

    static String readableType(String type) {
        String[] words = type.replace('_', ' ').split(" ");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private String title(List<Anomaly> anomalies, String type, String apiId, Set<Environment> environments) {
        String readable = readableType(type);
        StringBuilder title = new StringBuilder();
        if (anomalies.size() == 1) {
            title.append(readable).append(" Anomaly Detected in API ").append(apiId);
        } else {
            title.append("Multiple ").append(readable).append(" Anomalies Detected in API ").append(apiId);
        }
        if (environments.size() == 1) {
            title.append(" (").append(environments.iterator().next().getValue()).append(')');
        } else if (environments.size() > 1) {
            title.append(" (Multiple Environments)");
        }
        return title.toString();
    }

    private String description(List<Anomaly> anomalies, String type, String apiId, Set<Environment> environments) {
        StringBuilder description = new StringBuilder();
        if (anomalies.size() == 1) {
            Anomaly anomaly = anomalies.get(0);
            description.append(anomaly.getDescription() != null ? anomaly.getDescription() : "");
            if (anomaly.getExpectedValue() != null) {
                description.append(String.format(Locale.ROOT, " Current value: %.2f, Expected: %.2f.",
                        anomaly.getMetricValue(), anomaly.getExpectedValue()));
            }
            if (anomaly.getThreshold() != null) {
                description.append(String.format(Locale.ROOT, " Threshold: %.2f.", anomaly.getThreshold()));
            }
            if (anomaly.getEnvironment() != null) {
                description.append(" Environment: ").append(anomaly.getEnvironment().getValue()).append('.');
            }
            return description.toString();
        }

        description.append(anomalies.size()).append(' ')
                .append(readableType(type).toLowerCase(Locale.ROOT))
                .append(" anomalies detected in API ").append(apiId).append('.');
        if (environments.size() == 1) {
            description.append(" Environment: ").append(environments.iterator().next().getValue()).append('.');
        } else if (environments.size() > 1) {
            description.append(" Environments affected: ")
                    .append(environments.stream().map(Environment::getValue).collect(Collectors.joining(", ")))
                    .append('.');
        }
        double max = anomalies.stream().mapToDouble(Anomaly::getSeverity).max().orElse(0.0);
        double avg = anomalies.stream().mapToDouble(Anomaly::getSeverity).average().orElse(0.0);
        description.append(String.format(Locale.ROOT, " Max severity: %.2f, Average severity: %.2f.", max, avg));
        return description.toString();
    }

    private List<String> tags(List<Anomaly> anomalies, String type, Set<Environment> environments) {
        List<String> tags = new ArrayList<>();
        tags.add(type);
        for (Environment environment : environments) {
            tags.add("env:" + environment.getValue());
        }
        Set<String> endpointTags = new TreeSet<>();
        for (Anomaly anomaly : anomalies) {
            String endpoint = anomaly.contextString("endpoint");
            if (endpoint == null) {
                continue;
            }
            String leaf = endpoint.substring(endpoint.lastIndexOf('/') + 1);
            if (!leaf.isEmpty()) {
                endpointTags.add("endpoint:" + leaf);
            }
        }
        tags.addAll(endpointTags);
        return tags;
    }

    private Map<String, Object> metadata(List<Anomaly> anomalies, double maxSeverity) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("anomaly_count", anomalies.size());
        metadata.put("timestamps", anomalies.stream()
                .map(a -> a.getTimestamp() != null ? a.getTimestamp().toString() : null)
                .collect(Collectors.toList()));
        metadata.put("severities", anomalies.stream().map(Anomaly::getSeverity).collect(Collectors.toList()));
        metadata.put("avg_severity", anomalies.stream().mapToDouble(Anomaly::getSeverity).average().orElse(0.0));
        metadata.put("max_severity", maxSeverity);

        Map<String, Integer> endpoints = new TreeMap<>();
        for (Anomaly anomaly : anomalies) {
            String endpoint = anomaly.contextString("endpoint");
            if (endpoint != null) {
                String method = anomaly.contextString("method");
                endpoints.merge((method != null ? method : "UNKNOWN") + ":" + endpoint, 1, Integer::sum);
            }
        }
        if (!endpoints.isEmpty()) {
            metadata.put("affected_endpoints", new LinkedHashMap<>(endpoints));
        }
        return metadata;
    }

    private static Set<Environment> affectedEnvironments(List<Anomaly> anomalies) {
        Set<Environment> environments = EnumSet.noneOf(Environment.class);
        for (Anomaly anomaly : anomalies) {
            if (anomaly.getEnvironment() != null) {
                environments.add(anomaly.getEnvironment());
            }
        }
        return environments;
    }

    private static String alertId(List<Anomaly> anomalies) {
        String members = anomalies.stream()
                .map(Anomaly::getId)
                .sorted()
                .collect(Collectors.joining(","));
        return "alert-" + UUID.nameUUIDFromBytes(members.getBytes(StandardCharsets.UTF_8));
    }
}
