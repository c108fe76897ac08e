package com.company.apimonitoring.analysis;

import com.company.apimonitoring.domain.ApiMetric;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Grouping and summary helpers shared by the analyzers. Every group is returned
 * sorted by timestamp.
 */
public final class MetricGroups {

    private MetricGroups() {
    }

    public static String endpointKey(ApiMetric metric) {
        return metric.getMethod() + ":" + metric.getEndpoint();
    }

    public static Map<String, List<ApiMetric>> byMethodAndEndpoint(List<ApiMetric> metrics) {
        return groupBy(metrics, MetricGroups::endpointKey);
    }

    public static Map<String, List<ApiMetric>> groupBy(List<ApiMetric> metrics, Function<ApiMetric, String> keyFn) {
        Map<String, List<ApiMetric>> groups = new LinkedHashMap<>();
        for (ApiMetric metric : metrics) {
            groups.computeIfAbsent(keyFn.apply(metric), k -> new ArrayList<>()).add(metric);
        }
        groups.values().forEach(MetricGroups::sortByTimestamp);
        return groups;
    }

    public static void sortByTimestamp(List<ApiMetric> metrics) {
        metrics.sort(Comparator.comparing(ApiMetric::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder())));
    }

    public static List<ApiMetric> withResponseTime(List<ApiMetric> metrics) {
        List<ApiMetric> result = new ArrayList<>(metrics.size());
        for (ApiMetric metric : metrics) {
            if (metric.hasResponseTime()) {
                result.add(metric);
            }
        }
        return result;
    }

    public static double[] responseTimes(List<ApiMetric> metrics) {
        return metrics.stream()
                .filter(ApiMetric::hasResponseTime)
                .mapToDouble(ApiMetric::getResponseTime)
                .toArray();
    }

    public static double errorRate(List<ApiMetric> metrics) {
        if (metrics.isEmpty()) {
            return 0.0;
        }
        long errors = metrics.stream().filter(ApiMetric::isError).count();
        return (double) errors / metrics.size();
    }

    public static long errorCount(List<ApiMetric> metrics) {
        return metrics.stream().filter(ApiMetric::isError).count();
    }

    public static double meanResponseTime(List<ApiMetric> metrics) {
        return metrics.stream()
                .filter(ApiMetric::hasResponseTime)
                .mapToDouble(ApiMetric::getResponseTime)
                .average()
                .orElse(0.0);
    }
}
