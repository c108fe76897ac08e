package com.company.apimonitoring.analysis;

import com.company.apimonitoring.domain.Anomaly;
import com.company.apimonitoring.domain.ApiMetric;
import com.company.apimonitoring.domain.ApiSource;
import com.company.apimonitoring.domain.Prediction;

import java.util.List;

/**
 * Detection contract shared by per-API and global analyzers.
 * <p>
 * Both detection operations return an empty list when the window holds fewer than
 * {@link #getMinDataPoints()} samples, and never throw: internal failures are logged
 * and reported as an empty result so one analyzer cannot abort a scheduling cycle.
 */
public interface Analyzer {

    String getName();

    int getMinDataPoints();

    List<Anomaly> detectAnomalies(List<ApiMetric> metrics);

    List<Prediction> predictIssues(List<ApiMetric> metrics);

    /**
     * Hot-reload of the monitored API settings. Global analyzers ignore it.
     */
    void updateConfig(ApiSource source);

    /**
     * Releases model state. Idempotent, never throws.
     */
    void cleanup();
}
