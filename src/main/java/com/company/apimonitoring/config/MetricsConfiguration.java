package com.company.apimonitoring.config;

import com.company.apimonitoring.service.AnalysisScheduler;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
public class MetricsConfiguration {

    @Bean
    public MeterBinder analyzerMetrics(AnalysisScheduler analysisScheduler) {
        return (registry) -> {
            Gauge.builder("apimonitoring.analyzers.active", analysisScheduler,
                            AnalysisScheduler::getActiveAnalyzerCount)
                    .description("Number of per-api analyzers currently scheduled")
                    .register(registry);

            log.info("Custom metrics registered");
        };
    }
}
