package com.company.apimonitoring.scheduled;

import com.company.apimonitoring.service.AnalysisScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the analysis cycle. Fixed delay: a slow cycle pushes the next one back instead of overlapping it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnalysisJob {

    private final AnalysisScheduler analysisScheduler;

    @Scheduled(
            fixedDelayString = "${apimonitoring.analysis.interval-ms:60000}",
            initialDelayString = "${apimonitoring.analysis.initial-delay-ms:10000}"
    )
    public void runAnalysis() {
        log.debug("Starting analysis cycle");
        analysisScheduler.runCycle();
    }
}
