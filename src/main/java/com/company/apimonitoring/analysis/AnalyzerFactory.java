package com.company.apimonitoring.analysis;

import com.company.apimonitoring.domain.ApiSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Builds the per-API analyzer set and the shared global analyzers.
 */
@Component
@RequiredArgsConstructor
public class AnalyzerFactory {

    private final Clock clock;

    public List<Analyzer> createApiAnalyzers(ApiSource source) {
        return List.of(
                new ResponseTimeAnalyzer(source, clock),
                new ErrorRateAnalyzer(source, clock),
                new PatternAnalyzer(source, clock)
        );
    }

    public List<Analyzer> createGlobalAnalyzers() {
        return List.of(new CrossEnvironmentAnalyzer(clock));
    }
}
