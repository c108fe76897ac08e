package com.company.apimonitoring.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pools for the two fan-outs: analyzer pairs and notification channels.
 * A full queue runs the task on the submitting thread, so work is slowed down rather than dropped.
 */
@Configuration
public class AsyncConfig {

    @Bean("analysisExecutor")
    public Executor analysisExecutor(@Value("${apimonitoring.analysis.pool-size:0}") int configuredPoolSize) {
        int processors = Runtime.getRuntime().availableProcessors();
        int corePoolSize = configuredPoolSize > 0 ? configuredPoolSize : processors + 2;

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Math.max(corePoolSize * 2, 16));
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("analysis-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    // Also carries SMTP delivery so a slow mail server never blocks the alerting cycle
    @Bean("notificationExecutor")
    public Executor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
