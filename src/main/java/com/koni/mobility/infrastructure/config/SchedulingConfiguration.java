package com.koni.mobility.infrastructure.config;

import com.koni.mobility.application.pipeline.PipelineRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pool for scheduled pipeline runs.
 */
@Configuration
@ConditionalOnProperty(prefix = "mobility.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfiguration {

    /**
     * Creates the scheduler that drives the pipelines, with one thread per enabled
     * pipeline. Pipelines registered with default settings count as well.
     *
     * @param registry every pipeline built from a source adapter
     * @return the scheduler used by {@code PipelineScheduler}
     */
    @Bean
    public ThreadPoolTaskScheduler pipelineTaskScheduler(PipelineRegistry registry) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, registry.enabled().size()));
        scheduler.setThreadNamePrefix("pipeline-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
