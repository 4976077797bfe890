package com.koni.mobility.application.pipeline;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs every enabled pipeline at its own fixed rate once the application is ready.
 * Each pipeline gets its own scheduler thread, so a slow source never delays another.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "mobility.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineScheduler {

    private final PipelineRegistry registry;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();

    public PipelineScheduler(PipelineRegistry registry,
                             @Qualifier("pipelineTaskScheduler") TaskScheduler taskScheduler,
                             Clock clock) {
        this.registry = registry;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!scheduled.isEmpty()) {
            return;
        }
        for (IngestionPipeline pipeline : registry.enabled()) {
            scheduled.add(taskScheduler.scheduleAtFixedRate(() -> tick(pipeline), clock.instant(),
                    pipeline.getInterval()));
            log.info("Pipeline scheduled: pipeline={}, interval={}", pipeline.getName(), pipeline.getInterval());
        }
    }

    void tick(IngestionPipeline pipeline) {
        try {
            PipelineRunResult result = pipeline.run();
            log.debug("Scheduled run finished: pipeline={}, status={}", pipeline.getName(), result.getStatus());
        } catch (RuntimeException e) {
            // an exception escaping here would cancel all future runs of the pipeline
            log.error("Scheduled run failed: pipeline={}", pipeline.getName(), e);
        }
    }

    @PreDestroy
    public synchronized void stop() {
        scheduled.forEach(future -> future.cancel(false));
        scheduled.clear();
    }
}
