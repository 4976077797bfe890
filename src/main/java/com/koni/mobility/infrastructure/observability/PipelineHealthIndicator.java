package com.koni.mobility.infrastructure.observability;

import com.koni.mobility.application.pipeline.IngestionPipeline;
import com.koni.mobility.application.pipeline.PipelineRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health of the ingestion pipelines, exposed as the {@code pipelines} health component.
 *
 * DOWN once every enabled pipeline has failed {@value #FAILURE_THRESHOLD} runs in a row;
 * a single healthy source keeps the service UP. Per-pipeline state is reported as details.
 */
@Slf4j
@Component("pipelines")
@RequiredArgsConstructor
public class PipelineHealthIndicator implements HealthIndicator {

    static final int FAILURE_THRESHOLD = 3;

    private final PipelineRegistry registry;

    @Override
    public Health health() {
        List<IngestionPipeline> enabled = registry.enabled();
        Map<String, Object> details = new LinkedHashMap<>();
        int failing = 0;
        for (IngestionPipeline pipeline : enabled) {
            Map<String, Object> pipelineDetails = new LinkedHashMap<>();
            pipelineDetails.put("state", pipeline.getState());
            pipelineDetails.put("consecutiveFailures", pipeline.getConsecutiveFailures());
            pipeline.getLastResult().ifPresent(result -> pipelineDetails.put("lastStatus", result.getStatus()));
            details.put(pipeline.getName(), pipelineDetails);
            if (pipeline.getConsecutiveFailures() >= FAILURE_THRESHOLD) {
                failing++;
            }
        }

        if (!enabled.isEmpty() && failing == enabled.size()) {
            log.error("Pipeline health check failed: all {} enabled pipelines are failing", failing);
            return Health.down().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }
}
