package com.koni.mobility.infrastructure.web.dto;

import com.koni.mobility.application.pipeline.IngestionPipeline;
import com.koni.mobility.application.pipeline.PipelineState;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Current state of one pipeline.
 */
@Getter
@Builder
public class PipelineStatusResponse {

    private final String name;
    private final String source;
    private final boolean enabled;
    private final PipelineState state;
    private final Duration interval;
    private final Instant watermark;
    private final int consecutiveFailures;
    private final PipelineRunResponse lastRun;

    public static PipelineStatusResponse from(IngestionPipeline pipeline, Instant watermark) {
        return PipelineStatusResponse.builder()
                .name(pipeline.getName())
                .source(pipeline.getSource())
                .enabled(pipeline.isEnabled())
                .state(pipeline.getState())
                .interval(pipeline.getInterval())
                .watermark(watermark)
                .consecutiveFailures(pipeline.getConsecutiveFailures())
                .lastRun(pipeline.getLastResult().map(PipelineRunResponse::from).orElse(null))
                .build();
    }
}
