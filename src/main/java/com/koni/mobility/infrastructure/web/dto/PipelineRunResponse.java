package com.koni.mobility.infrastructure.web.dto;

import com.koni.mobility.application.pipeline.PipelineRunResult;
import com.koni.mobility.application.pipeline.PipelineRunStatus;
import com.koni.mobility.application.pipeline.PipelineState;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * One pipeline run as reported by the operations API.
 */
@Getter
@Builder
public class PipelineRunResponse {

    private final String pipeline;
    private final PipelineRunStatus status;
    private final PipelineState failedStage;
    private final Instant windowFrom;
    private final Instant windowUntil;
    private final int written;
    private final int skippedNonNumeric;
    private final int skippedDuplicate;
    private final int skippedMalformed;
    private final int unresolvedObservations;
    private final String message;
    private final Instant startedAt;
    private final Instant finishedAt;

    public static PipelineRunResponse from(PipelineRunResult result) {
        PipelineRunResponseBuilder response = PipelineRunResponse.builder()
                .pipeline(result.getPipeline())
                .status(result.getStatus())
                .failedStage(result.getFailedStage())
                .written(result.getIngestResult().getWritten())
                .skippedNonNumeric(result.getIngestResult().getSkippedNonNumeric())
                .skippedDuplicate(result.getIngestResult().getSkippedDuplicate())
                .skippedMalformed(result.getIngestResult().getSkippedMalformed())
                .unresolvedObservations(result.getUnresolvedObservations())
                .message(result.getMessage())
                .startedAt(result.getStartedAt())
                .finishedAt(result.getFinishedAt());
        if (result.getWindow() != null) {
            response.windowFrom(result.getWindow().getFrom())
                    .windowUntil(result.getWindow().getUntil());
        }
        return response.build();
    }
}
