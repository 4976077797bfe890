package com.koni.mobility.application.pipeline;

import com.koni.mobility.domain.model.IngestResult;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Outcome of one pipeline run.
 */
@Getter
@Builder
@ToString
public class PipelineRunResult {

    private final String pipeline;
    private final PipelineRunStatus status;
    /**
     * Stage that failed; {@code null} unless the run failed.
     */
    private final PipelineState failedStage;
    private final FetchWindow window;
    @Builder.Default
    private final IngestResult ingestResult = IngestResult.empty();
    private final int unresolvedObservations;
    private final String message;
    private final Instant startedAt;
    private final Instant finishedAt;

    public static PipelineRunResult skipped(String pipeline, Instant at) {
        return PipelineRunResult.builder()
                .pipeline(pipeline)
                .status(PipelineRunStatus.SKIPPED)
                .message("Previous run still in progress")
                .startedAt(at)
                .finishedAt(at)
                .build();
    }

    public boolean isSucceeded() {
        return status == PipelineRunStatus.SUCCEEDED;
    }
}
