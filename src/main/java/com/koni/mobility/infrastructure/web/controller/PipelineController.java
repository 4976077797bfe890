package com.koni.mobility.infrastructure.web.controller;

import com.koni.mobility.application.pipeline.IngestionPipeline;
import com.koni.mobility.application.pipeline.PipelineRegistry;
import com.koni.mobility.application.pipeline.PipelineRunResult;
import com.koni.mobility.infrastructure.web.dto.PipelineRunResponse;
import com.koni.mobility.infrastructure.web.dto.PipelineStatusResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Operations endpoints for the ingestion pipelines.
 *
 * Endpoints:
 * - GET /api/v1/pipelines: state, watermark and last run of every pipeline
 * - POST /api/v1/pipelines/{name}/runs: runs a pipeline now and waits for the result
 */
@RestController
@RequestMapping("/api/v1/pipelines")
@RequiredArgsConstructor
@Slf4j
public class PipelineController {

    private final PipelineRegistry registry;

    @GetMapping
    public ResponseEntity<List<PipelineStatusResponse>> listPipelines() {
        List<PipelineStatusResponse> pipelines = registry.all().stream()
                .map(pipeline -> PipelineStatusResponse.from(pipeline, pipeline.watermark()))
                .collect(Collectors.toList());
        return ResponseEntity.ok(pipelines);
    }

    /**
     * Runs the pipeline on the calling thread. A run already in progress yields
     * status {@code SKIPPED}; a failed run yields {@code FAILED} with the failing stage.
     *
     * @return 200 OK with the run result, 404 if the pipeline is unknown
     */
    @PostMapping("/{name}/runs")
    public ResponseEntity<PipelineRunResponse> runPipeline(@PathVariable String name) {
        IngestionPipeline pipeline = registry.get(name);
        log.info("Manual run requested: pipeline={}", name);

        PipelineRunResult result = pipeline.run();

        log.info("Manual run finished: pipeline={}, status={}, written={}",
                name, result.getStatus(), result.getIngestResult().getWritten());
        return ResponseEntity.ok(PipelineRunResponse.from(result));
    }
}
