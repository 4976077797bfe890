package com.koni.mobility.domain.repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository port for the per-pipeline watermark of the last successful run.
 */
public interface PipelineWatermarkRepository {

    Optional<Instant> findWatermark(String pipeline);

    void saveWatermark(String pipeline, Instant watermark);
}
