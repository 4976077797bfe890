package com.koni.mobility.application.pipeline;

import com.koni.mobility.application.ingest.ObservationIngestor;
import com.koni.mobility.application.port.EventPublisher;
import com.koni.mobility.application.reconcile.EntityReconciler;
import com.koni.mobility.domain.repository.PipelineWatermarkRepository;
import com.koni.mobility.infrastructure.observability.IngestionMetrics;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Collaborators shared by every pipeline.
 */
@Getter
@Component
@RequiredArgsConstructor
public class PipelineServices {

    private final EntityReconciler reconciler;
    private final ObservationIngestor ingestor;
    private final DatastreamWatermarkService datastreamWatermarks;
    private final PipelineWatermarkRepository watermarkRepository;
    private final EventPublisher eventPublisher;
    private final IngestionMetrics metrics;
    private final Clock clock;
}
