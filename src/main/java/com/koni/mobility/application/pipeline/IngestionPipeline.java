package com.koni.mobility.application.pipeline;

import com.koni.mobility.application.reconcile.DatastreamMapping;
import com.koni.mobility.domain.event.IngestionCompleted;
import com.koni.mobility.domain.exception.DatabaseUnavailableException;
import com.koni.mobility.domain.exception.MalformedPayloadException;
import com.koni.mobility.domain.exception.SourceUnavailableException;
import com.koni.mobility.domain.model.Datastream;
import com.koni.mobility.domain.model.IngestResult;
import com.koni.mobility.domain.model.Observation;
import com.koni.mobility.domain.model.RawObservation;
import com.koni.mobility.infrastructure.config.MobilityProperties;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetch, reconcile and ingest cycle of one source.
 *
 * A run walks {@code IDLE -> FETCHING -> RECONCILING -> INGESTING -> IDLE}. The fetch
 * window starts at the watermark of the last successful run and ends at the run's start
 * time; the watermark only moves after every stage succeeded, so a failed run is
 * repeated with the same window start by the next one.
 *
 * Failure handling per stage:
 * - {@link SourceUnavailableException} while fetching: retried, then the run is abandoned
 * - {@link MalformedPayloadException}: not retried, the run is abandoned
 * - {@link DatabaseUnavailableException}: retried, then the run is abandoned
 *
 * {@link #run()} never throws and never overlaps with itself.
 */
@Slf4j
public class IngestionPipeline {

    private final SourceAdapter adapter;
    private final MobilityProperties.Pipeline settings;
    private final PipelineServices services;
    private final Retry fetchRetry;
    private final Retry storeRetry;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile PipelineState state = PipelineState.IDLE;
    private volatile PipelineRunResult lastResult;

    public IngestionPipeline(SourceAdapter adapter, MobilityProperties.Pipeline settings, PipelineServices services) {
        this.adapter = adapter;
        this.settings = settings;
        this.services = services;
        this.fetchRetry = retry(adapter.name() + "-fetch", settings, SourceUnavailableException.class);
        this.storeRetry = retry(adapter.name() + "-store", settings, DatabaseUnavailableException.class);
    }

    /**
     * Executes one run, or reports {@code SKIPPED} when a run is already in progress.
     */
    public PipelineRunResult run() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Pipeline busy, skipping run: pipeline={}", getName());
            services.getMetrics().recordPipelineOutcome(getName(), "skipped");
            return PipelineRunResult.skipped(getName(), services.getClock().instant());
        }
        try {
            PipelineRunResult result = services.getMetrics().recordPipelineRun(getName(), this::execute);
            if (result.isSucceeded()) {
                consecutiveFailures.set(0);
            } else {
                consecutiveFailures.incrementAndGet();
            }
            services.getMetrics().recordPipelineOutcome(getName(), result.getStatus().name().toLowerCase(Locale.ROOT));
            lastResult = result;
            return result;
        } finally {
            state = PipelineState.IDLE;
            running.set(false);
        }
    }

    private PipelineRunResult execute() {
        Instant startedAt = services.getClock().instant();
        PipelineRunResult.PipelineRunResultBuilder result = PipelineRunResult.builder()
                .pipeline(getName())
                .startedAt(startedAt);
        try {
            enter(PipelineState.FETCHING);
            FetchWindow window = new FetchWindow(storeRetry.executeSupplier(this::currentWatermark), startedAt);
            result.window(window);
            FetchContext context = new FetchContext(window, settings.getDefaultStartTimestamp(),
                    ids -> services.getDatastreamWatermarks().latestTimestamps(adapter.source(), ids));
            SourceBatch batch = fetchRetry.executeSupplier(() -> adapter.fetch(context));
            log.info("Fetched batch: pipeline={}, from={}, until={}, sensors={}, datastreams={}, observations={}",
                    getName(), window.getFrom(), window.getUntil(), batch.getSensors().size(),
                    batch.getDatastreams().size(), batch.getObservations().size());

            enter(PipelineState.RECONCILING);
            DatastreamMapping mapping = storeRetry.executeSupplier(() -> reconcile(batch));

            enter(PipelineState.INGESTING);
            List<Observation> observations = new ArrayList<>(batch.getObservations().size());
            int unresolved = resolveObservations(batch, mapping, observations);
            IngestResult ingested = storeRetry.executeSupplier(() -> services.getIngestor().ingest(observations));
            storeRetry.executeRunnable(() -> services.getWatermarkRepository().saveWatermark(getName(), window.getUntil()));

            Instant finishedAt = services.getClock().instant();
            if (ingested.getWritten() > 0) {
                publishCompletion(ingested, window, finishedAt);
            }
            log.info("Pipeline run succeeded: pipeline={}, written={}, skippedNonNumeric={}, skippedDuplicate={}, "
                            + "unresolved={}, watermark={}",
                    getName(), ingested.getWritten(), ingested.getSkippedNonNumeric(),
                    ingested.getSkippedDuplicate(), unresolved, window.getUntil());
            return result.status(PipelineRunStatus.SUCCEEDED)
                    .ingestResult(ingested)
                    .unresolvedObservations(unresolved)
                    .finishedAt(finishedAt)
                    .build();
        } catch (SourceUnavailableException e) {
            log.warn("Source unavailable after {} attempts, abandoning run: pipeline={}, source={}, error={}",
                    settings.getMaxRetryCount(), getName(), e.getSource(), e.getMessage());
            return failed(result, e);
        } catch (MalformedPayloadException e) {
            log.warn("Malformed payload, skipping run: pipeline={}, error={}", getName(), e.getMessage());
            return failed(result, e);
        } catch (DatabaseUnavailableException e) {
            log.error("Store unavailable, abandoning run: pipeline={}, stage={}", getName(), state, e);
            return failed(result, e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure, abandoning run: pipeline={}, stage={}", getName(), state, e);
            return failed(result, e);
        }
    }

    private DatastreamMapping reconcile(SourceBatch batch) {
        services.getReconciler().reconcileSensors(adapter.source(), batch.getSensors());
        return services.getReconciler().reconcileDatastreams(adapter.source(), batch.getDatastreams(),
                adapter.categoryMapping());
    }

    /**
     * @return number of observations whose datastream is unknown
     */
    private int resolveObservations(SourceBatch batch, DatastreamMapping mapping, List<Observation> target) {
        int unresolved = 0;
        for (RawObservation raw : batch.getObservations()) {
            Optional<Datastream> datastream = mapping.resolve(raw);
            if (datastream.isPresent()) {
                target.add(new Observation(datastream.get().getId(), raw.getTimestamp(), raw.getRawValue(),
                        datastream.get().isConfidential()));
            } else {
                unresolved++;
                log.debug("No datastream for observation: pipeline={}, observation={}", getName(), raw);
            }
        }
        if (unresolved > 0) {
            log.warn("Observations without datastream were dropped: pipeline={}, count={}", getName(), unresolved);
        }
        return unresolved;
    }

    private void publishCompletion(IngestResult ingested, FetchWindow window, Instant completedAt) {
        IngestionCompleted event = new IngestionCompleted(UUID.randomUUID(), getName(), adapter.source(),
                ingested.getWritten(), ingested.getSkippedNonNumeric(), ingested.getSkippedDuplicate(),
                window.getUntil(), completedAt);
        try {
            services.getEventPublisher().publish(event);
        } catch (RuntimeException e) {
            log.warn("Could not publish ingestion event: pipeline={}, eventId={}", getName(), event.getEventId(), e);
        }
    }

    private PipelineRunResult failed(PipelineRunResult.PipelineRunResultBuilder result, RuntimeException e) {
        return result.status(PipelineRunStatus.FAILED)
                .failedStage(state)
                .message(e.getMessage())
                .finishedAt(services.getClock().instant())
                .build();
    }

    private Instant currentWatermark() {
        return services.getWatermarkRepository().findWatermark(getName())
                .orElse(settings.getDefaultStartTimestamp());
    }

    private void enter(PipelineState next) {
        log.debug("Pipeline stage: pipeline={}, {} -> {}", getName(), state, next);
        state = next;
    }

    private static Retry retry(String name, MobilityProperties.Pipeline settings,
                               Class<? extends Throwable> retryOn) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, settings.getMaxRetryCount()))
                .waitDuration(settings.getRetryBackoff())
                .retryExceptions(retryOn)
                .build();
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying {} (attempt {}): {}", name, event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
        return retry;
    }

    /**
     * Watermark of the last successful run, or the configured default start.
     */
    public Instant watermark() {
        return currentWatermark();
    }

    public String getName() {
        return adapter.name();
    }

    public String getSource() {
        return adapter.source();
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    public Duration getInterval() {
        return settings.getInterval();
    }

    public PipelineState getState() {
        return state;
    }

    public Optional<PipelineRunResult> getLastResult() {
        return Optional.ofNullable(lastResult);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }
}
