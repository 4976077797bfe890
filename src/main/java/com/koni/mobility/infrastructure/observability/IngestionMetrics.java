package com.koni.mobility.infrastructure.observability;

import com.koni.mobility.domain.model.EntityKind;
import com.koni.mobility.domain.model.IngestResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Component for tracking ingestion-specific metrics.
 * Provides counters for written and skipped measurements, entity creation and
 * creation conflicts, and a timer per pipeline run.
 */
@Slf4j
@Component
public class IngestionMetrics {

    private final MeterRegistry registry;
    private final Counter measurementsWritten;
    private final Counter skippedNonNumeric;
    private final Counter skippedDuplicate;
    private final Counter skippedMalformed;
    private final Counter eventsDropped;

    public IngestionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.measurementsWritten = Counter.builder("mobility.measurements.written.total")
                .description("Total measurements written to the store")
                .register(registry);

        this.skippedNonNumeric = Counter.builder("mobility.measurements.skipped.total")
                .description("Total observations not written")
                .tag("reason", "non_numeric")
                .register(registry);

        this.skippedDuplicate = Counter.builder("mobility.measurements.skipped.total")
                .description("Total observations not written")
                .tag("reason", "duplicate")
                .register(registry);

        this.skippedMalformed = Counter.builder("mobility.measurements.skipped.total")
                .description("Total observations not written")
                .tag("reason", "malformed")
                .register(registry);

        this.eventsDropped = Counter.builder("mobility.events.dropped.total")
                .description("Total ingestion events that could not be published")
                .register(registry);
    }

    /**
     * Adds the counts of one ingest call.
     */
    public void recordIngestResult(IngestResult result) {
        measurementsWritten.increment(result.getWritten());
        skippedNonNumeric.increment(result.getSkippedNonNumeric());
        skippedDuplicate.increment(result.getSkippedDuplicate());
        skippedMalformed.increment(result.getSkippedMalformed());
        log.debug("Ingest counters incremented: {}", result);
    }

    /**
     * Adds newly created sensors or datastreams, tagged by kind.
     */
    public void recordEntitiesCreated(EntityKind kind, int count) {
        Counter.builder("mobility.entities.created.total")
                .description("Total catalogue entities created")
                .tag("kind", kind.tag())
                .register(registry)
                .increment(count);
    }

    /**
     * Increment the counter for creations that lost a race against a concurrent writer.
     */
    public void recordCreationConflict(EntityKind kind) {
        Counter.builder("mobility.entities.conflicts.total")
                .description("Total benign uniqueness conflicts while creating entities")
                .tag("kind", kind.tag())
                .register(registry)
                .increment();
    }

    /**
     * Counts a finished run. Outcome is the lower-case run status, e.g. {@code succeeded}.
     */
    public void recordPipelineOutcome(String pipeline, String outcome) {
        Counter.builder("mobility.pipeline.runs.total")
                .description("Total pipeline runs by outcome")
                .tag("pipeline", pipeline)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Record the duration of one pipeline run.
     *
     * @param pipeline the pipeline name
     * @param run the run to time
     * @param <T> the return type of the run
     * @return the result of the run
     */
    public <T> T recordPipelineRun(String pipeline, Supplier<T> run) {
        return Timer.builder("mobility.pipeline.run.time")
                .description("Duration of pipeline runs")
                .tag("pipeline", pipeline)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(run);
    }

    /**
     * Counts an IngestionCompleted event given up after a failed publish.
     */
    public void recordEventDropped() {
        eventsDropped.increment();
        log.debug("Dropped event counter incremented");
    }
}
