package com.koni.mobility.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain event published after a pipeline run wrote at least one measurement.
 * Consumers use it to refresh derived views of the measurement store.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "eventId")
public class IngestionCompleted {

    private final UUID eventId;
    private final String pipeline;
    private final String source;
    private final int written;
    private final int skippedNonNumeric;
    private final int skippedDuplicate;
    private final Instant watermark;
    private final Instant completedAt;

    @JsonCreator
    public IngestionCompleted(
            @JsonProperty("eventId") UUID eventId,
            @JsonProperty("pipeline") String pipeline,
            @JsonProperty("source") String source,
            @JsonProperty("written") int written,
            @JsonProperty("skippedNonNumeric") int skippedNonNumeric,
            @JsonProperty("skippedDuplicate") int skippedDuplicate,
            @JsonProperty("watermark") Instant watermark,
            @JsonProperty("completedAt") Instant completedAt) {
        this.eventId = eventId;
        this.pipeline = pipeline;
        this.source = source;
        this.written = written;
        this.skippedNonNumeric = skippedNonNumeric;
        this.skippedDuplicate = skippedDuplicate;
        this.watermark = watermark;
        this.completedAt = completedAt;
    }
}
