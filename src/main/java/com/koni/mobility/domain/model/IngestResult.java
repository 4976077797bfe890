package com.koni.mobility.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome counts of one ingestion call.
 */
@Getter
@ToString
@EqualsAndHashCode
public class IngestResult {

    private static final IngestResult EMPTY = new IngestResult(0, 0, 0);

    private final int written;
    private final int skippedNonNumeric;
    private final int skippedDuplicate;
    /**
     * Observations without datastream id or timestamp.
     */
    private final int skippedMalformed;

    public IngestResult(int written, int skippedNonNumeric, int skippedDuplicate) {
        this(written, skippedNonNumeric, skippedDuplicate, 0);
    }

    public IngestResult(int written, int skippedNonNumeric, int skippedDuplicate, int skippedMalformed) {
        this.written = written;
        this.skippedNonNumeric = skippedNonNumeric;
        this.skippedDuplicate = skippedDuplicate;
        this.skippedMalformed = skippedMalformed;
    }

    public static IngestResult empty() {
        return EMPTY;
    }

    public IngestResult plus(IngestResult other) {
        return new IngestResult(
                written + other.written,
                skippedNonNumeric + other.skippedNonNumeric,
                skippedDuplicate + other.skippedDuplicate,
                skippedMalformed + other.skippedMalformed);
    }

    public int total() {
        return written + skippedNonNumeric + skippedDuplicate + skippedMalformed;
    }
}
