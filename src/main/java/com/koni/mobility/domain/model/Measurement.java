package com.koni.mobility.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A numeric value of a datastream at an instant. Equality is the natural key
 * (datastreamId, timestamp), so two measurements for the same key are the same row.
 */
@Getter
@ToString
@EqualsAndHashCode(of = {"datastreamId", "timestamp"})
public class Measurement {

    private final Long datastreamId;
    private final Instant timestamp;
    private final double value;
    private final boolean confidential;

    public Measurement(Long datastreamId, Instant timestamp, double value, boolean confidential) {
        this.datastreamId = datastreamId;
        this.timestamp = timestamp;
        this.value = value;
        this.confidential = confidential;
    }
}
