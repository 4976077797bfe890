package com.koni.mobility.domain.model;

import com.koni.mobility.domain.exception.ValidationException;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A reading already mapped to an internal datastream id, value not yet coerced.
 */
@Getter
@ToString
public class Observation {

    private final Long datastreamId;
    private final Instant timestamp;
    private final Object rawValue;
    private final boolean confidential;

    public Observation(Long datastreamId, Instant timestamp, Object rawValue, boolean confidential) {
        this.datastreamId = datastreamId;
        this.timestamp = timestamp;
        this.rawValue = rawValue;
        this.confidential = confidential;
    }

    /**
     * @throws ValidationException if the natural key is incomplete
     */
    public void validate() {
        if (datastreamId == null) {
            throw new ValidationException("datastreamId is required");
        }
        if (timestamp == null) {
            throw new ValidationException("timestamp is required");
        }
    }
}
