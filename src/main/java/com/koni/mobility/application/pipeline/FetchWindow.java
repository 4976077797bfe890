package com.koni.mobility.application.pipeline;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Half-open time range {@code (from, until]} a pipeline run asks its source for.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FetchWindow {

    private final Instant from;
    private final Instant until;

    public FetchWindow(Instant from, Instant until) {
        if (from.isAfter(until)) {
            throw new IllegalArgumentException("Window start " + from + " is after its end " + until);
        }
        this.from = from;
        this.until = until;
    }
}
