package com.koni.mobility.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A sensor as seen in a source payload, before reconciliation.
 * Explicit longitude/latitude take precedence over {@code rawGeometry}.
 */
@Getter
@Builder
@ToString
public class ObservedSensor {

    private final String source;
    private final ExternalId externalId;
    private final String description;
    private final Double longitude;
    private final Double latitude;
    private final RawGeometry rawGeometry;
    private final boolean confidential;
}
