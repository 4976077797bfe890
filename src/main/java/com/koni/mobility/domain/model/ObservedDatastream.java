package com.koni.mobility.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A datastream as seen in a source payload. {@code externalId} is {@link ExternalId#UNKNOWN}
 * for sources that only know (sensor, category).
 */
@Getter
@Builder
@ToString
public class ObservedDatastream {

    private final ExternalId sensorExternalId;
    @Builder.Default
    private final ExternalId externalId = ExternalId.UNKNOWN;
    private final String categoryLabel;
    private final boolean confidential;
}
