package com.koni.mobility.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A physical or logical measuring device, identified within its source by an external id.
 * The internal id is assigned by the store and is {@code null} until the sensor is persisted.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode(of = {"source", "externalId"})
public class Sensor {

    private final Long id;
    private final String source;
    private final ExternalId externalId;
    private final String description;
    private final Double longitude;
    private final Double latitude;
    private final String geometryWkt;
    private final boolean confidential;

    public Sensor withId(Long id) {
        return toBuilder().id(id).build();
    }
}
