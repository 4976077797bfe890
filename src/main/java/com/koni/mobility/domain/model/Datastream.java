package com.koni.mobility.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One measured quantity of a sensor.
 *
 * A datastream with a known external id is identified by (sensor, externalId);
 * one without is identified by (sensor, type).
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class Datastream {

    private final Long id;
    private final Long sensorId;
    private final ExternalId externalId;
    private final String type;
    private final String unit;
    private final boolean confidential;

    public boolean isIdentified() {
        return externalId != null && externalId.isKnown();
    }

    public Datastream withId(Long id) {
        return toBuilder().id(id).build();
    }
}
