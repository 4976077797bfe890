package com.koni.mobility.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A single reading from a source. It addresses its datastream either by the
 * datastream's external id or by (sensor external id, category label).
 */
@Getter
@ToString
public class RawObservation {

    private final ExternalId sensorExternalId;
    private final ExternalId datastreamExternalId;
    private final String categoryLabel;
    private final Instant timestamp;
    private final Object rawValue;

    private RawObservation(ExternalId sensorExternalId, ExternalId datastreamExternalId,
                           String categoryLabel, Instant timestamp, Object rawValue) {
        this.sensorExternalId = sensorExternalId;
        this.datastreamExternalId = datastreamExternalId;
        this.categoryLabel = categoryLabel;
        this.timestamp = timestamp;
        this.rawValue = rawValue;
    }

    public static RawObservation forDatastream(ExternalId datastreamExternalId, Instant timestamp, Object rawValue) {
        return new RawObservation(ExternalId.UNKNOWN, datastreamExternalId, null, timestamp, rawValue);
    }

    public static RawObservation forSensorCategory(ExternalId sensorExternalId, String categoryLabel,
                                                   Instant timestamp, Object rawValue) {
        return new RawObservation(sensorExternalId, ExternalId.UNKNOWN, categoryLabel, timestamp, rawValue);
    }

    public boolean addressesDatastream() {
        return datastreamExternalId != null && datastreamExternalId.isKnown();
    }
}
