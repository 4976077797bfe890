package com.koni.mobility.application.reconcile;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Resolved position of a sensor. Every field may be {@code null}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SensorLocation {

    private static final SensorLocation UNKNOWN = new SensorLocation(null, null, null);

    private final Double longitude;
    private final Double latitude;
    private final String geometryWkt;

    public SensorLocation(Double longitude, Double latitude, String geometryWkt) {
        this.longitude = longitude;
        this.latitude = latitude;
        this.geometryWkt = geometryWkt;
    }

    public static SensorLocation unknown() {
        return UNKNOWN;
    }
}
