package com.koni.mobility.application.pipeline;

import com.koni.mobility.domain.model.ObservedDatastream;
import com.koni.mobility.domain.model.ObservedSensor;
import com.koni.mobility.domain.model.RawObservation;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Normalized output of one fetch: the catalogue entities seen and their readings.
 */
@Getter
@ToString(of = {"sensors", "datastreams"})
public class SourceBatch {

    private final List<ObservedSensor> sensors;
    private final List<ObservedDatastream> datastreams;
    private final List<RawObservation> observations;

    public SourceBatch(List<ObservedSensor> sensors, List<ObservedDatastream> datastreams,
                       List<RawObservation> observations) {
        this.sensors = List.copyOf(sensors);
        this.datastreams = List.copyOf(datastreams);
        this.observations = List.copyOf(observations);
    }

    public boolean isEmpty() {
        return sensors.isEmpty() && datastreams.isEmpty() && observations.isEmpty();
    }
}
