package com.koni.mobility.application.reconcile;

import com.koni.mobility.domain.model.Datastream;
import com.koni.mobility.domain.model.ExternalId;
import com.koni.mobility.domain.model.RawObservation;
import com.koni.mobility.domain.model.TypeUnit;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of datastream reconciliation: the persisted datastream behind every observed one.
 *
 * Identified datastreams are found by their external id, the others by
 * (sensor external id, type), where the type comes from the source's category mapping.
 */
public class DatastreamMapping {

    private final CategoryMapping categoryMapping;
    private final Map<ExternalId, Datastream> byExternalId = new LinkedHashMap<>();
    private final Map<SensorType, Datastream> bySensorAndType = new HashMap<>();

    public DatastreamMapping(CategoryMapping categoryMapping) {
        this.categoryMapping = categoryMapping;
    }

    void registerIdentified(Datastream datastream) {
        byExternalId.putIfAbsent(datastream.getExternalId(), datastream);
    }

    void registerUnidentified(ExternalId sensorExternalId, Datastream datastream) {
        bySensorAndType.putIfAbsent(new SensorType(sensorExternalId, datastream.getType()), datastream);
    }

    public Optional<Datastream> byExternalId(ExternalId externalId) {
        return Optional.ofNullable(byExternalId.get(externalId));
    }

    public Optional<Datastream> bySensorAndType(ExternalId sensorExternalId, String type) {
        return Optional.ofNullable(bySensorAndType.get(new SensorType(sensorExternalId, type)));
    }

    /**
     * Finds the datastream an observation belongs to.
     */
    public Optional<Datastream> resolve(RawObservation observation) {
        if (observation.addressesDatastream()) {
            return byExternalId(observation.getDatastreamExternalId());
        }
        return categoryMapping.resolve(observation.getCategoryLabel())
                .map(TypeUnit::getType)
                .flatMap(type -> bySensorAndType(observation.getSensorExternalId(), type));
    }

    /**
     * External id to internal id of every identified datastream.
     */
    public Map<ExternalId, Long> asExternalIdMap() {
        Map<ExternalId, Long> ids = new LinkedHashMap<>();
        byExternalId.forEach((externalId, datastream) -> ids.put(externalId, datastream.getId()));
        return Collections.unmodifiableMap(ids);
    }

    public int size() {
        return byExternalId.size() + bySensorAndType.size();
    }

    private static final class SensorType {
        private final ExternalId sensorExternalId;
        private final String type;

        private SensorType(ExternalId sensorExternalId, String type) {
            this.sensorExternalId = sensorExternalId;
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof SensorType)) {
                return false;
            }
            SensorType other = (SensorType) o;
            return Objects.equals(sensorExternalId, other.sensorExternalId) && Objects.equals(type, other.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(sensorExternalId, type);
        }
    }
}
