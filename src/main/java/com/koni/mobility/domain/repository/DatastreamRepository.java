package com.koni.mobility.domain.repository;

import com.koni.mobility.domain.exception.DuplicateEntityException;
import com.koni.mobility.domain.model.Datastream;
import com.koni.mobility.domain.model.ExternalId;

import java.util.Collection;
import java.util.List;

/**
 * Repository port for datastreams.
 */
public interface DatastreamRepository {

    /**
     * Finds identified datastreams by external id, scoped to the source of their owning sensor.
     */
    List<Datastream> findBySourceAndExternalIds(String source, Collection<ExternalId> externalIds);

    /**
     * Finds the datastreams without external id owned by the given sensors.
     */
    List<Datastream> findUnidentifiedBySensorIds(Collection<Long> sensorIds);

    /**
     * @throws DuplicateEntityException if any row violates uniqueness; nothing is inserted then
     */
    List<Datastream> insertAll(List<Datastream> datastreams);

    /**
     * @throws DuplicateEntityException if the datastream already exists
     */
    Datastream insert(Datastream datastream);
}
