package com.koni.mobility.domain.repository;

import com.koni.mobility.domain.exception.DatabaseUnavailableException;
import com.koni.mobility.domain.exception.DuplicateEntityException;
import com.koni.mobility.domain.model.ExternalId;
import com.koni.mobility.domain.model.Sensor;

import java.util.Collection;
import java.util.List;

/**
 * Repository port for sensors.
 * Every method runs in its own short transaction; all of them may throw
 * {@link DatabaseUnavailableException}.
 */
public interface SensorRepository {

    /**
     * Finds the sensors of a source whose external id is in the given set, in one query.
     */
    List<Sensor> findBySourceAndExternalIds(String source, Collection<ExternalId> externalIds);

    /**
     * Inserts all sensors in a single transaction.
     *
     * @return the sensors with their store-assigned ids, in input order
     * @throws DuplicateEntityException if any row violates uniqueness; nothing is inserted then
     */
    List<Sensor> insertAll(List<Sensor> sensors);

    /**
     * Inserts one sensor in its own transaction.
     *
     * @throws DuplicateEntityException if the sensor already exists
     */
    Sensor insert(Sensor sensor);
}
