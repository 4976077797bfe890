package com.koni.mobility.domain.repository;

import com.koni.mobility.domain.model.Measurement;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Repository port for the append-only measurement store.
 */
public interface MeasurementRepository {

    /**
     * Inserts the measurements in one transaction, ignoring rows whose
     * (datastreamId, timestamp) already exists.
     *
     * @return number of rows actually written
     */
    int insertIgnoringConflicts(List<Measurement> measurements);

    /**
     * Latest stored timestamp per datastream, in one query. Datastreams without
     * measurements are absent from the result.
     */
    Map<Long, Instant> findLatestTimestamps(Collection<Long> datastreamIds);
}
