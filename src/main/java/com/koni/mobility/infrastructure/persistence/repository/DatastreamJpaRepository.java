package com.koni.mobility.infrastructure.persistence.repository;

import com.koni.mobility.infrastructure.persistence.entity.DatastreamEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Spring Data repository for datastreams.
 */
@Repository
public interface DatastreamJpaRepository extends JpaRepository<DatastreamEntity, Long> {

    /**
     * Datastreams whose owning sensor belongs to the source, by datastream external id.
     */
    @Query("select d from DatastreamEntity d, SensorEntity s "
            + "where d.sensorId = s.id and s.source = :source and d.externalId in :externalIds")
    List<DatastreamEntity> findBySourceAndExternalIds(@Param("source") String source,
                                                      @Param("externalIds") Collection<String> externalIds);

    List<DatastreamEntity> findBySensorIdInAndExternalId(Collection<Long> sensorIds, String externalId);
}
