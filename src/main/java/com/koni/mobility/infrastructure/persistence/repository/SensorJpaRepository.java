package com.koni.mobility.infrastructure.persistence.repository;

import com.koni.mobility.infrastructure.persistence.entity.SensorEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Spring Data repository for sensors.
 */
@Repository
public interface SensorJpaRepository extends JpaRepository<SensorEntity, Long> {

    List<SensorEntity> findBySourceAndExternalIdIn(String source, Collection<String> externalIds);
}
