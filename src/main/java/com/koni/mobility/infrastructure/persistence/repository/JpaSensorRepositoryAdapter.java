package com.koni.mobility.infrastructure.persistence.repository;

import com.koni.mobility.domain.exception.DuplicateEntityException;
import com.koni.mobility.domain.model.EntityKind;
import com.koni.mobility.domain.model.ExternalId;
import com.koni.mobility.domain.model.Sensor;
import com.koni.mobility.domain.repository.SensorRepository;
import com.koni.mobility.infrastructure.persistence.entity.SensorEntity;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * JPA adapter for SensorRepository.
 *
 * Inserts run in a transaction owned by this adapter, so constraint violations
 * detected at flush or at commit both surface as {@link DuplicateEntityException}.
 */
@Component
public class JpaSensorRepositoryAdapter implements SensorRepository {

    private final SensorJpaRepository jpaRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaSensorRepositoryAdapter(SensorJpaRepository jpaRepository, PlatformTransactionManager transactionManager) {
        this.jpaRepository = jpaRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public List<Sensor> findBySourceAndExternalIds(String source, Collection<ExternalId> externalIds) {
        if (externalIds.isEmpty()) {
            return List.of();
        }
        List<String> ids = externalIds.stream().map(ExternalId::getValue).collect(Collectors.toList());
        return DataAccessFailures.translate("sensor lookup", () ->
                jpaRepository.findBySourceAndExternalIdIn(source, ids).stream()
                        .map(this::toDomain)
                        .collect(Collectors.toList()));
    }

    /**
     * Inserts all sensors in one transaction and flushes, so a uniqueness conflict
     * surfaces here and not at commit.
     *
     * @param sensors sensors without ids
     * @return the stored sensors, ids assigned, in input order
     * @throws DuplicateEntityException if any row violates a unique index; nothing is stored
     */
    @Override
    public List<Sensor> insertAll(List<Sensor> sensors) {
        if (sensors.isEmpty()) {
            return List.of();
        }
        List<SensorEntity> entities = sensors.stream().map(this::toEntity).collect(Collectors.toList());
        return save("sensor bulk insert", () -> jpaRepository.saveAllAndFlush(entities)).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    /**
     * Inserts one sensor in its own transaction.
     *
     * @throws DuplicateEntityException if the sensor already exists
     */
    @Override
    public Sensor insert(Sensor sensor) {
        SensorEntity entity = toEntity(sensor);
        return toDomain(save("sensor insert", () -> jpaRepository.saveAndFlush(entity)));
    }

    private <T> T save(String operation, Supplier<T> action) {
        try {
            return DataAccessFailures.translate(operation, () -> transactionTemplate.execute(status -> action.get()));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateEntityException(EntityKind.SENSOR, operation + " violated a constraint", e);
        }
    }

    private SensorEntity toEntity(Sensor sensor) {
        return new SensorEntity(
                null,
                sensor.getExternalId().getValue(),
                sensor.getSource(),
                sensor.getLongitude(),
                sensor.getLatitude(),
                sensor.getGeometryWkt(),
                sensor.getDescription(),
                sensor.isConfidential()
        );
    }

    private Sensor toDomain(SensorEntity entity) {
        return Sensor.builder()
                .id(entity.getId())
                .source(entity.getSource())
                .externalId(ExternalId.of(entity.getExternalId()))
                .description(entity.getDescription())
                .longitude(entity.getLongitude())
                .latitude(entity.getLatitude())
                .geometryWkt(entity.getGeometry())
                .confidential(entity.isConfidential())
                .build();
    }
}
