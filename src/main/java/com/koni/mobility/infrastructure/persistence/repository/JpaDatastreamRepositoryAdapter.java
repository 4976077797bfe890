package com.koni.mobility.infrastructure.persistence.repository;

import com.koni.mobility.domain.exception.DuplicateEntityException;
import com.koni.mobility.domain.model.Datastream;
import com.koni.mobility.domain.model.EntityKind;
import com.koni.mobility.domain.model.ExternalId;
import com.koni.mobility.domain.repository.DatastreamRepository;
import com.koni.mobility.infrastructure.persistence.entity.DatastreamEntity;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * JPA adapter for DatastreamRepository.
 */
@Component
public class JpaDatastreamRepositoryAdapter implements DatastreamRepository {

    private final DatastreamJpaRepository jpaRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaDatastreamRepositoryAdapter(DatastreamJpaRepository jpaRepository,
                                          PlatformTransactionManager transactionManager) {
        this.jpaRepository = jpaRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public List<Datastream> findBySourceAndExternalIds(String source, Collection<ExternalId> externalIds) {
        if (externalIds.isEmpty()) {
            return List.of();
        }
        List<String> ids = externalIds.stream().map(ExternalId::getValue).collect(Collectors.toList());
        return DataAccessFailures.translate("datastream lookup", () ->
                jpaRepository.findBySourceAndExternalIds(source, ids).stream()
                        .map(this::toDomain)
                        .collect(Collectors.toList()));
    }

    /**
     * Loads the datastreams without external id of the given sensors, which are
     * identified by (sensor, type) instead.
     */
    @Override
    public List<Datastream> findUnidentifiedBySensorIds(Collection<Long> sensorIds) {
        if (sensorIds.isEmpty()) {
            return List.of();
        }
        return DataAccessFailures.translate("datastream lookup by sensor", () ->
                jpaRepository.findBySensorIdInAndExternalId(sensorIds, ExternalId.UNKNOWN_VALUE).stream()
                        .map(this::toDomain)
                        .collect(Collectors.toList()));
    }

    /**
     * Inserts all datastreams in one flushed transaction.
     *
     * @throws DuplicateEntityException if any row violates a unique index; nothing is stored
     */
    @Override
    public List<Datastream> insertAll(List<Datastream> datastreams) {
        if (datastreams.isEmpty()) {
            return List.of();
        }
        List<DatastreamEntity> entities = datastreams.stream().map(this::toEntity).collect(Collectors.toList());
        return save("datastream bulk insert", () -> jpaRepository.saveAllAndFlush(entities)).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public Datastream insert(Datastream datastream) {
        DatastreamEntity entity = toEntity(datastream);
        return toDomain(save("datastream insert", () -> jpaRepository.saveAndFlush(entity)));
    }

    private <T> T save(String operation, Supplier<T> action) {
        try {
            return DataAccessFailures.translate(operation, () -> transactionTemplate.execute(status -> action.get()));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateEntityException(EntityKind.DATASTREAM, operation + " violated a constraint", e);
        }
    }

    private DatastreamEntity toEntity(Datastream datastream) {
        return new DatastreamEntity(
                null,
                datastream.getExternalId().getValue(),
                datastream.getSensorId(),
                datastream.getType(),
                datastream.getUnit(),
                datastream.isConfidential()
        );
    }

    private Datastream toDomain(DatastreamEntity entity) {
        return Datastream.builder()
                .id(entity.getId())
                .sensorId(entity.getSensorId())
                .externalId(ExternalId.of(entity.getExternalId()))
                .type(entity.getType())
                .unit(entity.getUnit())
                .confidential(entity.isConfidential())
                .build();
    }
}
