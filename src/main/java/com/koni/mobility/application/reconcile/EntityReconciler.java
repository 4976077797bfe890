package com.koni.mobility.application.reconcile;

import com.koni.mobility.application.identity.IdentityCache;
import com.koni.mobility.application.identity.IdentityResolver;
import com.koni.mobility.domain.exception.DuplicateEntityException;
import com.koni.mobility.domain.exception.UnclassifiableCategoryException;
import com.koni.mobility.domain.model.Datastream;
import com.koni.mobility.domain.model.EntityKind;
import com.koni.mobility.domain.model.ExternalId;
import com.koni.mobility.domain.model.ObservedDatastream;
import com.koni.mobility.domain.model.ObservedSensor;
import com.koni.mobility.domain.model.Sensor;
import com.koni.mobility.domain.model.TypeUnit;
import com.koni.mobility.domain.repository.DatastreamRepository;
import com.koni.mobility.domain.repository.SensorRepository;
import com.koni.mobility.infrastructure.observability.IngestionMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Creates the sensors and datastreams a batch refers to, exactly once.
 *
 * For each entity kind the reconciler:
 * 1. Resolves every observed external id with one bulk query
 * 2. Partitions the batch into existing and new entities
 * 3. Inserts all new entities in one transaction
 * 4. Falls back to one insert per entity when the bulk insert hits a uniqueness conflict
 * 5. Treats a per-entity conflict as "created concurrently" and re-resolves the id
 *
 * The store's unique indexes make concurrent reconciliation of overlapping batches safe;
 * no lock is taken here and no transaction spans more than one repository call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityReconciler {

    private final IdentityResolver identityResolver;
    private final SensorRepository sensorRepository;
    private final DatastreamRepository datastreamRepository;
    private final GeometryResolver geometryResolver;
    private final IngestionMetrics metrics;

    /**
     * Ensures every observed sensor exists.
     *
     * @param source the source namespace the external ids belong to
     * @param observed sensors as reported by the source; on duplicate external ids the first entry wins
     * @return internal id of every observed sensor with a known external id
     */
    @Observed(name = "reconciler.sensors", contextualName = "reconcile-sensors")
    public Map<ExternalId, Long> reconcileSensors(String source, List<ObservedSensor> observed) {
        Map<ExternalId, ObservedSensor> distinct = new LinkedHashMap<>();
        for (ObservedSensor sensor : observed) {
            if (sensor.getExternalId() == null || !sensor.getExternalId().isKnown()) {
                log.warn("Skipping sensor without external id: source={}, description={}",
                        source, sensor.getDescription());
                continue;
            }
            if (distinct.putIfAbsent(sensor.getExternalId(), sensor) != null) {
                log.debug("Duplicate sensor in batch, keeping first occurrence: source={}, externalId={}",
                        source, sensor.getExternalId());
            }
        }
        if (distinct.isEmpty()) {
            return Map.of();
        }

        IdentityCache cache = identityResolver.resolveSensors(source, distinct.keySet());
        List<Sensor> toCreate = new ArrayList<>();
        for (ObservedSensor sensor : distinct.values()) {
            if (!cache.contains(sensor.getExternalId())) {
                toCreate.add(toSensor(source, sensor));
            }
        }

        List<Sensor> created = createExactlyOnce(EntityKind.SENSOR, source, toCreate,
                sensorRepository::insertAll,
                sensorRepository::insert,
                sensor -> identityResolver.resolveSensor(source, sensor.getExternalId()).map(sensor::withId));
        created.forEach(sensor -> cache.put(sensor.getExternalId(), sensor.getId()));

        log.info("Sensors reconciled: source={}, observed={}, existing={}, created={}",
                source, distinct.size(), distinct.size() - toCreate.size(), created.size());
        return cache.asMap();
    }

    /**
     * Ensures every observed datastream exists. Owning sensors must have been reconciled before.
     *
     * @param source the source namespace of the owning sensors
     * @param observed datastreams as reported by the source
     * @param categoryMapping the source's label to (type, unit) rules
     * @return the persisted datastream behind every observed one that could be reconciled
     */
    @Observed(name = "reconciler.datastreams", contextualName = "reconcile-datastreams")
    public DatastreamMapping reconcileDatastreams(String source, List<ObservedDatastream> observed,
                                                  CategoryMapping categoryMapping) {
        DatastreamMapping mapping = new DatastreamMapping(categoryMapping);
        if (observed.isEmpty()) {
            return mapping;
        }

        List<ExternalId> sensorExternalIds = new ArrayList<>();
        observed.forEach(datastream -> sensorExternalIds.add(datastream.getSensorExternalId()));
        IdentityCache sensors = identityResolver.resolveSensors(source, sensorExternalIds);

        Map<ExternalId, Datastream> identified = new LinkedHashMap<>();
        Map<List<Object>, Datastream> unidentified = new LinkedHashMap<>();
        for (ObservedDatastream datastream : observed) {
            Optional<Long> sensorId = sensors.internalId(datastream.getSensorExternalId());
            if (sensorId.isEmpty()) {
                log.warn("Skipping datastream of unknown sensor: source={}, sensorExternalId={}, externalId={}",
                        source, datastream.getSensorExternalId(), datastream.getExternalId());
                continue;
            }
            Optional<TypeUnit> typeUnit = classify(source, datastream, categoryMapping);
            if (typeUnit.isEmpty()) {
                continue;
            }
            Datastream candidate = Datastream.builder()
                    .sensorId(sensorId.get())
                    .externalId(datastream.getExternalId() == null ? ExternalId.UNKNOWN : datastream.getExternalId())
                    .type(typeUnit.get().getType())
                    .unit(typeUnit.get().getUnit())
                    .confidential(datastream.isConfidential())
                    .build();
            if (candidate.isIdentified()) {
                identified.putIfAbsent(candidate.getExternalId(), candidate);
            } else {
                unidentified.putIfAbsent(List.of(candidate.getSensorId(), candidate.getType()), candidate);
            }
        }

        List<Datastream> resolved = new ArrayList<>();
        List<Datastream> toCreate = new ArrayList<>();

        Map<ExternalId, Datastream> existingIdentified = new HashMap<>();
        if (!identified.isEmpty()) {
            identityResolver.findDatastreams(source, identified.keySet())
                    .forEach(datastream -> existingIdentified.put(datastream.getExternalId(), datastream));
        }
        for (Datastream candidate : identified.values()) {
            Datastream existing = existingIdentified.get(candidate.getExternalId());
            if (existing != null) {
                resolved.add(existing);
            } else {
                toCreate.add(candidate);
            }
        }

        Map<List<Object>, Datastream> existingUnidentified = new HashMap<>();
        if (!unidentified.isEmpty()) {
            List<Long> sensorIds = new ArrayList<>();
            unidentified.values().forEach(datastream -> sensorIds.add(datastream.getSensorId()));
            datastreamRepository.findUnidentifiedBySensorIds(distinct(sensorIds)).forEach(datastream ->
                    existingUnidentified.putIfAbsent(List.of(datastream.getSensorId(), datastream.getType()), datastream));
        }
        unidentified.forEach((key, candidate) -> {
            Datastream existing = existingUnidentified.get(key);
            if (existing != null) {
                resolved.add(existing);
            } else {
                toCreate.add(candidate);
            }
        });

        List<Datastream> created = createExactlyOnce(EntityKind.DATASTREAM, source, toCreate,
                datastreamRepository::insertAll,
                datastreamRepository::insert,
                datastream -> reResolveDatastream(source, datastream));
        resolved.addAll(created);

        for (Datastream datastream : resolved) {
            if (datastream.isIdentified()) {
                // the stored owner may differ from the sensor this batch lists it under
                mapping.registerIdentified(datastream);
            } else {
                sensors.externalId(datastream.getSensorId())
                        .ifPresent(sensorExternalId -> mapping.registerUnidentified(sensorExternalId, datastream));
            }
        }

        log.info("Datastreams reconciled: source={}, observed={}, existing={}, created={}",
                source, identified.size() + unidentified.size(), resolved.size() - created.size(), created.size());
        return mapping;
    }

    private Optional<TypeUnit> classify(String source, ObservedDatastream datastream, CategoryMapping categoryMapping) {
        Optional<TypeUnit> typeUnit = categoryMapping.resolve(datastream.getCategoryLabel());
        if (typeUnit.isEmpty()) {
            UnclassifiableCategoryException problem = new UnclassifiableCategoryException(datastream.getCategoryLabel());
            log.error("Skipping datastream: {}: source={}, sensorExternalId={}, externalId={}",
                    problem.getMessage(), source, datastream.getSensorExternalId(), datastream.getExternalId());
        }
        return typeUnit;
    }

    private Optional<Datastream> reResolveDatastream(String source, Datastream datastream) {
        if (datastream.isIdentified()) {
            return identityResolver.findDatastreams(source, List.of(datastream.getExternalId())).stream().findFirst();
        }
        return datastreamRepository.findUnidentifiedBySensorIds(List.of(datastream.getSensorId())).stream()
                .filter(existing -> existing.getType().equals(datastream.getType()))
                .findFirst();
    }

    /**
     * Inserts the rows in one transaction, falling back to one transaction per row when
     * another writer created some of them first.
     *
     * @return the rows that now exist, with internal ids; rows that neither insert nor
     *         re-resolve are logged and left out
     */
    private <T> List<T> createExactlyOnce(EntityKind kind, String source, List<T> rows,
                                          Function<List<T>, List<T>> insertAll,
                                          UnaryOperator<T> insert,
                                          Function<T, Optional<T>> reResolve) {
        if (rows.isEmpty()) {
            return List.of();
        }
        try {
            List<T> created = insertAll.apply(rows);
            metrics.recordEntitiesCreated(kind, created.size());
            return created;
        } catch (DuplicateEntityException e) {
            log.info("Bulk {} insert hit a uniqueness conflict, inserting one by one: source={}, rows={}",
                    kind.tag(), source, rows.size());
        }

        List<T> result = new ArrayList<>(rows.size());
        int created = 0;
        for (T row : rows) {
            try {
                result.add(insert.apply(row));
                created++;
            } catch (DuplicateEntityException e) {
                Optional<T> existing = reResolve.apply(row);
                if (existing.isPresent()) {
                    metrics.recordCreationConflict(kind);
                    log.info("{} was created concurrently, using existing row: source={}, row={}",
                            kind.tag(), source, existing.get());
                    result.add(existing.get());
                } else {
                    log.error("Insert of {} rejected but no existing row found, skipping: source={}, row={}",
                            kind.tag(), source, row, e);
                }
            }
        }
        metrics.recordEntitiesCreated(kind, created);
        return result;
    }

    private Sensor toSensor(String source, ObservedSensor observed) {
        SensorLocation location = geometryResolver.resolve(observed);
        return Sensor.builder()
                .source(source)
                .externalId(observed.getExternalId())
                .description(observed.getDescription())
                .longitude(location.getLongitude())
                .latitude(location.getLatitude())
                .geometryWkt(location.getGeometryWkt())
                .confidential(observed.isConfidential())
                .build();
    }

    private static List<Long> distinct(Collection<Long> ids) {
        return new ArrayList<>(new LinkedHashSet<>(ids));
    }
}
