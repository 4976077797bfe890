package com.koni.mobility.application.identity;

import com.koni.mobility.domain.model.Datastream;
import com.koni.mobility.domain.model.ExternalId;
import com.koni.mobility.domain.model.Sensor;
import com.koni.mobility.domain.repository.DatastreamRepository;
import com.koni.mobility.domain.repository.SensorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves (source, external id) pairs to internal ids with bulk queries.
 *
 * Responsibilities:
 * - Drop the sentinel id before querying, it never identifies anything
 * - Issue one query per batch, split only when the id list would exceed the bind-parameter limit
 * - Report unknown ids by leaving them out of the result, never by failing
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityResolver {

    static final int MAX_IDS_PER_QUERY = 10_000;

    private final SensorRepository sensorRepository;
    private final DatastreamRepository datastreamRepository;

    /**
     * Resolves many sensor external ids of one source in bulk.
     * Unknown ids are simply absent from the returned cache.
     *
     * @param source source name, e.g. {@code FROST}
     * @param externalIds ids as reported by the source; sentinels are ignored
     * @return cache of the ids that exist
     */
    public IdentityCache resolveSensors(String source, Collection<ExternalId> externalIds) {
        IdentityCache cache = new IdentityCache(source);
        for (Sensor sensor : findSensors(source, externalIds)) {
            cache.put(sensor.getExternalId(), sensor.getId());
        }
        log.debug("Resolved sensors: source={}, requested={}, found={}", source, externalIds.size(), cache.size());
        return cache;
    }

    /**
     * Single-id variant of {@link #resolveSensors}. With duplicate rows the oldest id wins.
     */
    public Optional<Long> resolveSensor(String source, ExternalId externalId) {
        if (!externalId.isKnown()) {
            return Optional.empty();
        }
        return sensorRepository.findBySourceAndExternalIds(source, List.of(externalId)).stream()
                .map(Sensor::getId)
                .min(Comparator.naturalOrder());
    }

    /**
     * Resolves many datastream external ids of one source in bulk.
     */
    public IdentityCache resolveDatastreams(String source, Collection<ExternalId> externalIds) {
        IdentityCache cache = new IdentityCache(source);
        for (Datastream datastream : findDatastreams(source, externalIds)) {
            cache.put(datastream.getExternalId(), datastream.getId());
        }
        log.debug("Resolved datastreams: source={}, requested={}, found={}", source, externalIds.size(), cache.size());
        return cache;
    }

    public Optional<Long> resolveDatastream(String source, ExternalId externalId) {
        return findDatastreams(source, List.of(externalId)).stream()
                .map(Datastream::getId)
                .findFirst();
    }

    /**
     * Bulk lookup returning the full rows, for callers that need more than the id.
     * If two sensors of the source publish the same datastream id, the older row wins.
     */
    public List<Datastream> findDatastreams(String source, Collection<ExternalId> externalIds) {
        List<Datastream> found = inPartitions(externalIds,
                ids -> datastreamRepository.findBySourceAndExternalIds(source, ids));
        found.sort(Comparator.comparing(Datastream::getId));
        Map<ExternalId, Long> kept = new HashMap<>();
        List<Datastream> unique = new ArrayList<>(found.size());
        for (Datastream datastream : found) {
            Long keptId = kept.putIfAbsent(datastream.getExternalId(), datastream.getId());
            if (keptId == null) {
                unique.add(datastream);
            } else {
                log.warn("Datastream external id is not unique within source, using id {}: source={}, externalId={}",
                        keptId, source, datastream.getExternalId());
            }
        }
        return unique;
    }

    private List<Sensor> findSensors(String source, Collection<ExternalId> externalIds) {
        return inPartitions(externalIds, ids -> sensorRepository.findBySourceAndExternalIds(source, ids));
    }

    private static <T> List<T> inPartitions(Collection<ExternalId> externalIds,
                                            Function<List<ExternalId>, List<T>> query) {
        List<ExternalId> known = new ArrayList<>(new LinkedHashSet<>(externalIds));
        known.removeIf(id -> id == null || !id.isKnown());
        List<T> result = new ArrayList<>();
        if (known.isEmpty()) {
            return result;
        }
        for (int from = 0; from < known.size(); from += MAX_IDS_PER_QUERY) {
            result.addAll(query.apply(known.subList(from, Math.min(from + MAX_IDS_PER_QUERY, known.size()))));
        }
        return result;
    }
}
