package com.koni.mobility.application.pipeline;

import com.koni.mobility.application.identity.IdentityCache;
import com.koni.mobility.application.identity.IdentityResolver;
import com.koni.mobility.domain.model.ExternalId;
import com.koni.mobility.domain.repository.MeasurementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Latest stored measurement timestamp per datastream, addressed by external id.
 * Costs two bulk queries regardless of the number of datastreams.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatastreamWatermarkService {

    private final IdentityResolver identityResolver;
    private final MeasurementRepository measurementRepository;

    public Map<ExternalId, Instant> latestTimestamps(String source, Collection<ExternalId> datastreamExternalIds) {
        IdentityCache datastreams = identityResolver.resolveDatastreams(source, datastreamExternalIds);
        if (datastreams.size() == 0) {
            return Map.of();
        }
        Map<ExternalId, Instant> result = new HashMap<>();
        measurementRepository.findLatestTimestamps(datastreams.internalIds()).forEach((id, latest) ->
                datastreams.externalId(id).ifPresent(externalId -> result.put(externalId, latest)));
        log.debug("Datastream watermarks loaded: source={}, requested={}, withMeasurements={}",
                source, datastreamExternalIds.size(), result.size());
        return result;
    }
}
