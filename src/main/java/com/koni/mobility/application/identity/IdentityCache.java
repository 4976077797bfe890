package com.koni.mobility.application.identity;

import com.koni.mobility.domain.model.ExternalId;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bidirectional external id / internal id map of one entity kind within one source.
 *
 * Lives for a single pipeline run and is confined to the thread executing it,
 * so it is not synchronized.
 */
public class IdentityCache {

    private final String source;
    private final Map<ExternalId, Long> internalByExternal = new LinkedHashMap<>();
    private final Map<Long, ExternalId> externalByInternal = new HashMap<>();

    public IdentityCache(String source) {
        this.source = source;
    }

    public void put(ExternalId externalId, Long internalId) {
        Long previous = internalByExternal.put(externalId, internalId);
        if (previous != null && !previous.equals(internalId)) {
            externalByInternal.remove(previous);
        }
        externalByInternal.put(internalId, externalId);
    }

    public boolean contains(ExternalId externalId) {
        return internalByExternal.containsKey(externalId);
    }

    public Optional<Long> internalId(ExternalId externalId) {
        return Optional.ofNullable(internalByExternal.get(externalId));
    }

    public Optional<ExternalId> externalId(Long internalId) {
        return Optional.ofNullable(externalByInternal.get(internalId));
    }

    public Set<Long> internalIds() {
        return Collections.unmodifiableSet(externalByInternal.keySet());
    }

    public Map<ExternalId, Long> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(internalByExternal));
    }

    public String getSource() {
        return source;
    }

    public int size() {
        return internalByExternal.size();
    }
}
