package com.koni.mobility.infrastructure.source.inrix;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.mobility.domain.model.RawGeometry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Geometries of INRIX XD segments, read from the GeoJSON export INRIX ships for a region.
 * Features are keyed by their {@code XDSegID} property.
 */
@Slf4j
final class XdSegmentIndex {

    private final Map<Long, RawGeometry> geometries;

    private XdSegmentIndex(Map<Long, RawGeometry> geometries) {
        this.geometries = geometries;
    }

    static XdSegmentIndex load(Resource resource, ObjectMapper objectMapper) {
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read XD segment file " + resource.getDescription(), e);
        }

        Map<Long, RawGeometry> geometries = new HashMap<>();
        int skipped = 0;
        for (JsonNode feature : root.path("features")) {
            JsonNode id = feature.path("properties").path("XDSegID");
            JsonNode geometry = feature.path("geometry");
            if ((!id.canConvertToLong() && !id.isTextual()) || geometry.isMissingNode() || geometry.isNull()) {
                skipped++;
                continue;
            }
            try {
                long segmentId = id.isTextual() ? Long.parseLong(id.asText().trim()) : id.longValue();
                geometries.put(segmentId, new RawGeometry(geometry.path("type").asText(null), geometry.get("coordinates")));
            } catch (NumberFormatException e) {
                skipped++;
            }
        }
        log.info("XD segment file loaded: resource={}, segments={}, skipped={}",
                resource.getDescription(), geometries.size(), skipped);
        return new XdSegmentIndex(Collections.unmodifiableMap(geometries));
    }

    Optional<RawGeometry> geometry(long segmentId) {
        return Optional.ofNullable(geometries.get(segmentId));
    }
}
