package com.koni.mobility.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A GeoJSON-style geometry as delivered by a source, not yet validated.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class RawGeometry {

    private final String type;
    private final JsonNode coordinates;
}
