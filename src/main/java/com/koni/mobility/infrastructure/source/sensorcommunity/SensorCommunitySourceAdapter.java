package com.koni.mobility.infrastructure.source.sensorcommunity;

import com.fasterxml.jackson.databind.JsonNode;
import com.koni.mobility.application.pipeline.FetchContext;
import com.koni.mobility.application.pipeline.SourceAdapter;
import com.koni.mobility.application.pipeline.SourceBatch;
import com.koni.mobility.application.reconcile.CategoryMapping;
import com.koni.mobility.application.reconcile.PriorityCategoryMapping;
import com.koni.mobility.domain.exception.MalformedPayloadException;
import com.koni.mobility.domain.model.ExternalId;
import com.koni.mobility.domain.model.ObservedDatastream;
import com.koni.mobility.domain.model.ObservedSensor;
import com.koni.mobility.domain.model.RawObservation;
import com.koni.mobility.domain.model.TypeUnit;
import com.koni.mobility.infrastructure.config.MobilityProperties;
import com.koni.mobility.infrastructure.source.SourceHttpClient;
import com.koni.mobility.infrastructure.source.SourceTimestamps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.net.URI;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Source adapter for the Sensor.Community area filter API.
 *
 * The API only returns the most recent readings of each sensor and has no datastream ids,
 * so datastreams are keyed by (sensor, value type).
 */
@Slf4j
@Component
public class SensorCommunitySourceAdapter implements SourceAdapter {

    public static final String NAME = "sensor-community";
    public static final String SOURCE = "SensorCommunity";

    static final CategoryMapping CATEGORIES = PriorityCategoryMapping.builder()
            .labels(new TypeUnit("PM10", "µg/m³"), "P1")
            .labels(new TypeUnit("PM2.5", "µg/m³"), "P2")
            .labels(new TypeUnit("air pressure", "Pa"), "pressure")
            .labels(new TypeUnit("temperature", "°C"), "temperature")
            .labels(new TypeUnit("humidity", "%"), "humidity")
            .build();

    private final SourceHttpClient httpClient;
    private final MobilityProperties.SensorCommunity settings;

    public SensorCommunitySourceAdapter(SourceHttpClient httpClient, MobilityProperties properties) {
        this.httpClient = httpClient;
        this.settings = properties.getSources().getSensorCommunity();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String source() {
        return SOURCE;
    }

    @Override
    public CategoryMapping categoryMapping() {
        return CATEGORIES;
    }

    @Override
    public SourceBatch fetch(FetchContext context) {
        JsonNode entries = httpClient.getJson(SOURCE, areaUri());
        if (!entries.isArray()) {
            throw new MalformedPayloadException("Sensor.Community response is not an array: " + entries.getNodeType());
        }

        Map<ExternalId, ObservedSensor> sensors = new LinkedHashMap<>();
        Map<ExternalId, Set<String>> valueTypes = new LinkedHashMap<>();
        List<RawObservation> observations = new ArrayList<>();
        int skipped = 0;
        for (JsonNode entry : entries) {
            if (!readEntry(entry, sensors, valueTypes, observations)) {
                skipped++;
            }
        }

        List<ObservedDatastream> datastreams = new ArrayList<>();
        valueTypes.forEach((sensorId, types) -> types.forEach(type -> datastreams.add(ObservedDatastream.builder()
                .sensorExternalId(sensorId)
                .categoryLabel(type)
                .confidential(false)
                .build())));
        log.info("Sensor.Community area read: entries={}, skipped={}, sensors={}, datastreams={}, observations={}",
                entries.size(), skipped, sensors.size(), datastreams.size(), observations.size());
        return new SourceBatch(new ArrayList<>(sensors.values()), datastreams, observations);
    }

    private boolean readEntry(JsonNode entry, Map<ExternalId, ObservedSensor> sensors,
                              Map<ExternalId, Set<String>> valueTypes, List<RawObservation> observations) {
        JsonNode sensor = entry.path("sensor");
        JsonNode idNode = sensor.path("id");
        ExternalId sensorId = idNode.isValueNode()
                ? ExternalId.of(idNode.isIntegralNumber() ? (Object) idNode.longValue() : idNode.asText())
                : ExternalId.UNKNOWN;
        Instant timestamp;
        try {
            timestamp = SourceTimestamps.parseUtcLocal(entry.path("timestamp").asText(""));
        } catch (DateTimeException e) {
            log.warn("Skipping Sensor.Community entry with unreadable timestamp: id={}, timestamp={}",
                    entry.path("id").asText(), entry.path("timestamp").asText());
            return false;
        }
        if (!sensorId.isKnown()) {
            log.warn("Skipping Sensor.Community entry without sensor id: id={}", entry.path("id").asText());
            return false;
        }

        sensors.computeIfAbsent(sensorId, key -> toSensor(key, entry));
        for (JsonNode reading : entry.path("sensordatavalues")) {
            String valueType = reading.path("value_type").asText("");
            if (CATEGORIES.resolve(valueType).isEmpty()) {
                log.debug("Ignoring Sensor.Community value type: sensor={}, valueType={}", sensorId, valueType);
                continue;
            }
            valueTypes.computeIfAbsent(sensorId, key -> new LinkedHashSet<>()).add(valueType);
            JsonNode value = reading.path("value");
            observations.add(RawObservation.forSensorCategory(sensorId, valueType, timestamp,
                    value.isNumber() ? value.numberValue() : value.asText(null)));
        }
        return true;
    }

    private static ObservedSensor toSensor(ExternalId sensorId, JsonNode entry) {
        JsonNode sensorType = entry.path("sensor").path("sensor_type");
        String manufacturer = sensorType.path("manufacturer").asText("");
        String name = sensorType.path("name").asText("");
        JsonNode location = entry.path("location");
        return ObservedSensor.builder()
                .source(SOURCE)
                .externalId(sensorId)
                .description(StringUtils.hasText(manufacturer) ? manufacturer + " - " + name : name)
                .longitude(coordinate(location.path("longitude")))
                .latitude(coordinate(location.path("latitude")))
                .confidential(false)
                .build();
    }

    private static Double coordinate(JsonNode node) {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual() && StringUtils.hasText(node.asText())) {
            try {
                return Double.valueOf(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    URI areaUri() {
        String base = settings.getBaseUrl().endsWith("/") ? settings.getBaseUrl() : settings.getBaseUrl() + "/";
        return URI.create(String.format(Locale.ROOT, "%sarea=%s,%s,%s", base,
                plain(settings.getLatitude()), plain(settings.getLongitude()), plain(settings.getRadiusKm())));
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
