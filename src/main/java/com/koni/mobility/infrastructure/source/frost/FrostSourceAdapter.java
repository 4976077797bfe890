package com.koni.mobility.infrastructure.source.frost;

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
import com.koni.mobility.domain.model.RawGeometry;
import com.koni.mobility.domain.model.RawObservation;
import com.koni.mobility.domain.model.TypeUnit;
import com.koni.mobility.infrastructure.config.MobilityProperties;
import com.koni.mobility.infrastructure.source.SourceHttpClient;
import com.koni.mobility.infrastructure.source.SourceTimestamps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Source adapter for the FROST SensorThings API of the city traffic portal.
 *
 * A FROST Thing becomes a sensor, each of its Datastreams a datastream identified by its
 * {@code @iot.id}. Observations are read per datastream, starting after the latest stored
 * measurement of that datastream, and paged through {@code @iot.nextLink}.
 */
@Slf4j
@Component
public class FrostSourceAdapter implements SourceAdapter {

    public static final String NAME = "frost";
    public static final String SOURCE = "FROST";

    static final Set<String> WEATHER_TYPES = Set.of(
            "SIGNIFICANTWEATHER", "WINDDIRECTION", "HUMIDITY", "TEMPERATURE",
            "DEWPOINT", "WINDSPEED", "PROBABILITYOFPRECIPITATION");

    static final Map<String, Integer> CHARGING_STATES = Map.of(
            "charging", 1,
            "available", 0,
            "outoforder", -1);

    static final CategoryMapping CATEGORIES = PriorityCategoryMapping.builder()
            .labels(new TypeUnit("E-Ladepunkt", "Occupancy status"), "E-Ladepunkt")
            .keepingLabel("Vacant Spaces", "Parkobjekt", "ParkingArea", "ParkingLocation")
            .labels(new TypeUnit("motor traffic measurement", "Vehicles Counted"),
                    "cC1", "cC2", "cC3", "vC1", "vC2", "vC3")
            .labels(new TypeUnit("bike traffic measurement", "Bikes counted"), "Bike")
            .labels(new TypeUnit("weather", "unknown"), "Wetter")
            .build();

    private static final String DATASTREAM_SELECT = "@iot.id,description,properties,observedArea,chargePointLocation";
    private static final String THING_EXPAND = "Thing($select=@iot.id,name,description,properties)";
    private static final String OBSERVATION_SELECT = "@iot.id,phenomenonTime,result";

    private final SourceHttpClient httpClient;
    private final MobilityProperties.Frost settings;

    public FrostSourceAdapter(SourceHttpClient httpClient, MobilityProperties properties) {
        this.httpClient = httpClient;
        this.settings = properties.getSources().getFrost();
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
        Map<ExternalId, ObservedSensor> sensors = new LinkedHashMap<>();
        List<ObservedDatastream> datastreams = new ArrayList<>();
        forEachPage(datastreamsUri(), node -> readDatastream(node, sensors, datastreams));
        log.info("FROST catalogue read: things={}, datastreams={}", sensors.size(), datastreams.size());

        List<ExternalId> classified = new ArrayList<>();
        for (ObservedDatastream datastream : datastreams) {
            if (CATEGORIES.resolve(datastream.getCategoryLabel()).isPresent()) {
                classified.add(datastream.getExternalId());
            }
        }
        Map<ExternalId, Instant> starts = context.datastreamStarts(classified);

        List<RawObservation> observations = new ArrayList<>();
        starts.forEach((datastreamId, start) -> {
            int before = observations.size();
            forEachPage(observationsUri(datastreamId, start), node -> readObservation(datastreamId, node, observations));
            log.debug("FROST observations read: datastream={}, since={}, count={}",
                    datastreamId, start, observations.size() - before);
        });
        return new SourceBatch(new ArrayList<>(sensors.values()), datastreams, observations);
    }

    private void readDatastream(JsonNode node, Map<ExternalId, ObservedSensor> sensors,
                                List<ObservedDatastream> datastreams) {
        ExternalId datastreamId = ExternalId.of(scalar(node.path("@iot.id")));
        JsonNode thing = node.path("Thing");
        ExternalId thingId = ExternalId.of(scalar(thing.path("@iot.id")));
        if (!datastreamId.isKnown() || !thingId.isKnown()) {
            log.warn("Skipping FROST datastream without datastream or thing id: datastream={}", datastreamId);
            return;
        }
        ObservedSensor sensor = sensors.computeIfAbsent(thingId, id -> toSensor(id, thing, node));
        datastreams.add(ObservedDatastream.builder()
                .sensorExternalId(thingId)
                .externalId(datastreamId)
                .categoryLabel(category(node))
                .confidential(sensor.isConfidential())
                .build());
    }

    private ObservedSensor toSensor(ExternalId thingId, JsonNode thing, JsonNode datastream) {
        JsonNode properties = thing.path("properties");
        String species = properties.path("species").asText("");
        String name = thing.path("name").asText("");
        String description;
        boolean confidential;
        switch (species) {
            case "Ladestation":
                description = thing.path("description").asText("");
                confidential = true;
                break;
            case "Zaehlstelle":
                description = properties.path("props").path("label").asText("");
                confidential = false;
                break;
            case "Parkhaus":
                description = name;
                confidential = true;
                break;
            case "Parkplatz":
            case "Parkfläche":
                description = name;
                confidential = false;
                break;
            default:
                description = name;
                confidential = !"ParkingLocation".equals(properties.path("type").asText(""));
                log.debug("Unknown FROST thing species: thing={}, species={}", thingId, species);
        }

        ObservedSensor.ObservedSensorBuilder sensor = ObservedSensor.builder()
                .source(SOURCE)
                .externalId(thingId)
                .description(description)
                .confidential(confidential);
        JsonNode observedArea = datastream.path("observedArea");
        JsonNode chargePoint = datastream.path("chargePointLocation").path("coordinates");
        if (observedArea.isObject()) {
            sensor.rawGeometry(new RawGeometry(observedArea.path("type").asText(null), observedArea.get("coordinates")));
        } else if (chargePoint.isObject()) {
            sensor.longitude(number(chargePoint.path("lon")))
                    .latitude(number(chargePoint.path("lat")));
        }
        return sensor.build();
    }

    /**
     * Datastream category: {@code properties.Klasse}, else {@code properties.type}, else
     * {@code Wetter} for weather descriptions.
     */
    static String category(JsonNode datastream) {
        JsonNode properties = datastream.path("properties");
        String klasse = properties.path("Klasse").asText("");
        if (StringUtils.hasText(klasse)) {
            return klasse;
        }
        String type = properties.path("type").asText("");
        if (StringUtils.hasText(type)) {
            return type;
        }
        return WEATHER_TYPES.contains(datastream.path("description").asText("")) ? "Wetter" : "unknown";
    }

    private void readObservation(ExternalId datastreamId, JsonNode node, List<RawObservation> target) {
        String phenomenonTime = node.path("phenomenonTime").asText("");
        try {
            Instant timestamp = SourceTimestamps.parseIso(phenomenonTime);
            target.add(RawObservation.forDatastream(datastreamId, timestamp, value(node.path("result"))));
        } catch (DateTimeException e) {
            log.warn("Skipping FROST observation with unreadable time: datastream={}, observation={}, phenomenonTime={}",
                    datastreamId, scalar(node.path("@iot.id")), phenomenonTime);
        }
    }

    static Object value(JsonNode result) {
        if (result.isNumber()) {
            return result.numberValue();
        }
        if (result.isTextual()) {
            Integer state = CHARGING_STATES.get(result.asText());
            return state != null ? state : result.asText();
        }
        if (result.isBoolean()) {
            return result.booleanValue();
        }
        return result.isMissingNode() || result.isNull() ? null : result.toString();
    }

    private void forEachPage(URI first, Consumer<JsonNode> consumer) {
        URI next = first;
        while (next != null) {
            JsonNode page = httpClient.getJson(SOURCE, next, headers());
            JsonNode values = page.get("value");
            if (values == null || !values.isArray()) {
                throw new MalformedPayloadException("FROST response without value array: " + next);
            }
            values.forEach(consumer);
            String nextLink = page.path("@iot.nextLink").asText("");
            next = StringUtils.hasText(nextLink) ? toUri(nextLink) : null;
        }
    }

    URI datastreamsUri() {
        return UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
                .path("Datastreams")
                .queryParam("$top", settings.getPageSize())
                .queryParam("$orderby", "@iot.id asc")
                .queryParam("$select", DATASTREAM_SELECT)
                .queryParam("$expand", THING_EXPAND)
                .encode()
                .build()
                .toUri();
    }

    URI observationsUri(ExternalId datastreamId, Instant since) {
        return UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
                .path("Datastreams(" + datastreamId.getValue() + ")/Observations")
                .queryParam("$top", settings.getPageSize())
                .queryParam("$orderby", "phenomenonTime asc")
                .queryParam("$select", OBSERVATION_SELECT)
                .queryParam("$filter", "phenomenonTime gt " + SourceTimestamps.format(since))
                .encode()
                .build()
                .toUri();
    }

    private static URI toUri(String link) {
        try {
            return URI.create(link);
        } catch (IllegalArgumentException e) {
            return UriComponentsBuilder.fromHttpUrl(link).encode().build().toUri();
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        if (StringUtils.hasText(settings.getUsername())) {
            headers.setBasicAuth(settings.getUsername(), settings.getPassword() == null ? "" : settings.getPassword());
        }
        return headers;
    }

    private static Object scalar(JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        return node.isValueNode() ? node.asText() : null;
    }

    private static Double number(JsonNode node) {
        return node.isNumber() ? node.doubleValue() : null;
    }
}
