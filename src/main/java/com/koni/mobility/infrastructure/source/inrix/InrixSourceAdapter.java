package com.koni.mobility.infrastructure.source.inrix;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source adapter for the INRIX segment speed API.
 *
 * Every run requests a fresh app token and then the speeds of all XD segments inside the
 * configured bounding box. The XD segment id is the sensor external id; each segment
 * carries one datastream per speed field, keyed by (segment, field). INRIX data is
 * licensed, so everything is confidential.
 */
@Slf4j
@Component
public class InrixSourceAdapter implements SourceAdapter {

    public static final String NAME = "inrix";
    public static final String SOURCE = "INRIX";

    static final String DESCRIPTION = "INRIX Speed Segment";

    static final CategoryMapping CATEGORIES = PriorityCategoryMapping.builder()
            .labels(new TypeUnit("speed", "km/h"), "speed")
            .labels(new TypeUnit("average speed", "km/h"), "average")
            .labels(new TypeUnit("segment closed", "None"), "segmentClosed")
            .labels(new TypeUnit("reference speed", "km/h"), "reference")
            .labels(new TypeUnit("travel time", "minutes"), "travelTimeMinutes")
            .labels(new TypeUnit("level of congestion", "None"), "speedBucket")
            .build();

    static final List<String> FIELDS = List.of(
            "speed", "average", "segmentClosed", "reference", "travelTimeMinutes", "speedBucket");

    private final SourceHttpClient httpClient;
    private final MobilityProperties.Inrix settings;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    private volatile XdSegmentIndex segmentIndex;

    public InrixSourceAdapter(SourceHttpClient httpClient, MobilityProperties properties,
                              ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.settings = properties.getSources().getInrix();
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
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
        if (!StringUtils.hasText(settings.getAppId()) || !StringUtils.hasText(settings.getHashToken())) {
            throw new IllegalStateException("INRIX app id and hash token are not configured");
        }
        String token = requestToken();
        JsonNode speeds = httpClient.getJson(SOURCE, speedUri(token)).path("result").path("segmentspeeds").path(0);
        JsonNode segments = speeds.path("segments");
        if (!segments.isArray()) {
            throw new MalformedPayloadException("INRIX response has no segment speeds");
        }
        Instant timestamp;
        try {
            timestamp = SourceTimestamps.parseIso(speeds.path("time").asText(""));
        } catch (DateTimeException e) {
            throw new MalformedPayloadException("INRIX response has unreadable time: " + speeds.path("time").asText(), e);
        }

        Optional<XdSegmentIndex> index = segmentIndex();
        Map<ExternalId, ObservedSensor> sensors = new LinkedHashMap<>();
        List<ObservedDatastream> datastreams = new ArrayList<>();
        List<RawObservation> observations = new ArrayList<>();
        int unknown = 0;
        for (JsonNode segment : segments) {
            Long segmentId = segmentId(segment.path("code"));
            if (segmentId == null) {
                log.warn("Skipping INRIX segment without usable code: code={}", segment.path("code").asText());
                unknown++;
                continue;
            }
            Optional<RawGeometry> geometry = index.flatMap(known -> known.geometry(segmentId));
            if (index.isPresent() && geometry.isEmpty()) {
                log.debug("Skipping INRIX segment missing from the XD segment file: segment={}", segmentId);
                unknown++;
                continue;
            }
            ExternalId sensorId = ExternalId.of(segmentId);
            if (sensors.containsKey(sensorId)) {
                continue;
            }
            sensors.put(sensorId, ObservedSensor.builder()
                    .source(SOURCE)
                    .externalId(sensorId)
                    .description(DESCRIPTION)
                    .rawGeometry(geometry.orElse(null))
                    .confidential(true)
                    .build());
            readSegment(segment, sensorId, timestamp, datastreams, observations);
        }
        log.info("INRIX segment speeds read: segments={}, skipped={}, sensors={}, observations={}, time={}",
                segments.size(), unknown, sensors.size(), observations.size(), timestamp);
        return new SourceBatch(new ArrayList<>(sensors.values()), datastreams, observations);
    }

    private static void readSegment(JsonNode segment, ExternalId sensorId, Instant timestamp,
                                    List<ObservedDatastream> datastreams, List<RawObservation> observations) {
        boolean closed = segment.path("segmentClosed").asBoolean(false);
        for (String field : FIELDS) {
            datastreams.add(ObservedDatastream.builder()
                    .sensorExternalId(sensorId)
                    .categoryLabel(field)
                    .confidential(true)
                    .build());
            Object value = value(segment, field, closed);
            if (value != null) {
                observations.add(RawObservation.forSensorCategory(sensorId, field, timestamp, value));
            }
        }
    }

    /**
     * Closed segments report no speed, which counts as standing still. A missing closed
     * flag means open.
     */
    static Object value(JsonNode segment, String field, boolean closed) {
        if ("segmentClosed".equals(field)) {
            return closed ? 1.0 : 0.0;
        }
        JsonNode node = segment.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return "speed".equals(field) && closed ? 0.0 : null;
        }
        return node.isNumber() ? node.numberValue() : node.asText();
    }

    private static Long segmentId(JsonNode code) {
        if (code.canConvertToLong()) {
            return code.longValue();
        }
        if (code.isTextual()) {
            try {
                return Long.parseLong(code.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private String requestToken() {
        JsonNode token = httpClient.getJson(SOURCE, tokenUri()).path("result").path("token");
        if (!token.isTextual() || !StringUtils.hasText(token.asText())) {
            throw new MalformedPayloadException("INRIX token response has no token");
        }
        return token.asText();
    }

    private Optional<XdSegmentIndex> segmentIndex() {
        if (!StringUtils.hasText(settings.getSegmentsFile())) {
            return Optional.empty();
        }
        XdSegmentIndex index = segmentIndex;
        if (index == null) {
            index = XdSegmentIndex.load(resourceLoader.getResource(settings.getSegmentsFile()), objectMapper);
            segmentIndex = index;
        }
        return Optional.of(index);
    }

    URI tokenUri() {
        return UriComponentsBuilder.fromHttpUrl(base(settings.getAuthUrl()) + "appToken")
                .queryParam("appId", settings.getAppId())
                .queryParam("hashToken", settings.getHashToken())
                .encode()
                .build()
                .toUri();
    }

    URI speedUri(String token) {
        String box = plain(settings.getNorthWestLatitude()) + "|" + plain(settings.getNorthWestLongitude()) + ","
                + plain(settings.getSouthEastLatitude()) + "|" + plain(settings.getSouthEastLongitude());
        return UriComponentsBuilder.fromHttpUrl(base(settings.getSegmentUrl()) + "segments/speed")
                .queryParam("box", box)
                .queryParam("units", 1)
                .queryParam("SpeedOutputFields", "All")
                .queryParam("accesstoken", token)
                .encode()
                .build()
                .toUri();
    }

    private static String base(String url) {
        return url.endsWith("/") ? url : url + "/";
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
