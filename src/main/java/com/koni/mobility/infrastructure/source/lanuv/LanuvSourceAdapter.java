package com.koni.mobility.infrastructure.source.lanuv;

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
import com.koni.mobility.infrastructure.config.MobilityProperties;
import com.koni.mobility.infrastructure.source.SourceHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.nio.charset.Charset;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Source adapter for the LANUV NRW current air quality table.
 *
 * LANUV publishes one semicolon separated table for the whole state, without
 * timestamps, and its column names in a second file. Rows are filtered to the
 * configured stations; the station code is the sensor external id and readings are
 * stamped with the hour the run falls into.
 */
@Slf4j
@Component
public class LanuvSourceAdapter implements SourceAdapter {

    public static final String NAME = "lanuv";
    public static final String SOURCE = "LANUV";

    static final String UNIT = "µg/m³";

    static final CategoryMapping CATEGORIES = PriorityCategoryMapping.builder()
            .keepingLabel(UNIT, "Ozon", "SO2", "NO2", "PM10")
            .build();

    /** Lines above the first station row of the values file. */
    private static final int VALUES_PREAMBLE = 2;
    private static final int STATION_COLUMN = 0;
    private static final int CODE_COLUMN = 1;

    private final SourceHttpClient httpClient;
    private final MobilityProperties.Lanuv settings;

    public LanuvSourceAdapter(SourceHttpClient httpClient, MobilityProperties properties) {
        this.httpClient = httpClient;
        this.settings = properties.getSources().getLanuv();
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
        Charset charset = Charset.forName(settings.getCharset());
        List<String> header = readHeader(httpClient.getText(SOURCE, fileUri(settings.getHeaderFile()), charset));
        String values = httpClient.getText(SOURCE, fileUri(settings.getValuesFile()), charset);
        Instant timestamp = context.getWindow().getUntil().truncatedTo(ChronoUnit.HOURS);

        Map<String, MobilityProperties.Station> stations = new LinkedHashMap<>();
        settings.getStations().forEach(station -> stations.put(station.getCode(), station));

        List<ObservedSensor> sensors = new ArrayList<>();
        List<ObservedDatastream> datastreams = new ArrayList<>();
        List<RawObservation> observations = new ArrayList<>();
        String[] lines = values.split("\\r?\\n");
        for (int i = VALUES_PREAMBLE; i < lines.length; i++) {
            if (!StringUtils.hasText(lines[i])) {
                continue;
            }
            List<String> cells = cells(lines[i]);
            if (cells.size() < header.size()) {
                log.warn("Skipping LANUV row with missing columns: line={}, columns={}, expected={}",
                        i + 1, cells.size(), header.size());
                continue;
            }
            MobilityProperties.Station station = stations.remove(cells.get(CODE_COLUMN));
            if (station == null) {
                continue;
            }
            ExternalId sensorId = ExternalId.of(station.getCode());
            sensors.add(ObservedSensor.builder()
                    .source(SOURCE)
                    .externalId(sensorId)
                    .description(cells.get(STATION_COLUMN))
                    .longitude(station.getLongitude())
                    .latitude(station.getLatitude())
                    .confidential(false)
                    .build());
            for (int column = CODE_COLUMN + 1; column < header.size(); column++) {
                String label = header.get(column);
                if (CATEGORIES.resolve(label).isEmpty()) {
                    continue;
                }
                datastreams.add(ObservedDatastream.builder()
                        .sensorExternalId(sensorId)
                        .categoryLabel(label)
                        .confidential(false)
                        .build());
                observations.add(RawObservation.forSensorCategory(sensorId, label, timestamp, value(cells.get(column))));
            }
        }
        if (!stations.isEmpty()) {
            log.warn("LANUV stations missing from the table: stations={}", stations.keySet());
        }
        log.info("LANUV table read: sensors={}, datastreams={}, observations={}, timestamp={}",
                sensors.size(), datastreams.size(), observations.size(), timestamp);
        return new SourceBatch(sensors, datastreams, observations);
    }

    /**
     * The column names are the first line of the header file that is not a comment.
     */
    static List<String> readHeader(String text) {
        for (String line : text.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            List<String> columns = cells(trimmed);
            if (columns.size() <= CODE_COLUMN + 1) {
                throw new MalformedPayloadException("LANUV header has no measurement columns: " + trimmed);
            }
            return columns;
        }
        throw new MalformedPayloadException("LANUV header file has no column names");
    }

    private static List<String> cells(String line) {
        List<String> cells = new ArrayList<>(Arrays.asList(line.split(";", -1)));
        // rows end with a separator
        if (!cells.isEmpty() && cells.get(cells.size() - 1).trim().isEmpty()) {
            cells.remove(cells.size() - 1);
        }
        cells.replaceAll(String::trim);
        return cells;
    }

    /**
     * Values under the detection limit come as {@code <n}; {@code -} and {@code *} mark
     * missing readings and stay non-numeric.
     */
    static String value(String cell) {
        return cell.startsWith("<") ? cell.substring(1).trim() : cell;
    }

    URI fileUri(String file) {
        String base = settings.getBaseUrl().endsWith("/") ? settings.getBaseUrl() : settings.getBaseUrl() + "/";
        return URI.create(base + file);
    }
}
