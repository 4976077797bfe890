package com.koni.mobility.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of the {@code mobility.*} configuration tree.
 * Invalid values fail the application on startup.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "mobility")
public class MobilityProperties {

    private Scheduler scheduler = new Scheduler();
    @Valid
    private Ingestion ingestion = new Ingestion();
    @Valid
    private Kafka kafka = new Kafka();

    /**
     * Pipeline settings keyed by pipeline name, which equals the source adapter name.
     */
    @Valid
    private Map<String, Pipeline> pipelines = new LinkedHashMap<>();

    @Valid
    private Sources sources = new Sources();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
    }

    @Data
    public static class Ingestion {
        @Positive
        private int batchSize = 10_000;
    }

    @Data
    public static class Kafka {
        @NotBlank
        private String ingestionTopic = "mobility.ingestion.completed";
        @NotBlank
        private String deadLetterTopic = "mobility.ingestion.completed.dlq";
        @Positive
        private int partitions = 3;
        @Positive
        private short replicationFactor = 1;
        private boolean createTopics = true;
        private boolean listenerAutoStartup = true;
    }

    @Data
    public static class Pipeline {
        private boolean enabled = true;
        @NotNull
        private Duration interval = Duration.ofMinutes(15);
        @NotNull
        private Instant defaultStartTimestamp = Instant.parse("2022-01-01T00:00:00Z");
        /**
         * Total attempts per stage, the first one included.
         */
        @Min(1)
        private int maxRetryCount = 5;
        @NotNull
        private Duration retryBackoff = Duration.ofSeconds(3);
    }

    @Data
    public static class Sources {
        @Valid
        private Frost frost = new Frost();
        @Valid
        private SensorCommunity sensorCommunity = new SensorCommunity();
        @Valid
        private Lanuv lanuv = new Lanuv();
        @Valid
        private Inrix inrix = new Inrix();
        @Valid
        private Http http = new Http();
    }

    @Data
    public static class Frost {
        @NotBlank
        private String baseUrl = "https://verkehr.aachen.de/Frost-Server/api/v1.1/";
        private String username;
        private String password;
        @Positive
        private int pageSize = 1000;
    }

    @Data
    public static class SensorCommunity {
        @NotBlank
        private String baseUrl = "https://data.sensor.community/airrohr/v1/filter/";
        private double latitude = 50.775555;
        private double longitude = 6.083611;
        @Positive
        private double radiusKm = 10;
    }

    @Data
    public static class Lanuv {
        @NotBlank
        private String baseUrl = "https://www.lanuv.nrw.de/fileadmin/lanuv/luft/immissionen/aktluftqual/";
        @NotBlank
        private String valuesFile = "eu_luftqualitaet.csv";
        @NotBlank
        private String headerFile = "header_eu_luftqualitaet.csv";
        @NotBlank
        private String charset = "windows-1250";

        /**
         * Stations to keep from the state-wide table, with their fixed positions.
         */
        @Valid
        @NotEmpty
        private List<Station> stations = new ArrayList<>(List.of(
                new Station("AABU", 6.093892118595028, 50.75473752425752),
                new Station("VACW", 6.095763792588302, 50.77312781748374)));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Station {
        @NotBlank
        private String code;
        private double longitude;
        private double latitude;
    }

    @Data
    public static class Inrix {
        @NotBlank
        private String authUrl = "https://uas-api.inrix.com/v1/";
        @NotBlank
        private String segmentUrl = "https://segment-api.inrix.com/v1/";
        private String appId;
        private String hashToken;

        /**
         * GeoJSON export of the XD segments, as a Spring resource location. Segments
         * missing from it are not ingested. Without it segments have no position.
         */
        private String segmentsFile;

        private double northWestLatitude = 50.8061702;
        private double northWestLongitude = 6.0530048;
        private double southEastLatitude = 50.7414927;
        private double southEastLongitude = 6.1705204;
    }

    @Data
    public static class Http {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(60);
    }
}
