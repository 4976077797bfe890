package com.koni.mobility.infrastructure.persistence.repository;

import com.koni.mobility.application.port.LatestMeasurementsView;
import com.koni.mobility.domain.exception.DuplicateEntityException;
import com.koni.mobility.domain.model.Datastream;
import com.koni.mobility.domain.model.ExternalId;
import com.koni.mobility.domain.model.Measurement;
import com.koni.mobility.domain.model.Sensor;
import com.koni.mobility.domain.repository.DatastreamRepository;
import com.koni.mobility.domain.repository.MeasurementRepository;
import com.koni.mobility.domain.repository.PipelineWatermarkRepository;
import com.koni.mobility.domain.repository.SensorRepository;
import com.koni.mobility.tags.IntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the persistence adapters against a real PostgreSQL schema.
 *
 * Covers what H2 cannot emulate: {@code ON CONFLICT DO NOTHING}, the partial unique
 * indexes on external ids and the latest_measurements materialized view.
 */
@IntegrationTest
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class PersistenceAdaptersIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2024-03-01T10:15:00Z");

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:16")
    )
            .withDatabaseName("mobility_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "none");
        registry.add("spring.sql.init.mode", () -> "always");
        registry.add("spring.sql.init.schema-locations", () -> "classpath:schema.sql");
    }

    @MockBean
    private KafkaTemplate<?, ?> kafkaTemplate;

    @Autowired
    private SensorRepository sensorRepository;

    @Autowired
    private DatastreamRepository datastreamRepository;

    @Autowired
    private MeasurementRepository measurementRepository;

    @Autowired
    private PipelineWatermarkRepository watermarkRepository;

    @Autowired
    private LatestMeasurementsView latestMeasurementsView;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanUp() {
        jdbcTemplate.execute("DELETE FROM measurements");
        jdbcTemplate.execute("DELETE FROM datastreams");
        jdbcTemplate.execute("DELETE FROM sensors");
        jdbcTemplate.execute("DELETE FROM pipeline_watermarks");
    }

    @Test
    void shouldIgnoreMeasurementsThatAlreadyExist() {
        // Given
        Long datastreamId = datastream(sensor("FROST", "42"), "7").getId();
        measurementRepository.insertIgnoringConflicts(List.of(new Measurement(datastreamId, T0, 12.5, false)));

        // When
        int written = measurementRepository.insertIgnoringConflicts(List.of(
                new Measurement(datastreamId, T0, 99.0, false),
                new Measurement(datastreamId, T1, 13.0, false)));

        // Then
        assertThat(written).isEqualTo(1);
        Double stored = jdbcTemplate.queryForObject(
                "SELECT value FROM measurements WHERE datastream_id = ? AND \"timestamp\" = ?",
                Double.class, datastreamId, Timestamp.from(T0));
        assertThat(stored).isEqualTo(12.5);
        assertThat(countMeasurements()).isEqualTo(2);
    }

    @Test
    void shouldReturnLatestTimestampPerDatastream() {
        // Given
        Sensor sensor = sensor("FROST", "42");
        Long first = datastream(sensor, "7").getId();
        Long second = datastream(sensor, "8").getId();
        Long empty = datastream(sensor, "9").getId();
        measurementRepository.insertIgnoringConflicts(List.of(
                new Measurement(first, T0, 1.0, false),
                new Measurement(first, T1, 2.0, false),
                new Measurement(second, T0, 3.0, false)));

        // When
        Map<Long, Instant> latest = measurementRepository.findLatestTimestamps(List.of(first, second, empty));

        // Then
        assertThat(latest).containsOnly(Map.entry(first, T1), Map.entry(second, T0));
    }

    @Test
    void shouldRejectSecondSensorWithSameSourceAndExternalId() {
        // Given
        sensor("FROST", "42");

        // When / Then
        assertThatThrownBy(() -> sensor("FROST", "42"))
                .isInstanceOf(DuplicateEntityException.class);
        assertThat(sensorRepository.findBySourceAndExternalIds("FROST", List.of(ExternalId.of(42))))
                .hasSize(1);
    }

    @Test
    void shouldAllowSameExternalIdInDifferentSourcesAndManyUnidentifiedSensors() {
        // When
        sensor("FROST", "42");
        sensor("SensorCommunity", "42");
        sensor("FROST", ExternalId.UNKNOWN_VALUE);
        sensor("FROST", ExternalId.UNKNOWN_VALUE);

        // Then
        Integer sensors = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM sensors", Integer.class);
        assertThat(sensors).isEqualTo(4);
    }

    @Test
    void shouldInsertNothingWhenBulkInsertHitsExistingSensor() {
        // Given
        sensor("FROST", "2");

        // When / Then
        assertThatThrownBy(() -> sensorRepository.insertAll(List.of(
                newSensor("FROST", "1"),
                newSensor("FROST", "2"))))
                .isInstanceOf(DuplicateEntityException.class);
        assertThat(sensorRepository.findBySourceAndExternalIds("FROST", List.of(ExternalId.of(1))))
                .isEmpty();
    }

    @Test
    void shouldKeyUnidentifiedDatastreamsBySensorAndType() {
        // Given
        Sensor sensor = sensor("SensorCommunity", "3001");
        datastreamRepository.insert(newDatastream(sensor, ExternalId.UNKNOWN_VALUE, "PM10"));

        // When / Then
        assertThatThrownBy(() -> datastreamRepository.insert(newDatastream(sensor, ExternalId.UNKNOWN_VALUE, "PM10")))
                .isInstanceOf(DuplicateEntityException.class);
        datastreamRepository.insert(newDatastream(sensor, ExternalId.UNKNOWN_VALUE, "PM2.5"));
        assertThat(datastreamRepository.findUnidentifiedBySensorIds(List.of(sensor.getId())))
                .extracting(Datastream::getType)
                .containsExactlyInAnyOrder("PM10", "PM2.5");
    }

    @Test
    void shouldScopeDatastreamLookupToSourceOfOwningSensor() {
        // Given
        datastream(sensor("FROST", "1"), "7");
        datastream(sensor("SensorCommunity", "1"), "7");

        // When
        List<Datastream> found = datastreamRepository.findBySourceAndExternalIds("FROST", List.of(ExternalId.of("7.0")));

        // Then
        assertThat(found).hasSize(1);
        assertThat(found.get(0).getExternalId()).isEqualTo(ExternalId.of(7));
    }

    @Test
    void shouldCreateAndMoveWatermark() {
        // When
        watermarkRepository.saveWatermark("frost", T0);
        watermarkRepository.saveWatermark("frost", T1);

        // Then
        assertThat(watermarkRepository.findWatermark("frost")).contains(T1);
        assertThat(watermarkRepository.findWatermark("sensor-community")).isEmpty();
    }

    @Test
    void shouldRefreshLatestMeasurementsView() {
        // Given
        Long datastreamId = datastream(sensor("FROST", "42"), "7").getId();
        measurementRepository.insertIgnoringConflicts(List.of(
                new Measurement(datastreamId, T0, 1.0, false),
                new Measurement(datastreamId, T1, 2.0, false)));

        // When
        latestMeasurementsView.refresh();

        // Then
        Double latest = jdbcTemplate.queryForObject(
                "SELECT value FROM latest_measurements WHERE datastream_id = ?", Double.class, datastreamId);
        assertThat(latest).isEqualTo(2.0);
    }

    private Sensor sensor(String source, String externalId) {
        return sensorRepository.insert(newSensor(source, externalId));
    }

    private Datastream datastream(Sensor sensor, String externalId) {
        return datastreamRepository.insert(newDatastream(sensor, externalId, "Bikes counted"));
    }

    private static Sensor newSensor(String source, String externalId) {
        return Sensor.builder()
                .source(source)
                .externalId(ExternalId.of(externalId))
                .description("test sensor")
                .longitude(6.08)
                .latitude(50.77)
                .build();
    }

    private static Datastream newDatastream(Sensor sensor, String externalId, String type) {
        return Datastream.builder()
                .sensorId(sensor.getId())
                .externalId(ExternalId.of(externalId))
                .type(type)
                .unit("count")
                .build();
    }

    private int countMeasurements() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM measurements", Integer.class);
        return count == null ? 0 : count;
    }
}
