package com.koni.mobility.infrastructure.source.sensorcommunity;

import com.koni.mobility.application.pipeline.FetchContext;
import com.koni.mobility.application.pipeline.FetchWindow;
import com.koni.mobility.application.pipeline.SourceBatch;
import com.koni.mobility.domain.exception.MalformedPayloadException;
import com.koni.mobility.domain.model.ExternalId;
import com.koni.mobility.domain.model.ObservedDatastream;
import com.koni.mobility.domain.model.ObservedSensor;
import com.koni.mobility.domain.model.RawObservation;
import com.koni.mobility.domain.model.TypeUnit;
import com.koni.mobility.infrastructure.config.MobilityProperties;
import com.koni.mobility.infrastructure.source.SourceHttpClient;
import com.koni.mobility.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@UnitTest
class SensorCommunitySourceAdapterTest {

    private static final URI AREA = URI.create("https://sc.test/airrohr/v1/filter/area=50.776,6.084,10");

    private MockRestServiceServer server;
    private SensorCommunitySourceAdapter adapter;

    @BeforeEach
    void setUp() {
        MobilityProperties properties = new MobilityProperties();
        MobilityProperties.SensorCommunity settings = properties.getSources().getSensorCommunity();
        settings.setBaseUrl("https://sc.test/airrohr/v1/filter");
        settings.setLatitude(50.776);
        settings.setLongitude(6.084);
        settings.setRadiusKm(10.0);
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        adapter = new SensorCommunitySourceAdapter(new SourceHttpClient(restTemplate), properties);
    }

    @Test
    void shouldBuildAreaFilterUri() {
        assertThat(adapter.areaUri()).isEqualTo(AREA);
    }

    @Test
    void shouldKeyDatastreamsBySensorAndValueTypeAndSkipUnreadableEntries() throws IOException {
        // Given
        server.expect(requestTo(AREA)).andRespond(withSuccess(
                new ClassPathResource("fixtures/sensor-community/area.json").getContentAsString(StandardCharsets.UTF_8),
                MediaType.APPLICATION_JSON));

        // When
        SourceBatch batch = adapter.fetch(context());

        // Then
        server.verify();
        assertThat(batch.getSensors()).extracting(ObservedSensor::getExternalId)
                .containsExactly(ExternalId.of(3001), ExternalId.of(3002));
        ObservedSensor dustSensor = batch.getSensors().get(0);
        assertThat(dustSensor.getDescription()).isEqualTo("Nova Fitness - SDS011");
        assertThat(dustSensor.getLatitude()).isEqualTo(50.776);
        assertThat(dustSensor.getLongitude()).isEqualTo(6.084);
        assertThat(dustSensor.isConfidential()).isFalse();

        assertThat(batch.getDatastreams()).allSatisfy(datastream ->
                assertThat(datastream.getExternalId()).isEqualTo(ExternalId.UNKNOWN));
        assertThat(batch.getDatastreams()).extracting(ObservedDatastream::getCategoryLabel)
                .containsExactly("P1", "P2", "temperature", "humidity", "pressure");

        assertThat(batch.getObservations()).hasSize(6)
                .allSatisfy(observation -> assertThat(observation.addressesDatastream()).isFalse());
        assertThat(batch.getObservations()).filteredOn(o -> o.getCategoryLabel().equals("P1"))
                .extracting(RawObservation::getTimestamp)
                .containsExactly(Instant.parse("2024-03-01T11:58:04Z"), Instant.parse("2024-03-01T11:59:04Z"));
        assertThat(batch.getObservations().get(0).getRawValue()).isEqualTo("12.40");
    }

    @Test
    void shouldRejectResponseThatIsNotAnArray() {
        // Given
        server.expect(requestTo(AREA)).andRespond(withSuccess("{\"error\": \"rate\"}", MediaType.APPLICATION_JSON));

        // Then
        assertThatThrownBy(() -> adapter.fetch(context())).isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void shouldMapAirQualityValueTypes() {
        assertThat(SensorCommunitySourceAdapter.CATEGORIES.resolve("P1")).contains(new TypeUnit("PM10", "µg/m³"));
        assertThat(SensorCommunitySourceAdapter.CATEGORIES.resolve("P2")).contains(new TypeUnit("PM2.5", "µg/m³"));
        assertThat(SensorCommunitySourceAdapter.CATEGORIES.resolve("pressure")).contains(new TypeUnit("air pressure", "Pa"));
        assertThat(SensorCommunitySourceAdapter.CATEGORIES.resolve("noise_LAeq")).isEmpty();
    }

    private static FetchContext context() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        return new FetchContext(new FetchWindow(start, Instant.parse("2024-03-01T12:00:00Z")), start, ids -> Map.of());
    }
}
