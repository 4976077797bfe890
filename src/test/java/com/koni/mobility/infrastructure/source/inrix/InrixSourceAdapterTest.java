package com.koni.mobility.infrastructure.source.inrix;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.mobility.application.pipeline.FetchContext;
import com.koni.mobility.application.pipeline.FetchWindow;
import com.koni.mobility.application.pipeline.SourceBatch;
import com.koni.mobility.domain.exception.MalformedPayloadException;
import com.koni.mobility.domain.model.ExternalId;
import com.koni.mobility.domain.model.ObservedSensor;
import com.koni.mobility.domain.model.RawObservation;
import com.koni.mobility.domain.model.TypeUnit;
import com.koni.mobility.infrastructure.config.MobilityProperties;
import com.koni.mobility.infrastructure.source.SourceHttpClient;
import com.koni.mobility.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@UnitTest
class InrixSourceAdapterTest {

    private MobilityProperties.Inrix settings;
    private MockRestServiceServer server;
    private InrixSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        MobilityProperties properties = new MobilityProperties();
        settings = properties.getSources().getInrix();
        settings.setAuthUrl("https://uas.test/v1");
        settings.setSegmentUrl("https://segment.test/v1/");
        settings.setAppId("app-7");
        settings.setHashToken("hash-9");
        settings.setSegmentsFile("classpath:fixtures/inrix/xd-segments.geojson");
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        adapter = new InrixSourceAdapter(new SourceHttpClient(restTemplate), properties,
                new DefaultResourceLoader(), new ObjectMapper());
    }

    @Test
    void shouldRequestTokenAndSpeedsForConfiguredBox() {
        assertThat(adapter.tokenUri().toString()).isEqualTo("https://uas.test/v1/appToken?appId=app-7&hashToken=hash-9");
        assertThat(adapter.speedUri("tok-1").getPath()).isEqualTo("/v1/segments/speed");
        assertThat(adapter.speedUri("tok-1").getQuery())
                .isEqualTo("box=50.8061702|6.0530048,50.7414927|6.1705204&units=1&SpeedOutputFields=All&accesstoken=tok-1");
    }

    @Test
    void shouldReadSegmentsKnownToTheSegmentFile() throws IOException {
        // Given
        expectTokenAndSpeeds();

        // When
        SourceBatch batch = adapter.fetch(context());

        // Then unknown and unreadable segment codes are dropped
        server.verify();
        assertThat(batch.getSensors()).extracting(ObservedSensor::getExternalId)
                .containsExactly(ExternalId.of(1290453271L), ExternalId.of(1290453272L));
        ObservedSensor open = batch.getSensors().get(0);
        assertThat(open.getDescription()).isEqualTo("INRIX Speed Segment");
        assertThat(open.isConfidential()).isTrue();
        assertThat(open.getRawGeometry().getType()).isEqualTo("LineString");
        assertThat(batch.getSensors().get(1).getRawGeometry().getType()).isEqualTo("MultiLineString");

        assertThat(batch.getDatastreams()).hasSize(12)
                .allSatisfy(datastream -> assertThat(datastream.isConfidential()).isTrue());
        assertThat(batch.getObservations())
                .allSatisfy(o -> assertThat(o.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z")));
        assertThat(batch.getObservations())
                .filteredOn(o -> o.getSensorExternalId().equals(ExternalId.of(1290453271L)))
                .extracting(RawObservation::getCategoryLabel, RawObservation::getRawValue)
                .containsExactly(
                        tuple("speed", 34),
                        tuple("average", 38),
                        tuple("segmentClosed", 0.0),
                        tuple("reference", 45),
                        tuple("travelTimeMinutes", 0.421),
                        tuple("speedBucket", 2));
    }

    @Test
    void shouldTreatClosedSegmentAsStandingStill() throws IOException {
        // Given
        expectTokenAndSpeeds();

        // When
        SourceBatch batch = adapter.fetch(context());

        // Then the closed segment reports speed 0 and no travel time
        assertThat(batch.getObservations())
                .filteredOn(o -> o.getSensorExternalId().equals(ExternalId.of(1290453272L)))
                .extracting(RawObservation::getCategoryLabel, RawObservation::getRawValue)
                .containsExactly(
                        tuple("speed", 0.0),
                        tuple("average", 30),
                        tuple("segmentClosed", 1.0),
                        tuple("reference", 45),
                        tuple("speedBucket", 0));
    }

    @Test
    void shouldKeepEverySegmentWithoutSegmentFile() throws IOException {
        // Given
        settings.setSegmentsFile(null);
        expectTokenAndSpeeds();

        // When
        SourceBatch batch = adapter.fetch(context());

        // Then
        assertThat(batch.getSensors()).hasSize(3)
                .allSatisfy(sensor -> assertThat(sensor.getRawGeometry()).isNull());
    }

    @Test
    void shouldRejectTokenResponseWithoutToken() {
        // Given
        server.expect(requestTo(adapter.tokenUri()))
                .andRespond(withSuccess("{\"statusId\": 43, \"result\": null}", MediaType.APPLICATION_JSON));

        // Then
        assertThatThrownBy(() -> adapter.fetch(context())).isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void shouldRefuseToRunWithoutCredentials() {
        // Given
        settings.setHashToken("");

        // Then
        assertThatThrownBy(() -> adapter.fetch(context())).isInstanceOf(IllegalStateException.class);
        server.verify();
    }

    @Test
    void shouldMapSpeedFieldsToTypes() {
        assertThat(InrixSourceAdapter.CATEGORIES.resolve("average")).contains(new TypeUnit("average speed", "km/h"));
        assertThat(InrixSourceAdapter.CATEGORIES.resolve("travelTimeMinutes")).contains(new TypeUnit("travel time", "minutes"));
        assertThat(InrixSourceAdapter.CATEGORIES.resolve("speedBucket")).contains(new TypeUnit("level of congestion", "None"));
    }

    private void expectTokenAndSpeeds() throws IOException {
        server.expect(requestTo(adapter.tokenUri())).andRespond(withSuccess(fixture("token.json"), MediaType.APPLICATION_JSON));
        server.expect(requestTo(adapter.speedUri("tok-1"))).andRespond(withSuccess(fixture("speeds.json"), MediaType.APPLICATION_JSON));
    }

    private static String fixture(String name) throws IOException {
        return new ClassPathResource("fixtures/inrix/" + name).getContentAsString(StandardCharsets.UTF_8);
    }

    private static FetchContext context() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        return new FetchContext(new FetchWindow(start, Instant.parse("2024-03-01T12:02:00Z")), start, ids -> Map.of());
    }
}
