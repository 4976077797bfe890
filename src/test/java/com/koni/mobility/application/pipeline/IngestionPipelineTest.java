package com.koni.mobility.application.pipeline;

import com.koni.mobility.application.identity.IdentityResolver;
import com.koni.mobility.application.ingest.ObservationIngestor;
import com.koni.mobility.application.port.EventPublisher;
import com.koni.mobility.application.reconcile.CategoryMapping;
import com.koni.mobility.application.reconcile.EntityReconciler;
import com.koni.mobility.application.reconcile.GeometryResolver;
import com.koni.mobility.application.reconcile.PriorityCategoryMapping;
import com.koni.mobility.domain.event.IngestionCompleted;
import com.koni.mobility.domain.exception.MalformedPayloadException;
import com.koni.mobility.domain.exception.SourceUnavailableException;
import com.koni.mobility.domain.model.ExternalId;
import com.koni.mobility.domain.model.ObservedDatastream;
import com.koni.mobility.domain.model.ObservedSensor;
import com.koni.mobility.domain.model.RawObservation;
import com.koni.mobility.domain.model.TypeUnit;
import com.koni.mobility.domain.repository.PipelineWatermarkRepository;
import com.koni.mobility.infrastructure.config.MobilityProperties;
import com.koni.mobility.infrastructure.observability.IngestionMetrics;
import com.koni.mobility.support.InMemoryEntityStore;
import com.koni.mobility.tags.UnitTest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@UnitTest
class IngestionPipelineTest {

    private static final String SOURCE = "FROST";
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Instant DEFAULT_START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-02-01T10:00:00Z");

    private InMemoryEntityStore store;
    private InMemoryWatermarks watermarks;
    private EventPublisher eventPublisher;
    private SimpleMeterRegistry registry;
    private PipelineServices services;
    private MobilityProperties.Pipeline settings;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        watermarks = new InMemoryWatermarks();
        eventPublisher = mock(EventPublisher.class);
        registry = new SimpleMeterRegistry();
        IngestionMetrics metrics = new IngestionMetrics(registry);
        IdentityResolver identityResolver = new IdentityResolver(store, store.datastreamRepository());
        EntityReconciler reconciler = new EntityReconciler(identityResolver, store, store.datastreamRepository(),
                new GeometryResolver(), metrics);
        services = new PipelineServices(
                reconciler,
                new ObservationIngestor(store, metrics, 1000),
                new DatastreamWatermarkService(identityResolver, store),
                watermarks,
                eventPublisher,
                metrics,
                Clock.fixed(NOW, ZoneOffset.UTC));

        settings = new MobilityProperties.Pipeline();
        settings.setDefaultStartTimestamp(DEFAULT_START);
        settings.setMaxRetryCount(3);
        settings.setRetryBackoff(Duration.ofMillis(1));
    }

    @Test
    void shouldIngestBatchAdvanceWatermarkAndPublishEvent() {
        // Given
        StubAdapter adapter = new StubAdapter(context -> batch(
                RawObservation.forDatastream(ExternalId.of(100), T1, "12.5"),
                RawObservation.forDatastream(ExternalId.of(100), T1.plusSeconds(60), "13")));
        IngestionPipeline pipeline = new IngestionPipeline(adapter, settings, services);

        // When
        PipelineRunResult result = pipeline.run();

        // Then
        assertThat(result.getStatus()).isEqualTo(PipelineRunStatus.SUCCEEDED);
        assertThat(result.getWindow()).isEqualTo(new FetchWindow(DEFAULT_START, NOW));
        assertThat(result.getIngestResult().getWritten()).isEqualTo(2);
        assertThat(store.measurements()).hasSize(2);
        assertThat(watermarks.findWatermark("stub")).contains(NOW);
        assertThat(pipeline.getState()).isEqualTo(PipelineState.IDLE);
        assertThat(pipeline.getLastResult()).contains(result);
        assertThat(pipeline.getConsecutiveFailures()).isZero();

        ArgumentCaptor<IngestionCompleted> event = ArgumentCaptor.forClass(IngestionCompleted.class);
        verify(eventPublisher).publish(event.capture());
        assertThat(event.getValue().getPipeline()).isEqualTo("stub");
        assertThat(event.getValue().getWritten()).isEqualTo(2);
        assertThat(event.getValue().getWatermark()).isEqualTo(NOW);
        assertThat(registry.get("mobility.pipeline.runs.total")
                .tag("pipeline", "stub").tag("outcome", "succeeded").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldLeaveWatermarkUnchangedWhenFetchTimesOutOnEveryRetryAndRequestSameWindowNextTime() {
        // Given
        watermarks.saveWatermark("stub", T1);
        StubAdapter adapter = new StubAdapter(context -> {
            throw new SourceUnavailableException(SOURCE, "read timed out");
        });
        IngestionPipeline pipeline = new IngestionPipeline(adapter, settings, services);

        // When
        PipelineRunResult first = pipeline.run();
        PipelineRunResult second = pipeline.run();

        // Then
        assertThat(first.getStatus()).isEqualTo(PipelineRunStatus.FAILED);
        assertThat(first.getFailedStage()).isEqualTo(PipelineState.FETCHING);
        assertThat(adapter.calls.get()).isEqualTo(2 * settings.getMaxRetryCount());
        assertThat(watermarks.findWatermark("stub")).contains(T1);
        assertThat(adapter.contexts).extracting(context -> context.getWindow().getFrom()).containsOnly(T1);
        assertThat(second.getWindow()).isEqualTo(first.getWindow());
        assertThat(pipeline.getConsecutiveFailures()).isEqualTo(2);
        verify(eventPublisher, never()).publish(any());
    }

    @Test
    void shouldNotRetryMalformedPayload() {
        // Given
        StubAdapter adapter = new StubAdapter(context -> {
            throw new MalformedPayloadException("not JSON");
        });
        IngestionPipeline pipeline = new IngestionPipeline(adapter, settings, services);

        // When
        PipelineRunResult result = pipeline.run();

        // Then
        assertThat(result.getStatus()).isEqualTo(PipelineRunStatus.FAILED);
        assertThat(result.getMessage()).isEqualTo("not JSON");
        assertThat(adapter.calls.get()).isEqualTo(1);
        assertThat(watermarks.findWatermark("stub")).isEmpty();
    }

    @Test
    void shouldRecoverWhenSourceComesBackWithinRetries() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        StubAdapter adapter = new StubAdapter(context -> {
            if (attempts.incrementAndGet() < 3) {
                throw new SourceUnavailableException(SOURCE, "503");
            }
            return batch(RawObservation.forDatastream(ExternalId.of(100), T1, 1));
        });
        IngestionPipeline pipeline = new IngestionPipeline(adapter, settings, services);

        // When
        PipelineRunResult result = pipeline.run();

        // Then
        assertThat(result.isSucceeded()).isTrue();
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(watermarks.findWatermark("stub")).contains(NOW);
    }

    @Test
    void shouldCountObservationsOfUnknownDatastreamsAsUnresolved() {
        // Given
        StubAdapter adapter = new StubAdapter(context -> batch(
                RawObservation.forDatastream(ExternalId.of(100), T1, 1),
                RawObservation.forDatastream(ExternalId.of(555), T1, 2)));
        IngestionPipeline pipeline = new IngestionPipeline(adapter, settings, services);

        // When
        PipelineRunResult result = pipeline.run();

        // Then
        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.getUnresolvedObservations()).isEqualTo(1);
        assertThat(result.getIngestResult().getWritten()).isEqualTo(1);
    }

    @Test
    void shouldNotPublishWhenNothingWasWrittenAndSucceedWhenPublishingFails() {
        // Given
        doThrow(new IllegalStateException("broker down")).when(eventPublisher).publish(any());
        StubAdapter adapter = new StubAdapter(context -> batch(RawObservation.forDatastream(ExternalId.of(100), T1, 1)));
        IngestionPipeline pipeline = new IngestionPipeline(adapter, settings, services);

        // When
        PipelineRunResult first = pipeline.run();
        PipelineRunResult second = pipeline.run();

        // Then
        assertThat(first.isSucceeded()).isTrue();
        assertThat(second.isSucceeded()).isTrue();
        assertThat(second.getIngestResult().getWritten()).isZero();
        assertThat(second.getIngestResult().getSkippedDuplicate()).isEqualTo(1);
        verify(eventPublisher).publish(any());
    }

    @Test
    void shouldOfferLatestStoredTimestampAsPerDatastreamStart() {
        // Given
        List<Map<ExternalId, Instant>> starts = new ArrayList<>();
        StubAdapter adapter = new StubAdapter(context -> {
            starts.add(context.datastreamStarts(List.of(ExternalId.of(100), ExternalId.of(101))));
            return batch(RawObservation.forDatastream(ExternalId.of(100), T1, 1));
        });
        IngestionPipeline pipeline = new IngestionPipeline(adapter, settings, services);

        // When
        pipeline.run();
        pipeline.run();

        // Then
        assertThat(starts.get(0)).containsEntry(ExternalId.of(100), DEFAULT_START)
                .containsEntry(ExternalId.of(101), DEFAULT_START);
        assertThat(starts.get(1)).containsEntry(ExternalId.of(100), T1)
                .containsEntry(ExternalId.of(101), DEFAULT_START);
    }

    @Test
    void shouldSkipRunWhilePreviousRunIsStillInProgress() throws Exception {
        // Given
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        StubAdapter adapter = new StubAdapter(context -> {
            fetching.countDown();
            awaitQuietly(release);
            return batch();
        });
        IngestionPipeline pipeline = new IngestionPipeline(adapter, settings, services);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<PipelineRunResult> slow = executor.submit(pipeline::run);
            assertThat(fetching.await(5, TimeUnit.SECONDS)).isTrue();
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> pipeline.getState() == PipelineState.FETCHING);

            // When
            PipelineRunResult overlapping = pipeline.run();
            release.countDown();

            // Then
            assertThat(overlapping.getStatus()).isEqualTo(PipelineRunStatus.SKIPPED);
            assertThat(slow.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(PipelineRunStatus.SUCCEEDED);
            assertThat(adapter.calls.get()).isEqualTo(1);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    private static SourceBatch batch(RawObservation... observations) {
        List<ObservedSensor> sensors = List.of(ObservedSensor.builder()
                .source(SOURCE).externalId(ExternalId.of(1)).description("crossing").build());
        List<ObservedDatastream> datastreams = List.of(ObservedDatastream.builder()
                .sensorExternalId(ExternalId.of(1)).externalId(ExternalId.of(100)).categoryLabel("Bike").build());
        return new SourceBatch(sensors, datastreams, List.of(observations));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class StubAdapter implements SourceAdapter {

        private static final CategoryMapping CATEGORIES = PriorityCategoryMapping.builder()
                .labels(new TypeUnit("bike traffic measurement", "Bikes counted"), "Bike")
                .build();

        private final Function<FetchContext, SourceBatch> behaviour;
        private final AtomicInteger calls = new AtomicInteger();
        private final List<FetchContext> contexts = new ArrayList<>();

        private StubAdapter(Function<FetchContext, SourceBatch> behaviour) {
            this.behaviour = behaviour;
        }

        @Override
        public String name() {
            return "stub";
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
            calls.incrementAndGet();
            synchronized (contexts) {
                contexts.add(context);
            }
            return behaviour.apply(context);
        }
    }

    private static final class InMemoryWatermarks implements PipelineWatermarkRepository {

        private final Map<String, Instant> watermarks = new ConcurrentHashMap<>();

        @Override
        public Optional<Instant> findWatermark(String pipeline) {
            return Optional.ofNullable(watermarks.get(pipeline));
        }

        @Override
        public void saveWatermark(String pipeline, Instant watermark) {
            watermarks.put(pipeline, watermark);
        }
    }
}
