package com.koni.mobility.application.pipeline;

import com.koni.mobility.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@UnitTest
@ExtendWith(MockitoExtension.class)
class PipelineSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private PipelineRegistry registry;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private IngestionPipeline frost;

    @Mock
    private ScheduledFuture<?> future;

    private PipelineScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new PipelineScheduler(registry, taskScheduler, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldScheduleEachEnabledPipelineAtItsIntervalAndRunItOnTick() {
        // Given
        when(registry.enabled()).thenReturn(List.of(frost));
        when(frost.getInterval()).thenReturn(Duration.ofMinutes(15));
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(NOW), eq(Duration.ofMinutes(15)));
        when(frost.run()).thenReturn(PipelineRunResult.skipped("frost", NOW));

        // When
        scheduler.start();

        // Then
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).scheduleAtFixedRate(task.capture(), eq(NOW), eq(Duration.ofMinutes(15)));
        task.getValue().run();
        verify(frost).run();
    }

    @Test
    void shouldNotScheduleTwiceAndCancelOnStop() {
        // Given
        when(registry.enabled()).thenReturn(List.of(frost));
        when(frost.getInterval()).thenReturn(Duration.ofMinutes(5));
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        // When
        scheduler.start();
        scheduler.start();
        scheduler.stop();

        // Then
        verify(taskScheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        verify(future).cancel(false);
    }

    @Test
    void shouldKeepSchedulingWhenRunThrows() {
        // Given
        when(frost.run()).thenThrow(new IllegalStateException("boom"));
        when(frost.getName()).thenReturn("frost");

        // Then
        assertThatCode(() -> scheduler.tick(frost)).doesNotThrowAnyException();
    }
}
