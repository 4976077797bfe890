package com.koni.mobility.infrastructure.messaging;

import com.koni.mobility.application.port.EventPublisher;
import com.koni.mobility.domain.event.IngestionCompleted;
import com.koni.mobility.infrastructure.config.MobilityProperties;
import com.koni.mobility.infrastructure.observability.IngestionMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Kafka implementation of the EventPublisher port guarded by a circuit breaker.
 *
 * Features:
 * - Uses the pipeline name as record key, so events of one pipeline stay ordered
 * - Fails fast while the circuit is OPEN instead of blocking pipeline threads on a dead broker
 * - Drops the event on failure; the next successful run triggers the same view refresh
 * - Logs circuit breaker state changes for observability
 */
@Slf4j
@Service
public class ResilientKafkaEventPublisher implements EventPublisher {

    private static final int TIMEOUT_SECONDS = 10;

    private final KafkaTemplate<String, IngestionCompleted> kafkaTemplate;
    private final CircuitBreaker circuitBreaker;
    private final IngestionMetrics metrics;
    private final String topic;

    public ResilientKafkaEventPublisher(
            KafkaTemplate<String, IngestionCompleted> kafkaTemplate,
            CircuitBreaker kafkaCircuitBreaker,
            IngestionMetrics metrics,
            MobilityProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.circuitBreaker = kafkaCircuitBreaker;
        this.metrics = metrics;
        this.topic = properties.getKafka().getIngestionTopic();

        registerCircuitBreakerEventListeners();
    }

    /**
     * Publishes an IngestionCompleted event. Never throws for broker failures.
     *
     * @param event the event to publish
     * @throws IllegalArgumentException if event is null
     */
    @Override
    public void publish(IngestionCompleted event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }

        log.debug("Publishing IngestionCompleted event with circuit breaker: pipeline={}, eventId={}",
                event.getPipeline(), event.getEventId());

        Supplier<Void> decorated = CircuitBreaker.decorateSupplier(circuitBreaker, () -> {
            publishToKafka(event);
            return null;
        });

        try {
            decorated.get();
        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker is OPEN, dropping event: pipeline={}, eventId={}",
                    event.getPipeline(), event.getEventId());
            metrics.recordEventDropped();
        } catch (RuntimeException e) {
            log.warn("Kafka publish failed, dropping event: pipeline={}, eventId={}, error={}",
                    event.getPipeline(), event.getEventId(), e.getMessage());
            metrics.recordEventDropped();
        }
    }

    private void publishToKafka(IngestionCompleted event) {
        try {
            CompletableFuture<SendResult<String, IngestionCompleted>> future =
                    kafkaTemplate.send(topic, event.getPipeline(), event);
            SendResult<String, IngestionCompleted> result = future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

            log.info("Published event to Kafka: topic={}, partition={}, offset={}, pipeline={}",
                    topic,
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getPipeline());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while publishing event " + event.getEventId(), e);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to publish event to Kafka: " + e.getMessage(), e);
        }
    }

    private void registerCircuitBreakerEventListeners() {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn(
                        "Circuit breaker state transition: {} -> {} (failure rate: {}%)",
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState(),
                        circuitBreaker.getMetrics().getFailureRate()))
                .onError(event -> log.warn("Circuit breaker recorded error: duration={}ms, error={}",
                        event.getElapsedDuration().toMillis(),
                        event.getThrowable().getClass().getSimpleName()))
                .onCallNotPermitted(event -> log.debug("Circuit breaker call not permitted (circuit is OPEN)"));
    }
}
