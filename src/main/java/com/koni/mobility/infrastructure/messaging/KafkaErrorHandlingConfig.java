package com.koni.mobility.infrastructure.messaging;

import com.koni.mobility.infrastructure.config.MobilityProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * Dead-letter handling for the view-refresh consumer.
 * A failing event is retried with exponential backoff (1s, 2s, 4s) and then published
 * to the dead-letter topic.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class KafkaErrorHandlingConfig {

    private static final long INITIAL_INTERVAL = 1000L;
    private static final double MULTIPLIER = 2.0;
    private static final int MAX_ATTEMPTS = 3;

    private final MobilityProperties properties;

    /**
     * Creates the error handler for the listener container.
     * Records go to partition -1 of the dead-letter topic, letting Kafka pick one.
     *
     * @param kafkaTemplate template used to publish dead letters
     * @return DefaultErrorHandler with backoff and dead-letter recovery
     */
    @Bean
    public CommonErrorHandler errorHandler(KafkaTemplate<?, ?> kafkaTemplate) {
        String deadLetterTopic = properties.getKafka().getDeadLetterTopic();
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                kafkaTemplate,
                (consumerRecord, exception) -> {
                    log.error("Sending event to DLQ after {} retries: topic={}, key={}, value={}, error={}",
                            MAX_ATTEMPTS,
                            consumerRecord.topic(),
                            consumerRecord.key(),
                            consumerRecord.value(),
                            exception.getMessage(),
                            exception);
                    return new TopicPartition(deadLetterTopic, -1);
                }
        );

        ExponentialBackOff backOff = new ExponentialBackOff(INITIAL_INTERVAL, MULTIPLIER);
        backOff.setMaxAttempts(MAX_ATTEMPTS);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);
        errorHandler.setRetryListeners((consumerRecord, exception, deliveryAttempt) ->
                log.warn("Retry attempt {} for event: topic={}, key={}, error={}",
                        deliveryAttempt,
                        consumerRecord.topic(),
                        consumerRecord.key(),
                        exception.getMessage()));
        return errorHandler;
    }
}
