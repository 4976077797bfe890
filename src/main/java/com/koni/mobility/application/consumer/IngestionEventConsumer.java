package com.koni.mobility.application.consumer;

import com.koni.mobility.application.port.LatestMeasurementsView;
import com.koni.mobility.domain.event.IngestionCompleted;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

/**
 * Keeps the latest-measurements view current by refreshing it after each ingestion
 * that wrote data. Offsets are committed manually once the refresh succeeded; a failed
 * refresh is retried by the container and finally dead-lettered.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionEventConsumer {

    private final LatestMeasurementsView latestMeasurementsView;

    @KafkaListener(
            topics = "${mobility.kafka.ingestion-topic}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory",
            autoStartup = "${mobility.kafka.listener-auto-startup:true}"
    )
    public void consume(IngestionCompleted event, Acknowledgment acknowledgment) {
        log.debug("Received IngestionCompleted event: {}", event);

        if (event.getWritten() == 0) {
            log.debug("Nothing written, view refresh not needed: pipeline={}, eventId={}",
                    event.getPipeline(), event.getEventId());
            acknowledgment.acknowledge();
            return;
        }

        try {
            latestMeasurementsView.refresh();
            log.info("Latest measurements view refreshed: pipeline={}, written={}, eventId={}",
                    event.getPipeline(), event.getWritten(), event.getEventId());
            acknowledgment.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error refreshing latest measurements view for event: {}", event, e);
            throw e;
        }
    }
}
