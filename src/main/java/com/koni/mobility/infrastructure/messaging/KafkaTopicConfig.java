package com.koni.mobility.infrastructure.messaging;

import com.koni.mobility.infrastructure.config.MobilityProperties;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the ingestion topic and its dead-letter topic.
 * Events are keyed by pipeline name, so events of one pipeline stay ordered.
 */
@Configuration
@ConditionalOnProperty(prefix = "mobility.kafka", name = "create-topics", havingValue = "true", matchIfMissing = true)
public class KafkaTopicConfig {

    /**
     * Creates the ingestion topic with the configured partitions and replication.
     */
    @Bean
    public NewTopic ingestionCompletedTopic(MobilityProperties properties) {
        MobilityProperties.Kafka kafka = properties.getKafka();
        return TopicBuilder.name(kafka.getIngestionTopic())
                .partitions(kafka.getPartitions())
                .replicas(kafka.getReplicationFactor())
                .build();
    }

    /**
     * Creates the dead-letter topic. One partition is enough for the few events
     * that end up there.
     */
    @Bean
    public NewTopic ingestionCompletedDeadLetterTopic(MobilityProperties properties) {
        MobilityProperties.Kafka kafka = properties.getKafka();
        return TopicBuilder.name(kafka.getDeadLetterTopic())
                .partitions(1)
                .replicas(kafka.getReplicationFactor())
                .build();
    }
}
