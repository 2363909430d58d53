package com.flagship.job_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for ledger integration events.
 * Only declared when the outbox publisher runs.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.job-ledger:job-ledger-events}")
    private String jobLedgerTopic;

    /**
     * Events are keyed by job-level aggregate id, three partitions keep
     * per-aggregate ordering while allowing parallel consumers.
     */
    @Bean
    public NewTopic jobLedgerTopic() {
        return TopicBuilder.name(jobLedgerTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
