package com.flagship.expense_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic carrying ledger change events.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-changes:ledger-changes}")
    private String ledgerChangesTopic;

    /**
     * Keyed by transaction id, so the three partitions keep the events of one
     * transaction in order.
     */
    @Bean
    public NewTopic ledgerChangesTopic() {
        return TopicBuilder.name(ledgerChangesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
