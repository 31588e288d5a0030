package com.flagship.coin_economy.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics owned or consumed by the economy service.
 *
 * ledger-events and coin-notifications are fed by the outbox publisher,
 * content-moderation is consumed to disqualify bot spends.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.notifications:coin-notifications}")
    private String notificationsTopic;

    @Value("${kafka.topic.content-moderation:content-moderation}")
    private String contentModerationTopic;

    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic contentModerationTopic() {
        return TopicBuilder.name(contentModerationTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
