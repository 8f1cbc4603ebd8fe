package com.flagship.card_autopay.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topic for lifecycle notifications (reminders, completion, failure, sync errors).
 * Keyed by card id so one card's notifications stay ordered.
 */
@Configuration
public class KafkaConfig {

    @Value("${autopay.notifications.topic:card-autopay-notifications}")
    private String notificationsTopic;

    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
