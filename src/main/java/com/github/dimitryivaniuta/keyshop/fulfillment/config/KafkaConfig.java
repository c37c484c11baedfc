package com.github.dimitryivaniuta.keyshop.fulfillment.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the notifications topic read by the chat-bot front end.
 *
 * <p>Keys are owner ids (or {@code operators}), so messages to one payer stay in order within a partition.
 * Nothing is created at startup when {@code spring.kafka.admin.auto-create=false}.</p>
 */
@Configuration
public class KafkaConfig {

    @Bean
    public NewTopic notificationsTopic(AppProperties props) {
        AppProperties.Outbox outbox = props.getOutbox();
        return TopicBuilder.name(outbox.getNotificationsTopic())
                .partitions(outbox.getNotificationsPartitions())
                .replicas(outbox.getNotificationsReplicas())
                .build();
    }
}
