package com.flagship.escort_market.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for marketplace domain events.
 * Keys are aggregate ids, so 3 partitions keep per-order ordering.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.marketplace:marketplace-events}")
    private String marketplaceTopic;

    @Bean
    @ConditionalOnProperty(name = "kafka.topic.auto-create", havingValue = "true", matchIfMissing = true)
    public NewTopic marketplaceTopic() {
        return TopicBuilder.name(marketplaceTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
