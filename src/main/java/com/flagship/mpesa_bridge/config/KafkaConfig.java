package com.flagship.mpesa_bridge.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    /**
     * Topic carrying completed-transaction events from the outbox to the audit mirror.
     * Events are keyed by transaction id.
     */
    @Bean
    public NewTopic transactionsTopic(@Value("${kafka.topic.transactions:transactions}") String name,
                                      @Value("${kafka.topic.partitions:3}") int partitions) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
