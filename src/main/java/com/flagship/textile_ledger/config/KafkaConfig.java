package com.flagship.textile_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger:textile-ledger}")
    private String ledgerTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Ledger and inventory events share one topic, keyed by aggregate id.
     */
    @Bean
    public NewTopic ledgerTopic() {
        return TopicBuilder.name(ledgerTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
