package com.flagship.pto_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by this service. Payroll input is owned by payroll and only consumed here.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.time-off:time-off-events}")
    private String timeOffTopic;

    /**
     * Keyed by request or balance id; 3 partitions keep per-aggregate ordering with some parallelism.
     */
    @Bean
    public NewTopic timeOffTopic() {
        return TopicBuilder.name(timeOffTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
