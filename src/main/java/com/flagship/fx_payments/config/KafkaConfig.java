package com.flagship.fx_payments.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics for the execution hand-off.
 *
 * Approved payments go out on the instructions topic; the execution provider
 * reports back on the outcomes topic.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.payment-instructions:payment-instructions}")
    private String paymentInstructionsTopic;

    @Value("${kafka.topic.execution-outcomes:payment-execution-outcomes}")
    private String executionOutcomesTopic;

    /**
     * Keyed by payment id, so instructions for one payment stay in order.
     */
    @Bean
    public NewTopic paymentInstructionsTopic() {
        return TopicBuilder.name(paymentInstructionsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic executionOutcomesTopic() {
        return TopicBuilder.name(executionOutcomesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
