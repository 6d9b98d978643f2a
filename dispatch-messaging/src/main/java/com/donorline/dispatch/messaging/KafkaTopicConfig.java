package com.donorline.dispatch.messaging;

import com.donorline.dispatch.config.KafkaTopics;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic auto-creation beans. Only the service profile declares topics;
 * send workers publish to them but never administer them.
 */
@Configuration
@Profile("service")
public class KafkaTopicConfig {

    @Bean
    public NewTopic emailSendEventsTopic() {
        return TopicBuilder.name(KafkaTopics.EMAIL_SEND_EVENTS_TOPIC).partitions(3).replicas(1).build();
    }

    @Bean
    public NewTopic campaignEventsTopic() {
        return TopicBuilder.name(KafkaTopics.CAMPAIGN_EVENTS_TOPIC).partitions(3).replicas(1).build();
    }
}
