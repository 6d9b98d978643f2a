package com.donorline.dispatch.config;

/**
 * Kafka topic name constants shared across all modules.
 * Kept out of the messaging module so publishers and consumers elsewhere
 * don't need Spring Kafka on the classpath to reference a topic.
 */
public final class KafkaTopics {

    public static final String EMAIL_SEND_EVENTS_TOPIC = "email-send-events";
    public static final String CAMPAIGN_EVENTS_TOPIC = "campaign-events";

    private KafkaTopics() {
        // constants only
    }
}
