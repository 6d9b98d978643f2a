package com.donorline.dispatch.messaging;

import com.donorline.dispatch.config.KafkaTopics;
import com.donorline.dispatch.model.dto.CampaignStatusEvent;
import com.donorline.dispatch.model.dto.EmailSendEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Publishes dispatch lifecycle events as JSON. Publishing is best effort: a broker
 * problem is logged and never fails the send or status change that produced the event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DispatchEventPublisher {

    private final ObjectMapper objectMapper;
    private final KafkaTemplate<String, String> kafkaTemplate;

    public void publishSendEvent(EmailSendEvent event) {
        publish(KafkaTopics.EMAIL_SEND_EVENTS_TOPIC, event.jobId().toString(), event);
    }

    public void publishCampaignStatus(CampaignStatusEvent event) {
        publish(KafkaTopics.CAMPAIGN_EVENTS_TOPIC, event.campaignId().toString(), event);
    }

    private void publish(String topic, String key, Object event) {
        try {
            String json = objectMapper.writeValueAsString(event);
            kafkaTemplate.send(topic, key, json).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.warn("Failed to publish {} to {} for key {}", event.getClass().getSimpleName(), topic, key, ex);
                }
            });
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} to {} for key {}", event.getClass().getSimpleName(), topic, key, e);
        }
    }
}
