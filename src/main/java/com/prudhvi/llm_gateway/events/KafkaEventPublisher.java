package com.prudhvi.llm_gateway.events;

import com.prudhvi.llm_gateway.config.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes breaker transitions and completed calls to Kafka so the audit
 * log and dashboards can record them.
 *
 * Fire-and-forget: the send is not awaited. If the broker is unavailable the
 * failure is logged at WARN and dropped.
 *
 * Topic: llm-gateway.events.kafka.topic (default llm-gateway.breaker-events)
 * Key:   provider name, so each provider's events stay ordered in one partition.
 *
 * Only active when llm-gateway.events.kafka.enabled=true.
 */
@Component
@ConditionalOnProperty(prefix = "llm-gateway.events.kafka", name = "enabled", havingValue = "true")
public class KafkaEventPublisher implements GatewayEventSink {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

    private final KafkaTemplate<String, GatewayEvent> kafka;
    private final String topic;

    public KafkaEventPublisher(KafkaTemplate<String, GatewayEvent> kafka, GatewayProperties properties) {
        this.kafka = kafka;
        this.topic = properties.getEvents().getKafka().getTopic();
    }

    @Override
    public void onTransition(StateTransitionEvent event) {
        publish(event);
    }

    @Override
    public void onCallCompleted(CallCompletedEvent event) {
        publish(event);
    }

    void publish(GatewayEvent event) {
        try {
            kafka.send(topic, event.provider(), event)
                 .exceptionally(ex -> {
                     log.warn("Kafka gateway event publish failed: {}", ex.getMessage());
                     return null;
                 });
        } catch (RuntimeException e) {
            log.warn("Kafka gateway event publish failed: {}", e.getMessage());
        }
    }
}
