package com.uxflow.gateway.service;

import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.DomainEvent;
import com.uxflow.gateway.infrastructure.GatewayInstance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes domain events to Kafka, keyed by project so events of one room
 * stay ordered within a partition.
 *
 * Enable with: KAFKA_ENABLED=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class KafkaDomainEventPublisher implements DomainEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final GatewayMetrics metricsService;
    private final GatewayInstance gatewayInstance;
    private final String topic;

    public KafkaDomainEventPublisher(KafkaTemplate<String, Object> kafkaTemplate,
                                     GatewayMetrics metricsService,
                                     GatewayInstance gatewayInstance,
                                     GatewayProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsService = metricsService;
        this.gatewayInstance = gatewayInstance;
        this.topic = properties.getEvents().getTopic();
    }

    @Override
    public void publish(DomainEvent event) {
        event.setGatewayId(gatewayInstance.getId());
        String eventType = event.getEventType().name();
        try {
            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topic, event.getProjectId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event published successfully: type={}, topic={}, partition={}, offset={}",
                            eventType, topic,
                            result.getRecordMetadata().partition(),
                            result.getRecordMetadata().offset());
                    metricsService.recordEventPublished(eventType, true);
                } else {
                    log.error("Failed to publish event: type={}, topic={}", eventType, topic, ex);
                    metricsService.recordEventPublished(eventType, false);
                }
            });

        } catch (Exception e) {
            log.error("Error publishing event: type={}", eventType, e);
            metricsService.recordEventPublished(eventType, false);
        }
    }
}
