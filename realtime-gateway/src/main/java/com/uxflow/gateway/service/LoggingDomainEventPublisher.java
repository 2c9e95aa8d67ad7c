package com.uxflow.gateway.service;

import com.uxflow.gateway.domain.DomainEvent;
import com.uxflow.gateway.infrastructure.GatewayInstance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Used when Kafka is disabled: events are only logged.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingDomainEventPublisher implements DomainEventPublisher {

    private final GatewayMetrics metricsService;
    private final GatewayInstance gatewayInstance;

    public LoggingDomainEventPublisher(GatewayMetrics metricsService, GatewayInstance gatewayInstance) {
        this.metricsService = metricsService;
        this.gatewayInstance = gatewayInstance;
    }

    @Override
    public void publish(DomainEvent event) {
        event.setGatewayId(gatewayInstance.getId());
        log.info("Domain event: type={}, userId={}, projectId={}, connectionId={}",
                event.getEventType(), event.getUserId(), event.getProjectId(), event.getConnectionId());
        metricsService.recordEventPublished(event.getEventType().name(), true);
    }
}
