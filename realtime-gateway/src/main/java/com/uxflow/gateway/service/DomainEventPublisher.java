package com.uxflow.gateway.service;

import com.uxflow.gateway.domain.DomainEvent;

/**
 * Fire-and-forget delivery of domain events to downstream consumers.
 * Implementations must not block and must not throw.
 */
public interface DomainEventPublisher {

    void publish(DomainEvent event);
}
