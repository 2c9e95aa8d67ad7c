package com.uxflow.gateway.support;

import com.uxflow.gateway.domain.DomainEvent;
import com.uxflow.gateway.service.DomainEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class RecordingEventPublisher implements DomainEventPublisher {

    private final List<DomainEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(DomainEvent event) {
        events.add(event);
    }

    public List<DomainEvent> events() {
        return events;
    }

    public List<DomainEvent> ofType(DomainEvent.EventType type) {
        return events.stream().filter(event -> event.getEventType() == type).collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
