package com.uxflow.gateway.service;

import com.uxflow.gateway.exception.AdmissionFailure;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gateway metrics on Micrometer.
 *
 * Counters are tagged with low-cardinality values only (reason, frame type,
 * operation); never with user, room or connection ids.
 */
@Service
@Slf4j
public class GatewayMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger activeConnections;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.activeConnections = registry.gauge("gateway.connections.active", new AtomicInteger(0));
    }

    // ===== Connections =====

    public void recordConnectionAdmitted(String userId) {
        counter("gateway.connections.admitted", Tags.empty()).increment();
        activeConnections.incrementAndGet();
        log.debug("[METRIC] Connection admitted: userId={}", userId);
    }

    public void recordConnectionRejected(AdmissionFailure failure) {
        counter("gateway.connections.rejected", Tags.of("reason", failure.name())).increment();
        log.debug("[METRIC] Connection rejected: reason={}", failure);
    }

    public void recordConnectionClosed(String userId) {
        counter("gateway.connections.closed", Tags.empty()).increment();
        activeConnections.decrementAndGet();
        log.debug("[METRIC] Connection closed: userId={}", userId);
    }

    public void recordAuthenticationAttempt(String result) {
        counter("gateway.auth.attempts", Tags.of("result", result)).increment();
    }

    public void recordConnectionTerminated() {
        counter("gateway.connections.terminated", Tags.empty()).increment();
    }

    // ===== Frames =====

    public void recordFrameReceived(String type) {
        counter("gateway.frames.received", Tags.of("type", type)).increment();
    }

    public void recordFrameRejected(String reason) {
        counter("gateway.frames.rejected", Tags.of("reason", reason)).increment();
        log.debug("[METRIC] Frame rejected: reason={}", reason);
    }

    public void recordDuplicateSuppressed(String type) {
        counter("gateway.frames.duplicates", Tags.of("type", type)).increment();
    }

    // ===== Broadcast =====

    public void recordBroadcast(int delivered, int pruned) {
        counter("gateway.broadcast.delivered", Tags.empty()).increment(delivered);
        if (pruned > 0) {
            counter("gateway.broadcast.pruned", Tags.empty()).increment(pruned);
        }
    }

    public void recordRelayPublished(boolean success) {
        counter("gateway.relay.published", Tags.of("success", String.valueOf(success))).increment();
    }

    public void recordRelayReceived(boolean ownOrigin) {
        counter("gateway.relay.received", Tags.of("own", String.valueOf(ownOrigin))).increment();
    }

    // ===== Dependencies =====

    public void recordCacheDegraded(String operation) {
        counter("gateway.shared_cache.degraded", Tags.of("operation", operation)).increment();
    }

    public void recordEventPublished(String eventType, boolean success) {
        counter("gateway.events.published",
                Tags.of("type", eventType, "success", String.valueOf(success))).increment();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public double count(String name, String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0;
    }

    private Counter counter(String name, Tags tags) {
        return registry.counter(name, tags);
    }
}
