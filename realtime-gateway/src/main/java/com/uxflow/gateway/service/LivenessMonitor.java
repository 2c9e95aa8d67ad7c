package com.uxflow.gateway.service;

import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.Connection;
import com.uxflow.gateway.domain.LivenessState;
import com.uxflow.gateway.infrastructure.RoomManager;
import com.uxflow.gateway.infrastructure.SessionRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Heartbeat state machine.
 *
 * Each tick terminates connections still PENDING_PONG from the previous tick
 * and pings the rest, moving them to PENDING_PONG. Any inbound frame or pong
 * moves a connection back to ALIVE. Pinged connections also re-arm their
 * shared-cache entries.
 */
@Service
@Slf4j
public class LivenessMonitor {

    public static final String TIMEOUT_REASON = "Liveness timeout";

    private final SessionRegistry sessionRegistry;
    private final RoomManager roomManager;
    private final ConnectionGate connectionGate;
    private final GatewayMetrics metricsService;
    private final Clock clock;
    private final Duration interval;

    private ScheduledExecutorService scheduler;

    public LivenessMonitor(SessionRegistry sessionRegistry,
                           RoomManager roomManager,
                           ConnectionGate connectionGate,
                           GatewayMetrics metricsService,
                           GatewayProperties properties,
                           Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.roomManager = roomManager;
        this.connectionGate = connectionGate;
        this.metricsService = metricsService;
        this.clock = clock;
        this.interval = properties.getLiveness().getInterval();
    }

    @PostConstruct
    public void start() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "liveness-monitor");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::safeTick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Liveness monitor started: interval={}", interval);
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            log.info("Liveness monitor stopped");
        }
    }

    /**
     * Any inbound frame or pong.
     */
    public void markAlive(Connection connection) {
        connection.markAlive(clock.instant());
    }

    public void tick() {
        int pinged = 0;
        int terminated = 0;

        for (Connection connection : sessionRegistry.getAll()) {
            if (connection.isClosed()) {
                continue;
            }
            LivenessState state = connection.getLivenessState();
            if (state == LivenessState.PENDING_PONG) {
                terminate(connection);
                terminated++;
            } else if (state == LivenessState.ALIVE) {
                connection.markPendingPong();
                if (!connection.getChannel().ping()) {
                    log.debug("Ping failed, awaiting next tick: connectionId={}", connection.getConnectionId());
                }
                sessionRegistry.refresh(connection);
                roomManager.refresh(connection);
                pinged++;
            }
        }

        log.debug("Liveness tick: pinged={}, terminated={}", pinged, terminated);
    }

    private void terminate(Connection connection) {
        connection.markTerminated();
        metricsService.recordConnectionTerminated();
        log.info("Terminating unresponsive connection: connectionId={}, userId={}, lastSeenAt={}",
                connection.getConnectionId(), connection.getUserId(), connection.getLastSeenAt());
        connectionGate.terminate(connection, ConnectionGate.CLOSE_SHUTDOWN, TIMEOUT_REASON);
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Liveness tick failed", e);
        }
    }
}
