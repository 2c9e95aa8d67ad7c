package com.uxflow.gateway.service;

import com.uxflow.gateway.domain.Connection;
import com.uxflow.gateway.domain.DomainEvent;
import com.uxflow.gateway.domain.LivenessState;
import com.uxflow.gateway.support.GatewayFixture;
import com.uxflow.gateway.support.RecordingClientChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LivenessMonitorTest {

    private GatewayFixture gateway;
    private LivenessMonitor monitor;

    @BeforeEach
    void setUp() {
        gateway = GatewayFixture.single();
        monitor = gateway.livenessMonitor;
    }

    @Test
    void tickPingsAliveConnections() {
        RecordingClientChannel channel = new RecordingClientChannel();
        Connection connection = gateway.connect("user-1", "proj-1", channel);

        monitor.tick();

        assertThat(channel.getPings()).isEqualTo(1);
        assertThat(connection.getLivenessState()).isEqualTo(LivenessState.PENDING_PONG);
        assertThat(channel.isOpen()).isTrue();
    }

    @Test
    void activityBetweenTicksKeepsConnectionOpen() {
        RecordingClientChannel channel = new RecordingClientChannel();
        Connection connection = gateway.connect("user-1", "proj-1", channel);

        for (int i = 0; i < 5; i++) {
            monitor.tick();
            gateway.clock.advance(Duration.ofSeconds(30));
            monitor.markAlive(connection);
        }

        assertThat(connection.getLivenessState()).isEqualTo(LivenessState.ALIVE);
        assertThat(connection.getLastSeenAt()).isEqualTo(gateway.clock.instant());
        assertThat(channel.getPings()).isEqualTo(5);
        assertThat(gateway.sessionRegistry.get(connection.getConnectionId())).isPresent();
    }

    @Test
    void inboundFrameCountsAsActivity() {
        RecordingClientChannel channel = new RecordingClientChannel();
        Connection connection = gateway.connect("user-1", "proj-1", channel);

        monitor.tick();
        gateway.receive(connection, "{\"type\":\"ping\"}");
        monitor.tick();

        assertThat(channel.isOpen()).isTrue();
        assertThat(connection.getLivenessState()).isEqualTo(LivenessState.PENDING_PONG);
    }

    @Test
    void silentConnectionIsTerminatedOnSecondTick() {
        RecordingClientChannel silent = new RecordingClientChannel();
        RecordingClientChannel peer = new RecordingClientChannel();
        Connection connection = gateway.connect("user-1", "proj-1", silent);
        Connection other = gateway.connect("user-2", "proj-1", peer);

        monitor.tick();
        monitor.markAlive(other);
        monitor.tick();

        assertThat(silent.isOpen()).isFalse();
        assertThat(silent.getCloseCode()).isEqualTo(ConnectionGate.CLOSE_SHUTDOWN);
        assertThat(silent.getCloseReason()).isEqualTo(LivenessMonitor.TIMEOUT_REASON);
        assertThat(connection.getLivenessState()).isEqualTo(LivenessState.TERMINATED);
        assertThat(gateway.sessionRegistry.get(connection.getConnectionId())).isEmpty();
        assertThat(gateway.roomManager.getLocalMemberIds("proj-1")).containsExactly(other.getConnectionId());
        assertThat(gateway.store.containsKey(gateway.keys.session(connection.getConnectionId()))).isFalse();
        assertThat(peer.framesOfType("member_left")).hasSize(1);
        assertThat(gateway.events.ofType(DomainEvent.EventType.CLIENT_DISCONNECTED))
                .extracting(event -> event.getPayload().get("reason"))
                .containsExactly(LivenessMonitor.TIMEOUT_REASON);
        assertThat(gateway.metrics.count("gateway.connections.terminated")).isEqualTo(1.0);
    }

    @Test
    void tickRefreshesSharedSessionAndMembershipEntries() {
        RecordingClientChannel channel = new RecordingClientChannel();
        Connection connection = gateway.connect("user-1", "proj-1", channel);
        String sessionKey = gateway.keys.session(connection.getConnectionId());

        gateway.clock.advance(Duration.ofMinutes(50));
        monitor.tick();
        monitor.markAlive(connection);
        gateway.clock.advance(Duration.ofMinutes(50));

        assertThat(gateway.store.containsKey(sessionKey)).isTrue();
        assertThat(gateway.store.rawMembers(gateway.keys.userConnections("user-1")))
                .containsExactly(connection.getConnectionId());
        assertThat(gateway.store.rawMembers(gateway.keys.roomMembers("proj-1")))
                .containsExactly("user-1:" + connection.getConnectionId() + ":gw-test");
    }
}
