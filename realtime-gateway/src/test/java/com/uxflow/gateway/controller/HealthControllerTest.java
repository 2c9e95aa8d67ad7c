package com.uxflow.gateway.controller;

import com.uxflow.gateway.domain.Tier;
import com.uxflow.gateway.support.GatewayFixture;
import com.uxflow.gateway.support.RecordingClientChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    private GatewayFixture gateway;
    private RedisConnectionFactory connectionFactory;
    private HealthController controller;

    @BeforeEach
    void setUp() {
        gateway = GatewayFixture.single();
        connectionFactory = mock(RedisConnectionFactory.class);
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        when(redisTemplate.getConnectionFactory()).thenReturn(connectionFactory);
        controller = new HealthController(redisTemplate, gateway.gatewayInstance,
                gateway.sessionRegistry, gateway.roomManager);
    }

    @Test
    void healthyWhenRedisAnswers() {
        when(connectionFactory.getConnection()).thenReturn(mock(RedisConnection.class));
        gateway.connect("user-1", "proj-1", new RecordingClientChannel());

        Map<String, Object> health = controller.health();

        assertThat(health)
                .containsEntry("status", "healthy")
                .containsEntry("redis", "connected")
                .containsEntry("gatewayId", "gw-test")
                .containsEntry("connections", 1)
                .containsEntry("rooms", 1);
    }

    @Test
    void degradedWhenRedisIsDown() {
        when(connectionFactory.getConnection()).thenThrow(new RedisConnectionFailureException("refused"));

        assertThat(controller.health())
                .containsEntry("status", "degraded")
                .containsEntry("redis", "disconnected");
    }

    @Test
    void statsGroupConnectionsByRoomWorkspaceAndTier() {
        gateway.connect("user-1", Tier.PRO, "proj-1", new RecordingClientChannel());
        gateway.connect("user-2", Tier.PRO, "proj-1", new RecordingClientChannel());
        gateway.connect("user-3", Tier.FREE, "proj-2", new RecordingClientChannel());

        Map<String, Object> stats = controller.stats();

        assertThat(stats).containsEntry("totalConnections", 3).containsEntry("totalRooms", 2);
        assertThat(stats.get("rooms")).isEqualTo(Map.of("proj-1", 2, "proj-2", 1));
        assertThat(stats.get("connectionsByWorkspace")).isEqualTo(Map.of("workspace-1", 3));
        assertThat(stats.get("connectionsByTier")).isEqualTo(Map.of("FREE", 1, "PRO", 2));
    }
}
