package com.uxflow.gateway.controller;

import com.uxflow.gateway.domain.Connection;
import com.uxflow.gateway.infrastructure.GatewayInstance;
import com.uxflow.gateway.infrastructure.RoomManager;
import com.uxflow.gateway.infrastructure.SessionRegistry;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final StringRedisTemplate redisTemplate;
    private final GatewayInstance gatewayInstance;
    private final SessionRegistry sessionRegistry;
    private final RoomManager roomManager;

    public HealthController(StringRedisTemplate redisTemplate,
                            GatewayInstance gatewayInstance,
                            SessionRegistry sessionRegistry,
                            RoomManager roomManager) {
        this.redisTemplate = redisTemplate;
        this.gatewayInstance = gatewayInstance;
        this.sessionRegistry = sessionRegistry;
        this.roomManager = roomManager;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("gatewayId", gatewayInstance.getId());
        response.put("connections", sessionRegistry.size());
        response.put("rooms", roomManager.getRoomCount());

        try (RedisConnection connection = redisTemplate.getConnectionFactory().getConnection()) {
            connection.ping();
            response.put("redis", "connected");
            response.put("status", "healthy");
        } catch (Exception e) {
            response.put("redis", "disconnected");
            response.put("status", "degraded");
        }

        return response;
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        Map<String, Integer> byWorkspace = new TreeMap<>();
        Map<String, Integer> byTier = new TreeMap<>();
        for (Connection connection : sessionRegistry.getAll()) {
            byWorkspace.merge(connection.getWorkspaceId(), 1, Integer::sum);
            byTier.merge(connection.getTier().name(), 1, Integer::sum);
        }

        Map<String, Object> response = new HashMap<>();
        response.put("gatewayId", gatewayInstance.getId());
        response.put("totalConnections", sessionRegistry.size());
        response.put("totalRooms", roomManager.getRoomCount());
        response.put("rooms", roomManager.getRoomSizes());
        response.put("connectionsByWorkspace", byWorkspace);
        response.put("connectionsByTier", byTier);
        return response;
    }
}
