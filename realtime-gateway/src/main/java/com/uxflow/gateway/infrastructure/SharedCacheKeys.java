package com.uxflow.gateway.infrastructure;

import com.uxflow.gateway.config.GatewayProperties;
import org.springframework.stereotype.Component;

/**
 * Shared-cache key namespace. Every key is TTL-bounded by its writer so a
 * crashed instance's state expires on its own.
 */
@Component
public class SharedCacheKeys {

    private final String prefix;

    public SharedCacheKeys(GatewayProperties properties) {
        this.prefix = properties.getSharedCache().getKeyPrefix();
    }

    public String session(String connectionId) {
        return prefix + "session:" + connectionId;
    }

    public String userConnections(String userId) {
        return prefix + "user:" + userId + ":connections";
    }

    public String roomMembers(String roomId) {
        return prefix + "room:" + roomId + ":members";
    }

    public String rateLimit(String kind, String id) {
        return prefix + "ratelimit:" + kind + ":" + id;
    }

    public String cursor(String roomId, String userId) {
        return prefix + "cursor:" + roomId + ":" + userId;
    }

    /**
     * Member entry of a room set: {@code userId:connectionId:gatewayInstanceId}.
     */
    public static String roomMember(String userId, String connectionId, String gatewayInstanceId) {
        return userId + ":" + connectionId + ":" + gatewayInstanceId;
    }
}
