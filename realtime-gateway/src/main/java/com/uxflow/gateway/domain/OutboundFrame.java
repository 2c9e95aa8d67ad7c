package com.uxflow.gateway.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Server-to-client frame: {@code {type, ...fields, timestamp}}. The timestamp
 * is stamped by whoever writes the frame out.
 */
@Getter
@JsonPropertyOrder({"type", "timestamp"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutboundFrame {

    private final String type;
    private Instant timestamp;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private OutboundFrame(String type) {
        this.type = type;
    }

    public static OutboundFrame of(String type) {
        return new OutboundFrame(type);
    }

    /**
     * Set the server timestamp unless one is already set.
     */
    public OutboundFrame stamp(Instant now) {
        if (timestamp == null) {
            timestamp = now;
        }
        return this;
    }

    public OutboundFrame with(String name, Object value) {
        if (value != null) {
            fields.put(name, value);
        }
        return this;
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return fields;
    }

    public Object get(String name) {
        return fields.get(name);
    }

    // Factory methods

    public static OutboundFrame connectionEstablished(Connection connection, Instant serverTime) {
        return of("connection_established")
                .with("connectionId", connection.getConnectionId())
                .with("projectId", connection.getRoomId())
                .with("workspaceId", connection.getWorkspaceId())
                .with("connectedAt", connection.getConnectedAt())
                .with("serverTime", serverTime);
    }

    public static OutboundFrame error(String code, String message) {
        return of("error")
                .with("code", code)
                .with("message", message);
    }

    public static OutboundFrame rateLimited(long retryAfterMs, long limit) {
        return of("rate_limited")
                .with("code", "RATE_LIMITED")
                .with("message", "Maximum " + limit + " messages per window exceeded")
                .with("retryAfterMs", retryAfterMs);
    }

    public static OutboundFrame memberJoined(String userId, String roomId, int memberCount) {
        return of("member_joined")
                .with("userId", userId)
                .with("projectId", roomId)
                .with("memberCount", memberCount);
    }

    public static OutboundFrame memberLeft(String userId, String roomId, int memberCount) {
        return of("member_left")
                .with("userId", userId)
                .with("projectId", roomId)
                .with("memberCount", memberCount);
    }

    public static OutboundFrame joinedProject(String roomId, List<Map<String, String>> members) {
        return of("joined_project")
                .with("projectId", roomId)
                .with("members", members);
    }

    public static OutboundFrame leftProject(String roomId) {
        return of("left_project")
                .with("projectId", roomId);
    }

    public static OutboundFrame pong() {
        return of("pong");
    }

    public static OutboundFrame acknowledged(String type, String idField, Object id, String status) {
        return of(type)
                .with(idField, id)
                .with("status", status);
    }
}
