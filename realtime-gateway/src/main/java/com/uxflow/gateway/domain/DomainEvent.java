package com.uxflow.gateway.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Event emitted to downstream consumers. Delivery is fire-and-forget.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DomainEvent {

    private EventType eventType;
    private String userId;
    private String projectId;
    private String workspaceId;
    private String connectionId;
    private String gatewayId;
    private Map<String, Object> payload;
    private Instant timestamp;

    public enum EventType {
        CLIENT_CONNECTED,
        CLIENT_DISCONNECTED,
        USER_MESSAGE_RECEIVED,
        PLAN_APPROVED,
        PLAN_FEEDBACK,
        IMAGE_UPLOAD_RECEIVED
    }

    public static DomainEvent of(EventType type,
                                 Connection connection,
                                 Map<String, Object> payload,
                                 Instant timestamp) {
        return DomainEvent.builder()
                .eventType(type)
                .userId(connection.getUserId())
                .projectId(connection.getRoomId())
                .workspaceId(connection.getWorkspaceId())
                .connectionId(connection.getConnectionId())
                .payload(payload)
                .timestamp(timestamp)
                .build();
    }
}
