package com.uxflow.gateway.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Shared-cache mirror of a local connection, used for cross-process visibility
 * and crash recovery. Never holds the socket itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {
    private String connectionId;
    private String userId;
    private String roomId;
    private String workspaceId;
    private String gatewayInstanceId;
    private Instant joinedAt;

    public static SessionRecord of(Connection connection, String gatewayInstanceId) {
        return SessionRecord.builder()
                .connectionId(connection.getConnectionId())
                .userId(connection.getUserId())
                .roomId(connection.getRoomId())
                .workspaceId(connection.getWorkspaceId())
                .gatewayInstanceId(gatewayInstanceId)
                .joinedAt(connection.getConnectedAt())
                .build();
    }
}
