package com.uxflow.gateway.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Broadcast relayed between gateway instances over the cross-gateway channel.
 * {@code message} is the already-serialized client frame.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelayEnvelope {
    private String roomId;
    private String message;
    private String excludeConnectionId;
    private String originGatewayId;
    private Instant timestamp;
}
