package com.uxflow.gateway.infrastructure;

import com.uxflow.gateway.config.GatewayProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Process-wide identity of this gateway. Tags relayed broadcasts for loop
 * prevention and attributes shared-cache mirrors.
 */
@Component
@Slf4j
@Getter
public class GatewayInstance {

    private final String id;

    @Autowired
    public GatewayInstance(GatewayProperties properties) {
        this(resolve(properties.getInstanceId()));
    }

    public GatewayInstance(String id) {
        this.id = id;
        log.info("Gateway instance id: {}", id);
    }

    private static String resolve(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String nodeId = System.getenv("NODE_ID");
        return nodeId != null ? nodeId : UUID.randomUUID().toString().substring(0, 8);
    }
}
