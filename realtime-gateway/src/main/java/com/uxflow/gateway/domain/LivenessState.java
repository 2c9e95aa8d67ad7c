package com.uxflow.gateway.domain;

/**
 * Heartbeat state of a connection.
 */
public enum LivenessState {
    ALIVE,
    PENDING_PONG,
    TERMINATED
}
