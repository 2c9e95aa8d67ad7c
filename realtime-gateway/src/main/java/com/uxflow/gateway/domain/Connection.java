package com.uxflow.gateway.domain;

import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A client socket accepted by this gateway instance.
 * Identity fields are fixed at admission; the room may change on a room switch.
 */
@Getter
public class Connection {

    private final String connectionId;
    private final String userId;
    private final String workspaceId;
    private final Tier tier;
    private final Instant connectedAt;
    private final ClientChannel channel;

    private volatile String roomId;
    private volatile Instant lastSeenAt;
    private volatile LivenessState livenessState = LivenessState.ALIVE;

    private final AtomicLong messageCount = new AtomicLong();
    private final AtomicLong bytesIn = new AtomicLong();
    private final AtomicLong bytesOut = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();

    public Connection(String connectionId,
                      String userId,
                      String roomId,
                      String workspaceId,
                      Tier tier,
                      ClientChannel channel,
                      Instant connectedAt) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.roomId = roomId;
        this.workspaceId = workspaceId;
        this.tier = tier;
        this.channel = channel;
        this.connectedAt = connectedAt;
        this.lastSeenAt = connectedAt;
    }

    /**
     * Write a serialized frame to the client.
     */
    public boolean send(String frame) {
        if (closed.get() || !channel.isOpen()) {
            return false;
        }
        boolean sent = channel.send(frame);
        if (sent) {
            bytesOut.addAndGet(frame.getBytes(StandardCharsets.UTF_8).length);
        }
        return sent;
    }

    public void recordInbound(int bytes) {
        messageCount.incrementAndGet();
        bytesIn.addAndGet(bytes);
    }

    public void markAlive(Instant now) {
        if (livenessState != LivenessState.TERMINATED) {
            livenessState = LivenessState.ALIVE;
        }
        lastSeenAt = now;
    }

    public void markPendingPong() {
        livenessState = LivenessState.PENDING_PONG;
    }

    public void markTerminated() {
        livenessState = LivenessState.TERMINATED;
    }

    public void moveToRoom(String roomId) {
        this.roomId = roomId;
    }

    /**
     * Flip the connection to closed. Returns true only for the first caller,
     * so disconnect cleanup runs once regardless of who triggered it.
     */
    public boolean markClosed() {
        return closed.compareAndSet(false, true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public String toString() {
        return "Connection{connectionId=" + connectionId + ", userId=" + userId
                + ", roomId=" + roomId + ", state=" + livenessState + "}";
    }
}
