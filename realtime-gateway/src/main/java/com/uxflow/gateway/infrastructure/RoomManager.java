package com.uxflow.gateway.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.CacheResult;
import com.uxflow.gateway.domain.Connection;
import com.uxflow.gateway.domain.OutboundFrame;
import com.uxflow.gateway.domain.RelayEnvelope;
import com.uxflow.gateway.service.GatewayMetrics;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Room membership and fan-out.
 *
 * Local maps hold the send capability of each member connection for as long as
 * it is in the room. The shared cache keeps a {@code userId:connectionId:gatewayId}
 * set per room for fleet-wide visibility. Broadcasts go to local members and are
 * relayed once to the other instances, which deliver locally without re-relaying.
 */
@Component
@Slf4j
public class RoomManager {

    // roomId -> (connectionId -> connection)
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Connection>> rooms = new ConcurrentHashMap<>();
    // connectionId -> roomId; a connection is in at most one room
    private final ConcurrentHashMap<String, String> connectionRooms = new ConcurrentHashMap<>();

    private final SharedStateStore sharedStore;
    private final SharedCacheKeys keys;
    private final CrossGatewayBus crossGatewayBus;
    private final GatewayInstance gatewayInstance;
    private final ObjectMapper objectMapper;
    private final GatewayMetrics metricsService;
    private final Clock clock;
    private final Duration membershipTtl;

    public RoomManager(SharedStateStore sharedStore,
                       SharedCacheKeys keys,
                       CrossGatewayBus crossGatewayBus,
                       GatewayInstance gatewayInstance,
                       ObjectMapper objectMapper,
                       GatewayMetrics metricsService,
                       GatewayProperties properties,
                       Clock clock) {
        this.sharedStore = sharedStore;
        this.keys = keys;
        this.crossGatewayBus = crossGatewayBus;
        this.gatewayInstance = gatewayInstance;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.clock = clock;
        this.membershipTtl = properties.getSharedCache().getSessionTtl();
    }

    @PostConstruct
    public void subscribeToRelay() {
        crossGatewayBus.subscribe(this::onRelay);
    }

    /**
     * Add a connection to a room, leaving its previous room first, and notify
     * the room's other members.
     */
    public CompletableFuture<CacheResult<Void>> join(String roomId, Connection connection) {
        String connectionId = connection.getConnectionId();
        String previous = connectionRooms.get(connectionId);
        if (roomId.equals(previous)) {
            return CompletableFuture.completedFuture(CacheResult.ok(null));
        }
        if (previous != null) {
            leave(previous, connectionId);
        }

        AtomicReference<Integer> size = new AtomicReference<>(0);
        rooms.compute(roomId, (id, members) -> {
            ConcurrentHashMap<String, Connection> room = members != null ? members : new ConcurrentHashMap<>();
            room.put(connectionId, connection);
            size.set(room.size());
            return room;
        });
        connectionRooms.put(connectionId, roomId);
        connection.moveToRoom(roomId);

        log.debug("Client joined room: roomId={}, connectionId={}, userId={}, roomSize={}",
                roomId, connectionId, connection.getUserId(), size.get());

        CompletableFuture<CacheResult<Void>> mirrored = sharedStore
                .addMember(keys.roomMembers(roomId), memberEntry(connection), membershipTtl)
                .thenApply(result -> logDegraded(result, "join", roomId, connectionId));

        broadcastToRoom(roomId,
                OutboundFrame.memberJoined(connection.getUserId(), roomId, size.get()),
                connectionId);

        return mirrored;
    }

    /**
     * Re-arm the TTL of a live member's entry in the shared room set. Entries
     * of connections nobody refreshes expire on their own.
     */
    public CompletableFuture<CacheResult<Void>> refresh(Connection connection) {
        String roomId = connectionRooms.get(connection.getConnectionId());
        if (roomId == null) {
            return CompletableFuture.completedFuture(CacheResult.ok(null));
        }
        return sharedStore.addMember(keys.roomMembers(roomId), memberEntry(connection), membershipTtl)
                .thenApply(result -> logDegraded(result, "refresh", roomId, connection.getConnectionId()));
    }

    /**
     * Remove a connection from a room. Unknown pairs are a no-op.
     *
     * @return true if the connection was a local member of the room
     */
    public boolean leave(String roomId, String connectionId) {
        if (roomId == null || connectionId == null) {
            return false;
        }
        AtomicReference<Connection> removed = new AtomicReference<>();
        AtomicReference<Integer> remaining = new AtomicReference<>(0);
        rooms.computeIfPresent(roomId, (id, members) -> {
            removed.set(members.remove(connectionId));
            remaining.set(members.size());
            return members.isEmpty() ? null : members;
        });
        connectionRooms.remove(connectionId, roomId);

        Connection connection = removed.get();
        if (connection == null) {
            return false;
        }

        log.debug("Client left room: roomId={}, connectionId={}, userId={}, remainingInRoom={}",
                roomId, connectionId, connection.getUserId(), remaining.get());

        sharedStore.removeMember(keys.roomMembers(roomId), memberEntry(connection))
                .thenApply(result -> logDegraded(result, "leave", roomId, connectionId));

        broadcastToRoom(roomId,
                OutboundFrame.memberLeft(connection.getUserId(), roomId, remaining.get()),
                connectionId);
        return true;
    }

    /**
     * Deliver to every local member except {@code excludeConnectionId} and relay
     * to the other gateway instances. Members whose delivery fails are removed
     * from the room.
     *
     * @return number of local members the frame was delivered to
     */
    public int broadcastToRoom(String roomId, OutboundFrame frame, String excludeConnectionId) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(frame.stamp(clock.instant()));
        } catch (JsonProcessingException e) {
            log.error("Error serializing broadcast: roomId={}, type={}", roomId, frame.getType(), e);
            return 0;
        }

        int delivered = deliverLocally(roomId, payload, excludeConnectionId);

        crossGatewayBus.publish(RelayEnvelope.builder()
                .roomId(roomId)
                .message(payload)
                .excludeConnectionId(excludeConnectionId)
                .originGatewayId(gatewayInstance.getId())
                .timestamp(clock.instant())
                .build());

        return delivered;
    }

    /**
     * Relay handler: deliver another instance's broadcast to local members only.
     */
    public void onRelay(RelayEnvelope envelope) {
        if (gatewayInstance.getId().equals(envelope.getOriginGatewayId())) {
            metricsService.recordRelayReceived(true);
            return;
        }
        metricsService.recordRelayReceived(false);
        try {
            int delivered = deliverLocally(envelope.getRoomId(), envelope.getMessage(),
                    envelope.getExcludeConnectionId());
            log.debug("Delivered relayed broadcast: roomId={}, origin={}, delivered={}",
                    envelope.getRoomId(), envelope.getOriginGatewayId(), delivered);
        } catch (Exception e) {
            log.error("Failed to handle cross-gateway broadcast: roomId={}", envelope.getRoomId(), e);
        }
    }

    private int deliverLocally(String roomId, String payload, String excludeConnectionId) {
        Map<String, Connection> members = rooms.get(roomId);
        if (members == null || members.isEmpty()) {
            log.debug("No local clients in room to broadcast to: roomId={}", roomId);
            return 0;
        }

        int delivered = 0;
        List<String> failed = new ArrayList<>();
        for (Connection member : members.values()) {
            if (member.getConnectionId().equals(excludeConnectionId)) {
                continue;
            }
            try {
                if (member.send(payload)) {
                    delivered++;
                } else {
                    failed.add(member.getConnectionId());
                }
            } catch (Exception e) {
                log.error("Failed to send message to client: connectionId={}, roomId={}",
                        member.getConnectionId(), roomId, e);
                failed.add(member.getConnectionId());
            }
        }

        for (String connectionId : failed) {
            log.info("Pruning unreachable room member: roomId={}, connectionId={}", roomId, connectionId);
            leave(roomId, connectionId);
        }

        metricsService.recordBroadcast(delivered, failed.size());
        log.debug("Broadcast to room completed: roomId={}, sent={}, failed={}, excluded={}",
                roomId, delivered, failed.size(), excludeConnectionId);
        return delivered;
    }

    // Queries

    public Optional<String> getRoomOf(String connectionId) {
        return Optional.ofNullable(connectionRooms.get(connectionId));
    }

    public Set<String> getLocalMemberIds(String roomId) {
        Map<String, Connection> members = rooms.get(roomId);
        return members == null ? Collections.emptySet() : Set.copyOf(members.keySet());
    }

    public List<Connection> getLocalMembers(String roomId) {
        Map<String, Connection> members = rooms.get(roomId);
        return members == null ? Collections.emptyList() : List.copyOf(members.values());
    }

    /**
     * Fleet-wide members of a room from the shared cache, or the local members
     * when the cache is degraded.
     */
    public CompletableFuture<List<Map<String, String>>> getGlobalMembers(String roomId) {
        return sharedStore.members(keys.roomMembers(roomId)).thenApply(result -> {
            List<Map<String, String>> members = new ArrayList<>();
            if (result.isDegraded()) {
                getLocalMembers(roomId).forEach(member -> members.add(describe(
                        member.getUserId(), member.getConnectionId(), gatewayInstance.getId())));
                return members;
            }
            for (String entry : result.getValue()) {
                String[] parts = entry.split(":", 3);
                if (parts.length == 3) {
                    members.add(describe(parts[0], parts[1], parts[2]));
                }
            }
            return members;
        });
    }

    public int getRoomCount() {
        return rooms.size();
    }

    public Map<String, Integer> getRoomSizes() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        rooms.forEach((roomId, members) -> sizes.put(roomId, members.size()));
        return sizes;
    }

    private String memberEntry(Connection connection) {
        return SharedCacheKeys.roomMember(connection.getUserId(), connection.getConnectionId(),
                gatewayInstance.getId());
    }

    private static Map<String, String> describe(String userId, String connectionId, String gatewayId) {
        Map<String, String> member = new LinkedHashMap<>();
        member.put("userId", userId);
        member.put("connectionId", connectionId);
        member.put("gatewayId", gatewayId);
        return member;
    }

    private static CacheResult<Void> logDegraded(CacheResult<?> result, String operation,
                                                 String roomId, String connectionId) {
        if (result.isDegraded()) {
            log.warn("Room membership mirror degraded: operation={}, roomId={}, connectionId={}, reason={}",
                    operation, roomId, connectionId, result.getReason());
            return CacheResult.degraded(result.getReason());
        }
        return CacheResult.ok(null);
    }
}
