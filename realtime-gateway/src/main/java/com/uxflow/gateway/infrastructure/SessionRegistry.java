package com.uxflow.gateway.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.CacheResult;
import com.uxflow.gateway.domain.Connection;
import com.uxflow.gateway.domain.SessionRecord;
import com.uxflow.gateway.exception.AdmissionException;
import com.uxflow.gateway.exception.AdmissionFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connection registry: local maps are authoritative for this instance, the
 * shared cache holds an advisory mirror for other instances and crash recovery.
 */
@Component
@Slf4j
public class SessionRegistry {

    private final ConcurrentHashMap<String, Connection> connections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> userConnections = new ConcurrentHashMap<>();

    private final SharedStateStore sharedStore;
    private final SharedCacheKeys keys;
    private final GatewayInstance gatewayInstance;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration sessionTtl;

    public SessionRegistry(SharedStateStore sharedStore,
                           SharedCacheKeys keys,
                           GatewayInstance gatewayInstance,
                           ObjectMapper objectMapper,
                           GatewayProperties properties,
                           Clock clock) {
        this.sharedStore = sharedStore;
        this.keys = keys;
        this.gatewayInstance = gatewayInstance;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sessionTtl = properties.getSharedCache().getSessionTtl();
    }

    public CompletableFuture<CacheResult<Void>> register(Connection connection) {
        return register(connection, Integer.MAX_VALUE);
    }

    /**
     * Register locally, refusing when the user already holds
     * {@code connectionLimit} local connections, then mirror to the shared cache.
     * The local check and insert are atomic per user.
     *
     * @throws AdmissionException TOO_MANY_CONNECTIONS when the local limit is reached
     */
    public CompletableFuture<CacheResult<Void>> register(Connection connection, int connectionLimit) {
        String connectionId = connection.getConnectionId();
        String userId = connection.getUserId();
        AtomicBoolean admitted = new AtomicBoolean();

        userConnections.compute(userId, (id, ids) -> {
            Set<String> current = ids != null ? ids : ConcurrentHashMap.newKeySet();
            if (current.size() < connectionLimit) {
                current.add(connectionId);
                admitted.set(true);
            }
            return current.isEmpty() ? null : current;
        });

        if (!admitted.get()) {
            throw new AdmissionException(AdmissionFailure.TOO_MANY_CONNECTIONS,
                    "Maximum " + connectionLimit + " connections reached");
        }
        connections.put(connectionId, connection);

        log.info("Session registered: connectionId={}, userId={}, roomId={}, total={}",
                connectionId, userId, connection.getRoomId(), connections.size());

        return mirror(connection).thenApply(result -> {
            if (result.isDegraded()) {
                log.warn("Session mirror degraded, continuing with local registration: connectionId={}, reason={}",
                        connectionId, result.getReason());
            }
            return result;
        });
    }

    /**
     * Best-effort: local state is removed first and unconditionally; shared
     * deletions that fail are logged, never propagated.
     */
    public CompletableFuture<CacheResult<Void>> unregister(String connectionId) {
        Connection connection = connections.remove(connectionId);
        if (connection == null) {
            return CompletableFuture.completedFuture(CacheResult.ok(null));
        }

        String userId = connection.getUserId();
        userConnections.computeIfPresent(userId, (id, ids) -> {
            ids.remove(connectionId);
            return ids.isEmpty() ? null : ids;
        });

        log.info("Session unregistered: connectionId={}, userId={}, duration={}s, total={}",
                connectionId, userId,
                Duration.between(connection.getConnectedAt(), clock.instant()).getSeconds(),
                connections.size());

        return CacheResult.allOf(
                sharedStore.delete(keys.session(connectionId)),
                sharedStore.removeMember(keys.userConnections(userId), connectionId)
        ).thenApply(result -> {
            if (result.isDegraded()) {
                log.warn("Shared session cleanup degraded, mirror will expire by TTL: connectionId={}, reason={}",
                        connectionId, result.getReason());
            }
            return result;
        });
    }

    /**
     * Local connection ids of a user.
     */
    public Set<String> lookupByUser(String userId) {
        Set<String> ids = userConnections.get(userId);
        return ids == null ? Collections.emptySet() : Set.copyOf(ids);
    }

    /**
     * Connections known for a user across the fleet: local ids united with the
     * shared per-user set. Falls back to the local view when the cache is degraded.
     */
    public CompletableFuture<Integer> countKnownConnections(String userId) {
        Set<String> local = lookupByUser(userId);
        return sharedStore.members(keys.userConnections(userId)).thenApply(result -> {
            if (result.isDegraded()) {
                log.warn("Connection count degraded to local view: userId={}, reason={}",
                        userId, result.getReason());
                return local.size();
            }
            Set<String> known = new HashSet<>(result.getValue());
            known.addAll(local);
            return known.size();
        });
    }

    /**
     * Re-arm the TTLs of a live connection's own mirror entries. Entries left
     * behind by a crashed instance are never refreshed and expire.
     */
    public CompletableFuture<CacheResult<Void>> refresh(Connection connection) {
        return CacheResult.allOf(
                sharedStore.expire(keys.session(connection.getConnectionId()), sessionTtl),
                sharedStore.addMember(keys.userConnections(connection.getUserId()),
                        connection.getConnectionId(), sessionTtl)
        );
    }

    /**
     * Rewrite the mirror after the connection switched rooms.
     */
    public CompletableFuture<CacheResult<Void>> updateRoom(Connection connection) {
        return mirror(connection);
    }

    public Optional<Connection> get(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Collection<Connection> getAll() {
        return Collections.unmodifiableCollection(connections.values());
    }

    public int size() {
        return connections.size();
    }

    private CompletableFuture<CacheResult<Void>> mirror(Connection connection) {
        String record;
        try {
            record = objectMapper.writeValueAsString(SessionRecord.of(connection, gatewayInstance.getId()));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize session record: connectionId={}", connection.getConnectionId(), e);
            return CompletableFuture.completedFuture(CacheResult.degraded("serialization failed"));
        }
        return CacheResult.allOf(
                sharedStore.put(keys.session(connection.getConnectionId()), record, sessionTtl),
                sharedStore.addMember(keys.userConnections(connection.getUserId()),
                        connection.getConnectionId(), sessionTtl)
        );
    }
}
