package com.uxflow.gateway.service;

import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.config.GatewayProperties.TierLimits;
import com.uxflow.gateway.domain.ClientChannel;
import com.uxflow.gateway.domain.Connection;
import com.uxflow.gateway.domain.DomainEvent;
import com.uxflow.gateway.domain.IdentityClaims;
import com.uxflow.gateway.domain.OutboundFrame;
import com.uxflow.gateway.domain.UpgradeRequest;
import com.uxflow.gateway.exception.AdmissionException;
import com.uxflow.gateway.exception.AdmissionFailure;
import com.uxflow.gateway.infrastructure.RoomManager;
import com.uxflow.gateway.infrastructure.SessionRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Connect-time orchestration: identity, admission limits, session creation and
 * room join. Also owns the disconnect cleanup sequence.
 *
 * Admission order:
 * 1. identity (synchronous, during the handshake) and revocation
 * 2. simultaneous connections for the user's tier
 * 3. connection-admission rate
 * 4. room and workspace identifiers
 */
@Service
@Slf4j
public class ConnectionGate {

    public static final int CLOSE_SHUTDOWN = 1001;
    public static final int CLOSE_INTERNAL_ERROR = 1011;

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final IdentityVerifier identityVerifier;
    private final RevocationChecker revocationChecker;
    private final SessionRegistry sessionRegistry;
    private final RoomManager roomManager;
    private final RateLimiter rateLimiter;
    private final DomainEventPublisher eventPublisher;
    private final FrameSender frameSender;
    private final GatewayMetrics metricsService;
    private final GatewayProperties properties;
    private final Clock clock;

    public ConnectionGate(IdentityVerifier identityVerifier,
                          RevocationChecker revocationChecker,
                          SessionRegistry sessionRegistry,
                          RoomManager roomManager,
                          RateLimiter rateLimiter,
                          DomainEventPublisher eventPublisher,
                          FrameSender frameSender,
                          GatewayMetrics metricsService,
                          GatewayProperties properties,
                          Clock clock) {
        this.identityVerifier = identityVerifier;
        this.revocationChecker = revocationChecker;
        this.sessionRegistry = sessionRegistry;
        this.roomManager = roomManager;
        this.rateLimiter = rateLimiter;
        this.eventPublisher = eventPublisher;
        this.frameSender = frameSender;
        this.metricsService = metricsService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Verify the bearer credential carried by the upgrade URI.
     *
     * @throws AdmissionException UNAUTHENTICATED or EXPIRED
     */
    public IdentityClaims verify(UpgradeRequest request) {
        try {
            return identityVerifier.verify(request.getCredential());
        } catch (AdmissionException e) {
            metricsService.recordConnectionRejected(e.getFailure());
            throw e;
        }
    }

    /**
     * Run the admission checks for an authenticated upgrade and open the
     * connection. On rejection the channel is closed with the failure's close
     * code and the returned future completes exceptionally with an
     * {@link AdmissionException}.
     */
    public CompletableFuture<Connection> admit(UpgradeRequest request, IdentityClaims claims, ClientChannel channel) {
        String userId = claims.getUserId();
        TierLimits limits = properties.getRateLimit().limitsFor(claims.getTier());

        return revocationChecker.isRevoked(claims.getCredential())
                .thenCompose(revoked -> {
                    if (revoked) {
                        throw new AdmissionException(AdmissionFailure.REVOKED, "Token revoked");
                    }
                    return sessionRegistry.countKnownConnections(userId);
                })
                .thenCompose(known -> {
                    if (known >= limits.getMaxConnections()) {
                        throw new AdmissionException(AdmissionFailure.TOO_MANY_CONNECTIONS,
                                "Maximum " + limits.getMaxConnections() + " connections exceeded");
                    }
                    return rateLimiter.checkConnectionAdmission(userId, limits);
                })
                .thenApply(decision -> {
                    if (!decision.isAllowed()) {
                        throw new AdmissionException(AdmissionFailure.ADMISSION_RATE_LIMITED,
                                "Too many connection attempts, retry in " + decision.getRetryAfterMs() + "ms");
                    }
                    validateIdentifiers(request);
                    return open(request, claims, channel, limits);
                })
                .whenComplete((connection, ex) -> {
                    if (ex != null) {
                        reject(userId, channel, unwrap(ex));
                    }
                });
    }

    private void validateIdentifiers(UpgradeRequest request) {
        if (request.getRoomId() == null || request.getWorkspaceId() == null) {
            throw new AdmissionException(AdmissionFailure.BAD_REQUEST, "Missing projectId or workspaceId");
        }
        if (!FrameValidator.isValidIdentifier(request.getRoomId())
                || !FrameValidator.isValidIdentifier(request.getWorkspaceId())) {
            throw new AdmissionException(AdmissionFailure.BAD_REQUEST, "Invalid projectId or workspaceId");
        }
    }

    private Connection open(UpgradeRequest request, IdentityClaims claims, ClientChannel channel, TierLimits limits) {
        Connection connection = new Connection(
                UUID.randomUUID().toString(),
                claims.getUserId(),
                request.getRoomId(),
                request.getWorkspaceId(),
                claims.getTier(),
                channel,
                clock.instant());

        // Atomic per-user check; closes the race between concurrent upgrades
        sessionRegistry.register(connection, limits.getMaxConnections());
        metricsService.recordConnectionAdmitted(connection.getUserId());
        try {
            roomManager.join(request.getRoomId(), connection);

            Map<String, Object> payload = new HashMap<>();
            payload.put("tier", claims.getTier().name());
            eventPublisher.publish(
                    DomainEvent.of(DomainEvent.EventType.CLIENT_CONNECTED, connection, payload, clock.instant()));

            frameSender.send(connection, OutboundFrame.connectionEstablished(connection, clock.instant()));
        } catch (RuntimeException e) {
            disconnect(connection, "Admission failed");
            throw e;
        }

        log.info("Client connected: connectionId={}, userId={}, projectId={}, workspaceId={}, tier={}",
                connection.getConnectionId(), connection.getUserId(), connection.getRoomId(),
                connection.getWorkspaceId(), connection.getTier());
        return connection;
    }

    private void reject(String userId, ClientChannel channel, Throwable cause) {
        if (cause instanceof AdmissionException) {
            AdmissionException admission = (AdmissionException) cause;
            log.warn("Connection rejected: userId={}, reason={}, message={}",
                    userId, admission.getFailure(), admission.getMessage());
            metricsService.recordConnectionRejected(admission.getFailure());
            closeQuietly(channel, admission.getFailure().closeCode(), admission.getMessage());
        } else {
            log.error("Error admitting connection: userId={}", userId, cause);
            closeQuietly(channel, CLOSE_INTERNAL_ERROR, "Internal error");
        }
    }

    /**
     * Close the socket and run disconnect cleanup.
     */
    public CompletableFuture<Void> terminate(Connection connection, int closeCode, String reason) {
        closeQuietly(connection.getChannel(), closeCode, reason);
        return disconnect(connection, reason);
    }

    /**
     * Best-effort cleanup: leave room, release rate limiter, remove from the
     * shared cache and local maps, emit ClientDisconnected. Each step runs even
     * if an earlier one fails. Runs once per connection.
     */
    public CompletableFuture<Void> disconnect(Connection connection, String reason) {
        if (!connection.markClosed()) {
            return CompletableFuture.completedFuture(null);
        }
        String connectionId = connection.getConnectionId();
        String roomId = roomManager.getRoomOf(connectionId).orElse(connection.getRoomId());

        try {
            roomManager.getRoomOf(connectionId).ifPresent(room -> roomManager.leave(room, connectionId));
        } catch (Exception e) {
            log.error("Failed to leave room on disconnect: connectionId={}", connectionId, e);
        }

        CompletableFuture<?> limiter = step("release rate limiter", connectionId,
                () -> rateLimiter.release(connectionId));
        CompletableFuture<?> registry = step("unregister session", connectionId,
                () -> sessionRegistry.unregister(connectionId));

        try {
            Map<String, Object> payload = new HashMap<>();
            payload.put("reason", reason);
            payload.put("messageCount", connection.getMessageCount().get());
            payload.put("durationMs", Duration.between(connection.getConnectedAt(), clock.instant()).toMillis());
            eventPublisher.publish(
                    DomainEvent.of(DomainEvent.EventType.CLIENT_DISCONNECTED, connection, payload, clock.instant()));
        } catch (Exception e) {
            log.error("Failed to emit disconnect event: connectionId={}", connectionId, e);
        }

        metricsService.recordConnectionClosed(connection.getUserId());
        log.info("Client disconnected: connectionId={}, userId={}, projectId={}, reason={}",
                connectionId, connection.getUserId(), roomId, reason);

        return CompletableFuture.allOf(limiter, registry);
    }

    private CompletableFuture<?> step(String name, String connectionId, Supplier<CompletableFuture<?>> action) {
        try {
            return action.get().handle((result, ex) -> {
                if (ex != null) {
                    log.error("Cleanup step failed: step={}, connectionId={}", name, connectionId, ex);
                }
                return null;
            });
        } catch (Exception e) {
            log.error("Cleanup step failed: step={}, connectionId={}", name, connectionId, e);
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * Close every local connection with 1001 and wait briefly for cleanup.
     */
    @PreDestroy
    public void shutdown() {
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (Connection connection : sessionRegistry.getAll()) {
            pending.add(terminate(connection, CLOSE_SHUTDOWN, "Server shutting down"));
        }
        if (pending.isEmpty()) {
            return;
        }
        log.info("Closing {} connections for shutdown", pending.size());
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                    .get(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Shutdown cleanup did not complete: {}", e.getMessage());
        }
    }

    private static void closeQuietly(ClientChannel channel, int code, String reason) {
        try {
            channel.close(code, reason);
        } catch (Exception e) {
            log.debug("Error closing channel: {}", e.getMessage());
        }
    }

    static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
