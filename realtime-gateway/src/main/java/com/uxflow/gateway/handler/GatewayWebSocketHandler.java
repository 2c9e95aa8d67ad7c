package com.uxflow.gateway.handler;

import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.Connection;
import com.uxflow.gateway.domain.IdentityClaims;
import com.uxflow.gateway.domain.UpgradeRequest;
import com.uxflow.gateway.exception.AdmissionFailure;
import com.uxflow.gateway.service.ConnectionGate;
import com.uxflow.gateway.service.LivenessMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * WebSocket entry point.
 *
 * Admission runs asynchronously after the upgrade. Frames are chained behind
 * the admission and behind each other, so a connection's frames are handled
 * in arrival order and only once it has been admitted.
 */
@Slf4j
@Component
public class GatewayWebSocketHandler extends TextWebSocketHandler {

    private final ConnectionGate connectionGate;
    private final InboundFramePipeline framePipeline;
    private final LivenessMonitor livenessMonitor;
    private final GatewayProperties properties;

    // wsId -> per-socket processing state
    private final Map<String, SocketContext> contexts = new ConcurrentHashMap<>();

    public GatewayWebSocketHandler(ConnectionGate connectionGate,
                                   InboundFramePipeline framePipeline,
                                   LivenessMonitor livenessMonitor,
                                   GatewayProperties properties) {
        this.connectionGate = connectionGate;
        this.framePipeline = framePipeline;
        this.livenessMonitor = livenessMonitor;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        UpgradeRequest request = (UpgradeRequest) wsSession.getAttributes().get(IdentityHandshakeInterceptor.ATTR_REQUEST);
        IdentityClaims claims = (IdentityClaims) wsSession.getAttributes().get(IdentityHandshakeInterceptor.ATTR_CLAIMS);
        if (request == null || claims == null) {
            log.warn("WebSocket connected without verified identity: wsId={}", wsSession.getId());
            wsSession.close(new CloseStatus(AdmissionFailure.UNAUTHENTICATED.closeCode(), "Authentication required"));
            return;
        }

        GatewayProperties.WebSocket limits = properties.getWebsocket();
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(
                wsSession, limits.getSendTimeLimitMs(), limits.getSendBufferBytes());

        CompletableFuture<Connection> admission =
                connectionGate.admit(request, claims, new WebSocketClientChannel(concurrent));
        contexts.put(wsSession.getId(), new SocketContext(admission));

        log.debug("WebSocket upgraded: wsId={}, userId={}, projectId={}",
                wsSession.getId(), claims.getUserId(), request.getRoomId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        SocketContext context = contexts.get(wsSession.getId());
        if (context == null) {
            return;
        }
        String payload = message.getPayload();
        context.enqueue(connection -> framePipeline.handle(payload, connection));
    }

    @Override
    protected void handlePongMessage(WebSocketSession wsSession, PongMessage message) {
        SocketContext context = contexts.get(wsSession.getId());
        if (context != null) {
            context.admission.thenAccept(livenessMonitor::markAlive);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        SocketContext context = contexts.remove(wsSession.getId());
        if (context == null) {
            return;
        }
        log.debug("WebSocket closed: wsId={}, status={}", wsSession.getId(), status);
        context.admission.thenAccept(connection ->
                connectionGate.disconnect(connection, "Client closed (" + status.getCode() + ")"));
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        log.error("WebSocket transport error: wsId={}", wsSession.getId(), exception);
    }

    private static final class SocketContext {

        private final CompletableFuture<Connection> admission;
        private CompletableFuture<Void> tail;

        private SocketContext(CompletableFuture<Connection> admission) {
            this.admission = admission;
            this.tail = admission.thenApply(connection -> null);
        }

        private synchronized void enqueue(Function<Connection, CompletableFuture<Void>> step) {
            tail = tail.thenCompose(ignored -> step.apply(admission.join()));
        }
    }
}
