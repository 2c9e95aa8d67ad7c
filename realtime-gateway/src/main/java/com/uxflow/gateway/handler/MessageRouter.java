package com.uxflow.gateway.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.Connection;
import com.uxflow.gateway.domain.DomainEvent;
import com.uxflow.gateway.domain.InboundFrame;
import com.uxflow.gateway.domain.InboundType;
import com.uxflow.gateway.domain.OutboundFrame;
import com.uxflow.gateway.exception.ProtocolError;
import com.uxflow.gateway.exception.ProtocolException;
import com.uxflow.gateway.infrastructure.RoomManager;
import com.uxflow.gateway.infrastructure.SessionRegistry;
import com.uxflow.gateway.infrastructure.SharedCacheKeys;
import com.uxflow.gateway.infrastructure.SharedStateStore;
import com.uxflow.gateway.service.DomainEventPublisher;
import com.uxflow.gateway.service.DuplicateSubmissionGuard;
import com.uxflow.gateway.service.FrameSender;
import com.uxflow.gateway.service.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Dispatches validated frames by type.
 *
 * Each handler has at most one externally visible effect (a domain event, a
 * room broadcast, or both) plus an optional reply to the sender.
 */
@Slf4j
@Component
public class MessageRouter {

    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private final RoomManager roomManager;
    private final SessionRegistry sessionRegistry;
    private final DuplicateSubmissionGuard duplicateGuard;
    private final DomainEventPublisher eventPublisher;
    private final FrameSender frameSender;
    private final SharedStateStore sharedStore;
    private final SharedCacheKeys keys;
    private final GatewayMetrics metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration cursorTtl;

    public MessageRouter(RoomManager roomManager,
                         SessionRegistry sessionRegistry,
                         DuplicateSubmissionGuard duplicateGuard,
                         DomainEventPublisher eventPublisher,
                         FrameSender frameSender,
                         SharedStateStore sharedStore,
                         SharedCacheKeys keys,
                         GatewayMetrics metricsService,
                         ObjectMapper objectMapper,
                         GatewayProperties properties,
                         Clock clock) {
        this.roomManager = roomManager;
        this.sessionRegistry = sessionRegistry;
        this.duplicateGuard = duplicateGuard;
        this.eventPublisher = eventPublisher;
        this.frameSender = frameSender;
        this.sharedStore = sharedStore;
        this.keys = keys;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.cursorTtl = properties.getSharedCache().getCursorTtl();
    }

    /**
     * @throws ProtocolException when the frame cannot be handled in the
     *         connection's current state
     */
    public CompletableFuture<Void> route(InboundFrame frame, Connection connection) {
        switch (frame.getType()) {
            case USER_MESSAGE:
                handleUserMessage(frame, connection);
                return DONE;
            case PLAN_APPROVED:
                handlePlanApproval(frame, connection);
                return DONE;
            case PLAN_FEEDBACK:
                handlePlanFeedback(frame, connection);
                return DONE;
            case IMAGE_UPLOAD:
                handleImageUpload(frame, connection);
                return DONE;
            case JOIN_PROJECT:
                return handleJoinProject(frame, connection);
            case LEAVE_PROJECT:
                handleLeaveProject(connection);
                return DONE;
            case CURSOR_POSITION:
                handleCursorPosition(frame, connection);
                return DONE;
            case PING:
                frameSender.send(connection, OutboundFrame.pong());
                return DONE;
            default:
                throw new ProtocolException(ProtocolError.UNKNOWN_TYPE, "Unknown message type: " + frame.getType());
        }
    }

    private void handleUserMessage(InboundFrame frame, Connection connection) {
        String roomId = requireRoom(frame, connection);
        if (!acquire(InboundType.USER_MESSAGE, connection, roomId)) {
            return;
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("message", frame.text("message"));
        payload.put("messageId", frame.text("messageId"));
        payload.put("qualityMode", frame.has("qualityMode") ? frame.text("qualityMode") : "standard");
        payload.put("context", plain(frame.node("context")));
        eventPublisher.publish(
                DomainEvent.of(DomainEvent.EventType.USER_MESSAGE_RECEIVED, connection, payload, clock.instant()));

        frameSender.send(connection, OutboundFrame.acknowledged(
                "message_acknowledged", "messageId", frame.text("messageId"), "processing"));

        log.info("User message forwarded: userId={}, projectId={}, messageLength={}",
                connection.getUserId(), roomId, frame.text("message") != null ? frame.text("message").length() : 0);
    }

    private void handlePlanApproval(InboundFrame frame, Connection connection) {
        String roomId = requireRoom(frame, connection);
        if (!acquire(InboundType.PLAN_APPROVED, connection, roomId)) {
            return;
        }

        String planId = frame.node("planId").asText();
        boolean approved = !frame.has("approved") || frame.node("approved").asBoolean(true);

        Map<String, Object> payload = new HashMap<>();
        payload.put("planId", planId);
        payload.put("approved", approved);
        payload.put("flowStructure", plain(frame.node("flowStructure")));
        payload.put("modifications", plain(frame.node("modifications")));
        eventPublisher.publish(
                DomainEvent.of(DomainEvent.EventType.PLAN_APPROVED, connection, payload, clock.instant()));

        frameSender.send(connection, OutboundFrame.acknowledged(
                "plan_approval_acknowledged", "planId", planId, approved ? "executing" : "rejected"));

        log.info("Plan approval forwarded: userId={}, projectId={}, planId={}, approved={}",
                connection.getUserId(), roomId, planId, approved);
    }

    private void handlePlanFeedback(InboundFrame frame, Connection connection) {
        String roomId = requireRoom(frame, connection);
        if (!acquire(InboundType.PLAN_FEEDBACK, connection, roomId)) {
            return;
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("feedback", frame.text("message"));
        payload.put("planId", frame.text("planId"));
        payload.put("originalPlan", plain(frame.node("originalPlan")));
        eventPublisher.publish(
                DomainEvent.of(DomainEvent.EventType.PLAN_FEEDBACK, connection, payload, clock.instant()));

        log.info("Plan feedback forwarded: userId={}, projectId={}", connection.getUserId(), roomId);
    }

    private void handleImageUpload(InboundFrame frame, Connection connection) {
        String roomId = requireRoom(frame, connection);
        if (!acquire(InboundType.IMAGE_UPLOAD, connection, roomId)) {
            return;
        }

        String imageData = frame.text("imageData");
        Map<String, Object> payload = new HashMap<>();
        payload.put("imageData", imageData);
        payload.put("uploadId", frame.text("uploadId"));
        payload.put("mimeType", frame.has("mimeType") ? frame.text("mimeType") : "image/png");
        payload.put("purpose", frame.has("purpose") ? frame.text("purpose") : "analysis");
        eventPublisher.publish(
                DomainEvent.of(DomainEvent.EventType.IMAGE_UPLOAD_RECEIVED, connection, payload, clock.instant()));

        frameSender.send(connection, OutboundFrame.acknowledged(
                "image_upload_acknowledged", "uploadId", frame.text("uploadId"), "analyzing"));

        log.info("Image upload forwarded: userId={}, projectId={}, imageSize={}",
                connection.getUserId(), roomId, imageData.length());
    }

    private CompletableFuture<Void> handleJoinProject(InboundFrame frame, Connection connection) {
        String newRoomId = frame.text("projectId");
        String oldRoomId = roomManager.getRoomOf(connection.getConnectionId()).orElse(null);

        roomManager.join(newRoomId, connection);
        sessionRegistry.updateRoom(connection);

        log.info("Client switched projects: userId={}, oldProjectId={}, newProjectId={}, connectionId={}",
                connection.getUserId(), oldRoomId, newRoomId, connection.getConnectionId());

        return roomManager.getGlobalMembers(newRoomId)
                .thenAccept(members -> frameSender.send(connection, OutboundFrame.joinedProject(newRoomId, members)));
    }

    private void handleLeaveProject(Connection connection) {
        String roomId = roomManager.getRoomOf(connection.getConnectionId())
                .orElseThrow(() -> new ProtocolException(ProtocolError.NOT_IN_ROOM, "Not in a project"));

        roomManager.leave(roomId, connection.getConnectionId());
        connection.moveToRoom(null);
        sessionRegistry.updateRoom(connection);
        sharedStore.delete(keys.cursor(roomId, connection.getUserId()));

        frameSender.send(connection, OutboundFrame.leftProject(roomId));
        log.info("Client left project: userId={}, projectId={}, connectionId={}",
                connection.getUserId(), roomId, connection.getConnectionId());
    }

    private void handleCursorPosition(InboundFrame frame, Connection connection) {
        String roomId = requireRoom(frame, connection);
        JsonNode position = frame.node("position");
        if (!position.isObject()) {
            throw new ProtocolException(ProtocolError.INVALID_MESSAGE, "Field 'position' must be an object");
        }

        OutboundFrame update = OutboundFrame.of("cursor_update")
                .with("userId", connection.getUserId())
                .with("projectId", roomId)
                .with("position", position)
                .with("elementId", frame.text("elementId"));
        roomManager.broadcastToRoom(roomId, update, connection.getConnectionId());

        // Presence only; a lost write is refreshed by the next move
        sharedStore.put(keys.cursor(roomId, connection.getUserId()), position.toString(), cursorTtl);
    }

    /**
     * The room the connection is in. A frame naming a different project is
     * rejected.
     */
    private String requireRoom(InboundFrame frame, Connection connection) {
        String roomId = roomManager.getRoomOf(connection.getConnectionId())
                .orElseThrow(() -> new ProtocolException(ProtocolError.NOT_IN_ROOM, "Must join project first"));
        String named = frame.text("projectId");
        if (named != null && !named.equals(roomId)) {
            throw new ProtocolException(ProtocolError.NOT_IN_ROOM, "Must join project first");
        }
        return roomId;
    }

    private boolean acquire(InboundType kind, Connection connection, String roomId) {
        if (duplicateGuard.tryAcquire(kind, connection.getUserId(), roomId)) {
            return true;
        }
        log.warn("Action already in progress, ignoring duplicate: type={}, userId={}, projectId={}",
                kind.wireName(), connection.getUserId(), roomId);
        metricsService.recordDuplicateSuppressed(kind.wireName());
        return false;
    }

    private Object plain(JsonNode node) {
        return node == null || node.isNull() ? null : objectMapper.convertValue(node, Object.class);
    }
}
