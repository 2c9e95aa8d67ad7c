package com.uxflow.gateway.handler;

import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.Connection;
import com.uxflow.gateway.domain.InboundFrame;
import com.uxflow.gateway.domain.OutboundFrame;
import com.uxflow.gateway.exception.ProtocolException;
import com.uxflow.gateway.service.FrameSender;
import com.uxflow.gateway.service.FrameValidator;
import com.uxflow.gateway.service.GatewayMetrics;
import com.uxflow.gateway.service.LivenessMonitor;
import com.uxflow.gateway.service.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Per-frame processing: liveness, size limit, message rate, parse, route.
 *
 * Frames over the size or rate limit never reach the router. Any failure is
 * contained to the frame: the client gets an error frame and the connection
 * stays open. The returned future never completes exceptionally.
 */
@Slf4j
@Component
public class InboundFramePipeline {

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final FrameValidator frameValidator;
    private final RateLimiter rateLimiter;
    private final LivenessMonitor livenessMonitor;
    private final MessageRouter messageRouter;
    private final FrameSender frameSender;
    private final GatewayMetrics metricsService;
    private final GatewayProperties properties;

    public InboundFramePipeline(FrameValidator frameValidator,
                                RateLimiter rateLimiter,
                                LivenessMonitor livenessMonitor,
                                MessageRouter messageRouter,
                                FrameSender frameSender,
                                GatewayMetrics metricsService,
                                GatewayProperties properties) {
        this.frameValidator = frameValidator;
        this.rateLimiter = rateLimiter;
        this.livenessMonitor = livenessMonitor;
        this.messageRouter = messageRouter;
        this.frameSender = frameSender;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    public CompletableFuture<Void> handle(String raw, Connection connection) {
        livenessMonitor.markAlive(connection);
        try {
            frameValidator.checkSize(raw);
        } catch (ProtocolException e) {
            reject(connection, e);
            return CompletableFuture.completedFuture(null);
        }
        connection.recordInbound(raw.getBytes(StandardCharsets.UTF_8).length);

        return rateLimiter.checkMessage(connection.getConnectionId(),
                        properties.getRateLimit().limitsFor(connection.getTier()))
                .thenCompose(decision -> {
                    if (!decision.isAllowed()) {
                        log.warn("Rate limit exceeded: connectionId={}, userId={}, count={}, limit={}, local={}",
                                connection.getConnectionId(), connection.getUserId(),
                                decision.getCount(), decision.getLimit(), decision.isLocal());
                        metricsService.recordFrameRejected("RATE_LIMITED");
                        frameSender.send(connection,
                                OutboundFrame.rateLimited(decision.getRetryAfterMs(), decision.getLimit()));
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    InboundFrame frame = frameValidator.parse(raw);
                    metricsService.recordFrameReceived(frame.getType().wireName());
                    return messageRouter.route(frame, connection);
                })
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof ProtocolException) {
                        reject(connection, (ProtocolException) cause);
                    } else {
                        log.error("Error handling message: connectionId={}, userId={}",
                                connection.getConnectionId(), connection.getUserId(), cause);
                        metricsService.recordFrameRejected(INTERNAL_ERROR);
                        frameSender.send(connection, OutboundFrame.error(INTERNAL_ERROR, "Message processing failed"));
                    }
                    return null;
                });
    }

    private void reject(Connection connection, ProtocolException e) {
        log.debug("Frame rejected: connectionId={}, error={}, message={}",
                connection.getConnectionId(), e.getError(), e.getMessage());
        metricsService.recordFrameRejected(e.getError().name());
        frameSender.send(connection, OutboundFrame.error(e.getError().name(), e.getMessage()));
    }
}
