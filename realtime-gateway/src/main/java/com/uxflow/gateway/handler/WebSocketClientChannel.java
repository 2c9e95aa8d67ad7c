package com.uxflow.gateway.handler;

import com.uxflow.gateway.domain.ClientChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link ClientChannel} over a Spring WebSocket session. The session is expected
 * to be wrapped in a {@code ConcurrentWebSocketSessionDecorator} so broadcasts
 * from several threads can write to it.
 */
@Slf4j
public class WebSocketClientChannel implements ClientChannel {

    private final WebSocketSession session;

    public WebSocketClientChannel(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public boolean send(String frame) {
        if (!session.isOpen()) {
            return false;
        }
        try {
            session.sendMessage(new TextMessage(frame));
            return true;
        } catch (IOException | RuntimeException e) {
            log.debug("Send failed: wsId={}, error={}", session.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean ping() {
        if (!session.isOpen()) {
            return false;
        }
        try {
            session.sendMessage(new PingMessage());
            return true;
        } catch (IOException | RuntimeException e) {
            log.debug("Ping failed: wsId={}, error={}", session.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.debug("Close failed: wsId={}, error={}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
