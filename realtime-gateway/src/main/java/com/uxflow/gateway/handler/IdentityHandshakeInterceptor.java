package com.uxflow.gateway.handler;

import com.uxflow.gateway.domain.IdentityClaims;
import com.uxflow.gateway.domain.UpgradeRequest;
import com.uxflow.gateway.exception.AdmissionException;
import com.uxflow.gateway.service.ConnectionGate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * Verifies the bearer credential before the upgrade completes. Rejected
 * upgrades get HTTP 401 and never reach the WebSocket handler.
 */
@Slf4j
@Component
public class IdentityHandshakeInterceptor implements HandshakeInterceptor {

    public static final String ATTR_REQUEST = "gateway.upgradeRequest";
    public static final String ATTR_CLAIMS = "gateway.identityClaims";

    private static final String BEARER = "Bearer ";

    private final ConnectionGate connectionGate;

    public IdentityHandshakeInterceptor(ConnectionGate connectionGate) {
        this.connectionGate = connectionGate;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        UpgradeRequest upgrade = UpgradeRequest.fromUri(request.getURI());
        if (upgrade.getCredential() == null) {
            String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
            if (header != null && header.startsWith(BEARER)) {
                upgrade.setCredential(header.substring(BEARER.length()));
            }
        }

        try {
            IdentityClaims claims = connectionGate.verify(upgrade);
            attributes.put(ATTR_REQUEST, upgrade);
            attributes.put(ATTR_CLAIMS, claims);
            return true;
        } catch (AdmissionException e) {
            log.warn("WebSocket upgrade rejected: remote={}, reason={}", request.getRemoteAddress(), e.getFailure());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               Exception exception) {
        if (exception != null) {
            log.warn("WebSocket handshake failed: remote={}", request.getRemoteAddress(), exception);
        }
    }
}
