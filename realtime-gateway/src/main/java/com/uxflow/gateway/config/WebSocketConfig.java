package com.uxflow.gateway.config;

import com.uxflow.gateway.handler.GatewayWebSocketHandler;
import com.uxflow.gateway.handler.IdentityHandshakeInterceptor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final GatewayWebSocketHandler gatewayWebSocketHandler;
    private final IdentityHandshakeInterceptor identityHandshakeInterceptor;
    private final GatewayProperties properties;

    public WebSocketConfig(GatewayWebSocketHandler gatewayWebSocketHandler,
                           IdentityHandshakeInterceptor identityHandshakeInterceptor,
                           GatewayProperties properties) {
        this.gatewayWebSocketHandler = gatewayWebSocketHandler;
        this.identityHandshakeInterceptor = identityHandshakeInterceptor;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(gatewayWebSocketHandler, properties.getWebsocket().getPath())
                .addInterceptors(identityHandshakeInterceptor)
                .setAllowedOrigins(properties.getWebsocket().getAllowedOrigins());
    }

    /**
     * The container buffer is larger than the frame limit so that slightly
     * oversized frames reach the validator and get an error frame back; larger
     * ones are closed by the container with 1009.
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.getWebsocket().getMaxFrameBytes() * 2);
        container.setMaxBinaryMessageBufferSize(8192);
        return container;
    }
}
