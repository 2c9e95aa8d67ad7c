package com.uxflow.gateway.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.CacheResult;
import com.uxflow.gateway.domain.RelayEnvelope;
import com.uxflow.gateway.service.GatewayMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Cross-gateway relay over Redis PubSub.
 *
 * Publishing runs on a single dedicated thread so the caller never blocks on
 * Redis and this instance's publications leave in submission order.
 */
@Component
@Slf4j
public class RedisCrossGatewayBus implements CrossGatewayBus, MessageListener {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;
    private final GatewayMetrics metricsService;
    private final String channel;
    private final long timeoutMs;
    private final ExecutorService publishExecutor;
    private final List<Consumer<RelayEnvelope>> handlers = new CopyOnWriteArrayList<>();

    public RedisCrossGatewayBus(StringRedisTemplate redisTemplate,
                                RedisMessageListenerContainer listenerContainer,
                                ObjectMapper objectMapper,
                                GatewayMetrics metricsService,
                                GatewayProperties properties) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.channel = properties.getSharedCache().getRelayChannel();
        this.timeoutMs = properties.getSharedCache().getTimeout().toMillis();
        this.publishExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "relay-publisher");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public CompletableFuture<CacheResult<Void>> publish(RelayEnvelope envelope) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(envelope);
        } catch (Exception e) {
            log.error("Failed to serialize relay envelope: roomId={}", envelope.getRoomId(), e);
            metricsService.recordRelayPublished(false);
            return CompletableFuture.completedFuture(CacheResult.degraded("serialization failed"));
        }

        return CompletableFuture
                .supplyAsync(() -> redisTemplate.convertAndSend(channel, payload), publishExecutor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((subscribers, error) -> {
                    if (error != null) {
                        // Relay is at-most-once; the other instances simply miss this broadcast.
                        log.warn("Relay publish failed, broadcast not delivered to other gateways: roomId={}, error={}",
                                envelope.getRoomId(), error.toString());
                        metricsService.recordRelayPublished(false);
                        metricsService.recordCacheDegraded("publish");
                        return CacheResult.<Void>degraded(error.toString());
                    }
                    log.debug("Relayed broadcast: roomId={}, subscribers={}", envelope.getRoomId(), subscribers);
                    metricsService.recordRelayPublished(true);
                    return CacheResult.<Void>ok(null);
                });
    }

    @Override
    public void subscribe(Consumer<RelayEnvelope> handler) {
        boolean first = handlers.isEmpty();
        handlers.add(handler);
        if (first) {
            listenerContainer.addMessageListener(this, new ChannelTopic(channel));
            log.info("Subscribed to cross-gateway channel: {}", channel);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            RelayEnvelope envelope = objectMapper.readValue(body, RelayEnvelope.class);
            handlers.forEach(handler -> handler.accept(envelope));
        } catch (Exception e) {
            log.error("Error processing relay message: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        listenerContainer.removeMessageListener(this);
        publishExecutor.shutdown();
        try {
            if (!publishExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                publishExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            publishExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
