package com.uxflow.gateway.infrastructure;

import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.CacheResult;
import com.uxflow.gateway.service.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RAtomicLong;
import org.redisson.api.RSetCache;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Redis-backed shared state through Redisson's async API.
 * Every call carries the configured deadline; timeout counts as failure.
 */
@Component
@Slf4j
public class RedissonSharedStateStore implements SharedStateStore {

    private final RedissonClient redissonClient;
    private final GatewayMetrics metricsService;
    private final long timeoutMs;

    public RedissonSharedStateStore(RedissonClient redissonClient,
                                    GatewayMetrics metricsService,
                                    GatewayProperties properties) {
        this.redissonClient = redissonClient;
        this.metricsService = metricsService;
        this.timeoutMs = properties.getSharedCache().getTimeout().toMillis();
    }

    @Override
    public CompletableFuture<CacheResult<Void>> put(String key, String value, Duration ttl) {
        return call("put", key, () -> redissonClient.<String>getBucket(key, StringCodec.INSTANCE)
                .setAsync(value, ttl.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public CompletableFuture<CacheResult<Boolean>> exists(String key) {
        return call("exists", key, () -> redissonClient.getBucket(key, StringCodec.INSTANCE).isExistsAsync());
    }

    @Override
    public CompletableFuture<CacheResult<Boolean>> delete(String key) {
        return call("delete", key, () -> redissonClient.getBucket(key, StringCodec.INSTANCE).deleteAsync());
    }

    @Override
    public CompletableFuture<CacheResult<Boolean>> expire(String key, Duration ttl) {
        return call("expire", key, () -> redissonClient.getBucket(key, StringCodec.INSTANCE).expireAsync(ttl));
    }

    @Override
    public CompletableFuture<CacheResult<Void>> addMember(String key, String member, Duration ttl) {
        return call("addMember", key, () -> {
            RSetCache<String> set = redissonClient.getSetCache(key, StringCodec.INSTANCE);
            return set.addAsync(member, ttl.toMillis(), TimeUnit.MILLISECONDS)
                    .thenApply(added -> (Void) null);
        });
    }

    @Override
    public CompletableFuture<CacheResult<Boolean>> removeMember(String key, String member) {
        return call("removeMember", key, () -> redissonClient.<String>getSetCache(key, StringCodec.INSTANCE)
                .removeAsync(member));
    }

    @Override
    public CompletableFuture<CacheResult<Set<String>>> members(String key) {
        return call("members", key, () -> redissonClient.<String>getSetCache(key, StringCodec.INSTANCE)
                .readAllAsync()
                .thenApply(members -> (Set<String>) new HashSet<>(members)));
    }

    @Override
    public CompletableFuture<CacheResult<Long>> increment(String key, Duration window) {
        return call("increment", key, () -> {
            RAtomicLong counter = redissonClient.getAtomicLong(key);
            return counter.incrementAndGetAsync().thenCompose(count -> {
                if (count == 1L) {
                    return counter.expireAsync(window).thenApply(ignored -> count);
                }
                return CompletableFuture.completedFuture(count);
            });
        });
    }

    @Override
    public CompletableFuture<CacheResult<Long>> timeToLive(String key) {
        return call("timeToLive", key, () -> redissonClient.getBucket(key).remainTimeToLiveAsync());
    }

    private <T> CompletableFuture<CacheResult<T>> call(String operation,
                                                       String key,
                                                       StageSupplier<T> supplier) {
        CompletionStage<T> stage;
        try {
            stage = supplier.get();
        } catch (Exception e) {
            return CompletableFuture.completedFuture(degrade(operation, key, e));
        }
        return stage.toCompletableFuture()
                .thenApply(CacheResult::ok)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(e -> degrade(operation, key, e));
    }

    private <T> CacheResult<T> degrade(String operation, String key, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;
        String reason = cause instanceof TimeoutException
                ? "timeout after " + timeoutMs + "ms"
                : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        metricsService.recordCacheDegraded(operation);
        log.warn("Shared cache degraded: operation={}, key={}, reason={}", operation, key, reason);
        return CacheResult.degraded(reason);
    }

    @FunctionalInterface
    private interface StageSupplier<T> {
        CompletionStage<T> get();
    }
}
