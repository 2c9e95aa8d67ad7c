package com.uxflow.gateway.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.config.GatewayProperties.TierLimits;
import com.uxflow.gateway.domain.CacheResult;
import com.uxflow.gateway.domain.RateDecision;
import com.uxflow.gateway.infrastructure.SharedCacheKeys;
import com.uxflow.gateway.infrastructure.SharedStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Fixed-window counters for connection admission (per user) and inbound
 * message rate (per connection).
 *
 * Counters live in the shared cache so every gateway instance sees the same
 * count. When the shared cache is degraded the check falls back to a
 * process-local window, which only sees this instance's share of the traffic.
 */
@Service
@Slf4j
public class RateLimiter {

    static final String CONNECT = "connect";
    static final String MESSAGE = "msg";

    private final SharedStateStore sharedStore;
    private final SharedCacheKeys keys;
    private final Clock clock;
    private final Duration window;

    // Local fallback windows, keyed like the shared counters
    private final Cache<String, LocalWindow> localWindows;

    public RateLimiter(SharedStateStore sharedStore,
                       SharedCacheKeys keys,
                       GatewayProperties properties,
                       Clock clock) {
        this.sharedStore = sharedStore;
        this.keys = keys;
        this.clock = clock;
        this.window = properties.getRateLimit().getWindow();
        this.localWindows = Caffeine.newBuilder()
                .maximumSize(200_000)
                .expireAfterAccess(window.multipliedBy(2))
                .ticker(DuplicateSubmissionGuard.ticker(clock))
                .build();
    }

    /**
     * Connection admissions per user within the window.
     */
    public CompletableFuture<RateDecision> checkConnectionAdmission(String userId, TierLimits limits) {
        return check(keys.rateLimit(CONNECT, userId), limits.getConnectsPerWindow());
    }

    /**
     * Inbound frames per connection within the window. The (M+1)-th frame in a
     * window is denied.
     */
    public CompletableFuture<RateDecision> checkMessage(String connectionId, TierLimits limits) {
        return check(keys.rateLimit(MESSAGE, connectionId), limits.getMessagesPerWindow());
    }

    /**
     * Drop the per-connection message window on disconnect.
     */
    public CompletableFuture<CacheResult<Boolean>> release(String connectionId) {
        String key = keys.rateLimit(MESSAGE, connectionId);
        localWindows.invalidate(key);
        return sharedStore.delete(key);
    }

    private CompletableFuture<RateDecision> check(String key, long limit) {
        return sharedStore.increment(key, window).thenCompose(result -> {
            if (result.isDegraded()) {
                log.debug("Rate limit falling back to local window: key={}, reason={}", key, result.getReason());
                return CompletableFuture.completedFuture(checkLocally(key, limit));
            }
            long count = result.getValue();
            if (count <= limit) {
                return CompletableFuture.completedFuture(RateDecision.allow(count, limit, false));
            }
            return sharedStore.timeToLive(key).thenApply(ttl -> {
                long retryAfterMs = window.toMillis();
                if (ttl.isOk() && ttl.getValue() > 0) {
                    retryAfterMs = ttl.getValue();
                } else if (ttl.isOk()) {
                    // Counter lost its TTL; re-arm so the window can close
                    log.warn("Rate limit counter without TTL, re-arming: key={}", key);
                    sharedStore.expire(key, window);
                }
                return RateDecision.deny(count, limit, retryAfterMs, false);
            });
        });
    }

    RateDecision checkLocally(String key, long limit) {
        long now = clock.millis();
        long windowMs = window.toMillis();
        LocalWindow current = localWindows.asMap().compute(key, (k, existing) -> {
            if (existing == null || now - existing.windowStart >= windowMs) {
                return new LocalWindow(now, 1);
            }
            return new LocalWindow(existing.windowStart, existing.count + 1);
        });
        if (current.count <= limit) {
            return RateDecision.allow(current.count, limit, true);
        }
        long retryAfterMs = Math.max(0, current.windowStart + windowMs - now);
        return RateDecision.deny(current.count, limit, retryAfterMs, true);
    }

    private static final class LocalWindow {
        private final long windowStart;
        private final long count;

        private LocalWindow(long windowStart, long count) {
            this.windowStart = windowStart;
            this.count = count;
        }
    }
}
