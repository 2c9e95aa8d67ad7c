package com.uxflow.gateway.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.InboundType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Suppresses repeated submissions of the same kind of action by the same user
 * in the same room within a short cooldown.
 */
@Service
@Slf4j
public class DuplicateSubmissionGuard {

    // kind:userId:roomId -> first submission time
    private final Cache<String, Long> inFlight;
    private final Clock clock;

    public DuplicateSubmissionGuard(GatewayProperties properties, Clock clock) {
        this.clock = clock;
        this.inFlight = Caffeine.newBuilder()
                .maximumSize(100_000)
                .expireAfterWrite(properties.getRouter().getDuplicateCooldown())
                .ticker(ticker(clock))
                .build();
    }

    /**
     * @return true if the action may proceed, false if an identical action is
     *         still inside its cooldown
     */
    public boolean tryAcquire(InboundType kind, String userId, String roomId) {
        String key = kind.wireName() + ":" + userId + ":" + roomId;
        Long previous = inFlight.asMap().putIfAbsent(key, clock.millis());
        if (previous != null) {
            log.debug("Duplicate submission suppressed: kind={}, userId={}, roomId={}",
                    kind.wireName(), userId, roomId);
            return false;
        }
        return true;
    }

    static Ticker ticker(Clock clock) {
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }
}
