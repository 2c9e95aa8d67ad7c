package com.uxflow.gateway.service;

import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.config.GatewayProperties.TierLimits;
import com.uxflow.gateway.domain.RateDecision;
import com.uxflow.gateway.infrastructure.SharedCacheKeys;
import com.uxflow.gateway.support.InMemorySharedStateStore;
import com.uxflow.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    private static final TierLimits LIMITS = new TierLimits(2, 3, 2);

    private MutableClock clock;
    private InMemorySharedStateStore store;
    private SharedCacheKeys keys;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        clock = new MutableClock();
        store = new InMemorySharedStateStore(clock);
        keys = new SharedCacheKeys(properties);
        rateLimiter = new RateLimiter(store, keys, properties, clock);
    }

    @Test
    void messageOverLimitIsDeniedWithRetryAfter() {
        for (int i = 1; i <= 3; i++) {
            RateDecision decision = rateLimiter.checkMessage("c1", LIMITS).join();
            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.getCount()).isEqualTo(i);
        }

        clock.advance(Duration.ofSeconds(20));
        RateDecision denied = rateLimiter.checkMessage("c1", LIMITS).join();

        assertThat(denied.isAllowed()).isFalse();
        assertThat(denied.isLocal()).isFalse();
        assertThat(denied.getLimit()).isEqualTo(3);
        assertThat(denied.getRetryAfterMs()).isEqualTo(40_000);
    }

    @Test
    void windowResetsWhenItExpires() {
        for (int i = 0; i < 4; i++) {
            rateLimiter.checkMessage("c1", LIMITS).join();
        }

        clock.advance(Duration.ofSeconds(60));

        RateDecision decision = rateLimiter.checkMessage("c1", LIMITS).join();
        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.getCount()).isEqualTo(1);
    }

    @Test
    void countersArePerConnection() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.checkMessage("c1", LIMITS).join();
        }

        assertThat(rateLimiter.checkMessage("c1", LIMITS).join().isAllowed()).isFalse();
        assertThat(rateLimiter.checkMessage("c2", LIMITS).join().isAllowed()).isTrue();
    }

    @Test
    void connectionAdmissionIsCountedPerUser() {
        assertThat(rateLimiter.checkConnectionAdmission("u1", LIMITS).join().isAllowed()).isTrue();
        assertThat(rateLimiter.checkConnectionAdmission("u1", LIMITS).join().isAllowed()).isTrue();
        assertThat(rateLimiter.checkConnectionAdmission("u1", LIMITS).join().isAllowed()).isFalse();
        assertThat(store.containsKey("gateway:ratelimit:connect:u1")).isTrue();
    }

    @Test
    void fallsBackToLocalWindowWhenSharedStoreIsDown() {
        store.setReachable(false);

        for (int i = 0; i < 3; i++) {
            RateDecision decision = rateLimiter.checkMessage("c1", LIMITS).join();
            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.isLocal()).isTrue();
        }
        clock.advance(Duration.ofSeconds(15));

        RateDecision denied = rateLimiter.checkMessage("c1", LIMITS).join();
        assertThat(denied.isAllowed()).isFalse();
        assertThat(denied.isLocal()).isTrue();
        assertThat(denied.getRetryAfterMs()).isEqualTo(45_000);

        clock.advance(Duration.ofSeconds(45));
        assertThat(rateLimiter.checkMessage("c1", LIMITS).join().isAllowed()).isTrue();
    }

    @Test
    void releaseDropsMessageWindow() {
        for (int i = 0; i < 4; i++) {
            rateLimiter.checkMessage("c1", LIMITS).join();
        }

        rateLimiter.release("c1").join();

        assertThat(store.containsKey(keys.rateLimit(RateLimiter.MESSAGE, "c1"))).isFalse();
        assertThat(rateLimiter.checkMessage("c1", LIMITS).join().getCount()).isEqualTo(1);
    }
}
