package com.uxflow.gateway.service;

import com.uxflow.gateway.config.GatewayProperties;
import com.uxflow.gateway.domain.InboundType;
import com.uxflow.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateSubmissionGuardTest {

    private MutableClock clock;
    private DuplicateSubmissionGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        guard = new DuplicateSubmissionGuard(new GatewayProperties(), clock);
    }

    @Test
    void secondSubmissionWithinCooldownIsSuppressed() {
        assertThat(guard.tryAcquire(InboundType.USER_MESSAGE, "u1", "proj-1")).isTrue();
        clock.advance(Duration.ofMillis(1500));

        assertThat(guard.tryAcquire(InboundType.USER_MESSAGE, "u1", "proj-1")).isFalse();
    }

    @Test
    void submissionIsAllowedAgainAfterCooldown() {
        guard.tryAcquire(InboundType.USER_MESSAGE, "u1", "proj-1");
        clock.advance(Duration.ofMillis(2001));

        assertThat(guard.tryAcquire(InboundType.USER_MESSAGE, "u1", "proj-1")).isTrue();
    }

    @Test
    void keysAreIndependentPerKindUserAndRoom() {
        assertThat(guard.tryAcquire(InboundType.USER_MESSAGE, "u1", "proj-1")).isTrue();

        assertThat(guard.tryAcquire(InboundType.PLAN_APPROVED, "u1", "proj-1")).isTrue();
        assertThat(guard.tryAcquire(InboundType.USER_MESSAGE, "u2", "proj-1")).isTrue();
        assertThat(guard.tryAcquire(InboundType.USER_MESSAGE, "u1", "proj-2")).isTrue();
    }
}
