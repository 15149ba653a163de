package com.edgegate.gateway.ratelimit;

import com.edgegate.common.model.RateLimitScope;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class FixedWindowRateLimiterTest {

    private MutableClock clock;
    private FixedWindowRateLimiter limiter;
    private final GatewayProperties.Quota tenPerMinute = new GatewayProperties.Quota(10, Duration.ofMinutes(1));

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        limiter = new FixedWindowRateLimiter(clock);
    }

    @Test
    void testRejectsRequestBeyondLimitWithinWindow() {
        for (int i = 1; i <= 10; i++) {
            RateLimitDecision decision = limiter.tryAcquire(RateLimitScope.USER, "user:alice", tenPerMinute);
            assertTrue(decision.isAllowed());
            assertEquals(10 - i, decision.getRemaining());
        }

        clock.advance(Duration.ofSeconds(15));
        RateLimitDecision rejected = limiter.tryAcquire(RateLimitScope.USER, "user:alice", tenPerMinute);
        assertFalse(rejected.isAllowed());
        assertEquals(Duration.ofSeconds(45), rejected.retryAfter(clock.instant()));
    }

    @Test
    void testWindowResetsLazilyWithFreshCount() {
        for (int i = 0; i < 11; i++) {
            limiter.tryAcquire(RateLimitScope.USER, "user:alice", tenPerMinute);
        }

        clock.advance(Duration.ofMinutes(1));
        RateLimitDecision decision = limiter.tryAcquire(RateLimitScope.USER, "user:alice", tenPerMinute);

        assertTrue(decision.isAllowed());
        assertEquals(9, decision.getRemaining());
        assertEquals(clock.instant().plus(Duration.ofMinutes(1)), decision.getResetAt());
    }

    @Test
    void testRejectionsDoNotConsumeQuota() {
        GatewayProperties.Quota two = new GatewayProperties.Quota(2, Duration.ofSeconds(10));
        limiter.tryAcquire(RateLimitScope.USER, "k", two);
        limiter.tryAcquire(RateLimitScope.USER, "k", two);
        for (int i = 0; i < 5; i++) {
            assertFalse(limiter.tryAcquire(RateLimitScope.USER, "k", two).isAllowed());
        }

        clock.advance(Duration.ofSeconds(10));
        assertTrue(limiter.tryAcquire(RateLimitScope.USER, "k", two).isAllowed());
        assertTrue(limiter.tryAcquire(RateLimitScope.USER, "k", two).isAllowed());
    }

    @Test
    void testKeysAndScopesAreIndependent() {
        GatewayProperties.Quota one = new GatewayProperties.Quota(1, Duration.ofMinutes(1));
        assertTrue(limiter.tryAcquire(RateLimitScope.USER, "a", one).isAllowed());
        assertTrue(limiter.tryAcquire(RateLimitScope.USER, "b", one).isAllowed());
        assertTrue(limiter.tryAcquire(RateLimitScope.SERVICE, "a", one).isAllowed());
        assertFalse(limiter.tryAcquire(RateLimitScope.USER, "a", one).isAllowed());
    }

    @Test
    void testResetAndPurge() {
        GatewayProperties.Quota one = new GatewayProperties.Quota(1, Duration.ofSeconds(5));
        limiter.tryAcquire(RateLimitScope.USER, "a", one);
        limiter.tryAcquire(RateLimitScope.USER, "b", one);

        limiter.reset(RateLimitScope.USER, "a");
        assertTrue(limiter.tryAcquire(RateLimitScope.USER, "a", one).isAllowed());
        assertEquals(2, limiter.size());

        clock.advance(Duration.ofSeconds(5));
        assertEquals(2, limiter.purgeExpired());
        assertEquals(0, limiter.size());
    }

    @Test
    void testBlockDurationOutlastsTheWindow() {
        GatewayProperties.Quota strict = new GatewayProperties.Quota(2, Duration.ofSeconds(10), Duration.ofMinutes(5));
        limiter.tryAcquire(RateLimitScope.USER, "k", strict);
        limiter.tryAcquire(RateLimitScope.USER, "k", strict);

        RateLimitDecision exceeded = limiter.tryAcquire(RateLimitScope.USER, "k", strict);
        assertFalse(exceeded.isAllowed());
        assertEquals(Duration.ofMinutes(5), exceeded.retryAfter(clock.instant()));

        clock.advance(Duration.ofMinutes(1));
        RateLimitDecision stillBlocked = limiter.tryAcquire(RateLimitScope.USER, "k", strict);
        assertFalse(stillBlocked.isAllowed());
        assertEquals(Duration.ofMinutes(4), stillBlocked.retryAfter(clock.instant()));
        assertEquals(0, limiter.purgeExpired());

        clock.advance(Duration.ofMinutes(4));
        assertTrue(limiter.tryAcquire(RateLimitScope.USER, "k", strict).isAllowed());
    }

    @Test
    void testStatsReportCountAndBlock() {
        RateLimitStats empty = limiter.stats(RateLimitScope.USER, "k");
        assertEquals(0, empty.getCount());
        assertFalse(empty.isBlocked());

        GatewayProperties.Quota strict = new GatewayProperties.Quota(1, Duration.ofSeconds(10), Duration.ofSeconds(30));
        limiter.tryAcquire(RateLimitScope.USER, "k", strict);
        RateLimitStats admitted = limiter.stats(RateLimitScope.USER, "k");
        assertEquals(1, admitted.getCount());
        assertEquals(clock.instant(), admitted.getWindowStart());
        assertFalse(admitted.isBlocked());

        limiter.tryAcquire(RateLimitScope.USER, "k", strict);
        RateLimitStats blocked = limiter.stats(RateLimitScope.USER, "k");
        assertTrue(blocked.isBlocked());
        assertEquals(clock.instant().plusSeconds(30), blocked.getBlockedUntil());

        limiter.reset(RateLimitScope.USER, "k");
        assertFalse(limiter.stats(RateLimitScope.USER, "k").isBlocked());
    }
}
