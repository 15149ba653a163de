package com.edgegate.gateway.ratelimit;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * One fixed window counter. Immutable; the limiter swaps in a new window per admission.
 */
@Value
public class RateLimitWindow {
    Instant windowStart;
    Duration windowDuration;
    int count;

    /**
     * End of the penalty block started by the rejection that exceeded the quota; null when not blocked
     */
    Instant blockedUntil;

    RateLimitWindow(Instant windowStart, Duration windowDuration, int count) {
        this(windowStart, windowDuration, count, null);
    }

    RateLimitWindow(Instant windowStart, Duration windowDuration, int count, Instant blockedUntil) {
        this.windowStart = windowStart;
        this.windowDuration = windowDuration;
        this.count = count;
        this.blockedUntil = blockedUntil;
    }

    public Instant resetAt() {
        return windowStart.plus(windowDuration);
    }

    public boolean isBlocked(Instant now) {
        return blockedUntil != null && now.isBefore(blockedUntil);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(resetAt()) && !isBlocked(now);
    }

    RateLimitWindow increment() {
        return new RateLimitWindow(windowStart, windowDuration, count + 1);
    }

    RateLimitWindow blockUntil(Instant until) {
        return new RateLimitWindow(windowStart, windowDuration, count, until);
    }
}
