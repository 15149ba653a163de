package com.edgegate.gateway.ratelimit;

import com.edgegate.common.model.RateLimitScope;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of checking one quota scope
 */
@Value
public class RateLimitDecision {
    RateLimitScope scope;
    boolean allowed;
    int limit;
    int remaining;
    Instant resetAt;

    /**
     * Time until the window resets, zero when already past
     */
    public Duration retryAfter(Instant now) {
        Duration remainingTime = Duration.between(now, resetAt);
        return remainingTime.isNegative() ? Duration.ZERO : remainingTime;
    }
}
