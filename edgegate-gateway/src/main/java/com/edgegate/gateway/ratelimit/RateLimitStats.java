package com.edgegate.gateway.ratelimit;

import com.edgegate.common.model.RateLimitScope;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of one counter. A key with no live window reports a count of zero.
 */
@Value
@Builder
public class RateLimitStats {
    RateLimitScope scope;
    String key;
    int count;
    Instant windowStart;
    Instant resetAt;
    boolean blocked;
    Instant blockedUntil;
}
