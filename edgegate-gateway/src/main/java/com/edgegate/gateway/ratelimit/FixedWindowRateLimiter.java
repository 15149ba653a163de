package com.edgegate.gateway.ratelimit;

import com.edgegate.common.model.RateLimitScope;
import com.edgegate.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed window counters keyed by {@code scope:key}.
 * Windows reset lazily on access; a rejected request does not consume quota.
 * A quota with a block duration turns the first rejection into a penalty: every
 * request is rejected until the block ends, even across window boundaries.
 */
@Slf4j
public class FixedWindowRateLimiter {

    private final Map<String, RateLimitWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public FixedWindowRateLimiter(Clock clock) {
        this.clock = clock;
    }

    public RateLimitDecision tryAcquire(RateLimitScope scope, String key, GatewayProperties.Quota quota) {
        Instant now = clock.instant();
        RateLimitDecision[] decision = new RateLimitDecision[1];

        windows.compute(windowKey(scope, key), (k, window) -> {
            if (window != null && window.isBlocked(now)) {
                decision[0] = new RateLimitDecision(scope, false, quota.getLimit(), 0, window.getBlockedUntil());
                return window;
            }
            if (window == null || window.isExpired(now)
                    || !window.getWindowDuration().equals(quota.getWindow())) {
                window = new RateLimitWindow(now, quota.getWindow(), 0);
            }
            if (window.getCount() >= quota.getLimit()) {
                if (quota.getBlockDuration() != null && !quota.getBlockDuration().isZero()) {
                    RateLimitWindow blocked = window.blockUntil(now.plus(quota.getBlockDuration()));
                    log.warn("Rate limit exceeded for {}:{}, blocked until {}", scope.getLabel(), key, blocked.getBlockedUntil());
                    decision[0] = new RateLimitDecision(scope, false, quota.getLimit(), 0, blocked.getBlockedUntil());
                    return blocked;
                }
                decision[0] = new RateLimitDecision(scope, false, quota.getLimit(), 0, window.resetAt());
                return window;
            }
            RateLimitWindow admitted = window.increment();
            decision[0] = new RateLimitDecision(scope, true, quota.getLimit(),
                    quota.getLimit() - admitted.getCount(), admitted.resetAt());
            return admitted;
        });

        if (!decision[0].isAllowed()) {
            log.debug("Rate limit reached for {}:{} ({} per {})", scope.getLabel(), key, quota.getLimit(), quota.getWindow());
        }
        return decision[0];
    }

    public RateLimitStats stats(RateLimitScope scope, String key) {
        Instant now = clock.instant();
        RateLimitWindow window = windows.get(windowKey(scope, key));
        if (window == null || window.isExpired(now)) {
            return RateLimitStats.builder()
                    .scope(scope)
                    .key(key)
                    .count(0)
                    .windowStart(now)
                    .build();
        }
        boolean blocked = window.isBlocked(now);
        return RateLimitStats.builder()
                .scope(scope)
                .key(key)
                .count(window.getCount())
                .windowStart(window.getWindowStart())
                .resetAt(window.resetAt())
                .blocked(blocked)
                .blockedUntil(blocked ? window.getBlockedUntil() : null)
                .build();
    }

    public void reset(RateLimitScope scope, String key) {
        windows.remove(windowKey(scope, key));
    }

    /**
     * Drop windows that have already expired
     * @return number of windows removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = windows.size();
        windows.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        return Math.max(0, before - windows.size());
    }

    public int size() {
        return windows.size();
    }

    private static String windowKey(RateLimitScope scope, String key) {
        return scope.getLabel() + ":" + key;
    }
}
