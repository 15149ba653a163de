package com.edgegate.gateway.ratelimit;

import com.edgegate.common.exception.RateLimitedException;
import com.edgegate.common.model.RateLimitScope;
import com.edgegate.common.security.UserPrincipal;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.observability.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Quota chain for gateway traffic.
 *
 * HTTP requests pass global, then per-service, then per-caller quotas; the first
 * scope that rejects stops the chain, so later scopes are not charged.
 * Realtime actions are limited per connection and action on a separate counter set.
 */
@Slf4j
@Component
public class GatewayRateLimiter {

    static final String GLOBAL_KEY = "*";

    private final GatewayProperties.RateLimit config;
    private final FixedWindowRateLimiter httpLimiter;
    private final FixedWindowRateLimiter realtimeLimiter;
    private final GatewayMetrics metrics;
    private final Clock clock;

    public GatewayRateLimiter(GatewayProperties properties, Clock clock, GatewayMetrics metrics) {
        this.config = properties.getRateLimit();
        this.clock = clock;
        this.metrics = metrics;
        this.httpLimiter = new FixedWindowRateLimiter(clock);
        this.realtimeLimiter = new FixedWindowRateLimiter(clock);

        log.info("Rate limits: enabled={}, global={}/{}, service={}/{}, user={}/{}",
                config.isEnabled(),
                config.getGlobal().getLimit(), config.getGlobal().getWindow(),
                config.getService().getLimit(), config.getService().getWindow(),
                config.getUser().getLimit(), config.getUser().getWindow());
    }

    /**
     * Charge one request against every scope
     * @return the caller-scope decision, for rate limit response headers; empty when limiting is disabled
     * @throws RateLimitedException from the first scope that rejects
     */
    public Optional<RateLimitDecision> check(String serviceName, String callerKey, UserPrincipal principal) {
        if (!config.isEnabled()) {
            return Optional.empty();
        }

        enforce(httpLimiter.tryAcquire(RateLimitScope.GLOBAL, GLOBAL_KEY, config.getGlobal()));
        enforce(httpLimiter.tryAcquire(RateLimitScope.SERVICE, serviceName, serviceQuota(serviceName)));
        RateLimitDecision caller = enforce(httpLimiter.tryAcquire(RateLimitScope.USER, callerKey, callerQuota(principal)));
        return Optional.of(caller);
    }

    /**
     * Charge one realtime action (subscribe, unsubscribe, ping, ...) for a connection
     * @throws RateLimitedException when the connection exceeded the action's quota
     */
    public void checkRealtime(String connectionId, String action) {
        if (!config.isEnabled()) {
            return;
        }
        GatewayProperties.Quota quota = config.getRealtime().getOrDefault(action, config.getRealtimeDefault());
        enforce(realtimeLimiter.tryAcquire(RateLimitScope.USER, connectionId + ":" + action, quota));
    }

    public void reset(RateLimitScope scope, String key) {
        httpLimiter.reset(scope, key);
    }

    public RateLimitStats stats(RateLimitScope scope, String key) {
        return httpLimiter.stats(scope, key);
    }

    public void resetRealtime(String connectionId, String action) {
        realtimeLimiter.reset(RateLimitScope.USER, connectionId + ":" + action);
    }

    @Scheduled(fixedDelayString = "${edgegate.rate-limit.purge-interval:PT5M}")
    public void purgeExpired() {
        int purged = httpLimiter.purgeExpired() + realtimeLimiter.purgeExpired();
        if (purged > 0) {
            log.debug("Purged {} expired rate limit windows", purged);
        }
    }

    GatewayProperties.Quota serviceQuota(String serviceName) {
        return config.getServices().getOrDefault(serviceName, config.getService());
    }

    GatewayProperties.Quota callerQuota(UserPrincipal principal) {
        if (principal != null && principal.getTier() != null) {
            GatewayProperties.Quota tierQuota = config.getTiers().get(principal.getTier().toLowerCase());
            if (tierQuota != null) {
                return tierQuota;
            }
        }
        return config.getUser();
    }

    private RateLimitDecision enforce(RateLimitDecision decision) {
        if (!decision.isAllowed()) {
            metrics.recordRateLimitRejection(decision.getScope());
            throw new RateLimitedException(decision.getScope(), decision.retryAfter(clock.instant()));
        }
        return decision;
    }
}
