package com.edgegate.common.exception;

import com.edgegate.common.model.RateLimitScope;

import java.time.Duration;

/**
 * Thrown when a quota scope rejects a request
 */
public class RateLimitedException extends GatewayException {

    private final RateLimitScope scope;

    public RateLimitedException(RateLimitScope scope, Duration retryAfter) {
        super(ErrorCode.RATE_LIMITED, "Rate limit exceeded (" + scope.getLabel() + ")", retryAfter, null);
        this.scope = scope;
    }

    public RateLimitScope getScope() {
        return scope;
    }
}
