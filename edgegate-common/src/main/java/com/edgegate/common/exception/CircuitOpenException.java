package com.edgegate.common.exception;

import java.time.Duration;

/**
 * Thrown by the circuit breaker when a call is rejected without reaching the downstream
 */
public class CircuitOpenException extends GatewayException {

    private final String breakerKey;

    public CircuitOpenException(String breakerKey, Duration retryAfter) {
        super(ErrorCode.CIRCUIT_OPEN, "Circuit open: " + breakerKey, retryAfter, null);
        this.breakerKey = breakerKey;
    }

    public String getBreakerKey() {
        return breakerKey;
    }
}
