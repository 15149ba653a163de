package com.edgegate.gateway.circuitbreaker;

import com.edgegate.common.model.CircuitState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of one breaker key
 */
@Value
@Builder
public class CircuitBreakerSnapshot {
    String key;
    CircuitState state;
    int consecutiveFailures;
    Instant lastFailureAt;
    Instant nextRetryAt;
    int successesInHalfOpen;

    /**
     * Outcomes in the current sliding window, and the failure percentage over them
     * ({@code -1} until the window holds failure-threshold calls)
     */
    int bufferedCalls;
    float failureRate;
}
