package com.edgegate.common.model;

/**
 * State of a circuit breaker key
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
