package com.edgegate.gateway.circuitbreaker;

import com.edgegate.common.model.CircuitState;
import lombok.Value;

import java.time.Instant;

/**
 * Published on every breaker state transition
 */
@Value
public class CircuitStateChangedEvent {
    String breakerKey;
    CircuitState from;
    CircuitState to;
    Instant at;
}
