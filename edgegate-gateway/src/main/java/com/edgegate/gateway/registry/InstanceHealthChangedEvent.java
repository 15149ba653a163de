package com.edgegate.gateway.registry;

import lombok.Value;

import java.time.Instant;

/**
 * Published when a probe flips an instance between healthy and unhealthy
 */
@Value
public class InstanceHealthChangedEvent {
    String serviceName;
    String instanceId;
    boolean healthy;
    Instant at;
}
