package com.edgegate.gateway.realtime;

import com.edgegate.gateway.circuitbreaker.CircuitStateChangedEvent;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.registry.InstanceHealthChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Republishes registry health flips and breaker transitions on the system channels
 */
@Slf4j
@Component
public class RealtimeEventListener {

    static final String INSTANCE_HEALTH_EVENT = "instance_health";
    static final String CIRCUIT_STATE_EVENT = "circuit_state";

    private final FanoutHub hub;
    private final GatewayProperties.Realtime config;

    public RealtimeEventListener(FanoutHub hub, GatewayProperties properties) {
        this.hub = hub;
        this.config = properties.getRealtime();
    }

    @EventListener
    public void onInstanceHealthChanged(InstanceHealthChangedEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("service", event.getServiceName());
        payload.put("instanceId", event.getInstanceId());
        payload.put("healthy", event.isHealthy());
        payload.put("at", event.getAt());
        hub.broadcast(config.getHealthChannel(), INSTANCE_HEALTH_EVENT, payload);
    }

    @EventListener
    public void onCircuitStateChanged(CircuitStateChangedEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("key", event.getBreakerKey());
        payload.put("from", event.getFrom());
        payload.put("to", event.getTo());
        payload.put("at", event.getAt());
        hub.broadcast(config.getCircuitChannel(), CIRCUIT_STATE_EVENT, payload);
    }
}
