package com.edgegate.gateway.realtime;

import com.edgegate.common.model.CircuitState;
import com.edgegate.common.security.UserPrincipal;
import com.edgegate.gateway.circuitbreaker.CircuitStateChangedEvent;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.observability.GatewayMetrics;
import com.edgegate.gateway.registry.InstanceHealthChangedEvent;
import com.edgegate.gateway.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RealtimeEventListenerTest {

    @Test
    void testSystemEventsReachOpsSubscribersOnly() {
        GatewayProperties properties = new GatewayProperties();
        FanoutHub hub = new FanoutHub(new ChannelAccessPolicy(properties), properties,
                new GatewayMetrics(new SimpleMeterRegistry()), MutableClock.startingAt("2024-01-01T00:00:00Z"));
        RealtimeEventListener listener = new RealtimeEventListener(hub, properties);

        RealtimeConnection ops = hub.connect(UserPrincipal.builder()
                .subject("ops")
                .roles(List.of("ADMIN"))
                .permissions(List.of(ChannelAccessPolicy.OPS_PERMISSION))
                .build());
        RealtimeConnection guest = hub.connect(null);

        hub.subscribe(ops.getId(), List.of("system.health", "system.circuits"));
        SubscribeResult denied = hub.subscribe(guest.getId(), List.of("system.health"));
        assertEquals("permission_required", denied.getRejected().get("system.health"));

        Instant at = Instant.parse("2024-01-01T00:00:05Z");
        listener.onInstanceHealthChanged(new InstanceHealthChangedEvent("pricing", "p1", false, at));
        listener.onCircuitStateChanged(new CircuitStateChangedEvent("pricing:GET:/price/**",
                CircuitState.CLOSED, CircuitState.OPEN, at));

        ops.close();
        List<ServerFrame> frames = ops.outbound().collectList().block();
        assertNotNull(frames);
        assertEquals(2, frames.size());

        ServerFrame health = frames.get(0);
        assertEquals(RealtimeEventListener.INSTANCE_HEALTH_EVENT, health.getEvent());
        assertEquals(Boolean.FALSE, ((Map<?, ?>) health.getPayload()).get("healthy"));

        ServerFrame circuit = frames.get(1);
        assertEquals("system.circuits", circuit.getChannel());
        assertEquals(CircuitState.OPEN, ((Map<?, ?>) circuit.getPayload()).get("to"));
    }
}
