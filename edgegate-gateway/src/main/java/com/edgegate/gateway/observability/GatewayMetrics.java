package com.edgegate.gateway.observability;

import com.edgegate.common.model.CircuitState;
import com.edgegate.common.model.RateLimitScope;
import com.edgegate.gateway.circuitbreaker.CircuitStateChangedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gateway metrics.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Proxied requests (count and latency by service and status)</li>
 *     <li>Circuit breaker state per key (0 closed, 1 half-open, 2 open)</li>
 *     <li>Rate limit rejections per scope</li>
 *     <li>Realtime connections, subscriptions and dropped messages</li>
 * </ul>
 */
@Component
public class GatewayMetrics {

    private final MeterRegistry meterRegistry;

    private final Map<String, AtomicInteger> breakerStates = new ConcurrentHashMap<>();
    private final Map<RateLimitScope, Counter> rateLimitRejections = new ConcurrentHashMap<>();

    private final AtomicInteger activeConnections;
    private final AtomicInteger activeSubscriptions;
    private final Counter realtimeMessagesDropped;
    private final Counter realtimeBroadcasts;

    public GatewayMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.activeConnections = meterRegistry.gauge("edgegate.realtime.connections", new AtomicInteger(0));
        this.activeSubscriptions = meterRegistry.gauge("edgegate.realtime.subscriptions", new AtomicInteger(0));
        this.realtimeMessagesDropped = Counter.builder("edgegate.realtime.messages.dropped")
                .description("Outbound realtime messages dropped on a full connection buffer")
                .register(meterRegistry);
        this.realtimeBroadcasts = Counter.builder("edgegate.realtime.broadcasts")
                .description("Realtime broadcasts published")
                .register(meterRegistry);

        for (RateLimitScope scope : RateLimitScope.values()) {
            rateLimitRejections.put(scope, Counter.builder("edgegate.ratelimit.rejections")
                    .description("Requests rejected by a quota scope")
                    .tag("scope", scope.getLabel())
                    .register(meterRegistry));
        }
    }

    // ========== Proxy ==========

    public void recordRequest(String serviceName, int status, Duration latency) {
        Timer.builder("edgegate.proxy.requests")
                .description("Proxied request latency")
                .tag("service", serviceName)
                .tag("status", String.valueOf(status))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(latency);
    }

    // ========== Circuit breakers ==========

    @EventListener
    public void onCircuitStateChanged(CircuitStateChangedEvent event) {
        breakerStates.computeIfAbsent(event.getBreakerKey(), key -> {
            AtomicInteger value = new AtomicInteger();
            Gauge.builder("edgegate.circuit.state", value, AtomicInteger::get)
                    .description("Circuit breaker state: 0 closed, 1 half-open, 2 open")
                    .tag("key", key)
                    .register(meterRegistry);
            return value;
        }).set(stateValue(event.getTo()));
    }

    public Integer breakerState(String key) {
        AtomicInteger value = breakerStates.get(key);
        return value != null ? value.get() : null;
    }

    // ========== Rate limiting ==========

    public void recordRateLimitRejection(RateLimitScope scope) {
        rateLimitRejections.get(scope).increment();
    }

    public double rateLimitRejections(RateLimitScope scope) {
        return rateLimitRejections.get(scope).count();
    }

    // ========== Realtime ==========

    public void setActiveConnections(int count) {
        activeConnections.set(count);
    }

    public void setActiveSubscriptions(int count) {
        activeSubscriptions.set(count);
    }

    public void recordMessageDropped() {
        realtimeMessagesDropped.increment();
    }

    public void recordBroadcast() {
        realtimeBroadcasts.increment();
    }

    private static int stateValue(CircuitState state) {
        switch (state) {
            case HALF_OPEN:
                return 1;
            case OPEN:
                return 2;
            default:
                return 0;
        }
    }
}
