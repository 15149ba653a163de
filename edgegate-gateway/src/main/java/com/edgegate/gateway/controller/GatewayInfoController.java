package com.edgegate.gateway.controller;

import com.edgegate.common.model.RateLimitScope;
import com.edgegate.gateway.circuitbreaker.CircuitBreakerRegistry;
import com.edgegate.gateway.circuitbreaker.CircuitBreakerSnapshot;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.ratelimit.GatewayRateLimiter;
import com.edgegate.gateway.ratelimit.RateLimitStats;
import com.edgegate.gateway.realtime.FanoutHub;
import com.edgegate.gateway.registry.ServiceRegistry;
import com.edgegate.gateway.router.RouteResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway Information Controller.
 * Provides information about configured routes, breaker states and gateway status.
 */
@Slf4j
@RestController
@RequestMapping("/gateway")
public class GatewayInfoController {

    private final RouteResolver routeResolver;
    private final CircuitBreakerRegistry circuitBreakers;
    private final ServiceRegistry registry;
    private final FanoutHub hub;
    private final GatewayRateLimiter rateLimiter;
    private final GatewayProperties properties;

    public GatewayInfoController(RouteResolver routeResolver, CircuitBreakerRegistry circuitBreakers,
                                 ServiceRegistry registry, FanoutHub hub, GatewayRateLimiter rateLimiter,
                                 GatewayProperties properties) {
        this.routeResolver = routeResolver;
        this.circuitBreakers = circuitBreakers;
        this.registry = registry;
        this.hub = hub;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    /**
     * Get all configured routes.
     * GET /gateway/routes
     */
    @GetMapping("/routes")
    public ResponseEntity<Map<String, Object>> getRoutes() {
        String prefix = properties.getProxy().getApiPrefix();
        List<Map<String, Object>> routeList = new ArrayList<>();
        for (GatewayProperties.Route route : routeResolver.getRoutes()) {
            Map<String, Object> routeInfo = new LinkedHashMap<>();
            routeInfo.put("id", route.getId());
            routeInfo.put("path", prefix + route.getPath());
            routeInfo.put("service", route.getServiceName());
            routeInfo.put("idempotent", route.getIdempotent() != null ? route.getIdempotent() : "by-method");
            routeInfo.put("healthyInstances", registry.listHealthy(route.getServiceName()).size());
            routeList.add(routeInfo);
        }

        Map<String, Object> response = new HashMap<>();
        response.put("routes", routeList);
        response.put("count", routeList.size());
        return ResponseEntity.ok(response);
    }

    /**
     * Get breaker state per key.
     * GET /gateway/circuits
     */
    @GetMapping("/circuits")
    public ResponseEntity<Map<String, CircuitBreakerSnapshot>> getCircuits() {
        return ResponseEntity.ok(circuitBreakers.snapshot());
    }

    /**
     * Get the current window for one quota counter.
     * GET /gateway/rate-limits/{scope}/{key}
     */
    @GetMapping("/rate-limits/{scope}/{key}")
    public ResponseEntity<RateLimitStats> getRateLimitStats(@PathVariable String scope, @PathVariable String key) {
        for (RateLimitScope candidate : RateLimitScope.values()) {
            if (candidate.getLabel().equalsIgnoreCase(scope)) {
                return ResponseEntity.ok(rateLimiter.stats(candidate, key));
            }
        }
        log.debug("Unknown rate limit scope requested: {}", scope);
        return ResponseEntity.notFound().build();
    }

    /**
     * Get gateway status.
     * GET /gateway/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("gateway", "EdgeGate");
        status.put("version", "1.0.0");
        status.put("status", "UP");
        status.put("services", registry.serviceNames().size());
        status.put("circuits", circuitBreakers.snapshot().size());
        status.put("realtimeConnections", hub.connectionCount());
        status.put("timestamp", System.currentTimeMillis());

        return ResponseEntity.ok(status);
    }
}
