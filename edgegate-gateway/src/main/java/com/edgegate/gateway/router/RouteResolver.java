package com.edgegate.gateway.router;

import com.edgegate.common.util.PathPatterns;
import com.edgegate.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Matches prefix-stripped paths against {@code edgegate.routes}, first match wins
 */
@Slf4j
@Component
public class RouteResolver {

    private static final Set<HttpMethod> IDEMPOTENT_METHODS = Set.of(
            HttpMethod.GET, HttpMethod.HEAD, HttpMethod.OPTIONS, HttpMethod.PUT, HttpMethod.DELETE);

    private final List<GatewayProperties.Route> routes;

    public RouteResolver(GatewayProperties properties) {
        this.routes = List.copyOf(properties.getRoutes());
        routes.forEach(route -> log.info("Route {}: {} -> {}", route.getId(), route.getPath(), route.getServiceName()));
    }

    public Optional<GatewayProperties.Route> resolve(String path) {
        for (GatewayProperties.Route route : routes) {
            if (PathPatterns.matches(path, route.getPath())) {
                return Optional.of(route);
            }
        }
        return Optional.empty();
    }

    /**
     * Explicit per-route flag, else derived from the method
     */
    public static boolean isIdempotent(GatewayProperties.Route route, HttpMethod method) {
        if (route.getIdempotent() != null) {
            return route.getIdempotent();
        }
        return IDEMPOTENT_METHODS.contains(method);
    }

    public List<GatewayProperties.Route> getRoutes() {
        return routes;
    }
}
