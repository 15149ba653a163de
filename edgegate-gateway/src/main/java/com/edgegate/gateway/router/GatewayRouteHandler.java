package com.edgegate.gateway.router;

import com.edgegate.common.exception.ErrorCode;
import com.edgegate.common.exception.GatewayException;
import com.edgegate.common.security.UserPrincipal;
import com.edgegate.common.util.PathPatterns;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.filter.AuthenticationFilter;
import com.edgegate.gateway.filter.CallerKeyResolver;
import com.edgegate.gateway.observability.GatewayMetrics;
import com.edgegate.gateway.proxy.ProxyRequest;
import com.edgegate.gateway.proxy.ProxyResponse;
import com.edgegate.gateway.proxy.ResilientProxy;
import com.edgegate.gateway.ratelimit.GatewayRateLimiter;
import com.edgegate.gateway.ratelimit.RateLimitDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Entry point for proxied API traffic: route lookup, quota chain, then the
 * resilient proxy. Every rejection is rendered by {@link GatewayErrorResponder}.
 */
@Slf4j
@Component
public class GatewayRouteHandler {

    static final String RATE_LIMIT_LIMIT_HEADER = "X-RateLimit-Limit";
    static final String RATE_LIMIT_REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RATE_LIMIT_RESET_HEADER = "X-RateLimit-Reset";

    /**
     * Caller deadline in milliseconds, capped at {@code proxy.request-timeout}
     */
    static final String REQUEST_TIMEOUT_HEADER = "X-Request-Timeout";

    private static final byte[] EMPTY = new byte[0];

    private final RouteResolver routeResolver;
    private final GatewayRateLimiter rateLimiter;
    private final CallerKeyResolver callerKeyResolver;
    private final ResilientProxy proxy;
    private final GatewayErrorResponder errorResponder;
    private final GatewayMetrics metrics;
    private final GatewayProperties.Proxy config;

    public GatewayRouteHandler(RouteResolver routeResolver, GatewayRateLimiter rateLimiter,
                               CallerKeyResolver callerKeyResolver, ResilientProxy proxy,
                               GatewayErrorResponder errorResponder, GatewayMetrics metrics,
                               GatewayProperties properties) {
        this.routeResolver = routeResolver;
        this.rateLimiter = rateLimiter;
        this.callerKeyResolver = callerKeyResolver;
        this.proxy = proxy;
        this.errorResponder = errorResponder;
        this.metrics = metrics;
        this.config = properties.getProxy();
    }

    public Mono<ServerResponse> handle(ServerRequest request) {
        ServerWebExchange exchange = request.exchange();
        ServerHttpRequest httpRequest = exchange.getRequest();
        String path = PathPatterns.stripPrefix(httpRequest.getURI().getRawPath(), config.getApiPrefix());

        Optional<GatewayProperties.Route> match = routeResolver.resolve(path);
        if (match.isEmpty()) {
            log.debug("No route for {} {}", request.method(), path);
            return errorResponder.render(new GatewayException(ErrorCode.ROUTE_NOT_FOUND, "No route for " + path), null);
        }

        GatewayProperties.Route route = match.get();
        String serviceName = route.getServiceName();
        UserPrincipal principal = AuthenticationFilter.principalOf(exchange);
        HttpHeaders rateLimitHeaders = new HttpHeaders();
        long start = System.nanoTime();

        return Mono.defer(() -> {
                    String callerKey = callerKeyResolver.resolve(httpRequest, principal);
                    rateLimiter.check(serviceName, callerKey, principal)
                            .ifPresent(decision -> applyRateLimitHeaders(rateLimitHeaders, decision));

                    return request.bodyToMono(byte[].class)
                            .defaultIfEmpty(EMPTY)
                            .flatMap(body -> proxy.forward(serviceName, toProxyRequest(httpRequest, path, route, body)));
                })
                .flatMap(response -> {
                    metrics.recordRequest(serviceName, response.getStatus(), Duration.ofNanos(System.nanoTime() - start));
                    return toServerResponse(response, rateLimitHeaders);
                })
                .onErrorResume(error -> {
                    GatewayException ex = errorResponder.normalize(error);
                    metrics.recordRequest(serviceName, ex.getErrorCode().getHttpStatus(),
                            Duration.ofNanos(System.nanoTime() - start));
                    log.debug("Request to {} rejected: {} {}", serviceName, ex.getErrorCode(), ex.getMessage());
                    return errorResponder.render(ex, rateLimitHeaders);
                });
    }

    private ProxyRequest toProxyRequest(ServerHttpRequest httpRequest, String path,
                                        GatewayProperties.Route route, byte[] body) {
        String clientAddress = httpRequest.getRemoteAddress() != null && httpRequest.getRemoteAddress().getAddress() != null
                ? httpRequest.getRemoteAddress().getAddress().getHostAddress()
                : null;

        return ProxyRequest.builder()
                .method(httpRequest.getMethod())
                .path(path)
                .rawQuery(httpRequest.getURI().getRawQuery())
                .headers(httpRequest.getHeaders())
                .body(body)
                .clientAddress(clientAddress)
                .scheme(httpRequest.getURI().getScheme())
                .host(httpRequest.getHeaders().getFirst(HttpHeaders.HOST))
                .routeTemplate(route.getPath())
                .idempotent(RouteResolver.isIdempotent(route, httpRequest.getMethod()))
                .timeout(requestDeadline(httpRequest.getHeaders(), config.getRequestTimeout()))
                .build();
    }

    static Duration requestDeadline(HttpHeaders headers, Duration max) {
        String value = headers.getFirst(REQUEST_TIMEOUT_HEADER);
        if (value == null || value.isBlank()) {
            return max;
        }
        try {
            long millis = Long.parseLong(value.trim());
            if (millis <= 0) {
                log.debug("Ignoring non-positive {}: {}", REQUEST_TIMEOUT_HEADER, value);
                return max;
            }
            Duration requested = Duration.ofMillis(millis);
            return requested.compareTo(max) < 0 ? requested : max;
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed {}: {}", REQUEST_TIMEOUT_HEADER, value);
            return max;
        }
    }

    private Mono<ServerResponse> toServerResponse(ProxyResponse response, HttpHeaders rateLimitHeaders) {
        ServerResponse.BodyBuilder builder = ServerResponse.status(response.getStatus())
                .headers(headers -> {
                    headers.addAll(response.getHeaders());
                    headers.addAll(rateLimitHeaders);
                });
        return response.getBody().length > 0 ? builder.bodyValue(response.getBody()) : builder.build();
    }

    private void applyRateLimitHeaders(HttpHeaders headers, RateLimitDecision decision) {
        headers.set(RATE_LIMIT_LIMIT_HEADER, String.valueOf(decision.getLimit()));
        headers.set(RATE_LIMIT_REMAINING_HEADER, String.valueOf(decision.getRemaining()));
        headers.set(RATE_LIMIT_RESET_HEADER, String.valueOf(decision.getResetAt().getEpochSecond()));
    }
}
