package com.edgegate.gateway.filter;

import com.edgegate.common.exception.ErrorCode;
import com.edgegate.common.exception.GatewayException;
import com.edgegate.common.security.UserPrincipal;
import com.edgegate.common.util.PathPatterns;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.router.GatewayErrorResponder;
import com.edgegate.gateway.security.PrincipalResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the caller identity from a bearer token.
 *
 * Flow:
 * 1. Drop any client-supplied X-User-* headers
 * 2. Verify the bearer token, if present
 * 3. Reject protected paths without a valid token, admin paths without the admin role
 * 4. Store the principal as an exchange attribute and pass user info downstream as headers
 */
@Slf4j
@Component
public class AuthenticationFilter implements WebFilter, Ordered {

    public static final String PRINCIPAL_ATTRIBUTE = AuthenticationFilter.class.getName() + ".principal";

    static final String USER_ID_HEADER = "X-User-Id";
    static final String USER_ROLES_HEADER = "X-User-Roles";
    static final String USER_TIER_HEADER = "X-User-Tier";

    private final PrincipalResolver principalResolver;
    private final GatewayErrorResponder errorResponder;
    private final GatewayProperties.Auth config;

    public AuthenticationFilter(PrincipalResolver principalResolver, GatewayErrorResponder errorResponder,
                                GatewayProperties properties) {
        this.principalResolver = principalResolver;
        this.errorResponder = errorResponder;
        this.config = properties.getAuth();
    }

    public static UserPrincipal principalOf(ServerWebExchange exchange) {
        UserPrincipal principal = exchange.getAttribute(PRINCIPAL_ATTRIBUTE);
        return principal != null ? principal : UserPrincipal.anonymous();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getURI().getPath();

        Optional<String> token = PrincipalResolver.bearerToken(request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        UserPrincipal principal = token.flatMap(principalResolver::verify).orElseGet(UserPrincipal::anonymous);

        if (!principal.isAuthenticated() && matchesAny(path, config.getProtectedPaths())) {
            log.warn("Rejected unauthenticated request for protected path: {}", path);
            return errorResponder.write(exchange, new GatewayException(ErrorCode.UNAUTHORIZED,
                    token.isPresent() ? "Invalid or expired token" : "Missing or invalid Authorization header"));
        }

        if (matchesAny(path, config.getAdminPaths()) && !principal.hasRole(config.getAdminRole())) {
            log.warn("Caller {} attempted to access admin-only path: {}",
                    principal.isAuthenticated() ? principal.getSubject() : "anonymous", path);
            return errorResponder.write(exchange, new GatewayException(
                    principal.isAuthenticated() ? ErrorCode.FORBIDDEN : ErrorCode.UNAUTHORIZED,
                    "Access denied: " + config.getAdminRole() + " role required"));
        }

        ServerHttpRequest mutated = request.mutate()
                .headers(headers -> {
                    headers.remove(USER_ID_HEADER);
                    headers.remove(USER_ROLES_HEADER);
                    headers.remove(USER_TIER_HEADER);
                    if (principal.isAuthenticated()) {
                        headers.set(USER_ID_HEADER, principal.getSubject());
                        if (principal.getRoles() != null && !principal.getRoles().isEmpty()) {
                            headers.set(USER_ROLES_HEADER, String.join(",", principal.getRoles()));
                        }
                        if (principal.getTier() != null) {
                            headers.set(USER_TIER_HEADER, principal.getTier());
                        }
                    }
                })
                .build();

        ServerWebExchange next = exchange.mutate().request(mutated).build();
        next.getAttributes().put(PRINCIPAL_ATTRIBUTE, principal);
        return chain.filter(next);
    }

    private static boolean matchesAny(String path, List<String> patterns) {
        return patterns.stream().anyMatch(pattern -> PathPatterns.matches(path, pattern));
    }

    @Override
    public int getOrder() {
        return -100;
    }
}
