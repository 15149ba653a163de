package com.edgegate.gateway.filter;

import com.edgegate.common.security.UserPrincipal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

/**
 * Caller key for per-caller quotas: {@code user:<subject>} when authenticated,
 * otherwise {@code ip:<client address>}.
 */
@Slf4j
@Component
public class CallerKeyResolver {

    public String resolve(ServerHttpRequest request, UserPrincipal principal) {
        if (principal != null && principal.isAuthenticated()) {
            return "user:" + principal.getSubject();
        }
        String key = "ip:" + clientIp(request);
        log.trace("Caller key (fallback to IP): {}", key);
        return key;
    }

    /**
     * Client address, honouring X-Forwarded-For then X-Real-IP
     */
    public static String clientIp(ServerHttpRequest request) {
        String xff = request.getHeaders().getFirst("X-Forwarded-For");
        if (xff != null && !xff.isEmpty()) {
            return xff.split(",")[0].trim();
        }

        String xRealIp = request.getHeaders().getFirst("X-Real-IP");
        if (xRealIp != null && !xRealIp.isEmpty()) {
            return xRealIp;
        }

        if (request.getRemoteAddress() != null && request.getRemoteAddress().getAddress() != null) {
            return request.getRemoteAddress().getAddress().getHostAddress();
        }

        return "unknown";
    }
}
