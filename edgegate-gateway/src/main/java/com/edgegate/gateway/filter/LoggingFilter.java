package com.edgegate.gateway.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Request/response logging. Assigns an X-Request-Id when the client sent none
 * and reports the handling time in X-Response-Time.
 */
@Slf4j
@Component
public class LoggingFilter implements WebFilter, Ordered {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String RESPONSE_TIME_HEADER = "X-Response-Time";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        long startTime = System.currentTimeMillis();

        String incomingId = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
        String requestId = incomingId != null && !incomingId.isBlank() ? incomingId : UUID.randomUUID().toString();

        ServerHttpRequest request = exchange.getRequest().mutate()
                .headers(headers -> headers.set(REQUEST_ID_HEADER, requestId))
                .build();
        ServerWebExchange next = exchange.mutate().request(request).build();
        ServerHttpResponse response = next.getResponse();

        log.info("Incoming request: {} {} | RequestId: {} | RemoteAddr: {}",
                request.getMethod(), request.getURI().getPath(), requestId, request.getRemoteAddress());

        response.beforeCommit(() -> {
            response.getHeaders().set(REQUEST_ID_HEADER, requestId);
            response.getHeaders().set(RESPONSE_TIME_HEADER, (System.currentTimeMillis() - startTime) + "ms");
            return Mono.empty();
        });

        return chain.filter(next)
                .doFinally(signal -> log.info("Outgoing response: {} | Status: {} | Duration: {}ms | RequestId: {}",
                        request.getURI().getPath(),
                        response.getStatusCode(),
                        System.currentTimeMillis() - startTime,
                        requestId));
    }

    @Override
    public int getOrder() {
        return -200;
    }
}
