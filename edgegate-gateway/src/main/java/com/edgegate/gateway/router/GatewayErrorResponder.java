package com.edgegate.gateway.router;

import com.edgegate.common.exception.ErrorCode;
import com.edgegate.common.exception.GatewayException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders gateway rejections as JSON:
 * {@code {error, code, message, status, retryAfterSeconds?, timestamp}}, plus a
 * {@code Retry-After} header when the exception carries a hint.
 * Anything that is not a {@link GatewayException} renders as INTERNAL_ERROR
 * without details.
 */
@Slf4j
@Component
public class GatewayErrorResponder {

    private final ObjectMapper objectMapper;

    public GatewayErrorResponder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GatewayException normalize(Throwable error) {
        if (error instanceof GatewayException) {
            return (GatewayException) error;
        }
        log.error("Unexpected gateway error", error);
        return new GatewayException(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", error);
    }

    public Map<String, Object> body(GatewayException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.getErrorCode().name());
        body.put("code", ex.getCode());
        body.put("message", ex.getMessage());
        body.put("status", ex.getErrorCode().getHttpStatus());
        ex.getRetryAfter().ifPresent(retryAfter -> body.put("retryAfterSeconds", retryAfterSeconds(retryAfter)));
        body.put("timestamp", Instant.now().toString());
        return body;
    }

    /**
     * Response for functional endpoints
     */
    public Mono<ServerResponse> render(Throwable error, HttpHeaders extraHeaders) {
        GatewayException ex = normalize(error);
        return ServerResponse.status(ex.getErrorCode().getHttpStatus())
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    if (extraHeaders != null) {
                        headers.addAll(extraHeaders);
                    }
                    ex.getRetryAfter().ifPresent(retryAfter ->
                            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(retryAfter))));
                })
                .bodyValue(body(ex));
    }

    /**
     * Write straight to the exchange, for web filters that stop the chain
     */
    public Mono<Void> write(ServerWebExchange exchange, GatewayException ex) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.valueOf(ex.getErrorCode().getHttpStatus()));
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        ex.getRetryAfter().ifPresent(retryAfter ->
                response.getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(retryAfter))));

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body(ex));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize error body: {}", e.getMessage());
            bytes = ("{\"error\":\"" + ex.getErrorCode().name() + "\"}").getBytes(StandardCharsets.UTF_8);
        }
        return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
    }

    /**
     * Whole seconds, rounded up, at least 1
     */
    public static long retryAfterSeconds(Duration retryAfter) {
        long seconds = (retryAfter.toMillis() + 999) / 1000;
        return Math.max(1, seconds);
    }
}
