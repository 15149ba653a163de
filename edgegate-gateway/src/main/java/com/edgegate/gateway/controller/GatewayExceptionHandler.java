package com.edgegate.gateway.controller;

import com.edgegate.common.exception.GatewayException;
import com.edgegate.gateway.router.GatewayErrorResponder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Exception handler for the annotated REST endpoints; same body as the proxy routes.
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    private final GatewayErrorResponder errorResponder;

    public GatewayExceptionHandler(GatewayErrorResponder errorResponder) {
        this.errorResponder = errorResponder;
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<Map<String, Object>> handleGatewayException(GatewayException ex) {
        log.warn("Gateway exception: {} - {}", ex.getErrorCode(), ex.getMessage());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(ex.getErrorCode().getHttpStatus());
        ex.getRetryAfter().ifPresent(retryAfter ->
                builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(GatewayErrorResponder.retryAfterSeconds(retryAfter))));
        return builder.body(errorResponder.body(ex));
    }
}
