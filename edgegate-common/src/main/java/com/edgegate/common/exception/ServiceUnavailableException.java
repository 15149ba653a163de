package com.edgegate.common.exception;

import java.time.Duration;

/**
 * Thrown when no healthy instance can serve a request, the downstream refused the
 * connection, or its circuit is open
 */
public class ServiceUnavailableException extends GatewayException {

    public ServiceUnavailableException(String serviceName) {
        super(ErrorCode.SERVICE_UNAVAILABLE, "Service unavailable: " + serviceName);
    }

    public ServiceUnavailableException(String serviceName, Throwable cause) {
        super(ErrorCode.SERVICE_UNAVAILABLE, "Service unavailable: " + serviceName, cause);
    }

    public ServiceUnavailableException(String serviceName, Duration retryAfter, Throwable cause) {
        super(ErrorCode.SERVICE_UNAVAILABLE, "Service unavailable: " + serviceName, retryAfter, cause);
    }
}
