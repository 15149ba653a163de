package com.edgegate.common.exception;

/**
 * Thrown when a downstream call outlives the caller's deadline
 */
public class GatewayTimeoutException extends GatewayException {

    public GatewayTimeoutException(String serviceName, Throwable cause) {
        super(ErrorCode.TIMEOUT, "Upstream request timed out: " + serviceName, cause);
    }
}
