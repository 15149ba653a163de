package com.edgegate.common.exception;

/**
 * Thrown when a downstream failure has no more specific mapping
 */
public class BadGatewayException extends GatewayException {

    public BadGatewayException(String serviceName, Throwable cause) {
        super(ErrorCode.BAD_GATEWAY, "Bad gateway: " + serviceName, cause);
    }
}
