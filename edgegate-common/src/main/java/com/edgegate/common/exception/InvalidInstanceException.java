package com.edgegate.common.exception;

/**
 * Thrown when a service instance cannot be registered because it lacks an address or port
 */
public class InvalidInstanceException extends GatewayException {

    public InvalidInstanceException(String message) {
        super(ErrorCode.INVALID_INSTANCE, message);
    }
}
