package com.edgegate.common.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Base exception for all gateway rejections.
 * Carries a stable {@link ErrorCode} and, where the caller may try again later,
 * a retry-after hint.
 */
public class GatewayException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Duration retryAfter;

    public GatewayException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    public GatewayException(ErrorCode errorCode, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryAfter = retryAfter;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getCode() {
        return errorCode.getCode();
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
