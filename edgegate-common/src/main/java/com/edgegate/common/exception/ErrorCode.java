package com.edgegate.common.exception;

/**
 * Stable error codes surfaced to gateway callers.
 * 1xxx: caller errors, 2xxx: downstream availability, 3xxx: gateway internal
 */
public enum ErrorCode {
    INVALID_INSTANCE(1001, 400),
    ROUTE_NOT_FOUND(1004, 404),
    FORBIDDEN(1003, 403),
    UNAUTHORIZED(1005, 401),
    RATE_LIMITED(1429, 429),
    SERVICE_UNAVAILABLE(2001, 503),
    CIRCUIT_OPEN(2002, 503),
    TIMEOUT(2004, 504),
    BAD_GATEWAY(2005, 502),
    INTERNAL_ERROR(3000, 500);

    private final int code;
    private final int httpStatus;

    ErrorCode(int code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public int getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
