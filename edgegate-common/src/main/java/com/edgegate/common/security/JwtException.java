package com.edgegate.common.security;

/**
 * Raised when a bearer token cannot be verified
 */
public class JwtException extends Exception {

    public JwtException(String message) {
        super(message);
    }

    public JwtException(String message, Throwable cause) {
        super(message, cause);
    }
}
