package com.edgegate.common.model;

/**
 * Quota scopes, listed in the order the gateway checks them
 */
public enum RateLimitScope {
    GLOBAL("global"),
    SERVICE("service"),
    USER("user");

    private final String label;

    RateLimitScope(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
