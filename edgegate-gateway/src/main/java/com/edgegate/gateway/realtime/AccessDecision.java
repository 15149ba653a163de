package com.edgegate.gateway.realtime;

/**
 * Outcome of a channel access check; the reason codes are sent to clients
 */
public enum AccessDecision {
    ALLOWED("allowed"),
    INVALID_CHANNEL("invalid_channel"),
    UNKNOWN_CHANNEL("unknown_channel"),
    TIER_REQUIRED("tier_required"),
    PERMISSION_REQUIRED("permission_required");

    private final String reason;

    AccessDecision(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    public boolean isAllowed() {
        return this == ALLOWED;
    }
}
