package com.edgegate.gateway.realtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event pushed by a backend service for realtime delivery.
 * Exactly one of {@code channel} and {@code identity} is set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RealtimeEventRequest {
    private String channel;

    /**
     * Subject of the target user, for account-scoped notifications
     */
    private String identity;

    private String event;
    private Object payload;
}
