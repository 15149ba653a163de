package com.edgegate.gateway.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound frame. Control frames carry a channel, channel events carry a payload.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServerFrame {
    public static final String CONNECTED = "connected";
    public static final String SUBSCRIBED = "subscribed";
    public static final String UNSUBSCRIBED = "unsubscribed";
    public static final String SUBSCRIPTION_ERROR = "subscription_error";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    String event;
    String channel;
    Object payload;
    String error;
    Instant timestamp;

    public static ServerFrame connected(String connectionId, boolean authenticated) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("connectionId", connectionId);
        payload.put("authenticated", authenticated);
        return ServerFrame.builder().event(CONNECTED).payload(payload).timestamp(Instant.now()).build();
    }

    public static ServerFrame subscribed(String channel) {
        return ServerFrame.builder().event(SUBSCRIBED).channel(channel).build();
    }

    public static ServerFrame unsubscribed(String channel) {
        return ServerFrame.builder().event(UNSUBSCRIBED).channel(channel).build();
    }

    public static ServerFrame subscriptionError(String channel, String reason) {
        return ServerFrame.builder().event(SUBSCRIPTION_ERROR).channel(channel).error(reason).build();
    }

    public static ServerFrame pong() {
        return ServerFrame.builder().event(PONG).timestamp(Instant.now()).build();
    }

    public static ServerFrame error(String message) {
        return ServerFrame.builder().event(ERROR).error(message).build();
    }

    public static ServerFrame event(String event, String channel, Object payload) {
        return ServerFrame.builder().event(event).channel(channel).payload(payload).timestamp(Instant.now()).build();
    }
}
