package com.edgegate.gateway.realtime;

import lombok.Value;

import java.time.Instant;

@Value
public class Subscription {
    String connectionId;
    String channel;
    Instant subscribedAt;
}
