package com.edgegate.gateway.realtime;

import com.edgegate.common.security.UserPrincipal;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One realtime client. Outbound frames go through a bounded buffer; when it is
 * full new frames are dropped so a slow client never blocks a broadcaster.
 */
@Slf4j
public class RealtimeConnection {

    private final String id;
    private final UserPrincipal principal;
    private final Instant connectedAt;
    private final Sinks.Many<ServerFrame> outbound;
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    private volatile boolean closed;
    private long dropped;

    public RealtimeConnection(String id, UserPrincipal principal, int bufferSize, Instant connectedAt) {
        this.id = id;
        this.principal = principal != null ? principal : UserPrincipal.anonymous();
        this.connectedAt = connectedAt;
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(bufferSize));
    }

    /**
     * Queue a frame without blocking
     * @return false if the frame was dropped
     */
    public synchronized boolean send(ServerFrame frame) {
        if (closed) {
            return false;
        }
        Sinks.EmitResult result = outbound.tryEmitNext(frame);
        if (result.isSuccess()) {
            return true;
        }
        dropped++;
        log.warn("Dropping {} frame for connection {} ({}), {} dropped so far",
                frame.getEvent(), id, result, dropped);
        return false;
    }

    public Flux<ServerFrame> outbound() {
        return outbound.asFlux();
    }

    public synchronized void close() {
        if (!closed) {
            closed = true;
            outbound.tryEmitComplete();
        }
    }

    public String getId() {
        return id;
    }

    public UserPrincipal getPrincipal() {
        return principal;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public boolean isClosed() {
        return closed;
    }

    public synchronized long getDropped() {
        return dropped;
    }

    Subscription addSubscription(String channel, Instant at) {
        return subscriptions.computeIfAbsent(channel, c -> new Subscription(id, c, at));
    }

    boolean removeSubscription(String channel) {
        return subscriptions.remove(channel) != null;
    }

    public Collection<Subscription> getSubscriptions() {
        return Collections.unmodifiableCollection(subscriptions.values());
    }

    public boolean isSubscribed(String channel) {
        return subscriptions.containsKey(channel);
    }
}
