package com.edgegate.gateway.realtime;

import com.edgegate.common.security.UserPrincipal;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.observability.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connection and channel-group bookkeeping for realtime delivery.
 *
 * Delivery is at most once per connection: each frame is queued on the
 * connection's bounded buffer and dropped if the buffer is full.
 */
@Slf4j
@Component
public class FanoutHub {

    private final Map<String, RealtimeConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> channelMembers = new ConcurrentHashMap<>();
    private final AtomicInteger subscriptionCount = new AtomicInteger();

    private final ChannelAccessPolicy accessPolicy;
    private final GatewayProperties.Realtime config;
    private final GatewayMetrics metrics;
    private final Clock clock;

    public FanoutHub(ChannelAccessPolicy accessPolicy, GatewayProperties properties,
                     GatewayMetrics metrics, Clock clock) {
        this.accessPolicy = accessPolicy;
        this.config = properties.getRealtime();
        this.metrics = metrics;
        this.clock = clock;
    }

    public RealtimeConnection connect(UserPrincipal principal) {
        RealtimeConnection connection = new RealtimeConnection(
                UUID.randomUUID().toString(), principal, config.getOutboundBufferSize(), clock.instant());
        connections.put(connection.getId(), connection);
        metrics.setActiveConnections(connections.size());

        log.info("Realtime connection {} opened ({}), total {}", connection.getId(),
                connection.getPrincipal().isAuthenticated() ? connection.getPrincipal().getSubject() : "anonymous",
                connections.size());
        return connection;
    }

    /**
     * Drop a connection and every subscription it holds. Unknown ids are ignored.
     */
    public void disconnect(String connectionId) {
        RealtimeConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return;
        }
        for (Subscription subscription : new ArrayList<>(connection.getSubscriptions())) {
            leave(connection, subscription.getChannel());
        }
        connection.close();
        metrics.setActiveConnections(connections.size());
        metrics.setActiveSubscriptions(subscriptionCount.get());

        log.info("Realtime connection {} closed, total {}", connectionId, connections.size());
    }

    public SubscribeResult subscribe(String connectionId, Collection<String> channels) {
        List<String> accepted = new ArrayList<>();
        Map<String, String> rejected = new LinkedHashMap<>();
        Set<String> requested = channels != null ? new LinkedHashSet<>(channels) : Collections.emptySet();

        RealtimeConnection connection = connections.get(connectionId);
        if (connection == null) {
            requested.forEach(channel -> rejected.put(channel, "not_connected"));
            return new SubscribeResult(accepted, rejected);
        }

        int index = 0;
        Instant now = clock.instant();
        for (String channel : requested) {
            if (index++ >= config.getMaxChannelsPerRequest()) {
                rejected.put(channel, "too_many_channels");
                continue;
            }
            AccessDecision decision = accessPolicy.decide(connection.getPrincipal(), channel);
            if (!decision.isAllowed()) {
                log.debug("Connection {} denied channel {}: {}", connectionId, channel, decision.getReason());
                rejected.put(channel, decision.getReason());
                continue;
            }
            if (!connection.isSubscribed(channel)) {
                connection.addSubscription(channel, now);
                channelMembers.compute(channel, (c, members) -> {
                    Set<String> joined = members != null ? members : ConcurrentHashMap.newKeySet();
                    joined.add(connectionId);
                    return joined;
                });
                subscriptionCount.incrementAndGet();
            }
            accepted.add(channel);
        }

        // closed while subscribing
        if (!connections.containsKey(connectionId)) {
            accepted.forEach(channel -> leave(connection, channel));
        }

        metrics.setActiveSubscriptions(subscriptionCount.get());
        return new SubscribeResult(accepted, rejected);
    }

    /**
     * Leave the given channels. Channels the connection never joined are ignored.
     */
    public void unsubscribe(String connectionId, Collection<String> channels) {
        RealtimeConnection connection = connections.get(connectionId);
        if (connection == null || channels == null) {
            return;
        }
        for (String channel : channels) {
            leave(connection, channel);
        }
        metrics.setActiveSubscriptions(subscriptionCount.get());
    }

    /**
     * Deliver to every connection subscribed to {@code channel}
     * @return number of connections the frame was queued for
     */
    public int broadcast(String channel, String event, Object payload) {
        Set<String> members = channelMembers.get(channel);
        metrics.recordBroadcast();
        if (members == null || members.isEmpty()) {
            return 0;
        }

        ServerFrame frame = ServerFrame.event(event, channel, payload);
        int delivered = 0;
        for (String connectionId : members) {
            RealtimeConnection connection = connections.get(connectionId);
            if (connection == null) {
                members.remove(connectionId);
                continue;
            }
            if (deliver(connection, frame)) {
                delivered++;
            }
        }
        log.debug("Broadcast {} on {} reached {} connections", event, channel, delivered);
        return delivered;
    }

    /**
     * Deliver to every connection authenticated as {@code subject}, regardless of subscriptions
     */
    public int broadcastToIdentity(String subject, String event, Object payload) {
        if (subject == null) {
            return 0;
        }
        ServerFrame frame = ServerFrame.event(event, null, payload);
        int delivered = 0;
        for (RealtimeConnection connection : connections.values()) {
            if (subject.equals(connection.getPrincipal().getSubject()) && deliver(connection, frame)) {
                delivered++;
            }
        }
        return delivered;
    }

    public RealtimeConnection getConnection(String connectionId) {
        return connections.get(connectionId);
    }

    public Set<String> subscribers(String channel) {
        Set<String> members = channelMembers.get(channel);
        return members != null ? Set.copyOf(members) : Collections.emptySet();
    }

    public int connectionCount() {
        return connections.size();
    }

    public int subscriptionCount() {
        return subscriptionCount.get();
    }

    public int channelCount() {
        return channelMembers.size();
    }

    private boolean deliver(RealtimeConnection connection, ServerFrame frame) {
        boolean queued = connection.send(frame);
        if (!queued && !connection.isClosed()) {
            metrics.recordMessageDropped();
        }
        return queued;
    }

    private void leave(RealtimeConnection connection, String channel) {
        if (!connection.removeSubscription(channel)) {
            return;
        }
        subscriptionCount.decrementAndGet();
        channelMembers.computeIfPresent(channel, (c, members) -> {
            members.remove(connection.getId());
            return members.isEmpty() ? null : members;
        });
    }
}
