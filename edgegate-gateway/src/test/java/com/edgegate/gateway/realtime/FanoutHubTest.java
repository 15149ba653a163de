package com.edgegate.gateway.realtime;

import com.edgegate.common.security.UserPrincipal;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.config.GatewayProperties.ChannelAccess;
import com.edgegate.gateway.config.GatewayProperties.ChannelRule;
import com.edgegate.gateway.observability.GatewayMetrics;
import com.edgegate.gateway.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class FanoutHubTest {

    private SimpleMeterRegistry meterRegistry;
    private GatewayProperties properties;
    private FanoutHub hub;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getRealtime().setMaxChannelsPerRequest(3);
        properties.getRealtime().setChannels(List.of(
                new ChannelRule("prices.basic", ChannelAccess.PUBLIC, List.of(), null),
                new ChannelRule("prices.vip", ChannelAccess.TIER, List.of("premium"), null),
                new ChannelRule("market.*", ChannelAccess.PUBLIC, List.of(), null)));
        hub = newHub();
    }

    private FanoutHub newHub() {
        meterRegistry = new SimpleMeterRegistry();
        return new FanoutHub(new ChannelAccessPolicy(properties), properties,
                new GatewayMetrics(meterRegistry), MutableClock.startingAt("2024-01-01T00:00:00Z"));
    }

    private static UserPrincipal user(String subject, String tier) {
        return UserPrincipal.builder().subject(subject).roles(List.of("USER")).tier(tier).permissions(List.of()).build();
    }

    private static List<ServerFrame> drain(RealtimeConnection connection) {
        connection.close();
        List<ServerFrame> frames = connection.outbound().collectList().block();
        return frames != null ? frames : new ArrayList<>();
    }

    private static List<String> channelEvents(RealtimeConnection connection, String event) {
        return drain(connection).stream()
                .filter(frame -> event.equals(frame.getEvent()))
                .map(ServerFrame::getChannel)
                .collect(Collectors.toList());
    }

    @Test
    void testTierGatedBroadcast() {
        RealtimeConnection anonymous = hub.connect(UserPrincipal.anonymous());
        RealtimeConnection basic = hub.connect(user("bob", "basic"));
        RealtimeConnection premium = hub.connect(user("carol", "premium"));

        SubscribeResult anonymousResult = hub.subscribe(anonymous.getId(), List.of("prices.basic", "prices.vip"));
        SubscribeResult basicResult = hub.subscribe(basic.getId(), List.of("prices.basic", "prices.vip"));
        SubscribeResult premiumResult = hub.subscribe(premium.getId(), List.of("prices.basic", "prices.vip"));

        assertEquals(List.of("prices.basic"), anonymousResult.getAccepted());
        assertEquals(Map.of("prices.vip", "tier_required"), anonymousResult.getRejected());
        assertEquals(List.of("prices.basic"), basicResult.getAccepted());
        assertEquals(List.of("prices.basic", "prices.vip"), premiumResult.getAccepted());

        assertEquals(3, hub.broadcast("prices.basic", "tick", Map.of("price", 101)));
        assertEquals(1, hub.broadcast("prices.vip", "signal", Map.of("side", "buy")));

        assertEquals(List.of("prices.basic"), channelEvents(anonymous, "tick"));
        assertTrue(channelEvents(basic, "signal").isEmpty());
        assertEquals(List.of("prices.vip"), channelEvents(premium, "signal"));
    }

    @Test
    void testUnsubscribeStopsDelivery() {
        RealtimeConnection connection = hub.connect(null);
        hub.subscribe(connection.getId(), List.of("market.BTC", "market.ETH"));
        assertEquals(2, hub.subscriptionCount());

        hub.unsubscribe(connection.getId(), List.of("market.BTC", "market.DOGE"));
        hub.unsubscribe(connection.getId(), List.of("market.BTC"));

        assertEquals(0, hub.broadcast("market.BTC", "tick", 1));
        assertEquals(1, hub.broadcast("market.ETH", "tick", 2));
        assertEquals(1, hub.subscriptionCount());
        assertEquals(1, hub.channelCount());
        assertEquals(List.of("market.ETH"), channelEvents(connection, "tick"));
    }

    @Test
    void testDisconnectRemovesEverySubscription() {
        RealtimeConnection first = hub.connect(null);
        RealtimeConnection second = hub.connect(null);
        hub.subscribe(first.getId(), List.of("market.BTC", "prices.basic"));
        hub.subscribe(second.getId(), List.of("market.BTC"));

        hub.disconnect(first.getId());
        hub.disconnect(first.getId());

        assertTrue(first.isClosed());
        assertNull(hub.getConnection(first.getId()));
        assertEquals(Set.of(second.getId()), hub.subscribers("market.BTC"));
        assertTrue(hub.subscribers("prices.basic").isEmpty());
        assertEquals(1, hub.connectionCount());
        assertEquals(1, hub.subscriptionCount());
        assertEquals(1.0, meterRegistry.get("edgegate.realtime.connections").gauge().value());
    }

    @Test
    void testSubscribeRejectsPerChannel() {
        RealtimeConnection connection = hub.connect(user("bob", "basic"));

        SubscribeResult result = hub.subscribe(connection.getId(),
                List.of("market.BTC", "orders.all", "bad..name", "market.ETH", "market.SOL"));

        assertEquals(List.of("market.BTC"), result.getAccepted());
        assertEquals("unknown_channel", result.getRejected().get("orders.all"));
        assertEquals("invalid_channel", result.getRejected().get("bad..name"));
        assertEquals("too_many_channels", result.getRejected().get("market.ETH"));
        assertEquals("too_many_channels", result.getRejected().get("market.SOL"));
    }

    @Test
    void testSubscribeIsIdempotent() {
        RealtimeConnection connection = hub.connect(null);
        hub.subscribe(connection.getId(), List.of("market.BTC"));
        SubscribeResult again = hub.subscribe(connection.getId(), List.of("market.BTC"));

        assertEquals(List.of("market.BTC"), again.getAccepted());
        assertEquals(1, hub.subscriptionCount());
        assertEquals(1, hub.broadcast("market.BTC", "tick", 1));
    }

    @Test
    void testUnknownConnectionCannotSubscribe() {
        SubscribeResult result = hub.subscribe("missing", List.of("market.BTC"));

        assertTrue(result.getAccepted().isEmpty());
        assertEquals(Map.of("market.BTC", "not_connected"), result.getRejected());
        assertEquals(0, hub.channelCount());
    }

    @Test
    void testBroadcastToIdentityIgnoresSubscriptions() {
        RealtimeConnection phone = hub.connect(user("alice", "basic"));
        RealtimeConnection laptop = hub.connect(user("alice", "basic"));
        RealtimeConnection other = hub.connect(user("bob", "basic"));

        assertEquals(2, hub.broadcastToIdentity("alice", "order_filled", Map.of("orderId", "o-1")));
        assertEquals(0, hub.broadcastToIdentity(null, "order_filled", Map.of()));

        assertEquals(1, drain(phone).size());
        assertEquals(1, drain(laptop).size());
        assertTrue(drain(other).isEmpty());
    }

    @Test
    void testSlowConsumerDropsWithoutBlockingOthers() {
        properties.getRealtime().setOutboundBufferSize(2);
        hub = newHub();
        RealtimeConnection slow = hub.connect(null);
        RealtimeConnection fast = hub.connect(null);
        hub.subscribe(slow.getId(), List.of("market.BTC"));
        hub.subscribe(fast.getId(), List.of("market.BTC"));

        List<String> seen = new ArrayList<>();
        fast.outbound().subscribe(frame -> seen.add(frame.getEvent()));

        for (int i = 0; i < 5; i++) {
            hub.broadcast("market.BTC", "tick", i);
        }

        assertEquals(5, seen.size());
        assertEquals(3, slow.getDropped());
        assertEquals(3.0, meterRegistry.get("edgegate.realtime.messages.dropped").counter().count());
    }

    @Test
    void testConcurrentSubscribeAndDisconnectLeaveNoMembers() throws InterruptedException {
        int clients = 50;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(clients);
        for (int i = 0; i < clients; i++) {
            pool.submit(() -> {
                try {
                    RealtimeConnection connection = hub.connect(null);
                    hub.subscribe(connection.getId(), List.of("market.BTC", "prices.basic"));
                    hub.disconnect(connection.getId());
                } finally {
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(0, hub.connectionCount());
        assertEquals(0, hub.subscriptionCount());
        assertEquals(0, hub.channelCount());
    }
}
