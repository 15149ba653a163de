package com.edgegate.gateway.realtime;

import com.edgegate.common.security.JwtTokenProvider;
import com.edgegate.common.security.UserPrincipal;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.config.GatewayProperties.ChannelAccess;
import com.edgegate.gateway.config.GatewayProperties.ChannelRule;
import com.edgegate.gateway.observability.GatewayMetrics;
import com.edgegate.gateway.ratelimit.GatewayRateLimiter;
import com.edgegate.gateway.security.PrincipalResolver;
import com.edgegate.gateway.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.HandshakeInfo;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RealtimeWebSocketHandlerTest {

    private MutableClock clock;
    private FanoutHub hub;
    private RealtimeWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        GatewayProperties properties = new GatewayProperties();
        properties.getRealtime().setChannels(List.of(
                new ChannelRule("market.*", ChannelAccess.PUBLIC, List.of(), null),
                new ChannelRule("signals.premium", ChannelAccess.TIER, List.of("premium"), null)));
        GatewayMetrics metrics = new GatewayMetrics(new SimpleMeterRegistry());

        hub = new FanoutHub(new ChannelAccessPolicy(properties), properties, metrics, clock);
        PrincipalResolver resolver = new PrincipalResolver(
                new JwtTokenProvider("realtime-handler-test-secret-0123456789abcdef", 3600, "edgegate"));
        handler = new RealtimeWebSocketHandler(hub, resolver,
                new GatewayRateLimiter(properties, clock, metrics), new ObjectMapper().findAndRegisterModules());
    }

    private static List<ServerFrame> drain(RealtimeConnection connection) {
        connection.close();
        return connection.outbound().collectList().block();
    }

    @Test
    void testSubscribeRepliesPerChannel() {
        RealtimeConnection connection = hub.connect(UserPrincipal.anonymous());

        handler.handleText(connection,
                "{\"action\":\"subscribe\",\"channels\":[\"market.BTC\",\"signals.premium\",\"nope\"]}");

        List<ServerFrame> frames = drain(connection);
        assertEquals(3, frames.size());
        assertEquals(ServerFrame.SUBSCRIBED, frames.get(0).getEvent());
        assertEquals("market.BTC", frames.get(0).getChannel());
        assertEquals(ServerFrame.SUBSCRIPTION_ERROR, frames.get(1).getEvent());
        assertEquals("tier_required", frames.get(1).getError());
        assertEquals("unknown_channel", frames.get(2).getError());
        assertEquals(1, hub.subscriptionCount());
    }

    @Test
    void testUnsubscribeAcknowledgesEveryChannel() {
        RealtimeConnection connection = hub.connect(null);
        hub.subscribe(connection.getId(), List.of("market.BTC"));

        handler.handleFrame(connection, new ClientFrame(ClientFrame.UNSUBSCRIBE, List.of("market.BTC", "market.ETH")));

        List<ServerFrame> frames = drain(connection);
        assertEquals(2, frames.size());
        assertTrue(frames.stream().allMatch(frame -> ServerFrame.UNSUBSCRIBED.equals(frame.getEvent())));
        assertEquals(0, hub.subscriptionCount());
    }

    @Test
    void testMalformedFramesGetErrorReplies() {
        RealtimeConnection connection = hub.connect(null);

        handler.handleText(connection, "not json");
        handler.handleText(connection, "{\"channels\":[\"market.BTC\"]}");
        handler.handleText(connection, "{\"action\":\"publish\"}");

        List<ServerFrame> frames = drain(connection);
        assertEquals(List.of("invalid_frame", "missing_action", "unknown_action"),
                List.of(frames.get(0).getError(), frames.get(1).getError(), frames.get(2).getError()));
    }

    @Test
    void testPingIsRateLimitedPerConnection() {
        RealtimeConnection connection = hub.connect(null);
        RealtimeConnection other = hub.connect(null);

        for (int i = 0; i < 6; i++) {
            handler.handleFrame(connection, new ClientFrame(ClientFrame.PING, null));
        }
        handler.handleFrame(other, new ClientFrame(ClientFrame.PING, null));

        List<ServerFrame> frames = drain(connection);
        assertEquals(6, frames.size());
        assertEquals(5, frames.stream().filter(frame -> ServerFrame.PONG.equals(frame.getEvent())).count());

        ServerFrame limited = frames.get(5);
        assertEquals("rate_limited", limited.getError());
        Map<?, ?> payload = (Map<?, ?>) limited.getPayload();
        assertEquals("ping", payload.get("action"));
        assertEquals(1L, payload.get("retryAfterSeconds"));

        assertEquals(ServerFrame.PONG, drain(other).get(0).getEvent());
    }

    @Test
    void testHandshakeTokenFromHeaderOrQuery() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer header-token");
        HandshakeInfo withHeader = new HandshakeInfo(URI.create("ws://localhost/ws?access_token=query-token"),
                headers, Mono.empty(), null);
        HandshakeInfo withQuery = new HandshakeInfo(URI.create("ws://localhost/ws?access_token=query-token"),
                new HttpHeaders(), Mono.empty(), null);
        HandshakeInfo without = new HandshakeInfo(URI.create("ws://localhost/ws"),
                new HttpHeaders(), Mono.empty(), null);

        assertEquals("header-token", RealtimeWebSocketHandler.handshakeToken(withHeader));
        assertEquals("query-token", RealtimeWebSocketHandler.handshakeToken(withQuery));
        assertNull(RealtimeWebSocketHandler.handshakeToken(without));
    }
}
