package com.edgegate.gateway.realtime;

import com.edgegate.common.exception.RateLimitedException;
import com.edgegate.common.security.UserPrincipal;
import com.edgegate.gateway.ratelimit.GatewayRateLimiter;
import com.edgegate.gateway.security.PrincipalResolver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * WebSocket endpoint for realtime channels.
 *
 * Connections may be anonymous; a bearer token is taken from the Authorization
 * header or the {@code access_token} query parameter. Invalid tokens connect as
 * anonymous, restricted to public channels.
 */
@Slf4j
@Component
public class RealtimeWebSocketHandler implements WebSocketHandler {

    static final String ACCESS_TOKEN_PARAM = "access_token";

    private final FanoutHub hub;
    private final PrincipalResolver principalResolver;
    private final GatewayRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public RealtimeWebSocketHandler(FanoutHub hub, PrincipalResolver principalResolver,
                                    GatewayRateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.hub = hub;
        this.principalResolver = principalResolver;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        UserPrincipal principal = principalResolver.resolveOrAnonymous(handshakeToken(session.getHandshakeInfo()));
        RealtimeConnection connection = hub.connect(principal);
        connection.send(ServerFrame.connected(connection.getId(), principal.isAuthenticated()));

        Mono<Void> input = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(text -> handleText(connection, text))
                .doFinally(signal -> hub.disconnect(connection.getId()))
                .then();

        Flux<WebSocketMessage> output = connection.outbound()
                .flatMap(frame -> serialize(frame).map(session::textMessage));

        return session.send(output)
                .and(input)
                .doFinally(signal -> {
                    hub.disconnect(connection.getId());
                    log.debug("WebSocket session {} finished: {}", session.getId(), signal);
                });
    }

    void handleText(RealtimeConnection connection, String text) {
        ClientFrame frame;
        try {
            frame = objectMapper.readValue(text, ClientFrame.class);
        } catch (JsonProcessingException e) {
            log.debug("Invalid frame from {}: {}", connection.getId(), e.getOriginalMessage());
            connection.send(ServerFrame.error("invalid_frame"));
            return;
        }
        handleFrame(connection, frame);
    }

    void handleFrame(RealtimeConnection connection, ClientFrame frame) {
        String action = frame.getAction();
        if (action == null) {
            connection.send(ServerFrame.error("missing_action"));
            return;
        }

        try {
            rateLimiter.checkRealtime(connection.getId(), action);
        } catch (RateLimitedException e) {
            log.debug("Connection {} rate limited on {}", connection.getId(), action);
            connection.send(ServerFrame.builder()
                    .event(ServerFrame.ERROR)
                    .error("rate_limited")
                    .payload(Map.of(
                            "action", action,
                            "retryAfterSeconds", e.getRetryAfter().map(d -> Math.max(1, (d.toMillis() + 999) / 1000)).orElse(1L)))
                    .build());
            return;
        }

        List<String> channels = frame.getChannels() != null ? frame.getChannels() : List.of();
        switch (action) {
            case ClientFrame.SUBSCRIBE:
                SubscribeResult result = hub.subscribe(connection.getId(), channels);
                result.getAccepted().forEach(channel -> connection.send(ServerFrame.subscribed(channel)));
                result.getRejected().forEach((channel, reason) ->
                        connection.send(ServerFrame.subscriptionError(channel, reason)));
                break;
            case ClientFrame.UNSUBSCRIBE:
                hub.unsubscribe(connection.getId(), channels);
                channels.forEach(channel -> connection.send(ServerFrame.unsubscribed(channel)));
                break;
            case ClientFrame.PING:
                connection.send(ServerFrame.pong());
                break;
            default:
                connection.send(ServerFrame.error("unknown_action"));
        }
    }

    private Mono<String> serialize(ServerFrame frame) {
        try {
            return Mono.just(objectMapper.writeValueAsString(frame));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} frame: {}", frame.getEvent(), e.getMessage());
            return Mono.empty();
        }
    }

    static String handshakeToken(HandshakeInfo handshake) {
        String header = handshake.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        return PrincipalResolver.bearerToken(header)
                .orElseGet(() -> UriComponentsBuilder.fromUri(handshake.getUri())
                        .build()
                        .getQueryParams()
                        .getFirst(ACCESS_TOKEN_PARAM));
    }
}
