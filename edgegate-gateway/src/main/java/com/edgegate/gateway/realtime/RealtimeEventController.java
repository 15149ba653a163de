package com.edgegate.gateway.realtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Internal entry point for backend services publishing realtime events.
 * POST /internal/events
 */
@Slf4j
@RestController
@RequestMapping("/internal/events")
public class RealtimeEventController {

    private final FanoutHub hub;

    public RealtimeEventController(FanoutHub hub) {
        this.hub = hub;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> publish(@RequestBody RealtimeEventRequest request) {
        boolean hasChannel = request.getChannel() != null && !request.getChannel().isBlank();
        boolean hasIdentity = request.getIdentity() != null && !request.getIdentity().isBlank();

        if (hasChannel == hasIdentity) {
            return badRequest("Exactly one of channel or identity is required");
        }
        if (request.getEvent() == null || request.getEvent().isBlank()) {
            return badRequest("event is required");
        }

        int delivered = hasChannel
                ? hub.broadcast(request.getChannel(), request.getEvent(), request.getPayload())
                : hub.broadcastToIdentity(request.getIdentity(), request.getEvent(), request.getPayload());

        log.debug("Published {} to {} ({} deliveries)", request.getEvent(),
                hasChannel ? "channel " + request.getChannel() : "identity " + request.getIdentity(), delivered);

        Map<String, Object> response = new HashMap<>();
        response.put("event", request.getEvent());
        response.put("delivered", delivered);
        return ResponseEntity.accepted().body(response);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("connections", hub.connectionCount());
        stats.put("subscriptions", hub.subscriptionCount());
        stats.put("channels", hub.channelCount());
        return ResponseEntity.ok(stats);
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("error", "INVALID_EVENT");
        response.put("message", message);
        return ResponseEntity.badRequest().body(response);
    }
}
