package com.edgegate.gateway.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Gateway configuration, bound from the {@code edgegate.*} properties
 */
@Data
@ConfigurationProperties(prefix = "edgegate")
public class GatewayProperties {

    private Registry registry = new Registry();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Proxy proxy = new Proxy();
    private RateLimit rateLimit = new RateLimit();
    private Realtime realtime = new Realtime();
    private Auth auth = new Auth();

    /**
     * Path pattern to service mapping, matched in order against the path with the
     * API prefix removed
     */
    private List<Route> routes = new ArrayList<>();

    @Data
    public static class Registry {
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private Duration healthCheckTimeout = Duration.ofSeconds(5);
        private Duration reconcileInterval = Duration.ofSeconds(60);

        private String defaultHealthEndpoint = "/health";

        /**
         * Health endpoint per service name, overriding the default
         */
        private Map<String, String> healthEndpoints = new HashMap<>();

        /**
         * Failed probes in a row after which reconciliation evicts an instance
         */
        private int maxMissedChecks = 5;

        private int probeConcurrency = 16;

        /**
         * static | spring-cloud
         */
        private String discoveryBackend = "static";

        private List<StaticInstance> staticInstances = new ArrayList<>();

        public String healthEndpointFor(String serviceName) {
            return healthEndpoints.getOrDefault(serviceName, defaultHealthEndpoint);
        }
    }

    @Data
    public static class StaticInstance {
        private String id;
        private String serviceName;
        private String address;
        private Integer port;
        private List<String> tags = new ArrayList<>();
        private Map<String, String> metadata = new HashMap<>();
    }

    @Data
    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(10);

        /**
         * Successful half-open trials needed before the breaker closes
         */
        private int halfOpenSuccessThreshold = 1;

        /**
         * Factor applied to the recovery timeout after a failed trial. 1.0 keeps a fixed cadence.
         */
        private double recoveryBackoffMultiplier = 1.0;
        private Duration maxRecoveryTimeout = Duration.ofMinutes(5);

        /**
         * Failures that pass through without counting toward the threshold
         */
        private List<Class<? extends Throwable>> ignoredExceptions = new ArrayList<>(List.of(CancellationException.class));
    }

    @Data
    public static class Proxy {
        private String apiPrefix = "/api/v1";
        private int maxRetries = 2;
        private Duration baseDelay = Duration.ofSeconds(1);

        /**
         * Deadline for the whole forward, retries included. Callers may ask for less
         * with the {@code X-Request-Timeout} header.
         */
        private Duration requestTimeout = Duration.ofSeconds(30);

        /**
         * Cap on a single attempt. An attempt that hits it counts as a breaker failure;
         * one cut short by the caller's deadline does not.
         */
        private Duration attemptTimeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(2);
        private int maxBodyBytes = 10 * 1024 * 1024;
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private Quota global = new Quota(10_000, Duration.ofMinutes(1));
        private Quota service = new Quota(1_000, Duration.ofMinutes(1));

        /**
         * Per-service overrides of the service scope quota
         */
        private Map<String, Quota> services = new HashMap<>();

        /**
         * Caller quota for anonymous callers and callers without a configured tier
         */
        private Quota user = new Quota(100, Duration.ofMinutes(1));

        /**
         * Caller quota by subscription tier claim
         */
        private Map<String, Quota> tiers = new HashMap<>();

        /**
         * Per-connection quotas for realtime actions (subscribe, unsubscribe, ping)
         */
        private Map<String, Quota> realtime = new HashMap<>(Map.of(
                "subscribe", new Quota(10, Duration.ofSeconds(10)),
                "unsubscribe", new Quota(10, Duration.ofSeconds(10)),
                "ping", new Quota(5, Duration.ofSeconds(1))));

        private Quota realtimeDefault = new Quota(10, Duration.ofSeconds(1));

        private Duration purgeInterval = Duration.ofMinutes(5);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Quota {
        private int limit;
        private Duration window;

        /**
         * Penalty after the quota is exceeded: all requests are rejected for this long.
         * Unset means rejections end with the window.
         */
        private Duration blockDuration;

        public Quota(int limit, Duration window) {
            this(limit, window, null);
        }
    }

    @Data
    public static class Realtime {
        private String path = "/ws";
        private int outboundBufferSize = 256;
        private int maxChannelsPerRequest = 50;
        private String healthChannel = "system.health";
        private String circuitChannel = "system.circuits";
        private List<ChannelRule> channels = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChannelRule {
        /**
         * Exact channel name, or a prefix ending in {@code .*}
         */
        private String pattern;
        private ChannelAccess access = ChannelAccess.PUBLIC;
        private List<String> tiers = new ArrayList<>();
        private String permission;
    }

    public enum ChannelAccess {
        PUBLIC,
        TIER,
        PERMISSION
    }

    @Data
    public static class Auth {
        /**
         * Paths that reject requests without a valid bearer token
         */
        private List<String> protectedPaths = new ArrayList<>();

        /**
         * Paths that additionally require the {@code adminRole} role
         */
        private List<String> adminPaths = new ArrayList<>();

        private String adminRole = "ADMIN";
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Route {
        private String id;
        private String path;
        private String serviceName;

        /**
         * Whether failed attempts may be retried. Unset falls back to the HTTP method:
         * GET, HEAD, OPTIONS, PUT and DELETE are retryable.
         */
        private Boolean idempotent;
    }
}
