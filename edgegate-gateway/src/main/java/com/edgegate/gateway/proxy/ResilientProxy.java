package com.edgegate.gateway.proxy;

import com.edgegate.common.exception.BadGatewayException;
import com.edgegate.common.exception.CircuitOpenException;
import com.edgegate.common.exception.GatewayException;
import com.edgegate.common.exception.GatewayTimeoutException;
import com.edgegate.common.exception.ServiceUnavailableException;
import com.edgegate.common.model.ServiceInstance;
import com.edgegate.common.util.ForwardedHeaders;
import com.edgegate.gateway.circuitbreaker.CircuitBreakerRegistry;
import com.edgegate.gateway.config.GatewayProperties;
import com.edgegate.gateway.registry.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Forwards a request to a healthy instance of a service.
 *
 * Each attempt picks an instance and runs under the circuit breaker for
 * {@code service:METHOD:routeTemplate}. Retries wrap the breaker, so an open
 * breaker stops them. Only idempotent requests are retried, and only on
 * transport errors, attempt timeouts and 5xx responses. The caller's deadline
 * bounds the whole chain.
 */
@Slf4j
@Service
public class ResilientProxy {

    private final ServiceRegistry registry;
    private final CircuitBreakerRegistry circuitBreakers;
    private final DownstreamClient downstreamClient;
    private final GatewayProperties.Proxy config;

    public ResilientProxy(ServiceRegistry registry, CircuitBreakerRegistry circuitBreakers,
                          DownstreamClient downstreamClient, GatewayProperties properties) {
        this.registry = registry;
        this.circuitBreakers = circuitBreakers;
        this.downstreamClient = downstreamClient;
        this.config = properties.getProxy();
    }

    public Mono<ProxyResponse> forward(String serviceName, ProxyRequest request) {
        String breakerKey = breakerKey(serviceName, request);
        Duration deadline = request.getTimeout() != null ? request.getTimeout() : config.getRequestTimeout();
        Duration attemptTimeout = config.getAttemptTimeout();
        HttpHeaders outbound = outboundHeaders(request);

        Mono<ProxyResponse> attempt = Mono.defer(() -> {
            ServiceInstance instance = registry.pick(serviceName);
            return circuitBreakers.execute(breakerKey,
                    () -> downstreamClient.exchange(instance, request, outbound).timeout(attemptTimeout));
        });

        if (request.isIdempotent() && config.getMaxRetries() > 0) {
            attempt = attempt.retryWhen(Retry.backoff(config.getMaxRetries(), config.getBaseDelay())
                    .jitter(0)
                    .filter(ResilientProxy::isRetryable)
                    .doBeforeRetry(signal -> log.warn("Retrying {} after attempt {} failed: {}",
                            breakerKey, signal.totalRetries() + 1, signal.failure().getMessage()))
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
        }

        // the deadline covers every attempt and backoff; cutting an attempt short releases its breaker permit
        return attempt.timeout(deadline)
                .onErrorMap(error -> mapError(serviceName, error));
    }

    static String breakerKey(String serviceName, ProxyRequest request) {
        String template = request.getRouteTemplate() != null ? request.getRouteTemplate() : request.getPath();
        return serviceName + ":" + request.getMethod().name() + ":" + template;
    }

    static HttpHeaders outboundHeaders(ProxyRequest request) {
        HttpHeaders headers = ForwardedHeaders.sanitize(request.getHeaders());
        headers.remove(HttpHeaders.CONTENT_LENGTH);
        ForwardedHeaders.applyForwarded(headers, request.getClientAddress(), request.getScheme(), request.getHost());
        return headers;
    }

    static boolean isRetryable(Throwable error) {
        return error instanceof DownstreamServerException
                || error instanceof TimeoutException
                || error instanceof WebClientRequestException;
    }

    static Throwable mapError(String serviceName, Throwable error) {
        if (error instanceof CircuitOpenException) {
            CircuitOpenException open = (CircuitOpenException) error;
            return new ServiceUnavailableException(serviceName, open.getRetryAfter().orElse(null), open);
        }
        if (error instanceof GatewayException) {
            return error;
        }
        if (error instanceof TimeoutException) {
            return new GatewayTimeoutException(serviceName, error);
        }
        if (error instanceof WebClientRequestException && isConnectFailure(error)) {
            return new ServiceUnavailableException(serviceName, error);
        }
        log.warn("Upstream {} failed: {}", serviceName, error.toString());
        return new BadGatewayException(serviceName, error);
    }

    private static boolean isConnectFailure(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof ConnectException || current instanceof UnknownHostException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
