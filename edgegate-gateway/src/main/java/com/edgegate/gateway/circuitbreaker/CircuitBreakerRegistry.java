package com.edgegate.gateway.circuitbreaker;

import com.edgegate.gateway.config.GatewayProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Per-key circuit breakers, created lazily on first use.
 *
 * {@link #execute} never retries; callers that retry must wrap the whole
 * execute call so that every attempt consults the breaker again.
 */
@Slf4j
@Component
public class CircuitBreakerRegistry {

    private final Map<String, KeyedCircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig breakerConfig;
    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;
    private final Predicate<Throwable> ignored;

    public CircuitBreakerRegistry(GatewayProperties properties, Clock clock, ApplicationEventPublisher eventPublisher) {
        GatewayProperties.CircuitBreaker config = properties.getCircuitBreaker();
        this.clock = clock;
        this.eventPublisher = eventPublisher;
        this.ignored = ignoredPredicate(config.getIgnoredExceptions());
        this.breakerConfig = breakerConfig(config, clock, ignored);

        log.info("Circuit breakers: failureThreshold={}, recoveryTimeout={}, backoffMultiplier={}, ignored={}",
                config.getFailureThreshold(), config.getRecoveryTimeout(),
                config.getRecoveryBackoffMultiplier(), config.getIgnoredExceptions());
    }

    /**
     * Run {@code call} under the breaker for {@code key}.
     * Fails with CircuitOpenException, without subscribing to the call, while the key is open.
     */
    public <T> Mono<T> execute(String key, Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            KeyedCircuitBreaker.Permit permit = breakerFor(key).acquirePermission();
            return Mono.defer(call)
                    .doOnSuccess(value -> permit.onSuccess())
                    .doOnError(permit::onError)
                    .doOnCancel(permit::release);
        });
    }

    public Map<String, CircuitBreakerSnapshot> snapshot() {
        Map<String, CircuitBreakerSnapshot> result = new TreeMap<>();
        breakers.forEach((key, breaker) -> result.put(key, breaker.snapshot()));
        return result;
    }

    public CircuitBreakerSnapshot snapshot(String key) {
        KeyedCircuitBreaker breaker = breakers.get(key);
        return breaker != null ? breaker.snapshot() : null;
    }

    KeyedCircuitBreaker breakerFor(String key) {
        return breakers.computeIfAbsent(key, k -> {
            log.debug("Creating circuit breaker for key: {}", k);
            return new KeyedCircuitBreaker(k, breakerConfig, clock, ignored, eventPublisher::publishEvent);
        });
    }

    /**
     * A count-based window as long as the failure threshold that opens at a 100% failure
     * rate, which is the same as opening after that many consecutive failures.
     */
    static CircuitBreakerConfig breakerConfig(GatewayProperties.CircuitBreaker config, Clock clock,
                                              Predicate<Throwable> ignored) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(config.getFailureThreshold())
                .minimumNumberOfCalls(config.getFailureThreshold())
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(config.getHalfOpenSuccessThreshold())
                .waitIntervalFunctionInOpenState(recoveryInterval(config))
                .ignoreException(ignored)
                .clock(clock)
                .build();
    }

    static IntervalFunction recoveryInterval(GatewayProperties.CircuitBreaker config) {
        if (config.getRecoveryBackoffMultiplier() <= 1.0) {
            return IntervalFunction.of(config.getRecoveryTimeout());
        }
        return IntervalFunction.ofExponentialBackoff(config.getRecoveryTimeout(),
                config.getRecoveryBackoffMultiplier(), config.getMaxRecoveryTimeout());
    }

    private static Predicate<Throwable> ignoredPredicate(List<Class<? extends Throwable>> types) {
        return error -> {
            for (Throwable current = error; current != null; current = current.getCause()) {
                for (Class<? extends Throwable> type : types) {
                    if (type.isInstance(current)) {
                        return true;
                    }
                }
                if (current.getCause() == current) {
                    break;
                }
            }
            return false;
        };
    }
}
