package com.edgegate.gateway.circuitbreaker;

import com.edgegate.common.exception.CircuitOpenException;
import com.edgegate.common.model.CircuitState;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Breaker state for one key, backed by a Resilience4j {@link CircuitBreaker}.
 *
 * Every admitted call is stamped with the epoch it was admitted in. The epoch
 * moves on each state transition, and outcomes that arrive after it moved are
 * dropped, so a slow call admitted while CLOSED can never decide a half-open trial.
 *
 * Calls into the delegate happen under this object's monitor. Transition events
 * are queued there and handed to the listener after the monitor is released.
 */
@Slf4j
public class KeyedCircuitBreaker {

    static final Duration TRIAL_IN_FLIGHT_RETRY_AFTER = Duration.ofSeconds(1);

    private final String key;
    private final CircuitBreaker delegate;
    private final IntervalFunction recoveryInterval;
    private final Clock clock;
    private final Predicate<Throwable> ignored;
    private final Consumer<CircuitStateChangedEvent> listener;
    private final Queue<CircuitStateChangedEvent> pendingEvents = new ConcurrentLinkedQueue<>();
    private final Object publishLock = new Object();

    // guarded by this
    private long epoch;
    private int openAttempts;
    private int consecutiveFailures;
    private int successesInHalfOpen;
    private boolean trialInFlight;
    private Instant lastFailureAt;
    private Instant nextRetryAt;

    KeyedCircuitBreaker(String key,
                        CircuitBreakerConfig config,
                        Clock clock,
                        Predicate<Throwable> ignored,
                        Consumer<CircuitStateChangedEvent> listener) {
        this.key = key;
        this.delegate = CircuitBreaker.of(key, config);
        this.recoveryInterval = config.getWaitIntervalFunctionInOpenState();
        this.clock = clock;
        this.ignored = ignored;
        this.listener = listener;
        this.delegate.getEventPublisher().onStateTransition(this::onTransition);
    }

    /**
     * Admit a call or reject it with {@link CircuitOpenException}.
     * The returned permit must be completed exactly once.
     */
    Permit acquirePermission() {
        try {
            synchronized (this) {
                if (trialInFlight && delegate.getState() == CircuitBreaker.State.HALF_OPEN) {
                    throw new CircuitOpenException(key, TRIAL_IN_FLIGHT_RETRY_AFTER);
                }
                if (!delegate.tryAcquirePermission()) {
                    throw new CircuitOpenException(key, retryAfter());
                }
                if (delegate.getState() == CircuitBreaker.State.HALF_OPEN) {
                    trialInFlight = true;
                    log.info("Circuit {} admitting half-open trial", key);
                }
                return new Permit(epoch, System.nanoTime());
            }
        } finally {
            publishPendingEvents();
        }
    }

    CircuitBreakerSnapshot snapshot() {
        synchronized (this) {
            CircuitBreaker.Metrics metrics = delegate.getMetrics();
            return CircuitBreakerSnapshot.builder()
                    .key(key)
                    .state(toCircuitState(delegate.getState()))
                    .consecutiveFailures(consecutiveFailures)
                    .lastFailureAt(lastFailureAt)
                    .nextRetryAt(nextRetryAt)
                    .successesInHalfOpen(successesInHalfOpen)
                    .bufferedCalls(metrics.getNumberOfBufferedCalls())
                    .failureRate(metrics.getFailureRate())
                    .build();
        }
    }

    private void recordSuccess(long admittedIn, long durationNanos) {
        try {
            synchronized (this) {
                if (admittedIn != epoch) {
                    log.debug("Circuit {} dropping success admitted before the last transition", key);
                    return;
                }
                CircuitBreaker.State state = delegate.getState();
                if (state == CircuitBreaker.State.CLOSED) {
                    consecutiveFailures = 0;
                } else if (state == CircuitBreaker.State.HALF_OPEN) {
                    trialInFlight = false;
                    successesInHalfOpen++;
                }
                delegate.onSuccess(durationNanos, TimeUnit.NANOSECONDS);
            }
        } finally {
            publishPendingEvents();
        }
    }

    private void recordError(long admittedIn, long durationNanos, Throwable error) {
        try {
            synchronized (this) {
                if (admittedIn != epoch) {
                    log.debug("Circuit {} dropping failure admitted before the last transition: {}", key, error.toString());
                    return;
                }
                boolean halfOpen = delegate.getState() == CircuitBreaker.State.HALF_OPEN;
                if (halfOpen) {
                    trialInFlight = false;
                }
                if (ignored.test(error)) {
                    log.debug("Circuit {} ignoring expected failure: {}", key, error.toString());
                    delegate.onError(durationNanos, TimeUnit.NANOSECONDS, error);
                    return;
                }

                consecutiveFailures++;
                lastFailureAt = clock.instant();
                if (halfOpen) {
                    // any failed trial reopens, even when more than one success is needed to close
                    delegate.transitionToOpenState();
                } else {
                    delegate.onError(durationNanos, TimeUnit.NANOSECONDS, error);
                }
            }
        } finally {
            publishPendingEvents();
        }
    }

    private void releasePermission(long admittedIn) {
        synchronized (this) {
            if (admittedIn != epoch) {
                return;
            }
            if (delegate.getState() == CircuitBreaker.State.HALF_OPEN) {
                trialInFlight = false;
            }
            delegate.releasePermission();
        }
    }

    /**
     * Runs on the thread that caused the transition, inside one of the
     * synchronized blocks above.
     */
    private void onTransition(CircuitBreakerOnStateTransitionEvent event) {
        CircuitState from = toCircuitState(event.getStateTransition().getFromState());
        CircuitState to = toCircuitState(event.getStateTransition().getToState());
        Instant now = clock.instant();

        epoch++;
        trialInFlight = false;
        switch (to) {
            case OPEN:
                openAttempts = from == CircuitState.HALF_OPEN ? openAttempts + 1 : 1;
                nextRetryAt = now.plusMillis(recoveryInterval.apply(openAttempts));
                successesInHalfOpen = 0;
                if (from == CircuitState.HALF_OPEN) {
                    log.warn("Circuit {} half-open trial failed, reopening until {}", key, nextRetryAt);
                } else {
                    log.warn("Circuit {} opening after {} consecutive failures", key, consecutiveFailures);
                }
                break;
            case HALF_OPEN:
                nextRetryAt = null;
                successesInHalfOpen = 0;
                break;
            case CLOSED:
                nextRetryAt = null;
                openAttempts = 0;
                consecutiveFailures = 0;
                successesInHalfOpen = 0;
                break;
            default:
                throw new IllegalStateException("Unknown circuit state: " + to);
        }

        log.info("Circuit {} transitioned {} -> {}", key, from, to);
        pendingEvents.add(new CircuitStateChangedEvent(key, from, to, now));
    }

    private void publishPendingEvents() {
        synchronized (publishLock) {
            CircuitStateChangedEvent event;
            while ((event = pendingEvents.poll()) != null) {
                listener.accept(event);
            }
        }
    }

    private Duration retryAfter() {
        if (delegate.getState() != CircuitBreaker.State.OPEN || nextRetryAt == null) {
            return TRIAL_IN_FLIGHT_RETRY_AFTER;
        }
        Duration remaining = Duration.between(clock.instant(), nextRetryAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    static CircuitState toCircuitState(CircuitBreaker.State state) {
        switch (state) {
            case CLOSED:
            case DISABLED:
            case METRICS_ONLY:
                return CircuitState.CLOSED;
            case OPEN:
            case FORCED_OPEN:
                return CircuitState.OPEN;
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            default:
                throw new IllegalStateException("Unknown circuit state: " + state);
        }
    }

    /**
     * One admitted call. The first of success, error or release wins.
     */
    final class Permit {
        private final long admittedIn;
        private final long startNanos;
        private final AtomicBoolean completed = new AtomicBoolean();

        private Permit(long admittedIn, long startNanos) {
            this.admittedIn = admittedIn;
            this.startNanos = startNanos;
        }

        void onSuccess() {
            if (completed.compareAndSet(false, true)) {
                recordSuccess(admittedIn, System.nanoTime() - startNanos);
            }
        }

        void onError(Throwable error) {
            if (completed.compareAndSet(false, true)) {
                recordError(admittedIn, System.nanoTime() - startNanos, error);
            }
        }

        void release() {
            if (completed.compareAndSet(false, true)) {
                releasePermission(admittedIn);
            }
        }
    }
}
