package com.ryuqq.dispatch.adapter.inmemory.protection;

import com.ryuqq.dispatch.core.protection.CircuitBreaker;
import com.ryuqq.dispatch.core.protection.CircuitBreakerConfig;
import com.ryuqq.dispatch.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.dispatch.core.protection.CircuitBreakerState;
import com.ryuqq.dispatch.core.protection.CircuitPermit;
import com.ryuqq.dispatch.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link CircuitBreaker} based on consecutive failures.
 *
 * <p><strong>State Machine:</strong></p>
 * <ul>
 *   <li>CLOSED: every failure increments {@code consecutiveFailures}, a success resets it;
 *       reaching {@code failureThreshold} opens the circuit</li>
 *   <li>OPEN: calls are rejected until {@code recoveryTimeout} has elapsed since {@code openedAt};
 *       the first call after that moves the circuit to HALF_OPEN before it runs</li>
 *   <li>HALF_OPEN: at most {@code halfOpenMaxCalls} concurrent trials; {@code successThreshold}
 *       consecutive successes close the circuit, any failure reopens it</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Every transition decision runs under a per-breaker {@link ReentrantLock}</li>
 *   <li>The protected call itself runs outside the lock</li>
 *   <li>Each transition bumps a generation counter; outcomes reported with a permit from an
 *       older generation are ignored</li>
 * </ul>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public class InMemoryCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private long openedAt;
    private long generation;
    private int halfOpenInFlight;

    /**
     * Creates a new breaker in the CLOSED state.
     *
     * @param name breaker name
     * @param config breaker configuration
     * @param clock monotonic time source
     * @throws IllegalArgumentException if any argument is null or name is blank
     */
    public InMemoryCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<CircuitPermit> tryAcquire() {
        lock.lock();
        try {
            if (state == CircuitBreakerState.CLOSED) {
                return Optional.of(new CircuitPermit(name, generation, false));
            }
            if (state == CircuitBreakerState.OPEN) {
                if (clock.monotonicNanos() - openedAt < config.recoveryTimeout().toNanos()) {
                    return Optional.empty();
                }
                transitionTo(CircuitBreakerState.HALF_OPEN);
            } else if (halfOpenInFlight >= config.halfOpenMaxCalls()) {
                return Optional.empty();
            }
            halfOpenInFlight++;
            return Optional.of(new CircuitPermit(name, generation, true));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess(CircuitPermit permit) {
        lock.lock();
        try {
            if (isStale(permit)) {
                return;
            }
            if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures = 0;
            } else if (state == CircuitBreakerState.HALF_OPEN) {
                halfOpenInFlight--;
                consecutiveSuccesses++;
                if (consecutiveSuccesses >= config.successThreshold()) {
                    transitionTo(CircuitBreakerState.CLOSED);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordFailure(CircuitPermit permit) {
        lock.lock();
        try {
            if (isStale(permit)) {
                return;
            }
            if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures++;
                if (consecutiveFailures >= config.failureThreshold()) {
                    transitionTo(CircuitBreakerState.OPEN);
                }
            } else if (state == CircuitBreakerState.HALF_OPEN) {
                transitionTo(CircuitBreakerState.OPEN);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(CircuitPermit permit) {
        lock.lock();
        try {
            if (!isStale(permit) && state == CircuitBreakerState.HALF_OPEN && permit.trial()) {
                halfOpenInFlight--;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(
                name,
                state,
                consecutiveFailures,
                consecutiveSuccesses,
                state == CircuitBreakerState.OPEN ? OptionalLong.of(openedAt) : OptionalLong.empty()
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Duration retryAfter() {
        lock.lock();
        try {
            if (state != CircuitBreakerState.OPEN) {
                return Duration.ZERO;
            }
            long remaining = config.recoveryTimeout().toNanos() - (clock.monotonicNanos() - openedAt);
            return remaining > 0 ? Duration.ofNanos(remaining) : Duration.ZERO;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            if (state != CircuitBreakerState.CLOSED) {
                transitionTo(CircuitBreakerState.CLOSED);
            } else {
                generation++;
                consecutiveFailures = 0;
                consecutiveSuccesses = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the configuration of this breaker.
     *
     * @return breaker configuration
     */
    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private boolean isStale(CircuitPermit permit) {
        if (permit == null) {
            throw new IllegalArgumentException("permit cannot be null");
        }
        return !name.equals(permit.breakerName()) || permit.generation() != generation;
    }

    // caller holds the lock
    private void transitionTo(CircuitBreakerState target) {
        CircuitBreakerState previous = state;
        state = target;
        generation++;
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
        halfOpenInFlight = 0;
        openedAt = target == CircuitBreakerState.OPEN ? clock.monotonicNanos() : 0L;
        log.info("Circuit '{}' transitioned {} -> {}", name, previous, target);
    }
}
