package com.ryuqq.dispatch.testkit.fixture;

import com.ryuqq.dispatch.core.time.Clock;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic {@link Clock} for tests.
 *
 * <p>Time only moves when a test calls {@link #advance(Duration)} or when code under test calls
 * {@link #sleep(Duration)}. A sleep returns immediately, advances the clock by the requested
 * duration and records it, so retry schedules can be asserted without waiting.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ManualClock clock = new ManualClock();
 * RetryMiddleware retry = new RetryMiddleware(policy, clock);
 * // ... dispatch ...
 * assertThat(clock.getSleeps()).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
 * </pre>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public class ManualClock implements Clock {

    private final AtomicLong nanos;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    /**
     * Creates a clock starting at an arbitrary non-zero instant.
     */
    public ManualClock() {
        this(1_000_000_000L);
    }

    /**
     * Creates a clock starting at the given instant.
     *
     * @param startNanos initial monotonic value
     */
    public ManualClock(long startNanos) {
        this.nanos = new AtomicLong(startNanos);
    }

    @Override
    public long monotonicNanos() {
        return nanos.get();
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("sleep interrupted");
        }
        sleeps.add(duration);
        advance(duration);
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount to advance (non-negative)
     * @throws IllegalArgumentException if duration is null or negative
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be null or negative");
        }
        nanos.addAndGet(duration.toNanos());
    }

    /**
     * Returns every duration passed to {@link #sleep(Duration)}, in call order.
     *
     * @return immutable snapshot
     */
    public List<Duration> getSleeps() {
        return List.copyOf(sleeps);
    }
}
