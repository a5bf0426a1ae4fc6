package com.ryuqq.dispatch.core.time;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * {@link System#nanoTime()} 기반 Clock.
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public final class SystemClock implements Clock {

    static final SystemClock INSTANCE = new SystemClock();

    private SystemClock() {
    }

    @Override
    public long monotonicNanos() {
        return System.nanoTime();
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    }
}
