package com.ryuqq.dispatch.adapter.inmemory.metrics;

import com.ryuqq.dispatch.core.contract.MessageType;
import com.ryuqq.dispatch.core.metrics.DispatchStatistics;
import com.ryuqq.dispatch.core.metrics.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link MetricsCollector}.
 *
 * <p>Counters are kept per message type in a {@link ConcurrentHashMap}; updates are lock-free.
 * Slow dispatches are kept in arrival order until {@link #reset()}.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * InMemoryMetricsCollector collector = new InMemoryMetricsCollector();
 * // ... dispatch through a pipeline with a metrics stage ...
 * DispatchStatistics stats = collector.getStatistics(MessageType.of("order.place"));
 * double rate = stats.successRate();
 * </pre>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public class InMemoryMetricsCollector implements MetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMetricsCollector.class);

    private final Map<MessageType, TypeMetrics> metrics = new ConcurrentHashMap<>();
    private final List<SlowDispatch> slowDispatches = new CopyOnWriteArrayList<>();

    @Override
    public void recordDuration(MessageType type, Duration duration, boolean success) {
        requireType(type);
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be null or negative");
        }
        metrics.computeIfAbsent(type, t -> new TypeMetrics()).recordDuration(duration.toNanos());
    }

    @Override
    public void incrementCount(MessageType type, boolean success) {
        requireType(type);
        TypeMetrics typeMetrics = metrics.computeIfAbsent(type, t -> new TypeMetrics());
        if (success) {
            typeMetrics.successes.increment();
        } else {
            typeMetrics.failures.increment();
        }
    }

    @Override
    public void recordSlowDispatch(MessageType type, Duration duration) {
        requireType(type);
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
        slowDispatches.add(new SlowDispatch(type, duration));
    }

    /**
     * Returns the statistics for one message type.
     *
     * @param type message type
     * @return statistics (all zero if nothing was recorded)
     */
    public DispatchStatistics getStatistics(MessageType type) {
        requireType(type);
        TypeMetrics typeMetrics = metrics.get(type);
        return typeMetrics == null ? DispatchStatistics.empty(type) : typeMetrics.snapshot(type);
    }

    /**
     * Returns the statistics of every message type seen so far.
     *
     * @return immutable map keyed by message type
     */
    public Map<MessageType, DispatchStatistics> getStatistics() {
        return metrics.entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().snapshot(e.getKey())));
    }

    /**
     * Returns the number of counted dispatches across all message types.
     *
     * @return success + failure counts
     */
    public long totalDispatches() {
        return metrics.values().stream()
            .mapToLong(m -> m.successes.sum() + m.failures.sum())
            .sum();
    }

    /**
     * Returns the recorded slow dispatches, in arrival order.
     *
     * @return immutable snapshot
     */
    public List<SlowDispatch> getSlowDispatches() {
        return List.copyOf(slowDispatches);
    }

    /**
     * Clears all metrics. Intended for test isolation.
     */
    public void reset() {
        metrics.clear();
        slowDispatches.clear();
        log.info("Metrics collector reset");
    }

    private static void requireType(MessageType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    /**
     * A dispatch that exceeded the slow threshold.
     *
     * @param type message type
     * @param duration elapsed time
     */
    public record SlowDispatch(MessageType type, Duration duration) {
    }

    private static final class TypeMetrics {

        private final LongAdder successes = new LongAdder();
        private final LongAdder failures = new LongAdder();
        private final LongAdder durationCount = new LongAdder();
        private final LongAdder durationSumNanos = new LongAdder();
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong(Long.MIN_VALUE);

        void recordDuration(long nanos) {
            durationCount.increment();
            durationSumNanos.add(nanos);
            minNanos.accumulateAndGet(nanos, Math::min);
            maxNanos.accumulateAndGet(nanos, Math::max);
        }

        DispatchStatistics snapshot(MessageType type) {
            long count = durationCount.sum();
            if (count == 0) {
                return new DispatchStatistics(
                    type, successes.sum(), failures.sum(), Duration.ZERO, Duration.ZERO, Duration.ZERO
                );
            }
            return new DispatchStatistics(
                type,
                successes.sum(),
                failures.sum(),
                Duration.ofNanos(durationSumNanos.sum() / count),
                Duration.ofNanos(minNanos.get()),
                Duration.ofNanos(maxNanos.get())
            );
        }
    }
}
