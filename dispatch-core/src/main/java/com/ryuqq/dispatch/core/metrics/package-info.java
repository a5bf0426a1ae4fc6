/**
 * Dispatch metrics package.
 *
 * <p>{@link com.ryuqq.dispatch.core.metrics.MetricsCollector} is the sink the metrics stage reports to;
 * {@link com.ryuqq.dispatch.core.metrics.DispatchStatistics} is the per-type summary an implementation exposes.</p>
 *
 * <p><strong>Implementations:</strong></p>
 * <ul>
 *   <li>dispatch-adapter-inmemory: InMemoryMetricsCollector (single process, lock-free counters)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.core.metrics;
