/**
 * In-memory metrics collector.
 *
 * <p>Intended for development, tests and single-process deployments without a metrics backend.</p>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.adapter.inmemory.metrics;
