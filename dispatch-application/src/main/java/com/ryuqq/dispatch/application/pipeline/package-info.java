/**
 * Middleware chain and the standard stages.
 *
 * <p><strong>Reference order (outer to inner):</strong></p>
 * <ol>
 *   <li>{@link com.ryuqq.dispatch.application.pipeline.LoggingMiddleware} (optional)</li>
 *   <li>{@link com.ryuqq.dispatch.application.pipeline.MetricsMiddleware} (optional)</li>
 *   <li>{@link com.ryuqq.dispatch.application.pipeline.IdempotencyMiddleware} (commands only)</li>
 *   <li>{@link com.ryuqq.dispatch.application.pipeline.ValidationMiddleware}</li>
 *   <li>{@link com.ryuqq.dispatch.application.pipeline.RetryMiddleware}</li>
 *   <li>{@link com.ryuqq.dispatch.application.pipeline.CircuitBreakerMiddleware}</li>
 * </ol>
 *
 * <p>{@link com.ryuqq.dispatch.application.pipeline.DispatchPipelines} assembles this order.</p>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.application.pipeline;
