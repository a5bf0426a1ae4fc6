/**
 * Retry policy.
 *
 * <p>{@link com.ryuqq.dispatch.core.retry.ExponentialBackoffRetryPolicy} computes
 * {@code baseDelay * 2^attempt + uniform(0, jitterMax)} and classifies retryable
 * errors by type. The first retry is attempt 0.</p>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.core.retry;
