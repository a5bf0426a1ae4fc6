/**
 * Dispatch error taxonomy.
 *
 * <p>All expected failures travel as {@code Result.err(DispatchError)}:</p>
 * <ul>
 *   <li>{@link com.ryuqq.dispatch.core.error.ValidationError} - Input rejected before side effects</li>
 *   <li>{@link com.ryuqq.dispatch.core.error.UnregisteredHandlerError} - Configuration fault</li>
 *   <li>{@link com.ryuqq.dispatch.core.error.TransientError} - Retryable failure</li>
 *   <li>{@link com.ryuqq.dispatch.core.error.CircuitOpenError} - Fast-fail by an open breaker</li>
 *   <li>{@link com.ryuqq.dispatch.core.error.ConflictError} - Idempotency policy rejection</li>
 *   <li>{@link com.ryuqq.dispatch.core.error.HandlerError} - Permanent business failure</li>
 *   <li>{@link com.ryuqq.dispatch.core.error.Fatal} - Unexpected runtime fault</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.dispatch.core.error.DuplicateHandlerException} is the only exception type,
 * raised at registration time.</p>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.core.error;
