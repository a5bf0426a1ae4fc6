/**
 * Idempotency model package.
 *
 * <p>Value objects and records describing idempotent command execution:</p>
 * <ul>
 *   <li>{@link com.ryuqq.dispatch.core.model.IdempotencyKey} - Caller-supplied idempotency token</li>
 *   <li>{@link com.ryuqq.dispatch.core.model.IdempotencyRecord} - Stored state for one key</li>
 *   <li>{@link com.ryuqq.dispatch.core.model.IdempotencyStatus} - IN_FLIGHT / COMPLETED</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.core.model;
