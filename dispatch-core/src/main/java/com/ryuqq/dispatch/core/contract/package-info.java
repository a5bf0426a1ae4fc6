/**
 * Message contract package.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatch.core.contract.Message} - Immutable message with a stable type id</li>
 *   <li>{@link com.ryuqq.dispatch.core.contract.Command} - Write intent, optional idempotency key</li>
 *   <li>{@link com.ryuqq.dispatch.core.contract.Query} - Read-only request</li>
 * </ul>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatch.core.contract.MessageType} - Handler registry key</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.core.contract;
