/**
 * Service Provider Interfaces for shared idempotency state.
 *
 * <p><strong>Implementations:</strong></p>
 * <ul>
 *   <li>dispatch-adapter-inmemory: InMemoryIdempotencyGuard (single process, ConcurrentHashMap)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.core.spi;
