/**
 * In-memory circuit breaker implementations.
 *
 * <p>Single-process only; breaker state is not shared across JVMs.</p>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.adapter.inmemory.protection;
