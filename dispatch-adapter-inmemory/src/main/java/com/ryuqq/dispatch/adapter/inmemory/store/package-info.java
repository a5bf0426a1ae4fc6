/**
 * In-memory idempotency guard.
 *
 * <p>Single-process only; records are lost on restart.</p>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.adapter.inmemory.store;
