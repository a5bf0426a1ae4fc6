/**
 * Middleware contract.
 *
 * <p>A middleware is explicit function composition, {@code (message, next) -> Result},
 * built once from an ordered list. See {@code com.ryuqq.dispatch.application.pipeline}
 * for the standard stages.</p>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.core.middleware;
