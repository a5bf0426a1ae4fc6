/**
 * Handler contract consumed by the bus.
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.core.handler;
