/**
 * Injectable monotonic time source.
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.core.time;
