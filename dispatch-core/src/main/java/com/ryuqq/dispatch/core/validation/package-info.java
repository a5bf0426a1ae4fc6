/**
 * Validation slot.
 *
 * <p>Only the slot is defined here; business rules are supplied by callers.</p>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.core.validation;
