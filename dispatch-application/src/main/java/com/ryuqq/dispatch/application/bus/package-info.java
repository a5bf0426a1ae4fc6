/**
 * Command and query buses.
 *
 * <p>The bus resolves a handler by {@link com.ryuqq.dispatch.core.contract.MessageType} and runs the
 * configured middleware chain around it. Registration happens during setup; the registry seals on the
 * first dispatch.</p>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.application.bus;
