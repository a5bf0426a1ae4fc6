/**
 * Circuit breaker SPI and configuration.
 *
 * <p>Breakers are named and independent; each one serializes its own transition decisions
 * while the protected call runs outside the lock. Outcomes are tagged with the admission
 * generation through {@link com.ryuqq.dispatch.core.protection.CircuitPermit}.</p>
 *
 * <p><strong>Implementations:</strong></p>
 * <ul>
 *   <li>dispatch-adapter-inmemory: InMemoryCircuitBreaker, InMemoryCircuitBreakerRegistry</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.core.protection;
