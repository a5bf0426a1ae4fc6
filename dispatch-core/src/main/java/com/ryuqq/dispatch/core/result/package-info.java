/**
 * Dispatch result package.
 *
 * <p>This package defines the sealed {@code Result} hierarchy returned by every
 * handler, middleware stage and bus dispatch.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatch.core.result.Result} - Sealed interface (permits Ok, Err)</li>
 * </ul>
 *
 * <h2>Result Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatch.core.result.Ok} - Success value (may be null for {@code Void})</li>
 *   <li>{@link com.ryuqq.dispatch.core.result.Err} - Typed error value (never null)</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Result&lt;Integer, DispatchError&gt; doubled = result.map(value -&gt; value * 2);
 * Result&lt;Receipt, DispatchError&gt; chained = result.andThen(this::charge);
 * </pre>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.core.result;
