package com.ryuqq.dispatch.testkit.contract;

import com.ryuqq.dispatch.adapter.inmemory.protection.InMemoryCircuitBreakerRegistry;
import com.ryuqq.dispatch.adapter.inmemory.store.InMemoryIdempotencyGuard;
import com.ryuqq.dispatch.application.bus.CommandBus;
import com.ryuqq.dispatch.application.bus.QueryBus;
import com.ryuqq.dispatch.application.pipeline.DispatchPipelines;
import com.ryuqq.dispatch.application.pipeline.IdempotencyConfig;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.protection.CircuitBreakerConfig;
import com.ryuqq.dispatch.core.protection.CircuitBreakerState;
import com.ryuqq.dispatch.core.result.Result;
import com.ryuqq.dispatch.core.retry.RetryPolicy;
import com.ryuqq.dispatch.testkit.fixture.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>This class wires the in-memory SPI implementations to a {@link ManualClock} and offers
 * helpers for building buses with the standard pipeline.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>ManualClock: deterministic time, retry sleeps are recorded instead of waited</li>
 *   <li>InMemoryCircuitBreakerRegistry: breakers configured by {@link #breakerConfig()}</li>
 *   <li>InMemoryIdempotencyGuard: idempotency records</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * public class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         CommandBus bus = commandBus(policy, new IdempotencyConfig());
 *         bus.register(TestCommand.TYPE, handler);
 *
 *         assertOk(bus.dispatch(TestCommand.of("payload")), "done");
 *     }
 * }
 * </pre>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected ManualClock clock;
    protected InMemoryCircuitBreakerRegistry breakers;
    protected InMemoryIdempotencyGuard guard;

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh instances of all SPI implementations.</p>
     */
    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        breakers = new InMemoryCircuitBreakerRegistry(breakerConfig(), clock);
        guard = new InMemoryIdempotencyGuard(clock);
    }

    /**
     * Cleans up test fixtures after each test.
     *
     * <p>Resets all in-memory state to prevent test interference.</p>
     */
    @AfterEach
    void tearDown() {
        if (breakers != null) {
            breakers.reset();
        }
        if (guard != null) {
            guard.reset();
        }
    }

    /**
     * Circuit breaker configuration used by {@link #breakers}. Override to customize.
     *
     * @return breaker configuration
     */
    protected CircuitBreakerConfig breakerConfig() {
        return new CircuitBreakerConfig();
    }

    /**
     * Creates a command bus with the full standard pipeline.
     *
     * @param policy retry policy
     * @param idempotencyConfig idempotency configuration
     * @return command bus
     */
    protected CommandBus commandBus(RetryPolicy policy, IdempotencyConfig idempotencyConfig) {
        return new CommandBus(DispatchPipelines.command()
            .idempotency(guard, idempotencyConfig)
            .retry(policy, clock)
            .circuitBreaker(breakers)
            .build());
    }

    /**
     * Creates a query bus with retry and circuit breaker stages.
     *
     * @param policy retry policy
     * @return query bus
     */
    protected QueryBus queryBus(RetryPolicy policy) {
        return new QueryBus(DispatchPipelines.query()
            .retry(policy, clock)
            .circuitBreaker(breakers)
            .build());
    }

    /**
     * Asserts that the result is Ok with the expected value.
     *
     * @param result dispatch result
     * @param expected expected value
     * @param <R> value type
     */
    protected <R> void assertOk(Result<R, DispatchError> result, R expected) {
        assertTrue(result.isOk(),
                String.format("Expected Ok(%s) but was %s", expected, result));
        assertEquals(expected, result.unwrap());
    }

    /**
     * Asserts that the result is Err of the expected type and returns the error.
     *
     * @param result dispatch result
     * @param type expected error type
     * @param <E> error type
     * @return the error
     */
    protected <E extends DispatchError> E assertErr(Result<?, DispatchError> result, Class<E> type) {
        assertTrue(result.isErr(),
                String.format("Expected Err(%s) but was %s", type.getSimpleName(), result));
        DispatchError error = result.unwrapErr();
        assertInstanceOf(type, error,
                String.format("Expected %s but was %s", type.getSimpleName(), error));
        return type.cast(error);
    }

    /**
     * Asserts the state of a named circuit breaker.
     *
     * @param name breaker name
     * @param expected expected state
     */
    protected void assertBreakerState(String name, CircuitBreakerState expected) {
        CircuitBreakerState actual = breakers.get(name).getState();
        assertEquals(expected, actual,
                String.format("Expected circuit '%s' to be %s but was %s", name, expected, actual));
    }
}
