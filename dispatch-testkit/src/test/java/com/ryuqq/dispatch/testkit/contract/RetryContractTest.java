package com.ryuqq.dispatch.testkit.contract;

import com.ryuqq.dispatch.adapter.inmemory.protection.InMemoryCircuitBreakerRegistry;
import com.ryuqq.dispatch.application.bus.CommandBus;
import com.ryuqq.dispatch.application.bus.QueryBus;
import com.ryuqq.dispatch.application.pipeline.DispatchPipelines;
import com.ryuqq.dispatch.application.pipeline.IdempotencyConfig;
import com.ryuqq.dispatch.core.error.CircuitOpenError;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.error.HandlerError;
import com.ryuqq.dispatch.core.error.TransientError;
import com.ryuqq.dispatch.core.protection.CircuitBreakerConfig;
import com.ryuqq.dispatch.core.protection.CircuitBreakerState;
import com.ryuqq.dispatch.core.result.Result;
import com.ryuqq.dispatch.core.retry.ExponentialBackoffRetryPolicy;
import com.ryuqq.dispatch.testkit.fixture.ScriptedHandler;
import com.ryuqq.dispatch.testkit.fixture.TestCommand;
import com.ryuqq.dispatch.testkit.fixture.TestQuery;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for retry with exponential backoff.
 *
 * <p>Sleeps go through the {@link com.ryuqq.dispatch.testkit.fixture.ManualClock}, so the
 * recorded delays are the exact backoff values.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Always-failing handler is called 1 + maxAttempts times with 100ms, 200ms, 400ms delays</li>
 *   <li>Jittered delays stay within [base * 2^n, base * 2^n + jitterMax]</li>
 *   <li>Non-retryable errors are returned after a single call</li>
 *   <li>Retry sits outside the breaker: once the breaker opens, retrying stops</li>
 * </ul>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
class RetryContractTest extends AbstractContractTest {

    private static final TransientError TIMEOUT = TransientError.of("TIMEOUT", "downstream timed out");

    private static final ExponentialBackoffRetryPolicy POLICY = new ExponentialBackoffRetryPolicy(
        3, Duration.ofMillis(100), Duration.ZERO, Set.of(TransientError.class)
    );

    @Override
    protected CircuitBreakerConfig breakerConfig() {
        return new CircuitBreakerConfig().withFailureThreshold(10);
    }

    @Test
    void testRetry_AlwaysFailing_CalledFourTimesWithExponentialDelays() {
        // Given
        ScriptedHandler<TestCommand, String> handler = ScriptedHandler.always(Result.err(TIMEOUT));
        CommandBus bus = commandBus(POLICY, new IdempotencyConfig());
        bus.register(TestCommand.TYPE, handler);

        // When
        Result<String, DispatchError> result = bus.dispatch(TestCommand.of("payload"));

        // Then: 1 original + 3 retries, original error returned
        assertEquals(4, handler.getInvocations());
        assertSame(TIMEOUT, assertErr(result, TransientError.class));
        assertEquals(
            List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400)),
            clock.getSleeps()
        );
    }

    @Test
    void testRetry_RecoversOnSecondRetry_ReturnsOk() {
        // Given
        ScriptedHandler<TestCommand, String> handler = ScriptedHandler.sequence(
            Result.err(TIMEOUT),
            Result.err(TIMEOUT),
            Result.ok("third-time-lucky")
        );
        CommandBus bus = commandBus(POLICY, new IdempotencyConfig());
        bus.register(TestCommand.TYPE, handler);

        // When
        Result<String, DispatchError> result = bus.dispatch(TestCommand.of("payload"));

        // Then
        assertOk(result, "third-time-lucky");
        assertEquals(3, handler.getInvocations());
        assertEquals(2, clock.getSleeps().size());
    }

    @Test
    void testRetry_JitteredDelays_StayWithinBounds() {
        // Given
        ExponentialBackoffRetryPolicy jittered = POLICY.withJitterMax(Duration.ofMillis(50));
        ScriptedHandler<TestCommand, String> handler = ScriptedHandler.always(Result.err(TIMEOUT));
        CommandBus bus = commandBus(jittered, new IdempotencyConfig());
        bus.register(TestCommand.TYPE, handler);

        // When
        bus.dispatch(TestCommand.of("payload"));

        // Then
        List<Duration> sleeps = clock.getSleeps();
        assertEquals(3, sleeps.size());
        for (int n = 0; n < sleeps.size(); n++) {
            Duration lower = Duration.ofMillis(100L << n);
            Duration upper = lower.plusMillis(50);
            Duration actual = sleeps.get(n);
            assertTrue(actual.compareTo(lower) >= 0 && actual.compareTo(upper) <= 0,
                    String.format("Delay %s for attempt %d outside [%s, %s]", actual, n, lower, upper));
        }
    }

    @Test
    void testRetry_NonRetryableError_SingleCall() {
        // Given
        ScriptedHandler<TestCommand, String> handler =
            ScriptedHandler.always(Result.err(HandlerError.of("OUT_OF_STOCK", "no stock")));
        CommandBus bus = commandBus(POLICY, new IdempotencyConfig());
        bus.register(TestCommand.TYPE, handler);

        // When
        Result<String, DispatchError> result = bus.dispatch(TestCommand.of("payload"));

        // Then
        assertErr(result, HandlerError.class);
        assertEquals(1, handler.getInvocations());
        assertTrue(clock.getSleeps().isEmpty());
    }

    @Test
    void testRetry_BreakerOpensMidRetry_StopsWithCircuitOpenError() {
        // Given: breaker opens after 3 failures, policy would allow 5 retries
        InMemoryCircuitBreakerRegistry fragileBreakers = new InMemoryCircuitBreakerRegistry(
            new CircuitBreakerConfig().withFailureThreshold(3), clock
        );
        ScriptedHandler<TestQuery, String> handler = ScriptedHandler.always(Result.err(TIMEOUT));
        QueryBus bus = new QueryBus(DispatchPipelines.query()
            .retry(POLICY.withMaxAttempts(5), clock)
            .circuitBreaker(fragileBreakers)
            .build());
        bus.register(TestQuery.TYPE, handler);

        // When
        Result<String, DispatchError> result = bus.dispatch(new TestQuery("q-1"));

        // Then: each attempt re-checked the breaker and retrying stopped once it opened
        assertErr(result, CircuitOpenError.class);
        assertEquals(3, handler.getInvocations());
        assertEquals(
            List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400)),
            clock.getSleeps()
        );
        assertEquals(CircuitBreakerState.OPEN, fragileBreakers.get(TestQuery.TYPE.getValue()).getState());
    }

    @Test
    void testRetry_QueryBus_RetriesTransientErrors() {
        // Given
        ScriptedHandler<TestQuery, String> handler = ScriptedHandler.sequence(
            Result.err(TIMEOUT),
            Result.ok("row")
        );
        QueryBus bus = queryBus(POLICY);
        bus.register(TestQuery.TYPE, handler);

        // When
        Result<String, DispatchError> result = bus.dispatch(new TestQuery("q-1"));

        // Then
        assertOk(result, "row");
        assertEquals(List.of(Duration.ofMillis(100)), clock.getSleeps());
    }
}
