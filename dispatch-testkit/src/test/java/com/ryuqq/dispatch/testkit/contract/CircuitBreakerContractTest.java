package com.ryuqq.dispatch.testkit.contract;

import com.ryuqq.dispatch.application.bus.CommandBus;
import com.ryuqq.dispatch.application.pipeline.IdempotencyConfig;
import com.ryuqq.dispatch.core.error.CircuitOpenError;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.error.TransientError;
import com.ryuqq.dispatch.core.error.ValidationError;
import com.ryuqq.dispatch.core.protection.CircuitBreakerConfig;
import com.ryuqq.dispatch.core.protection.CircuitBreakerState;
import com.ryuqq.dispatch.core.result.Result;
import com.ryuqq.dispatch.core.retry.ExponentialBackoffRetryPolicy;
import com.ryuqq.dispatch.testkit.fixture.ScriptedHandler;
import com.ryuqq.dispatch.testkit.fixture.TestCommand;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the circuit breaker state machine seen through a command bus.
 *
 * <p>The breaker is configured with {@code failureThreshold=3, recoveryTimeout=10s,
 * successThreshold=2} and retries are disabled so every dispatch is exactly one
 * protected call.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Three consecutive failures open the breaker, a success before that resets the count</li>
 *   <li>Open breaker rejects with CircuitOpenError without invoking the handler</li>
 *   <li>After the recovery timeout one trial call is admitted in HALF_OPEN</li>
 *   <li>Two trial successes close the breaker, a trial failure reopens it</li>
 * </ul>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
class CircuitBreakerContractTest extends AbstractContractTest {

    private static final String BREAKER = TestCommand.TYPE.getValue();
    private static final TransientError UNAVAILABLE = TransientError.of("UNAVAILABLE", "downstream unavailable");

    @Override
    protected CircuitBreakerConfig breakerConfig() {
        return new CircuitBreakerConfig(3, Duration.ofSeconds(10), 2, 1);
    }

    @Test
    void testBreaker_ThreeFailures_OpenThenRecoverThroughHalfOpen() {
        // Given
        ScriptedHandler<TestCommand, String> handler = ScriptedHandler.sequence(
            Result.err(UNAVAILABLE),
            Result.err(UNAVAILABLE),
            Result.err(UNAVAILABLE),
            Result.ok("recovered-1"),
            Result.ok("recovered-2")
        );
        CommandBus bus = noRetryBus();
        bus.register(TestCommand.TYPE, handler);

        // When: three consecutive failures
        for (int i = 0; i < 3; i++) {
            assertErr(bus.dispatch(TestCommand.of("call-" + i)), TransientError.class);
        }

        // Then: breaker is open
        assertBreakerState(BREAKER, CircuitBreakerState.OPEN);

        // When: call during OPEN
        CircuitOpenError open = assertErr(bus.dispatch(TestCommand.of("rejected")), CircuitOpenError.class);

        // Then: handler was not invoked
        assertEquals(3, handler.getInvocations(), "Handler must not run while the circuit is open");
        assertEquals(BREAKER, open.breakerName());
        assertEquals(Duration.ofSeconds(10), open.retryAfter());

        // When: recovery timeout elapses and one call succeeds
        clock.advance(Duration.ofSeconds(10));
        assertOk(bus.dispatch(TestCommand.of("trial-1")), "recovered-1");

        // Then: still HALF_OPEN (1/2)
        assertBreakerState(BREAKER, CircuitBreakerState.HALF_OPEN);

        // When: second success
        assertOk(bus.dispatch(TestCommand.of("trial-2")), "recovered-2");

        // Then: closed
        assertBreakerState(BREAKER, CircuitBreakerState.CLOSED);
    }

    @Test
    void testBreaker_SuccessBeforeThreshold_ResetsFailureCount() {
        // Given
        ScriptedHandler<TestCommand, String> handler = ScriptedHandler.sequence(
            Result.err(UNAVAILABLE),
            Result.err(UNAVAILABLE),
            Result.ok("ok"),
            Result.err(UNAVAILABLE),
            Result.err(UNAVAILABLE)
        );
        CommandBus bus = noRetryBus();
        bus.register(TestCommand.TYPE, handler);

        // When
        for (int i = 0; i < 5; i++) {
            bus.dispatch(TestCommand.of("call-" + i));
        }

        // Then
        assertBreakerState(BREAKER, CircuitBreakerState.CLOSED);
        assertEquals(2, breakers.get(BREAKER).snapshot().consecutiveFailures());
    }

    @Test
    void testBreaker_RecoveryTimeoutNotElapsed_StillRejects() {
        // Given
        ScriptedHandler<TestCommand, String> handler = ScriptedHandler.always(Result.err(UNAVAILABLE));
        CommandBus bus = noRetryBus();
        bus.register(TestCommand.TYPE, handler);
        for (int i = 0; i < 3; i++) {
            bus.dispatch(TestCommand.of("call-" + i));
        }

        // When
        clock.advance(Duration.ofSeconds(9));
        CircuitOpenError open = assertErr(bus.dispatch(TestCommand.of("early")), CircuitOpenError.class);

        // Then
        assertEquals(Duration.ofSeconds(1), open.retryAfter());
        assertEquals(3, handler.getInvocations());
    }

    @Test
    void testBreaker_FailureInHalfOpen_ReturnsToOpen() {
        // Given
        ScriptedHandler<TestCommand, String> handler = ScriptedHandler.always(Result.err(UNAVAILABLE));
        CommandBus bus = noRetryBus();
        bus.register(TestCommand.TYPE, handler);
        for (int i = 0; i < 3; i++) {
            bus.dispatch(TestCommand.of("call-" + i));
        }
        clock.advance(Duration.ofSeconds(10));

        // When: trial call is admitted and fails
        assertErr(bus.dispatch(TestCommand.of("trial")), TransientError.class);

        // Then: handler ran for the trial, breaker reopened with a fresh timer
        assertEquals(4, handler.getInvocations(), "Trial call must be admitted after the recovery timeout");
        assertBreakerState(BREAKER, CircuitBreakerState.OPEN);
        CircuitOpenError open = assertErr(bus.dispatch(TestCommand.of("again")), CircuitOpenError.class);
        assertEquals(Duration.ofSeconds(10), open.retryAfter());
    }

    @Test
    void testBreaker_ValidationErrorsFromHandler_DoNotOpenCircuit() {
        // Given
        ScriptedHandler<TestCommand, String> handler =
            ScriptedHandler.always(Result.err(ValidationError.of("payload", "is invalid")));
        CommandBus bus = noRetryBus();
        bus.register(TestCommand.TYPE, handler);

        // When
        for (int i = 0; i < 10; i++) {
            assertErr(bus.dispatch(TestCommand.of("bad-" + i)), ValidationError.class);
        }

        // Then
        assertBreakerState(BREAKER, CircuitBreakerState.CLOSED);
        assertEquals(10, handler.getInvocations());
    }

    @Test
    void testBreaker_RegistryReset_ClosesOpenCircuit() {
        // Given
        ScriptedHandler<TestCommand, String> handler = ScriptedHandler.sequence(
            Result.err(UNAVAILABLE),
            Result.err(UNAVAILABLE),
            Result.err(UNAVAILABLE),
            Result.ok("after-reset")
        );
        CommandBus bus = noRetryBus();
        bus.register(TestCommand.TYPE, handler);
        for (int i = 0; i < 3; i++) {
            bus.dispatch(TestCommand.of("call-" + i));
        }

        // When
        breakers.reset(BREAKER);

        // Then
        Result<String, DispatchError> result = bus.dispatch(TestCommand.of("fresh"));
        assertOk(result, "after-reset");
    }

    private CommandBus noRetryBus() {
        return commandBus(ExponentialBackoffRetryPolicy.noRetry(), new IdempotencyConfig());
    }
}
