package com.ryuqq.dispatch.application.pipeline;

import com.ryuqq.dispatch.application.fixture.SampleCommand;
import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.error.CircuitOpenError;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.error.HandlerError;
import com.ryuqq.dispatch.core.error.TransientError;
import com.ryuqq.dispatch.core.middleware.Next;
import com.ryuqq.dispatch.core.result.Result;
import com.ryuqq.dispatch.core.retry.ExponentialBackoffRetryPolicy;
import com.ryuqq.dispatch.core.time.Clock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * RetryMiddleware 테스트.
 *
 * <p>Clock을 mock으로 대체하여 실제 대기 없이 backoff 호출을 검증합니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RetryMiddlewareTest {

    private static final TransientError TRANSIENT = TransientError.of("TIMEOUT", "timed out");

    @Mock
    private Clock clock;

    private final ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.defaultPolicy()
        .withBaseDelay(Duration.ofMillis(100))
        .withJitterMax(Duration.ZERO);

    @Test
    void invoke_첫_시도_성공이면_sleep_없음() throws Exception {
        // Given
        RetryMiddleware middleware = new RetryMiddleware(policy, clock);
        ScriptedNext next = new ScriptedNext(Result.ok("ok"));

        // When
        Result<String, DispatchError> result = middleware.invoke(SampleCommand.of("x"), next);

        // Then
        assertThat(result.unwrap()).isEqualTo("ok");
        assertThat(next.calls.get()).isEqualTo(1);
        verify(clock, never()).sleep(any());
    }

    @Test
    void invoke_TransientError_두번_후_성공하면_3회_호출과_지수_backoff() throws Exception {
        // Given
        RetryMiddleware middleware = new RetryMiddleware(policy, clock);
        ScriptedNext next = new ScriptedNext(Result.err(TRANSIENT), Result.err(TRANSIENT), Result.ok("ok"));

        // When
        Result<String, DispatchError> result = middleware.invoke(SampleCommand.of("x"), next);

        // Then
        assertThat(result.unwrap()).isEqualTo("ok");
        assertThat(next.calls.get()).isEqualTo(3);
        InOrder order = inOrder(clock);
        order.verify(clock).sleep(Duration.ofMillis(100));
        order.verify(clock).sleep(Duration.ofMillis(200));
    }

    @Test
    void invoke_재시도_소진시_마지막_Err_반환_총_maxAttempts_plus_1회() throws Exception {
        // Given
        RetryMiddleware middleware = new RetryMiddleware(policy, clock);
        ScriptedNext next = new ScriptedNext(Result.err(TRANSIENT));

        // When
        Result<String, DispatchError> result = middleware.invoke(SampleCommand.of("x"), next);

        // Then
        assertThat(result.unwrapErr()).isSameAs(TRANSIENT);
        assertThat(next.calls.get()).isEqualTo(4);
        verify(clock, times(3)).sleep(any());
    }

    @Test
    void invoke_재시도_불가_오류는_즉시_반환() throws Exception {
        // Given
        RetryMiddleware middleware = new RetryMiddleware(policy, clock);
        ScriptedNext next = new ScriptedNext(Result.err(HandlerError.of("REJECTED", "rejected")));

        // When
        Result<String, DispatchError> result = middleware.invoke(SampleCommand.of("x"), next);

        // Then
        assertThat(result.unwrapErr()).isInstanceOf(HandlerError.class);
        assertThat(next.calls.get()).isEqualTo(1);
        verify(clock, never()).sleep(any());
    }

    @Test
    void invoke_CircuitOpenError는_재시도하지_않음() throws Exception {
        // Given
        RetryMiddleware middleware = new RetryMiddleware(policy, clock);
        ScriptedNext next = new ScriptedNext(Result.err(new CircuitOpenError("sample.command", Duration.ofSeconds(5))));

        // When
        Result<String, DispatchError> result = middleware.invoke(SampleCommand.of("x"), next);

        // Then
        assertThat(result.unwrapErr()).isInstanceOf(CircuitOpenError.class);
        assertThat(next.calls.get()).isEqualTo(1);
    }

    @Test
    void invoke_backoff_중_interrupt면_마지막_Err_반환_및_flag_복원() throws Exception {
        // Given
        doThrow(new InterruptedException("stop")).when(clock).sleep(any());
        RetryMiddleware middleware = new RetryMiddleware(policy, clock);
        ScriptedNext next = new ScriptedNext(Result.err(TRANSIENT), Result.ok("never"));

        // When
        Result<String, DispatchError> result = middleware.invoke(SampleCommand.of("x"), next);

        // Then
        assertThat(result.unwrapErr()).isSameAs(TRANSIENT);
        assertThat(next.calls.get()).isEqualTo(1);
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void invoke_noRetry_정책이면_한번만_호출() {
        // Given
        RetryMiddleware middleware = new RetryMiddleware(ExponentialBackoffRetryPolicy.noRetry(), clock);
        ScriptedNext next = new ScriptedNext(Result.err(TRANSIENT));

        // When
        middleware.invoke(SampleCommand.of("x"), next);

        // Then
        assertThat(next.calls.get()).isEqualTo(1);
    }

    /**
     * 준비된 결과를 순서대로 반환하고, 마지막 결과를 반복하는 Next.
     */
    private static final class ScriptedNext implements Next<String> {

        private final Deque<Result<String, DispatchError>> script;
        private final AtomicInteger calls = new AtomicInteger();

        @SafeVarargs
        private ScriptedNext(Result<String, DispatchError>... results) {
            this.script = new ArrayDeque<>(List.of(results));
        }

        @Override
        public Result<String, DispatchError> proceed(Message<String> message) {
            calls.incrementAndGet();
            return script.size() > 1 ? script.poll() : script.peek();
        }
    }
}
