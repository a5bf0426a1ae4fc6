package com.ryuqq.dispatch.application.pipeline;

import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.middleware.Middleware;
import com.ryuqq.dispatch.core.middleware.Next;
import com.ryuqq.dispatch.core.result.Result;
import com.ryuqq.dispatch.core.retry.RetryContext;
import com.ryuqq.dispatch.core.retry.RetryPolicy;
import com.ryuqq.dispatch.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 재시도 단계.
 *
 * <p>Circuit Breaker 단계를 감싸므로, 각 재시도는 Breaker 상태를 다시 확인합니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>Err이고 {@link RetryPolicy#shouldRetry}가 true이면 {@link RetryPolicy#delayFor} 만큼 대기 후 재시도</li>
 *   <li>대기는 주입된 {@link Clock}으로 호출 스레드에서만 수행</li>
 *   <li>재시도 소진 시 마지막 Err를 변경 없이 반환</li>
 *   <li>대기 중 인터럽트되면 인터럽트 플래그를 복원하고 마지막 Err 반환</li>
 * </ul>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public final class RetryMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(RetryMiddleware.class);

    private final RetryPolicy policy;
    private final Clock clock;

    /**
     * RetryMiddleware 생성.
     *
     * @param policy 재시도 정책
     * @param clock 대기에 사용할 Clock
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public RetryMiddleware(RetryPolicy policy, Clock clock) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.policy = policy;
        this.clock = clock;
    }

    @Override
    public <R> Result<R, DispatchError> invoke(Message<R> message, Next<R> next) {
        RetryContext context = RetryContext.initial(policy);
        Result<R, DispatchError> result = next.proceed(message);

        while (result.isErr() && context.shouldRetry(result.unwrapErr())) {
            Duration delay = context.delay();
            log.debug("Retrying {} (attempt {}/{}) after {}ms: {}",
                message.type(), context.attempt() + 1, policy.maxAttempts(), delay.toMillis(), result.unwrapErr().code());
            try {
                clock.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Retry of {} interrupted, returning last error", message.type());
                return result;
            }
            context = context.next();
            result = next.proceed(message);
        }

        if (result.isErr() && context.attempt() > 0 && context.attempt() >= policy.maxAttempts()) {
            log.warn("Retries exhausted for {} after {} attempt(s): {}",
                message.type(), context.attempt(), result.unwrapErr().code());
        }
        return result;
    }
}
