package com.ryuqq.dispatch.core.retry;

import com.ryuqq.dispatch.core.error.DispatchError;

import java.time.Duration;

/**
 * 단일 dispatch 호출 동안만 존재하는 재시도 상태.
 *
 * @param attempt 다음 재시도의 인덱스 (0부터 시작)
 * @param policy 적용 중인 정책
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record RetryContext(int attempt, RetryPolicy policy) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException attempt가 음수이거나 policy가 null인 경우
     */
    public RetryContext {
        if (attempt < 0) {
            throw new IllegalArgumentException(
                "attempt cannot be negative (current: " + attempt + ")"
            );
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
    }

    /**
     * 원래 호출 직후의 초기 상태.
     *
     * @param policy 재시도 정책
     * @return attempt=0 컨텍스트
     */
    public static RetryContext initial(RetryPolicy policy) {
        return new RetryContext(0, policy);
    }

    /**
     * 다음 재시도로 진행한 새 컨텍스트.
     *
     * @return attempt + 1 컨텍스트
     */
    public RetryContext next() {
        return new RetryContext(attempt + 1, policy);
    }

    /**
     * 현재 attempt로 재시도 가능 여부 판단.
     *
     * @param error 직전 시도의 오류
     * @return 재시도 여부
     */
    public boolean shouldRetry(DispatchError error) {
        return policy.shouldRetry(error, attempt);
    }

    /**
     * 현재 attempt의 대기 시간.
     *
     * @return 대기 시간
     */
    public Duration delay() {
        return policy.delayFor(attempt);
    }
}
