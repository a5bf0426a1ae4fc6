package com.ryuqq.dispatch.core.retry;

import com.ryuqq.dispatch.core.error.DispatchError;

import java.time.Duration;

/**
 * 재시도 정책 (상태 없음).
 *
 * <p>{@code attempt}는 첫 번째 재시도가 0입니다. 원래 호출은 maxAttempts에 포함되지 않습니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public interface RetryPolicy {

    /**
     * 재시도 여부 판단.
     *
     * @param error 직전 시도의 오류
     * @param attempt 다음 재시도의 인덱스 (0부터 시작)
     * @return 재시도 여부
     */
    boolean shouldRetry(DispatchError error, int attempt);

    /**
     * 재시도 전 대기 시간.
     *
     * @param attempt 재시도 인덱스 (0부터 시작)
     * @return 대기 시간
     */
    Duration delayFor(int attempt);

    /**
     * 최대 재시도 횟수.
     *
     * @return 최대 재시도 횟수 (0이면 재시도 안 함)
     */
    int maxAttempts();
}
