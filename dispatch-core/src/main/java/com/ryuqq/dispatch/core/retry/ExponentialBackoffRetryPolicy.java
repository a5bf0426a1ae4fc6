package com.ryuqq.dispatch.core.retry;

import com.ryuqq.dispatch.core.error.CircuitOpenError;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.error.TransientError;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential Backoff with Jitter 재시도 정책 (불변 record).
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = baseDelay * 2^attempt + jitter
 * jitter = uniform(0, jitterMax), 재시도마다 독립
 * </pre>
 *
 * <p><strong>예시 (baseDelay=100ms, jitterMax=0):</strong></p>
 * <ul>
 *   <li>attempt=0: 100ms</li>
 *   <li>attempt=1: 200ms</li>
 *   <li>attempt=2: 400ms</li>
 * </ul>
 *
 * <p>{@link CircuitOpenError}는 retryableErrors 구성과 관계없이 재시도하지 않습니다.</p>
 *
 * @param maxAttempts 최대 재시도 횟수 (0 이상)
 * @param baseDelay 기본 지연 시간 (0 이상)
 * @param jitterMax 최대 Jitter (0 이상)
 * @param retryableErrors 재시도 대상 오류 타입
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record ExponentialBackoffRetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    Duration jitterMax,
    Set<Class<? extends DispatchError>> retryableErrors
) implements RetryPolicy {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelay=1s, jitterMax=100ms, retryableErrors={TransientError}</p>
     */
    public ExponentialBackoffRetryPolicy() {
        this(3, Duration.ofSeconds(1), Duration.ofMillis(100), Set.of(TransientError.class));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExponentialBackoffRetryPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException(
                "maxAttempts cannot be negative (current: " + maxAttempts + ")"
            );
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException(
                "baseDelay cannot be null or negative (current: " + baseDelay + ")"
            );
        }
        if (jitterMax == null || jitterMax.isNegative()) {
            throw new IllegalArgumentException(
                "jitterMax cannot be null or negative (current: " + jitterMax + ")"
            );
        }
        if (retryableErrors == null) {
            throw new IllegalArgumentException("retryableErrors cannot be null");
        }
        retryableErrors = Set.copyOf(retryableErrors);
    }

    /**
     * 재시도하지 않는 정책.
     *
     * @return maxAttempts=0 정책
     */
    public static ExponentialBackoffRetryPolicy noRetry() {
        return new ExponentialBackoffRetryPolicy(0, Duration.ZERO, Duration.ZERO, Set.of());
    }

    /**
     * 기본 정책.
     *
     * @return 기본 설정 정책
     */
    public static ExponentialBackoffRetryPolicy defaultPolicy() {
        return new ExponentialBackoffRetryPolicy();
    }

    @Override
    public boolean shouldRetry(DispatchError error, int attempt) {
        if (error == null || attempt < 0 || attempt >= maxAttempts) {
            return false;
        }
        if (error instanceof CircuitOpenError) {
            return false;
        }
        for (Class<? extends DispatchError> type : retryableErrors) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Duration delayFor(int attempt) {
        long base = baseDelayFor(attempt).toNanos();
        long jitterBound = jitterMax.toNanos();
        if (jitterBound == 0) {
            return Duration.ofNanos(base);
        }
        long jitter = jitterBound == Long.MAX_VALUE
            ? ThreadLocalRandom.current().nextLong(Long.MAX_VALUE)
            : ThreadLocalRandom.current().nextLong(jitterBound + 1);
        long total = base + jitter;
        if (total < 0) {
            total = Long.MAX_VALUE;
        }
        return Duration.ofNanos(total);
    }

    /**
     * Jitter를 제외한 결정적 지연 시간 ({@code baseDelay * 2^attempt}).
     *
     * <p>overflow 시 {@code Long.MAX_VALUE} 나노초로 포화됩니다.</p>
     *
     * @param attempt 재시도 인덱스 (0 이상)
     * @return 결정적 지연 시간
     * @throws IllegalArgumentException attempt가 음수인 경우
     */
    public Duration baseDelayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException(
                "attempt cannot be negative (current: " + attempt + ")"
            );
        }
        long baseNanos = baseDelay.toNanos();
        if (baseNanos == 0) {
            return Duration.ZERO;
        }
        if (attempt >= Long.SIZE - 1 || baseNanos > (Long.MAX_VALUE >> attempt)) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(baseNanos << attempt);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public ExponentialBackoffRetryPolicy withMaxAttempts(int maxAttempts) {
        return new ExponentialBackoffRetryPolicy(maxAttempts, baseDelay, jitterMax, retryableErrors);
    }

    /**
     * baseDelay만 변경한 새 인스턴스 생성.
     */
    public ExponentialBackoffRetryPolicy withBaseDelay(Duration baseDelay) {
        return new ExponentialBackoffRetryPolicy(maxAttempts, baseDelay, jitterMax, retryableErrors);
    }

    /**
     * jitterMax만 변경한 새 인스턴스 생성.
     */
    public ExponentialBackoffRetryPolicy withJitterMax(Duration jitterMax) {
        return new ExponentialBackoffRetryPolicy(maxAttempts, baseDelay, jitterMax, retryableErrors);
    }

    /**
     * retryableErrors만 변경한 새 인스턴스 생성.
     */
    public ExponentialBackoffRetryPolicy withRetryableErrors(Set<Class<? extends DispatchError>> retryableErrors) {
        return new ExponentialBackoffRetryPolicy(maxAttempts, baseDelay, jitterMax, retryableErrors);
    }
}
