package com.ryuqq.dispatch.core.model;

import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.result.Result;

import java.time.Duration;

/**
 * 멱등성 기록.
 *
 * <p>시각 값은 모두 {@link com.ryuqq.dispatch.core.time.Clock#monotonicNanos()} 기준입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>IN_FLIGHT: result는 null, expiresAt은 {@link Long#MAX_VALUE} (실행 중에는 만료되지 않음)</li>
 *   <li>COMPLETED: result는 null이 아니며, expiresAt = 완료 시각 + TTL</li>
 * </ul>
 *
 * @param key 멱등성 키
 * @param status 상태
 * @param result 저장된 결과 (IN_FLIGHT이면 null)
 * @param createdAt 최초 관측 시각 (monotonic nanos)
 * @param expiresAt 만료 시각 (monotonic nanos)
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record IdempotencyRecord(
    IdempotencyKey key,
    IdempotencyStatus status,
    Result<?, DispatchError> result,
    long createdAt,
    long expiresAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 불변식을 위반하는 경우
     */
    public IdempotencyRecord {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status == IdempotencyStatus.COMPLETED && result == null) {
            throw new IllegalArgumentException("result cannot be null for a COMPLETED record");
        }
        if (status == IdempotencyStatus.IN_FLIGHT && result != null) {
            throw new IllegalArgumentException("result must be null for an IN_FLIGHT record");
        }
        if (expiresAt < createdAt) {
            throw new IllegalArgumentException(
                "expiresAt must be >= createdAt (createdAt: " + createdAt + ", expiresAt: " + expiresAt + ")"
            );
        }
    }

    /**
     * IN_FLIGHT 기록 생성.
     *
     * @param key 멱등성 키
     * @param now 현재 시각 (monotonic nanos)
     * @return IN_FLIGHT 기록
     */
    public static IdempotencyRecord inFlight(IdempotencyKey key, long now) {
        return new IdempotencyRecord(key, IdempotencyStatus.IN_FLIGHT, null, now, Long.MAX_VALUE);
    }

    /**
     * 이 기록을 COMPLETED로 전이한 새 기록 생성.
     *
     * @param result 저장할 결과
     * @param now 완료 시각 (monotonic nanos)
     * @param ttl 보존 기간
     * @return COMPLETED 기록
     * @throws IllegalStateException 이미 COMPLETED인 경우
     */
    public IdempotencyRecord complete(Result<?, DispatchError> result, long now, Duration ttl) {
        if (status == IdempotencyStatus.COMPLETED) {
            throw new IllegalStateException("Record already completed: " + key);
        }
        return new IdempotencyRecord(key, IdempotencyStatus.COMPLETED, result, createdAt, saturatedAdd(now, ttl));
    }

    /**
     * 만료 여부 확인 ({@code now > expiresAt}).
     *
     * @param now 현재 시각 (monotonic nanos)
     * @return 만료 여부
     */
    public boolean isExpired(long now) {
        return now > expiresAt;
    }

    /**
     * 완료 여부 확인.
     *
     * @return COMPLETED 여부
     */
    public boolean isCompleted() {
        return status == IdempotencyStatus.COMPLETED;
    }

    private static long saturatedAdd(long now, Duration ttl) {
        long ttlNanos;
        try {
            ttlNanos = ttl.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
        long sum = now + ttlNanos;
        // overflow
        if (((now ^ sum) & (ttlNanos ^ sum)) < 0) {
            return Long.MAX_VALUE;
        }
        return sum;
    }
}
