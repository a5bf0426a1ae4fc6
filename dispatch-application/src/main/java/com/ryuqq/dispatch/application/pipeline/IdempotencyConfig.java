package com.ryuqq.dispatch.application.pipeline;

import java.time.Duration;
import java.util.Optional;

/**
 * 멱등성 단계 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultTtl: Command가 TTL을 지정하지 않은 경우의 보존 기간 (기본 24시간)</li>
 *   <li>duplicatePolicy: 실행 중 중복 처리 정책 (기본 WAIT)</li>
 *   <li>inFlightWaitTimeout: WAIT 정책의 1회 대기 한도 (기본 없음)</li>
 * </ul>
 *
 * @param defaultTtl 기본 보존 기간 (양수)
 * @param duplicatePolicy 실행 중 중복 처리 정책
 * @param inFlightWaitTimeout 대기 한도 (null이면 무기한)
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record IdempotencyConfig(
    Duration defaultTtl,
    DuplicatePolicy duplicatePolicy,
    Duration inFlightWaitTimeout
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultTtl=24h, duplicatePolicy=WAIT, inFlightWaitTimeout=없음</p>
     */
    public IdempotencyConfig() {
        this(Duration.ofHours(24), DuplicatePolicy.WAIT, null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public IdempotencyConfig {
        if (defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException(
                "defaultTtl must be positive (current: " + defaultTtl + ")"
            );
        }
        if (duplicatePolicy == null) {
            throw new IllegalArgumentException("duplicatePolicy cannot be null");
        }
        if (inFlightWaitTimeout != null && (inFlightWaitTimeout.isZero() || inFlightWaitTimeout.isNegative())) {
            throw new IllegalArgumentException(
                "inFlightWaitTimeout must be positive (current: " + inFlightWaitTimeout + ")"
            );
        }
    }

    /**
     * 대기 한도 조회.
     *
     * @return 대기 한도 (무기한이면 empty)
     */
    public Optional<Duration> findInFlightWaitTimeout() {
        return Optional.ofNullable(inFlightWaitTimeout);
    }

    /**
     * defaultTtl만 변경한 새 인스턴스 생성.
     */
    public IdempotencyConfig withDefaultTtl(Duration defaultTtl) {
        return new IdempotencyConfig(defaultTtl, duplicatePolicy, inFlightWaitTimeout);
    }

    /**
     * duplicatePolicy만 변경한 새 인스턴스 생성.
     */
    public IdempotencyConfig withDuplicatePolicy(DuplicatePolicy duplicatePolicy) {
        return new IdempotencyConfig(defaultTtl, duplicatePolicy, inFlightWaitTimeout);
    }

    /**
     * inFlightWaitTimeout만 변경한 새 인스턴스 생성.
     */
    public IdempotencyConfig withInFlightWaitTimeout(Duration inFlightWaitTimeout) {
        return new IdempotencyConfig(defaultTtl, duplicatePolicy, inFlightWaitTimeout);
    }
}
