package com.ryuqq.dispatch.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: OPEN 전이까지의 연속 실패 횟수 (기본 5)</li>
 *   <li>recoveryTimeout: OPEN 유지 시간 (기본 30초)</li>
 *   <li>successThreshold: HALF_OPEN에서 CLOSED 전이까지의 연속 성공 횟수 (기본 2)</li>
 *   <li>halfOpenMaxCalls: HALF_OPEN에서 동시에 허용되는 시험 호출 수 (기본 1)</li>
 * </ul>
 *
 * @param failureThreshold 연속 실패 임계값 (양수)
 * @param recoveryTimeout OPEN 유지 시간 (0 이상)
 * @param successThreshold 연속 성공 임계값 (양수)
 * @param halfOpenMaxCalls HALF_OPEN 동시 시험 호출 수 (양수)
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration recoveryTimeout,
    int successThreshold,
    int halfOpenMaxCalls
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, recoveryTimeout=30s, successThreshold=2, halfOpenMaxCalls=1</p>
     */
    public CircuitBreakerConfig() {
        this(5, Duration.ofSeconds(30), 2, 1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "recoveryTimeout cannot be null or negative (current: " + recoveryTimeout + ")"
            );
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException(
                "successThreshold must be positive (current: " + successThreshold + ")"
            );
        }
        if (halfOpenMaxCalls <= 0) {
            throw new IllegalArgumentException(
                "halfOpenMaxCalls must be positive (current: " + halfOpenMaxCalls + ")"
            );
        }
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, successThreshold, halfOpenMaxCalls);
    }

    /**
     * recoveryTimeout만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withRecoveryTimeout(Duration recoveryTimeout) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, successThreshold, halfOpenMaxCalls);
    }

    /**
     * successThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, successThreshold, halfOpenMaxCalls);
    }

    /**
     * halfOpenMaxCalls만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withHalfOpenMaxCalls(int halfOpenMaxCalls) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, successThreshold, halfOpenMaxCalls);
    }
}
