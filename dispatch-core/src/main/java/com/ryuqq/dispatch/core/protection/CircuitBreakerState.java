package com.ryuqq.dispatch.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 failureThreshold 도달)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeout 경과 후 다음 호출)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 연속 성공 successThreshold 도달 → CLOSED
 *   └─► 실패 1회 → OPEN
 * </pre>
 *
 * <p>종료 상태는 없습니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>연속 실패 횟수를 추적하며, 성공 시 0으로 리셋합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>보호 대상 호출은 실행되지 않고 {@code CircuitOpenError}가 반환됩니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (제한된 수의 시험 호출만 통과).
     */
    HALF_OPEN
}
