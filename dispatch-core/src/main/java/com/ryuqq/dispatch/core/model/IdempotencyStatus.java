package com.ryuqq.dispatch.core.model;

/**
 * 멱등성 기록 상태.
 *
 * <pre>
 * (없음) ──begin──► IN_FLIGHT ──complete──► COMPLETED ──expiresAt 경과──► (없음)
 *                      │
 *                      └──release──► (없음)
 * </pre>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public enum IdempotencyStatus {

    /**
     * 실행 중. 동일 키의 두 번째 실행은 시작될 수 없습니다.
     */
    IN_FLIGHT,

    /**
     * 완료됨. 저장된 결과가 만료 시각까지 모든 호출자에게 그대로 반환됩니다.
     */
    COMPLETED
}
