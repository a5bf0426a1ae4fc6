package com.ryuqq.dispatch.core.protection;

import java.util.OptionalLong;

/**
 * Circuit Breaker 상태의 불변 스냅샷.
 *
 * @param name Circuit Breaker 이름
 * @param state 현재 상태
 * @param consecutiveFailures 연속 실패 횟수 (CLOSED에서 의미)
 * @param consecutiveSuccesses 연속 성공 횟수 (HALF_OPEN에서 의미)
 * @param openedAt OPEN 진입 시각 (monotonic nanos, OPEN이 아니면 empty)
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record CircuitBreakerSnapshot(
    String name,
    CircuitBreakerState state,
    int consecutiveFailures,
    int consecutiveSuccesses,
    OptionalLong openedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public CircuitBreakerSnapshot {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (openedAt == null) {
            throw new IllegalArgumentException("openedAt cannot be null");
        }
    }
}
