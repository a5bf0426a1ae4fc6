package com.ryuqq.dispatch.core.protection;

/**
 * Circuit Breaker 통과 허가.
 *
 * <p>허가 시점의 세대(generation)를 기록합니다. 상태 전이가 일어나면 세대가 증가하므로,
 * 전이 이전에 허가된 호출의 결과는 새 상태에 집계되지 않습니다.</p>
 *
 * @param breakerName 허가를 발급한 Circuit Breaker 이름
 * @param generation 허가 시점의 세대
 * @param trial HALF_OPEN 시험 호출 여부
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record CircuitPermit(String breakerName, long generation, boolean trial) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException breakerName이 null이거나 빈 문자열인 경우
     */
    public CircuitPermit {
        if (breakerName == null || breakerName.isBlank()) {
            throw new IllegalArgumentException("breakerName cannot be null or blank");
        }
    }
}
