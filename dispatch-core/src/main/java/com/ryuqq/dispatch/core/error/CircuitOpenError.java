package com.ryuqq.dispatch.core.error;

import java.time.Duration;

/**
 * Circuit Breaker가 OPEN 상태라 호출이 거부됨.
 *
 * <p>해당 시도에 대한 종단 결과이며 Retry Stage는 재시도하지 않습니다.
 * 외부 호출자는 {@code retryAfter} 이후 다시 시도할 수 있습니다.</p>
 *
 * @param breakerName Circuit Breaker 이름
 * @param retryAfter HALF_OPEN 시도까지 남은 시간 (0 이상)
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record CircuitOpenError(String breakerName, Duration retryAfter) implements DispatchError {

    public static final String CODE = "CIRCUIT_OPEN";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException breakerName이 빈 문자열이거나 retryAfter가 음수인 경우
     */
    public CircuitOpenError {
        if (breakerName == null || breakerName.isBlank()) {
            throw new IllegalArgumentException("breakerName cannot be null or blank");
        }
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter cannot be null or negative");
        }
    }

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public String message() {
        return "Circuit '" + breakerName + "' is open, retry after " + retryAfter.toMillis() + "ms";
    }
}
