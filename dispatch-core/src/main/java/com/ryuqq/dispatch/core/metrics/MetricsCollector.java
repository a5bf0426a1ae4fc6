package com.ryuqq.dispatch.core.metrics;

import com.ryuqq.dispatch.core.contract.MessageType;

import java.time.Duration;

/**
 * Dispatch 메트릭 수집 SPI.
 *
 * <p>메트릭 단계가 dispatch마다 호출합니다. 구현체는 여러 스레드에서 동시에 호출될 수 있으므로
 * 스레드 안전해야 하며, 호출 경로에서 블로킹하지 않아야 합니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public interface MetricsCollector {

    /**
     * 소요 시간 기록.
     *
     * @param type 메시지 타입
     * @param duration 소요 시간
     * @param success Ok 여부
     */
    void recordDuration(MessageType type, Duration duration, boolean success);

    /**
     * 성공/실패 횟수 증가.
     *
     * @param type 메시지 타입
     * @param success Ok 여부
     */
    void incrementCount(MessageType type, boolean success);

    /**
     * 느린 dispatch 기록.
     *
     * @param type 메시지 타입
     * @param duration 소요 시간
     */
    void recordSlowDispatch(MessageType type, Duration duration);
}
