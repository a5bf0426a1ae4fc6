package com.ryuqq.dispatch.core.time;

import java.time.Duration;

/**
 * 단조(monotonic) 시간 소스.
 *
 * <p>Circuit Breaker의 openedAt, Retry 대기, 멱등성 기록 만료 계산에 사용됩니다.
 * 테스트에서는 결정적인 구현으로 교체할 수 있습니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public interface Clock {

    /**
     * 현재 단조 시각 (나노초).
     *
     * <p>절대 시각이 아니며, 두 값의 차이만 의미가 있습니다.</p>
     *
     * @return 단조 시각 (nanos)
     */
    long monotonicNanos();

    /**
     * 호출 스레드만 지정 시간 동안 대기.
     *
     * @param duration 대기 시간 (0 이하이면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * 시스템 시계 반환.
     *
     * @return {@link SystemClock} 싱글톤
     */
    static Clock system() {
        return SystemClock.INSTANCE;
    }
}
