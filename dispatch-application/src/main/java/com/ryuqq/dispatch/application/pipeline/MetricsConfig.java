package com.ryuqq.dispatch.application.pipeline;

import java.time.Duration;

/**
 * 메트릭 단계 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: false이면 아무것도 기록하지 않고 통과 (기본 true)</li>
 *   <li>trackDuration: 소요 시간 기록 (기본 true)</li>
 *   <li>trackSuccessRate: 성공/실패 횟수 기록 (기본 true)</li>
 *   <li>detectSlowDispatches: 느린 dispatch 기록 (기본 true)</li>
 *   <li>slowThreshold: 이 값을 초과하면 느린 dispatch (기본 1초)</li>
 * </ul>
 *
 * @param enabled 활성화 여부
 * @param trackDuration 소요 시간 기록 여부
 * @param trackSuccessRate 성공/실패 횟수 기록 여부
 * @param detectSlowDispatches 느린 dispatch 기록 여부
 * @param slowThreshold 느린 dispatch 기준 (양수)
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record MetricsConfig(
    boolean enabled,
    boolean trackDuration,
    boolean trackSuccessRate,
    boolean detectSlowDispatches,
    Duration slowThreshold
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: 모든 항목 활성화, slowThreshold=1s</p>
     */
    public MetricsConfig() {
        this(true, true, true, true, Duration.ofSeconds(1));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException slowThreshold가 양수가 아닌 경우
     */
    public MetricsConfig {
        if (slowThreshold == null || slowThreshold.isZero() || slowThreshold.isNegative()) {
            throw new IllegalArgumentException(
                "slowThreshold must be positive (current: " + slowThreshold + ")"
            );
        }
    }

    /**
     * 메트릭을 기록하지 않는 설정.
     *
     * @return enabled=false 설정
     */
    public static MetricsConfig disabled() {
        return new MetricsConfig().withEnabled(false);
    }

    /**
     * enabled만 변경한 새 인스턴스 생성.
     */
    public MetricsConfig withEnabled(boolean enabled) {
        return new MetricsConfig(enabled, trackDuration, trackSuccessRate, detectSlowDispatches, slowThreshold);
    }

    /**
     * trackDuration만 변경한 새 인스턴스 생성.
     */
    public MetricsConfig withTrackDuration(boolean trackDuration) {
        return new MetricsConfig(enabled, trackDuration, trackSuccessRate, detectSlowDispatches, slowThreshold);
    }

    /**
     * trackSuccessRate만 변경한 새 인스턴스 생성.
     */
    public MetricsConfig withTrackSuccessRate(boolean trackSuccessRate) {
        return new MetricsConfig(enabled, trackDuration, trackSuccessRate, detectSlowDispatches, slowThreshold);
    }

    /**
     * detectSlowDispatches만 변경한 새 인스턴스 생성.
     */
    public MetricsConfig withDetectSlowDispatches(boolean detectSlowDispatches) {
        return new MetricsConfig(enabled, trackDuration, trackSuccessRate, detectSlowDispatches, slowThreshold);
    }

    /**
     * slowThreshold만 변경한 새 인스턴스 생성.
     */
    public MetricsConfig withSlowThreshold(Duration slowThreshold) {
        return new MetricsConfig(enabled, trackDuration, trackSuccessRate, detectSlowDispatches, slowThreshold);
    }
}
