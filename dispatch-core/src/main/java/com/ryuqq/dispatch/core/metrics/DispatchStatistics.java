package com.ryuqq.dispatch.core.metrics;

import com.ryuqq.dispatch.core.contract.MessageType;

import java.time.Duration;

/**
 * 메시지 타입별 dispatch 통계 스냅샷.
 *
 * <p>소요 시간 값은 기록된 적이 없으면 {@link Duration#ZERO}입니다.</p>
 *
 * @param type 메시지 타입
 * @param successCount 성공 횟수
 * @param failureCount 실패 횟수
 * @param averageDuration 평균 소요 시간
 * @param minDuration 최소 소요 시간
 * @param maxDuration 최대 소요 시간
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record DispatchStatistics(
    MessageType type,
    long successCount,
    long failureCount,
    Duration averageDuration,
    Duration minDuration,
    Duration maxDuration
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DispatchStatistics {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (successCount < 0 || failureCount < 0) {
            throw new IllegalArgumentException(
                "counts cannot be negative (success: " + successCount + ", failure: " + failureCount + ")"
            );
        }
        if (averageDuration == null || minDuration == null || maxDuration == null) {
            throw new IllegalArgumentException("durations cannot be null");
        }
    }

    /**
     * 기록이 없는 통계.
     *
     * @param type 메시지 타입
     * @return 모든 값이 0인 통계
     */
    public static DispatchStatistics empty(MessageType type) {
        return new DispatchStatistics(type, 0, 0, Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }

    /**
     * 전체 실행 횟수.
     *
     * @return 성공 + 실패
     */
    public long totalExecutions() {
        return successCount + failureCount;
    }

    /**
     * 성공률.
     *
     * @return 0.0 ~ 1.0 (실행 기록이 없으면 0.0)
     */
    public double successRate() {
        long total = totalExecutions();
        return total == 0 ? 0.0 : (double) successCount / total;
    }
}
