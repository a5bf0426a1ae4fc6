package com.ryuqq.dispatch.application.pipeline;

import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.middleware.Middleware;
import com.ryuqq.dispatch.core.middleware.Next;
import com.ryuqq.dispatch.core.result.Result;
import com.ryuqq.dispatch.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.UUID;

/**
 * 로깅 단계 (선택, 가장 바깥쪽).
 *
 * <p>메시지 타입, 결과, 소요 시간을 기록합니다. MDC에 {@value #REQUEST_ID_KEY}가 없으면
 * 새 요청 ID를 생성하여 dispatch 동안만 설정합니다.</p>
 *
 * <p>소요 시간이 slowThreshold 이상이면 warn 레벨로 기록합니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public final class LoggingMiddleware implements Middleware {

    /**
     * 요청 상관관계 ID의 MDC 키.
     */
    public static final String REQUEST_ID_KEY = "requestId";

    private static final Logger log = LoggerFactory.getLogger(LoggingMiddleware.class);

    private final Clock clock;
    private final Duration slowThreshold;

    /**
     * 기본 설정으로 생성 (slowThreshold=1s).
     *
     * @param clock 소요 시간 측정용 Clock
     */
    public LoggingMiddleware(Clock clock) {
        this(clock, Duration.ofSeconds(1));
    }

    /**
     * LoggingMiddleware 생성.
     *
     * @param clock 소요 시간 측정용 Clock
     * @param slowThreshold 느린 dispatch 기준 (양수)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LoggingMiddleware(Clock clock, Duration slowThreshold) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (slowThreshold == null || slowThreshold.isZero() || slowThreshold.isNegative()) {
            throw new IllegalArgumentException(
                "slowThreshold must be positive (current: " + slowThreshold + ")"
            );
        }
        this.clock = clock;
        this.slowThreshold = slowThreshold;
    }

    @Override
    public <R> Result<R, DispatchError> invoke(Message<R> message, Next<R> next) {
        boolean ownsRequestId = MDC.get(REQUEST_ID_KEY) == null;
        if (ownsRequestId) {
            MDC.put(REQUEST_ID_KEY, UUID.randomUUID().toString().substring(0, 8));
        }
        String type = message.type().getValue();
        long start = clock.monotonicNanos();
        try {
            log.debug("Dispatching {}", type);
            Result<R, DispatchError> result = next.proceed(message);
            long elapsedMs = Duration.ofNanos(clock.monotonicNanos() - start).toMillis();

            if (result.isOk()) {
                log.debug("Dispatch of {} succeeded in {}ms", type, elapsedMs);
            } else {
                DispatchError error = result.unwrapErr();
                log.debug("Dispatch of {} failed in {}ms: {} - {}", type, elapsedMs, error.code(), error.message());
            }
            if (elapsedMs >= slowThreshold.toMillis()) {
                log.warn("Slow dispatch of {}: {}ms (threshold {}ms)", type, elapsedMs, slowThreshold.toMillis());
            }
            return result;
        } finally {
            if (ownsRequestId) {
                MDC.remove(REQUEST_ID_KEY);
            }
        }
    }
}
