package com.ryuqq.dispatch.application.pipeline;

import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.contract.MessageType;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.metrics.MetricsCollector;
import com.ryuqq.dispatch.core.middleware.Middleware;
import com.ryuqq.dispatch.core.middleware.Next;
import com.ryuqq.dispatch.core.result.Result;
import com.ryuqq.dispatch.core.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 메트릭 단계 (선택, Logging 바로 안쪽).
 *
 * <p>메시지 타입별로 소요 시간, 성공/실패 횟수, 느린 dispatch를 {@link MetricsCollector}에 기록합니다.
 * Ok만 성공으로 집계하며, Err와 안쪽에서 전파된 예외는 실패로 집계합니다.
 * 예외는 기록 후 그대로 다시 던집니다.</p>
 *
 * <p>멱등성 단계보다 바깥에 있으므로 저장된 결과를 재생한 dispatch도 집계됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * InMemoryMetricsCollector collector = new InMemoryMetricsCollector();
 * MiddlewareChain chain = DispatchPipelines.command()
 *     .metrics(collector, Clock.system())
 *     .build();
 *
 * DispatchStatistics stats = collector.getStatistics(PlaceOrder.TYPE);
 * }</pre>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public final class MetricsMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(MetricsMiddleware.class);

    private final MetricsCollector collector;
    private final Clock clock;
    private final MetricsConfig config;

    /**
     * 기본 설정으로 생성.
     *
     * @param collector 메트릭 수집기
     * @param clock 소요 시간 측정용 Clock
     */
    public MetricsMiddleware(MetricsCollector collector, Clock clock) {
        this(collector, clock, new MetricsConfig());
    }

    /**
     * MetricsMiddleware 생성.
     *
     * @param collector 메트릭 수집기
     * @param clock 소요 시간 측정용 Clock
     * @param config 설정
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public MetricsMiddleware(MetricsCollector collector, Clock clock, MetricsConfig config) {
        if (collector == null) {
            throw new IllegalArgumentException("collector cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.collector = collector;
        this.clock = clock;
        this.config = config;
    }

    @Override
    public <R> Result<R, DispatchError> invoke(Message<R> message, Next<R> next) {
        if (!config.enabled()) {
            return next.proceed(message);
        }
        MessageType type = message.type();
        long start = clock.monotonicNanos();
        boolean success = false;
        try {
            Result<R, DispatchError> result = next.proceed(message);
            success = result.isOk();
            return result;
        } finally {
            record(type, Duration.ofNanos(clock.monotonicNanos() - start), success);
        }
    }

    private void record(MessageType type, Duration duration, boolean success) {
        if (config.trackDuration()) {
            collector.recordDuration(type, duration, success);
        }
        if (config.trackSuccessRate()) {
            collector.incrementCount(type, success);
        }
        if (config.detectSlowDispatches() && duration.compareTo(config.slowThreshold()) > 0) {
            log.debug("Recording slow dispatch of {}: {}ms", type, duration.toMillis());
            collector.recordSlowDispatch(type, duration);
        }
    }
}
