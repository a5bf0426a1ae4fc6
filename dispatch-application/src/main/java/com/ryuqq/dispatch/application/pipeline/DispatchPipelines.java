package com.ryuqq.dispatch.application.pipeline;

import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.metrics.MetricsCollector;
import com.ryuqq.dispatch.core.middleware.Middleware;
import com.ryuqq.dispatch.core.protection.CircuitBreakerRegistry;
import com.ryuqq.dispatch.core.retry.RetryPolicy;
import com.ryuqq.dispatch.core.spi.IdempotencyGuard;
import com.ryuqq.dispatch.core.time.Clock;
import com.ryuqq.dispatch.core.validation.Validator;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 표준 순서의 Middleware Chain 빌더.
 *
 * <p>설정 메서드의 호출 순서와 관계없이 항상 다음 순서로 조립합니다:</p>
 * <pre>
 * [Logging →] [Metrics →] Idempotency → Validation → Retry → CircuitBreaker → Handler
 * </pre>
 *
 * <ul>
 *   <li>중복 억제는 어떤 부수 효과보다 먼저 (가장 바깥쪽)</li>
 *   <li>검증 실패는 재시도 예산을 쓰거나 Breaker를 트립시키지 않음</li>
 *   <li>Retry가 CircuitBreaker를 감싸므로 각 재시도가 Breaker를 다시 확인</li>
 * </ul>
 *
 * <p>설정하지 않은 단계는 생략됩니다. Query 빌더는 멱등성 단계를 지원하지 않습니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public final class DispatchPipelines {

    private DispatchPipelines() {
    }

    /**
     * Command Bus용 빌더.
     *
     * @return Builder
     */
    public static Builder command() {
        return new Builder(true);
    }

    /**
     * Query Bus용 빌더 (멱등성 단계 없음).
     *
     * @return Builder
     */
    public static Builder query() {
        return new Builder(false);
    }

    /**
     * 표준 순서 Chain 빌더.
     */
    public static final class Builder {

        private final boolean idempotencyAllowed;
        private Middleware logging;
        private Middleware metrics;
        private Middleware idempotency;
        private Middleware validation;
        private Middleware retry;
        private Middleware circuitBreaker;

        private Builder(boolean idempotencyAllowed) {
            this.idempotencyAllowed = idempotencyAllowed;
        }

        /**
         * 로깅 단계 설정.
         *
         * @param clock 소요 시간 측정용 Clock
         * @return this
         */
        public Builder logging(Clock clock) {
            this.logging = new LoggingMiddleware(clock);
            return this;
        }

        /**
         * 메트릭 단계 설정.
         *
         * @param collector 메트릭 수집기
         * @param clock 소요 시간 측정용 Clock
         * @return this
         */
        public Builder metrics(MetricsCollector collector, Clock clock) {
            this.metrics = new MetricsMiddleware(collector, clock);
            return this;
        }

        /**
         * 메트릭 단계 설정 (직접 구성한 단계).
         *
         * @param middleware 메트릭 단계
         * @return this
         */
        public Builder metrics(MetricsMiddleware middleware) {
            if (middleware == null) {
                throw new IllegalArgumentException("middleware cannot be null");
            }
            this.metrics = middleware;
            return this;
        }

        /**
         * 멱등성 단계 설정.
         *
         * @param guard 멱등성 가드
         * @param config 설정
         * @return this
         * @throws IllegalStateException Query 빌더인 경우
         */
        public Builder idempotency(IdempotencyGuard guard, IdempotencyConfig config) {
            if (!idempotencyAllowed) {
                throw new IllegalStateException("Query pipelines do not support the idempotency stage");
            }
            this.idempotency = new IdempotencyMiddleware(guard, config);
            return this;
        }

        /**
         * 검증 단계 설정.
         *
         * @param validator 모든 메시지에 적용할 Validator
         * @return this
         */
        public Builder validation(Validator validator) {
            this.validation = new ValidationMiddleware(validator);
            return this;
        }

        /**
         * 검증 단계 설정 (직접 구성한 단계).
         *
         * @param middleware 검증 단계
         * @return this
         */
        public Builder validation(ValidationMiddleware middleware) {
            if (middleware == null) {
                throw new IllegalArgumentException("middleware cannot be null");
            }
            this.validation = middleware;
            return this;
        }

        /**
         * 재시도 단계 설정.
         *
         * @param policy 재시도 정책
         * @param clock 대기에 사용할 Clock
         * @return this
         */
        public Builder retry(RetryPolicy policy, Clock clock) {
            this.retry = new RetryMiddleware(policy, clock);
            return this;
        }

        /**
         * Circuit Breaker 단계 설정 (메시지 타입별 Breaker).
         *
         * @param registry Circuit Breaker 레지스트리
         * @return this
         */
        public Builder circuitBreaker(CircuitBreakerRegistry registry) {
            this.circuitBreaker = new CircuitBreakerMiddleware(registry);
            return this;
        }

        /**
         * Circuit Breaker 단계 설정.
         *
         * @param registry Circuit Breaker 레지스트리
         * @param nameResolver Breaker 이름 리졸버
         * @return this
         */
        public Builder circuitBreaker(CircuitBreakerRegistry registry, Function<Message<?>, String> nameResolver) {
            this.circuitBreaker = new CircuitBreakerMiddleware(registry, nameResolver);
            return this;
        }

        /**
         * Chain 조립.
         *
         * @return 표준 순서의 MiddlewareChain
         */
        public MiddlewareChain build() {
            List<Middleware> stages = new ArrayList<>();
            addIfPresent(stages, logging);
            addIfPresent(stages, metrics);
            addIfPresent(stages, idempotency);
            addIfPresent(stages, validation);
            addIfPresent(stages, retry);
            addIfPresent(stages, circuitBreaker);
            return MiddlewareChain.of(stages);
        }

        private static void addIfPresent(List<Middleware> stages, Middleware stage) {
            if (stage != null) {
                stages.add(stage);
            }
        }
    }
}
