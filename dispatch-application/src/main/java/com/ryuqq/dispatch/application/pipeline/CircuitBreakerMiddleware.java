package com.ryuqq.dispatch.application.pipeline;

import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.error.CircuitOpenError;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.middleware.Middleware;
import com.ryuqq.dispatch.core.middleware.Next;
import com.ryuqq.dispatch.core.protection.CircuitBreaker;
import com.ryuqq.dispatch.core.protection.CircuitBreakerRegistry;
import com.ryuqq.dispatch.core.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Circuit Breaker 단계 (Handler 바로 바깥).
 *
 * <p>Breaker 이름은 기본적으로 메시지 타입 값이며, 리졸버로 바꿀 수 있습니다
 * (예: 같은 외부 의존성을 쓰는 여러 타입을 하나의 Breaker로 묶기).</p>
 *
 * <p>OPEN이면 {@code next}를 호출하지 않고 CircuitOpenError를 반환합니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public final class CircuitBreakerMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerMiddleware.class);

    private final CircuitBreakerRegistry registry;
    private final Function<Message<?>, String> nameResolver;

    /**
     * 메시지 타입별 Breaker로 생성.
     *
     * @param registry Circuit Breaker 레지스트리
     */
    public CircuitBreakerMiddleware(CircuitBreakerRegistry registry) {
        this(registry, message -> message.type().getValue());
    }

    /**
     * CircuitBreakerMiddleware 생성.
     *
     * @param registry Circuit Breaker 레지스트리
     * @param nameResolver 메시지에서 Breaker 이름을 결정하는 함수
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public CircuitBreakerMiddleware(CircuitBreakerRegistry registry, Function<Message<?>, String> nameResolver) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (nameResolver == null) {
            throw new IllegalArgumentException("nameResolver cannot be null");
        }
        this.registry = registry;
        this.nameResolver = nameResolver;
    }

    @Override
    public <R> Result<R, DispatchError> invoke(Message<R> message, Next<R> next) {
        CircuitBreaker breaker = registry.get(nameResolver.apply(message));
        Result<R, DispatchError> result = breaker.execute(() -> next.proceed(message));
        if (result.isErr() && result.unwrapErr() instanceof CircuitOpenError) {
            log.debug("Circuit '{}' rejected {}", breaker.name(), message.type());
        }
        return result;
    }
}
