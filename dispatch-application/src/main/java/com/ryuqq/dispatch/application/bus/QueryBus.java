package com.ryuqq.dispatch.application.bus;

import com.ryuqq.dispatch.application.pipeline.MiddlewareChain;
import com.ryuqq.dispatch.core.contract.MessageType;
import com.ryuqq.dispatch.core.contract.Query;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.handler.Handler;
import com.ryuqq.dispatch.core.result.Result;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Query Bus (읽기 메시지의 진입점).
 *
 * <p>읽기는 반복 가능하므로 멱등성 단계 없이 구성합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * QueryBus bus = new QueryBus(DispatchPipelines.query()
 *     .retry(policy, clock)
 *     .circuitBreaker(breakers)
 *     .build());
 *
 * bus.register(FindOrder.TYPE, findOrderHandler);
 *
 * Result<Order, DispatchError> result = bus.dispatch(new FindOrder(orderId));
 * }</pre>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public class QueryBus extends AbstractBus {

    /**
     * Middleware 없이 생성.
     */
    public QueryBus() {
        this(MiddlewareChain.empty());
    }

    /**
     * Middleware Chain과 공용 ForkJoinPool로 생성.
     *
     * @param chain Middleware Chain
     */
    public QueryBus(MiddlewareChain chain) {
        this(chain, ForkJoinPool.commonPool());
    }

    /**
     * Middleware Chain과 비동기 실행기로 생성.
     *
     * @param chain Middleware Chain
     * @param executor dispatchAsync 실행기
     */
    public QueryBus(MiddlewareChain chain, Executor executor) {
        super("query", chain, executor);
    }

    /**
     * Query Handler 등록 (설정 단계 전용).
     *
     * @param type 메시지 타입
     * @param handler Handler
     * @param <R> 성공 값 타입
     * @param <M> Query 타입
     * @throws com.ryuqq.dispatch.core.error.DuplicateHandlerException 이미 등록된 타입인 경우
     * @throws IllegalStateException 첫 dispatch 이후 호출된 경우
     */
    public <R, M extends Query<R>> void register(MessageType type, Handler<M, R> handler) {
        registerHandler(type, handler);
    }

    /**
     * Query dispatch.
     *
     * @param query Query
     * @param <R> 성공 값 타입
     * @return 처리 결과 (예외를 던지지 않음)
     */
    public <R> Result<R, DispatchError> dispatch(Query<R> query) {
        return dispatchMessage(query);
    }

    /**
     * Query 비동기 dispatch.
     *
     * @param query Query
     * @param <R> 성공 값 타입
     * @return 처리 결과 Future
     */
    public <R> CompletableFuture<Result<R, DispatchError>> dispatchAsync(Query<R> query) {
        return dispatchMessageAsync(query);
    }
}
