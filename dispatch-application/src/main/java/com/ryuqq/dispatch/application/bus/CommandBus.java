package com.ryuqq.dispatch.application.bus;

import com.ryuqq.dispatch.application.pipeline.MiddlewareChain;
import com.ryuqq.dispatch.core.contract.Command;
import com.ryuqq.dispatch.core.contract.MessageType;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.handler.Handler;
import com.ryuqq.dispatch.core.result.Result;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Command Bus (쓰기 메시지의 진입점).
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CommandBus bus = new CommandBus(DispatchPipelines.command()
 *     .idempotency(guard, new IdempotencyConfig())
 *     .retry(policy, clock)
 *     .circuitBreaker(breakers)
 *     .build());
 *
 * bus.register(PlaceOrder.TYPE, placeOrderHandler);
 *
 * Result<OrderId, DispatchError> result = bus.dispatch(new PlaceOrder(...));
 * }</pre>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public class CommandBus extends AbstractBus {

    /**
     * Middleware 없이 생성.
     */
    public CommandBus() {
        this(MiddlewareChain.empty());
    }

    /**
     * Middleware Chain과 공용 ForkJoinPool로 생성.
     *
     * @param chain Middleware Chain
     */
    public CommandBus(MiddlewareChain chain) {
        this(chain, ForkJoinPool.commonPool());
    }

    /**
     * Middleware Chain과 비동기 실행기로 생성.
     *
     * @param chain Middleware Chain
     * @param executor dispatchAsync 실행기
     */
    public CommandBus(MiddlewareChain chain, Executor executor) {
        super("command", chain, executor);
    }

    /**
     * Command Handler 등록 (설정 단계 전용).
     *
     * @param type 메시지 타입
     * @param handler Handler
     * @param <R> 성공 값 타입
     * @param <M> Command 타입
     * @throws com.ryuqq.dispatch.core.error.DuplicateHandlerException 이미 등록된 타입인 경우
     * @throws IllegalStateException 첫 dispatch 이후 호출된 경우
     */
    public <R, M extends Command<R>> void register(MessageType type, Handler<M, R> handler) {
        registerHandler(type, handler);
    }

    /**
     * Command dispatch.
     *
     * @param command Command
     * @param <R> 성공 값 타입
     * @return 처리 결과 (예외를 던지지 않음)
     */
    public <R> Result<R, DispatchError> dispatch(Command<R> command) {
        return dispatchMessage(command);
    }

    /**
     * Command 비동기 dispatch.
     *
     * @param command Command
     * @param <R> 성공 값 타입
     * @return 처리 결과 Future
     */
    public <R> CompletableFuture<Result<R, DispatchError>> dispatchAsync(Command<R> command) {
        return dispatchMessageAsync(command);
    }
}
