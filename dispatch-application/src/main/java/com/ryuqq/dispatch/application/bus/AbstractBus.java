package com.ryuqq.dispatch.application.bus;

import com.ryuqq.dispatch.application.pipeline.MiddlewareChain;
import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.contract.MessageType;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.error.Fatal;
import com.ryuqq.dispatch.core.error.UnregisteredHandlerError;
import com.ryuqq.dispatch.core.handler.Handler;
import com.ryuqq.dispatch.core.middleware.Next;
import com.ryuqq.dispatch.core.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Command Bus와 Query Bus의 공통 구현.
 *
 * <p><strong>dispatch 흐름:</strong></p>
 * <ol>
 *   <li>레지스트리 봉인 (최초 dispatch 1회)</li>
 *   <li>메시지 타입으로 Handler 조회 (없으면 Chain 실행 없이 UnregisteredHandlerError)</li>
 *   <li>Middleware Chain 실행, Handler는 가장 안쪽 단계</li>
 * </ol>
 *
 * <p><strong>예외 변환:</strong></p>
 * <ul>
 *   <li>Handler 경계: Handler가 던진 예외는 Fatal로 변환 (Circuit Breaker와 멱등성 가드가 관측)</li>
 *   <li>Bus 경계: Middleware에서 빠져나온 예외도 Fatal로 변환</li>
 * </ul>
 *
 * <p>호출자는 dispatch에서 예외를 받지 않습니다.
 * {@link VirtualMachineError}만 예외적으로 전파됩니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public abstract class AbstractBus {

    private static final Logger log = LoggerFactory.getLogger(AbstractBus.class);

    private final HandlerRegistry registry;
    private final MiddlewareChain chain;
    private final Executor executor;

    /**
     * AbstractBus 생성.
     *
     * @param category 메시지 분류 이름 (command, query)
     * @param chain Middleware Chain
     * @param executor dispatchAsync 실행기
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    protected AbstractBus(String category, MiddlewareChain chain, Executor executor) {
        if (chain == null) {
            throw new IllegalArgumentException("chain cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.registry = new HandlerRegistry(category);
        this.chain = chain;
        this.executor = executor;
    }

    /**
     * Handler 등록.
     *
     * @param type 메시지 타입
     * @param handler Handler
     * @param <R> 성공 값 타입
     * @param <M> 메시지 타입
     */
    protected final <R, M extends Message<R>> void registerHandler(MessageType type, Handler<M, R> handler) {
        registry.register(type, handler);
    }

    /**
     * 메시지 dispatch (예외를 던지지 않음).
     *
     * @param message 메시지
     * @param <R> 성공 값 타입
     * @return 처리 결과
     */
    protected final <R> Result<R, DispatchError> dispatchMessage(Message<R> message) {
        if (message == null) {
            return Result.err(Fatal.of("message cannot be null"));
        }
        registry.seal();

        try {
            MessageType type = message.type();
            Optional<Handler<?, ?>> handler = registry.find(type);
            if (handler.isEmpty()) {
                log.debug("No handler registered for {}", type);
                return Result.err(new UnregisteredHandlerError(type));
            }

            Handler<?, ?> resolved = handler.get();
            Next<R> terminal = m -> invokeHandler(resolved, m);
            return chain.execute(message, terminal);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            log.error("Dispatch of {} failed unexpectedly", message.getClass().getName(), t);
            return Result.err(Fatal.of(t));
        }
    }

    /**
     * 메시지를 Executor에서 비동기 dispatch.
     *
     * <p>반환된 Future를 취소하거나 타임아웃으로 포기해도 호출자만 분리되며,
     * dispatch 자체는 끝까지 실행됩니다. 멱등성 대기자는 항상 해제됩니다.</p>
     *
     * @param message 메시지
     * @param <R> 성공 값 타입
     * @return 처리 결과 Future (예외로 완료되지 않음)
     */
    protected final <R> CompletableFuture<Result<R, DispatchError>> dispatchMessageAsync(Message<R> message) {
        try {
            return CompletableFuture.supplyAsync(() -> dispatchMessage(message), executor).copy();
        } catch (RejectedExecutionException e) {
            log.warn("Async dispatch rejected by executor", e);
            return CompletableFuture.completedFuture(Result.err(Fatal.of(e)));
        }
    }

    /**
     * 등록 여부 확인.
     *
     * @param type 메시지 타입
     * @return 등록 여부
     */
    public boolean isRegistered(MessageType type) {
        return registry.isRegistered(type);
    }

    /**
     * 등록된 메시지 타입 목록.
     *
     * @return 불변 스냅샷
     */
    public Set<MessageType> registeredTypes() {
        return registry.registeredTypes();
    }

    /**
     * 구성된 Middleware Chain.
     *
     * @return Middleware Chain
     */
    public MiddlewareChain chain() {
        return chain;
    }

    @SuppressWarnings("unchecked")
    private <R> Result<R, DispatchError> invokeHandler(Handler<?, ?> handler, Message<R> message) {
        Handler<Message<R>, R> typed = (Handler<Message<R>, R>) handler;
        try {
            Result<R, DispatchError> result = typed.handle(message);
            if (result == null) {
                log.error("Handler for {} returned null result", message.type());
                return Result.err(Fatal.of("Handler returned null result for " + message.type().getValue()));
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Handler for {} was interrupted", message.type());
            return Result.err(Fatal.of(e));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            log.error("Handler for {} failed unexpectedly", message.type(), t);
            return Result.err(Fatal.of(t));
        }
    }
}
