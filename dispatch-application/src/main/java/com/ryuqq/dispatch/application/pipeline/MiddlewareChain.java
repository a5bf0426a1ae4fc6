package com.ryuqq.dispatch.application.pipeline;

import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.error.Fatal;
import com.ryuqq.dispatch.core.middleware.Middleware;
import com.ryuqq.dispatch.core.middleware.Next;
import com.ryuqq.dispatch.core.result.Result;

import java.util.Arrays;
import java.util.List;

/**
 * 순서가 고정된 Middleware 합성.
 *
 * <p>설정 시점에 한 번 구성되며, 호출마다 순서가 바뀌지 않습니다.
 * 목록의 첫 번째 단계가 가장 바깥쪽입니다.</p>
 *
 * <pre>
 * stages = [A, B, C]
 * execute: A → B → C → terminal(Handler) → C → B → A
 * </pre>
 *
 * <p>단계가 null Result를 반환하면 Fatal로 대체합니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public final class MiddlewareChain {

    private static final MiddlewareChain EMPTY = new MiddlewareChain(List.of());

    private final List<Middleware> stages;

    private MiddlewareChain(List<Middleware> stages) {
        this.stages = stages;
    }

    /**
     * Middleware 목록으로 Chain 생성.
     *
     * @param stages 바깥쪽부터 안쪽 순서의 단계 목록
     * @return MiddlewareChain
     * @throws IllegalArgumentException stages가 null이거나 null 요소를 포함하는 경우
     */
    public static MiddlewareChain of(List<Middleware> stages) {
        if (stages == null || stages.contains(null)) {
            throw new IllegalArgumentException("stages cannot be null or contain null");
        }
        return new MiddlewareChain(List.copyOf(stages));
    }

    /**
     * Middleware 목록으로 Chain 생성.
     *
     * @param stages 바깥쪽부터 안쪽 순서의 단계
     * @return MiddlewareChain
     */
    public static MiddlewareChain of(Middleware... stages) {
        if (stages == null) {
            throw new IllegalArgumentException("stages cannot be null or contain null");
        }
        return of(Arrays.asList(stages));
    }

    /**
     * 단계가 없는 Chain (Handler만 호출).
     *
     * @return 빈 MiddlewareChain
     */
    public static MiddlewareChain empty() {
        return EMPTY;
    }

    /**
     * Chain 실행.
     *
     * @param message 메시지
     * @param terminal 가장 안쪽 단계 (Handler 호출)
     * @param <R> 성공 값 타입
     * @return 처리 결과
     */
    public <R> Result<R, DispatchError> execute(Message<R> message, Next<R> terminal) {
        if (terminal == null) {
            throw new IllegalArgumentException("terminal cannot be null");
        }
        return proceed(0, message, terminal);
    }

    /**
     * 단계 목록 조회.
     *
     * @return 불변 목록 (바깥쪽부터)
     */
    public List<Middleware> stages() {
        return stages;
    }

    /**
     * 단계 수.
     *
     * @return 단계 수
     */
    public int size() {
        return stages.size();
    }

    private <R> Result<R, DispatchError> proceed(int index, Message<R> message, Next<R> terminal) {
        if (index == stages.size()) {
            Result<R, DispatchError> result = terminal.proceed(message);
            return result != null ? result : Result.err(Fatal.of("Handler returned null result"));
        }
        Middleware stage = stages.get(index);
        Next<R> next = m -> proceed(index + 1, m, terminal);
        Result<R, DispatchError> result = stage.invoke(message, next);
        if (result == null) {
            return Result.err(Fatal.of("Middleware " + stage.getClass().getSimpleName() + " returned null result"));
        }
        return result;
    }
}
