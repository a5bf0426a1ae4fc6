package com.ryuqq.dispatch.core.handler;

import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.result.Result;

/**
 * 하나의 메시지 타입에 바인딩되는 비즈니스 로직.
 *
 * <p>예상 가능한 실패는 {@link Result#err(Object)}로 반환해야 합니다.
 * 던져진 예외는 Bus가 {@link com.ryuqq.dispatch.core.error.Fatal}로 변환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * commandBus.register(PlaceOrder.TYPE, (PlaceOrder command) -> {
 *     if (command.amount() <= 0) {
 *         return Result.err(HandlerError.of("ORDER-001", "amount must be positive"));
 *     }
 *     return Result.ok(orderService.place(command));
 * });
 * }</pre>
 *
 * @param <M> 메시지 타입
 * @param <R> 성공 값 타입
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Handler<M extends Message<R>, R> {

    /**
     * 메시지 처리.
     *
     * @param message 처리할 메시지
     * @return 처리 결과
     * @throws Exception 예상치 못한 오류 (Bus가 Fatal로 변환)
     */
    Result<R, DispatchError> handle(M message) throws Exception;
}
