package com.ryuqq.dispatch.core.middleware;

import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.result.Result;

/**
 * Handler 호출을 감싸는 횡단 관심사 단계.
 *
 * <p>Middleware는 {@code next}를 호출하여 체인의 나머지를 실행하고,
 * 자신이 책임지는 변환이 아닌 한 내부 Result를 그대로 전파해야 합니다.
 * {@code next}를 호출하지 않고 Err를 반환하는 것(short-circuit)은
 * 해당 단계 고유의 이유가 있을 때만 허용됩니다.</p>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>{@code
 * public class TimingMiddleware implements Middleware {
 *
 *     public <R> Result<R, DispatchError> invoke(Message<R> message, Next<R> next) {
 *         long start = System.nanoTime();
 *         try {
 *             return next.proceed(message);
 *         } finally {
 *             metrics.record(message.type(), System.nanoTime() - start);
 *         }
 *     }
 * }
 * }</pre>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public interface Middleware {

    /**
     * 단계 실행.
     *
     * @param message 처리 중인 메시지
     * @param next 체인의 나머지
     * @param <R> 성공 값 타입
     * @return 처리 결과
     */
    <R> Result<R, DispatchError> invoke(Message<R> message, Next<R> next);
}
