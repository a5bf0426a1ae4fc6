package com.ryuqq.dispatch.core.middleware;

import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.result.Result;

/**
 * Middleware Chain의 나머지 단계.
 *
 * <p>Retry처럼 여러 번 호출될 수 있습니다.</p>
 *
 * @param <R> 성공 값 타입
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Next<R> {

    /**
     * 다음 단계 실행.
     *
     * @param message 처리 중인 메시지
     * @return 처리 결과
     */
    Result<R, DispatchError> proceed(Message<R> message);
}
