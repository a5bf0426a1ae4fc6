package com.ryuqq.dispatch.core.contract;

/**
 * 읽기 전용 요청 메시지.
 *
 * <p>Query는 부수 효과를 가져서는 안 되며, 멱등성 키를 갖지 않습니다.
 * 읽기는 본래 반복 가능하므로 Query Bus는 멱등성 단계 없이 구성됩니다.</p>
 *
 * @param <R> 조회 결과 타입
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public interface Query<R> extends Message<R> {
}
