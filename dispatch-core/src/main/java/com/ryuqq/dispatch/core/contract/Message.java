package com.ryuqq.dispatch.core.contract;

/**
 * Bus로 전달되는 불변 메시지.
 *
 * <p>Message는 {@link Command} (쓰기) 또는 {@link Query} (읽기) 중 하나이며,
 * Handler Registry의 키로 사용되는 {@link MessageType}을 제공합니다.
 * 호출자가 생성하고 Bus가 한 번 소비하며, 이후 변경되지 않습니다.</p>
 *
 * <p>구현체는 record로 작성하는 것을 권장합니다. 멱등성 가드는
 * 동일 키의 요청 비교에 {@link Object#equals(Object)}를 사용합니다.</p>
 *
 * @param <R> Handler가 성공 시 반환하는 값 타입
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public interface Message<R> {

    /**
     * 메시지 타입 조회.
     *
     * @return Handler Registry 키
     */
    MessageType type();
}
