package com.ryuqq.dispatch.core.error;

import com.ryuqq.dispatch.core.contract.MessageType;

/**
 * 동일 메시지 타입에 Handler를 두 번 등록하려는 경우 발생 (시작 시점 설정 오류).
 *
 * <p>dispatch 시점까지 미뤄지지 않고 {@code register} 호출 시점에 즉시 발생합니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public class DuplicateHandlerException extends RuntimeException {

    private final MessageType type;

    /**
     * DuplicateHandlerException 생성.
     *
     * @param type 이미 등록된 메시지 타입
     */
    public DuplicateHandlerException(MessageType type) {
        super("Handler already registered for message type: " + type.getValue());
        this.type = type;
    }

    /**
     * 중복 등록된 메시지 타입 조회.
     *
     * @return 메시지 타입
     */
    public MessageType getType() {
        return type;
    }
}
