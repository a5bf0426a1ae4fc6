package com.ryuqq.dispatch.core.error;

import com.ryuqq.dispatch.core.contract.MessageType;

/**
 * 등록되지 않은 메시지 타입 (설정 오류, 재시도 불가).
 *
 * <p>Handler는 호출되지 않으며 Middleware Chain도 실행되지 않습니다.</p>
 *
 * @param type 조회에 실패한 메시지 타입
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record UnregisteredHandlerError(MessageType type) implements DispatchError {

    public static final String CODE = "UNREGISTERED_HANDLER";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type이 null인 경우
     */
    public UnregisteredHandlerError {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public String message() {
        return "No handler registered for message type: " + type.getValue();
    }
}
