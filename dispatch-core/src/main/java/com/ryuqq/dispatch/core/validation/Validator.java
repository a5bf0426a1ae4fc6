package com.ryuqq.dispatch.core.validation;

import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.error.ValidationError;
import com.ryuqq.dispatch.core.result.Result;

/**
 * 메시지 검증 슬롯.
 *
 * <p>검증 규칙의 내용은 이 모듈의 관심사가 아니며, 호출자가 주입합니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Validator {

    /**
     * 메시지 검증.
     *
     * @param message 검증할 메시지
     * @return 통과 시 {@code Ok(null)}, 실패 시 {@code Err(ValidationError)}
     */
    Result<Void, ValidationError> validate(Message<?> message);
}
