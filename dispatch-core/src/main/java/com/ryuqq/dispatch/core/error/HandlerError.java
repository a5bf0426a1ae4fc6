package com.ryuqq.dispatch.core.error;

/**
 * Handler가 반환한 영구적 실패 (재시도 불가).
 *
 * <p>비즈니스 규칙 위반처럼 재시도해도 성공할 수 없는 경우에 사용합니다.</p>
 *
 * @param code 오류 코드 (예: PAY-001, ORDER-404)
 * @param message 오류 메시지
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record HandlerError(String code, String message) implements DispatchError {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code 또는 message가 null이거나 빈 문자열인 경우
     */
    public HandlerError {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * HandlerError 생성.
     *
     * @param code 오류 코드
     * @param message 오류 메시지
     * @return HandlerError 인스턴스
     */
    public static HandlerError of(String code, String message) {
        return new HandlerError(code, message);
    }
}
