package com.ryuqq.dispatch.core.error;

/**
 * 멱등성 정책에 의한 거부 (재시도 불가).
 *
 * <p><strong>발생 조건:</strong></p>
 * <ul>
 *   <li>REJECT 정책에서 동일 키가 실행 중인 경우</li>
 *   <li>WAIT 정책에서 대기 시간이 초과된 경우</li>
 *   <li>동일 키가 다른 Command에 재사용된 경우</li>
 * </ul>
 *
 * @param key 멱등성 키 값
 * @param message 오류 메시지
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record ConflictError(String key, String message) implements DispatchError {

    public static final String CODE = "CONFLICT";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key 또는 message가 null이거나 빈 문자열인 경우
     */
    public ConflictError {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * ConflictError 생성.
     *
     * @param key 멱등성 키 값
     * @param message 오류 메시지
     * @return ConflictError 인스턴스
     */
    public static ConflictError of(String key, String message) {
        return new ConflictError(key, message);
    }

    @Override
    public String code() {
        return CODE;
    }
}
