package com.ryuqq.dispatch.core.error;

/**
 * 필드 단위 검증 위반.
 *
 * @param field 필드 이름
 * @param message 위반 내용
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record Violation(String field, String message) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException field 또는 message가 null이거나 빈 문자열인 경우
     */
    public Violation {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * Violation 생성.
     *
     * @param field 필드 이름
     * @param message 위반 내용
     * @return Violation 인스턴스
     */
    public static Violation of(String field, String message) {
        return new Violation(field, message);
    }
}
