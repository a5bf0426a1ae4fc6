package com.ryuqq.dispatch.core.error;

import java.util.List;

/**
 * 입력 검증 실패.
 *
 * <p>부수 효과가 발생하기 전에 반환되며, 재시도 예산을 소비하거나
 * Circuit Breaker 실패로 집계되지 않습니다.</p>
 *
 * @param message 요약 메시지
 * @param violations 필드 단위 위반 목록 (비어 있을 수 있음)
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record ValidationError(String message, List<Violation> violations) implements DispatchError {

    public static final String CODE = "VALIDATION";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null이거나 빈 문자열이거나 violations가 null인 경우
     */
    public ValidationError {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (violations == null) {
            throw new IllegalArgumentException("violations cannot be null");
        }
        violations = List.copyOf(violations);
    }

    /**
     * 위반 목록 없이 생성.
     *
     * @param message 요약 메시지
     * @return ValidationError 인스턴스
     */
    public static ValidationError of(String message) {
        return new ValidationError(message, List.of());
    }

    /**
     * 단일 필드 위반으로 생성.
     *
     * @param field 필드 이름
     * @param message 위반 내용
     * @return ValidationError 인스턴스
     */
    public static ValidationError of(String field, String message) {
        return new ValidationError(message, List.of(Violation.of(field, message)));
    }

    /**
     * 위반 목록으로 생성.
     *
     * @param violations 위반 목록 (1개 이상)
     * @return ValidationError 인스턴스
     * @throws IllegalArgumentException violations가 비어 있는 경우
     */
    public static ValidationError of(List<Violation> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations cannot be null or empty");
        }
        return new ValidationError("Validation failed with " + violations.size() + " violation(s)", violations);
    }

    @Override
    public String code() {
        return CODE;
    }
}
