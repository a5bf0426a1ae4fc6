package com.ryuqq.dispatch.core.error;

/**
 * 예상치 못한 런타임 오류.
 *
 * <p>Handler나 Middleware에서 던져진 예외는 Bus 경계에서 이 variant로 변환되어
 * 호출자에게 반환됩니다.</p>
 *
 * @param message 오류 메시지
 * @param cause 원인 예외 (null 가능)
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record Fatal(String message, Throwable cause) implements DispatchError {

    public static final String CODE = "FATAL";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null이거나 빈 문자열인 경우
     */
    public Fatal {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * 예외로부터 Fatal 생성.
     *
     * @param cause 원인 예외
     * @return Fatal 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static Fatal of(Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        String detail = cause.getMessage();
        String message = cause.getClass().getName() + (detail == null ? "" : ": " + detail);
        return new Fatal(message, cause);
    }

    /**
     * 메시지만으로 Fatal 생성.
     *
     * @param message 오류 메시지
     * @return Fatal 인스턴스
     */
    public static Fatal of(String message) {
        return new Fatal(message, null);
    }

    @Override
    public String code() {
        return CODE;
    }
}
