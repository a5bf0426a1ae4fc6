package com.ryuqq.dispatch.core.error;

/**
 * 일시적 오류 (재시도 가능).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>네트워크 타임아웃</li>
 *   <li>외부 API 503 Service Unavailable</li>
 *   <li>DB 커넥션 획득 실패</li>
 * </ul>
 *
 * @param code 오류 코드 (예: TIMEOUT, DOWNSTREAM-503)
 * @param message 오류 메시지
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record TransientError(String code, String message) implements DispatchError {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code 또는 message가 null이거나 빈 문자열인 경우
     */
    public TransientError {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * TransientError 생성.
     *
     * @param code 오류 코드
     * @param message 오류 메시지
     * @return TransientError 인스턴스
     */
    public static TransientError of(String code, String message) {
        return new TransientError(code, message);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
