package com.ryuqq.dispatch.core.error;

/**
 * Dispatch 오류 분류 (Sealed).
 *
 * <p>Bus.dispatch는 예외를 던지지 않고, 모든 실패를 이 타입의 variant로 반환합니다.</p>
 *
 * <ul>
 *   <li>{@link ValidationError}: 입력 거부 (부수 효과 이전, 재시도 안 함)</li>
 *   <li>{@link UnregisteredHandlerError}: 등록되지 않은 메시지 타입 (설정 오류)</li>
 *   <li>{@link TransientError}: 일시적 오류 (재시도 가능)</li>
 *   <li>{@link CircuitOpenError}: Circuit Breaker에 의한 즉시 거부</li>
 *   <li>{@link ConflictError}: 멱등성 정책에 의한 거부</li>
 *   <li>{@link HandlerError}: Handler가 반환한 영구적 비즈니스 실패</li>
 *   <li>{@link Fatal}: 예상치 못한 런타임 오류</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (error instanceof TransientError te) {
 *     log.warn("Transient failure: {}", te.code());
 * }
 * }</pre>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public sealed interface DispatchError permits
    ValidationError,
    UnregisteredHandlerError,
    TransientError,
    CircuitOpenError,
    ConflictError,
    HandlerError,
    Fatal {

    /**
     * 오류 코드.
     *
     * @return 오류 코드 (예: VALIDATION, CIRCUIT_OPEN)
     */
    String code();

    /**
     * 오류 메시지.
     *
     * @return 사람이 읽을 수 있는 메시지
     */
    String message();

    /**
     * 재시도 분류 기본값.
     *
     * <p>기본 RetryPolicy는 설정된 retryable 오류 타입 집합을 기준으로 판단하며,
     * 이 값은 그 집합의 기본 구성({@link TransientError})과 일치합니다.</p>
     *
     * @return 재시도 가능 여부
     */
    default boolean isRetryable() {
        return false;
    }
}
