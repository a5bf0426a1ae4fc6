package com.ryuqq.dispatch.core.protection;

import com.ryuqq.dispatch.core.error.CircuitOpenError;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.error.Fatal;
import com.ryuqq.dispatch.core.error.ValidationError;
import com.ryuqq.dispatch.core.result.Result;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Circuit Breaker SPI.
 *
 * <p>보호 대상 호출의 연속 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 장애가 전체 시스템으로 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>동시성:</strong> 상태 전이 결정은 Breaker 단위로 직렬화되어야 하며,
 * 보호 대상 호출 자체는 그 밖에서 동시에 실행됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = registry.get("payment-gateway");
 *
 * Optional<CircuitPermit> permit = cb.tryAcquire();
 * if (permit.isEmpty()) {
 *     return Result.err(new CircuitOpenError(cb.name(), cb.retryAfter()));
 * }
 *
 * Result<Receipt, DispatchError> result = gateway.charge(request);
 * if (result.isOk()) {
 *     cb.recordSuccess(permit.get());
 * } else {
 *     cb.recordFailure(permit.get());
 * }
 * return result;
 * }</pre>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 이름.
     *
     * @return 이름
     */
    String name();

    /**
     * 통과 허가 요청.
     *
     * <ul>
     *   <li>CLOSED: 항상 허가</li>
     *   <li>OPEN: recoveryTimeout 경과 전에는 거부, 경과 후에는 HALF_OPEN으로 전이하고 시험 호출로 허가</li>
     *   <li>HALF_OPEN: halfOpenMaxCalls 범위 안에서만 허가</li>
     * </ul>
     *
     * @return 허가 (거부 시 empty)
     */
    Optional<CircuitPermit> tryAcquire();

    /**
     * 허가된 호출의 성공 기록.
     *
     * @param permit {@link #tryAcquire()}가 발급한 허가
     */
    void recordSuccess(CircuitPermit permit);

    /**
     * 허가된 호출의 실패 기록.
     *
     * @param permit {@link #tryAcquire()}가 발급한 허가
     */
    void recordFailure(CircuitPermit permit);

    /**
     * 결과를 집계하지 않고 허가 반납.
     *
     * <p>HALF_OPEN 시험 슬롯만 반환하며 카운터는 변경하지 않습니다.</p>
     *
     * @param permit {@link #tryAcquire()}가 발급한 허가
     */
    void release(CircuitPermit permit);

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 현재 상태의 불변 스냅샷.
     *
     * @return 스냅샷
     */
    CircuitBreakerSnapshot snapshot();

    /**
     * HALF_OPEN 시도까지 남은 시간.
     *
     * @return 남은 시간 (OPEN이 아니면 {@link Duration#ZERO})
     */
    Duration retryAfter();

    /**
     * CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 격리 목적으로 사용됩니다.</p>
     */
    void reset();

    /**
     * 호출을 Circuit Breaker로 보호하여 실행.
     *
     * <p>결과 분류:</p>
     * <ul>
     *   <li>Ok: 성공으로 기록</li>
     *   <li>Err(ValidationError): 집계하지 않고 허가 반납</li>
     *   <li>그 외 Err (Fatal 포함): 실패로 기록</li>
     *   <li>null: 실패로 기록 후 Fatal 반환</li>
     *   <li>예외: 실패로 기록 후 다시 던짐</li>
     * </ul>
     *
     * @param call 보호 대상 호출 (거부 시 호출되지 않음)
     * @param <T> 성공 값 타입
     * @return 호출 결과 또는 {@link CircuitOpenError}
     */
    default <T> Result<T, DispatchError> execute(Supplier<Result<T, DispatchError>> call) {
        Optional<CircuitPermit> acquired = tryAcquire();
        if (acquired.isEmpty()) {
            return Result.err(new CircuitOpenError(name(), retryAfter()));
        }
        CircuitPermit permit = acquired.get();

        Result<T, DispatchError> result;
        try {
            result = call.get();
        } catch (RuntimeException | Error e) {
            recordFailure(permit);
            throw e;
        }

        if (result == null) {
            recordFailure(permit);
            return Result.err(Fatal.of("Protected call returned null result"));
        }
        if (result.isOk()) {
            recordSuccess(permit);
        } else if (result.unwrapErr() instanceof ValidationError) {
            release(permit);
        } else {
            recordFailure(permit);
        }
        return result;
    }
}
