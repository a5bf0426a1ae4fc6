package com.ryuqq.dispatch.core.spi;

import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.model.IdempotencyKey;
import com.ryuqq.dispatch.core.result.Result;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * {@link IdempotencyGuard#begin} 결과 (Sealed).
 *
 * <ul>
 *   <li>{@link Admitted}: 이 호출이 최초 실행자. Handler를 실행한 뒤 complete 또는 release 해야 함</li>
 *   <li>{@link Duplicate}: 이미 완료됨. 저장된 결과를 그대로 반환</li>
 *   <li>{@link DuplicateInFlight}: 다른 호출이 실행 중. Handler를 실행하면 안 됨</li>
 *   <li>{@link Mismatch}: 동일 키가 다른 요청에 사용 중</li>
 * </ul>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public sealed interface Admission {

    /**
     * 멱등성 키.
     *
     * @return 키
     */
    IdempotencyKey key();

    /**
     * 최초 실행 허가.
     *
     * @param key 멱등성 키
     */
    record Admitted(IdempotencyKey key) implements Admission {
    }

    /**
     * 완료된 기록의 결과.
     *
     * @param key 멱등성 키
     * @param result 저장된 결과
     */
    record Duplicate(IdempotencyKey key, Result<?, DispatchError> result) implements Admission {
    }

    /**
     * 실행 중인 기록.
     *
     * <p>{@code completion}은 실행 중인 호출이 complete하면 저장된 결과로,
     * release되면 empty로 완료됩니다.</p>
     *
     * @param key 멱등성 키
     * @param completion 완료 대기용 Future
     */
    record DuplicateInFlight(
        IdempotencyKey key,
        CompletableFuture<Optional<Result<?, DispatchError>>> completion
    ) implements Admission {
    }

    /**
     * 동일 키가 다른 요청 fingerprint로 사용 중.
     *
     * @param key 멱등성 키
     */
    record Mismatch(IdempotencyKey key) implements Admission {
    }
}
