package com.ryuqq.dispatch.application.pipeline;

import com.ryuqq.dispatch.core.contract.Command;
import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.error.CircuitOpenError;
import com.ryuqq.dispatch.core.error.ConflictError;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.error.Fatal;
import com.ryuqq.dispatch.core.middleware.Middleware;
import com.ryuqq.dispatch.core.middleware.Next;
import com.ryuqq.dispatch.core.model.IdempotencyKey;
import com.ryuqq.dispatch.core.result.Result;
import com.ryuqq.dispatch.core.spi.Admission;
import com.ryuqq.dispatch.core.spi.IdempotencyGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 멱등성 단계 (가장 바깥쪽).
 *
 * <p>멱등성 키가 있는 Command만 처리하며, Query와 키 없는 Command는 그대로 통과시킵니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>{@link IdempotencyGuard#begin}으로 원자적 check-and-mark (키는 Command 타입 범위로 한정)</li>
 *   <li>Admitted: 나머지 Chain 실행 후 결과 저장 (Ok와 영구적 Err)</li>
 *   <li>Duplicate: 저장된 결과를 그대로 반환 (Handler 미실행)</li>
 *   <li>DuplicateInFlight: WAIT이면 완료까지 대기 후 그 결과 반환, REJECT이면 ConflictError</li>
 *   <li>Mismatch: 같은 키가 다른 Command에 사용 중이므로 ConflictError</li>
 * </ol>
 *
 * <p><strong>해제 규칙:</strong> 실행이 예외, {@link Fatal}, {@link CircuitOpenError} 또는 재시도 가능한
 * 오류(재시도 소진 후 남은 TransientError)로 끝나거나 호출 스레드가 인터럽트된 상태로 끝나면
 * 결과를 저장하지 않고 IN_FLIGHT 표시를 해제합니다. 대기자는 begin을 다시 시도하고,
 * 이후 같은 키의 호출은 Handler까지 다시 도달합니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public final class IdempotencyMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyMiddleware.class);

    private final IdempotencyGuard guard;
    private final IdempotencyConfig config;

    /**
     * 기본 설정으로 생성.
     *
     * @param guard 멱등성 가드
     */
    public IdempotencyMiddleware(IdempotencyGuard guard) {
        this(guard, new IdempotencyConfig());
    }

    /**
     * IdempotencyMiddleware 생성.
     *
     * @param guard 멱등성 가드
     * @param config 설정
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public IdempotencyMiddleware(IdempotencyGuard guard, IdempotencyConfig config) {
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.guard = guard;
        this.config = config;
    }

    @Override
    public <R> Result<R, DispatchError> invoke(Message<R> message, Next<R> next) {
        if (!(message instanceof Command<R> command)) {
            return next.proceed(message);
        }
        Optional<IdempotencyKey> maybeKey = command.idempotencyKey();
        if (maybeKey.isEmpty()) {
            return next.proceed(message);
        }
        String requested = maybeKey.get().getValue();
        IdempotencyKey key = maybeKey.get().scopedTo(command.type());
        Duration ttl = command.idempotencyTtl().orElse(config.defaultTtl());

        while (true) {
            Admission admission = guard.begin(key, command);

            if (admission instanceof Admission.Admitted) {
                return executeAdmitted(key, command, next, ttl);
            }
            if (admission instanceof Admission.Duplicate duplicate) {
                log.debug("Returning stored result for {}", key);
                return stored(duplicate.result());
            }
            if (admission instanceof Admission.Mismatch) {
                log.warn("Idempotency key {} reused for a different command", key);
                return Result.err(ConflictError.of(requested, "Idempotency key reused for a different command"));
            }

            Admission.DuplicateInFlight inFlight = (Admission.DuplicateInFlight) admission;
            if (config.duplicatePolicy() == DuplicatePolicy.REJECT) {
                log.warn("Rejected duplicate in-flight command for {}", key);
                return Result.err(ConflictError.of(requested, "Command with the same idempotency key is in flight"));
            }

            Optional<Result<?, DispatchError>> completed;
            try {
                completed = await(inFlight.completion());
            } catch (TimeoutException e) {
                log.warn("Timed out waiting for in-flight command {}", key);
                return Result.err(ConflictError.of(requested, "Timed out waiting for the in-flight command"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Result.err(ConflictError.of(requested, "Interrupted while waiting for the in-flight command"));
            } catch (ExecutionException e) {
                return Result.err(Fatal.of(e.getCause() != null ? e.getCause() : e));
            }

            if (completed.isPresent()) {
                log.debug("In-flight command {} completed, returning its result", key);
                return stored(completed.get());
            }
            log.debug("In-flight command {} was released, retrying admission", key);
        }
    }

    private <R> Result<R, DispatchError> executeAdmitted(
        IdempotencyKey key,
        Command<R> command,
        Next<R> next,
        Duration ttl
    ) {
        boolean completed = false;
        try {
            Result<R, DispatchError> result = next.proceed(command);
            if (!Thread.currentThread().isInterrupted() && isStorable(result)) {
                guard.complete(key, result, ttl);
                completed = true;
            }
            return result;
        } finally {
            if (!completed) {
                guard.release(key);
                log.warn("Released idempotency key {} without storing a result", key);
            }
        }
    }

    // Fatal, CircuitOpenError and retryable errors are never stored
    private static boolean isStorable(Result<?, DispatchError> result) {
        if (result.isOk()) {
            return true;
        }
        DispatchError error = result.unwrapErr();
        return !(error instanceof Fatal || error instanceof CircuitOpenError || error.isRetryable());
    }

    private Optional<Result<?, DispatchError>> await(
        CompletableFuture<Optional<Result<?, DispatchError>>> completion
    ) throws InterruptedException, ExecutionException, TimeoutException {
        Optional<Duration> timeout = config.findInFlightWaitTimeout();
        if (timeout.isPresent()) {
            return completion.get(timeout.get().toNanos(), TimeUnit.NANOSECONDS);
        }
        return completion.get();
    }

    @SuppressWarnings("unchecked")
    private static <R> Result<R, DispatchError> stored(Result<?, DispatchError> result) {
        return (Result<R, DispatchError>) result;
    }
}
