package com.ryuqq.dispatch.core.spi;

import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.model.IdempotencyKey;
import com.ryuqq.dispatch.core.model.IdempotencyRecord;
import com.ryuqq.dispatch.core.result.Result;

import java.time.Duration;
import java.util.Optional;

/**
 * 멱등성 가드 SPI (Service Provider Interface).
 *
 * <p>키당 최대 한 번의 실행을 보장하는 TTL 기반 저장소입니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>확인 후 IN_FLIGHT 표시는 단일 원자 연산 (동일 키 동시 begin 중 하나만 Admitted)</li>
 *   <li>COMPLETED 기록은 만료 전까지 모든 호출자에게 동일한 결과 반환</li>
 *   <li>만료된 기록은 없는 것으로 취급</li>
 *   <li>키 단위 동시성 제어 (전역 락 금지)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Admission admission = guard.begin(key, command);
 * if (admission instanceof Admission.Admitted) {
 *     Result<?, DispatchError> result = handler.handle(command);
 *     guard.complete(key, result, Duration.ofHours(24));
 * }
 * }</pre>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public interface IdempotencyGuard {

    /**
     * 실행 시작 시도 (원자적 check-and-mark).
     *
     * @param key 멱등성 키
     * @param fingerprint 요청 식별 값 (null이면 비교하지 않음)
     * @return Admitted, Duplicate, DuplicateInFlight, Mismatch 중 하나
     * @throws IllegalArgumentException key가 null인 경우
     */
    Admission begin(IdempotencyKey key, Object fingerprint);

    /**
     * 결과 저장 및 COMPLETED 표시.
     *
     * <p>대기 중인 DuplicateInFlight 호출자에게 결과를 전달합니다.</p>
     *
     * @param key 멱등성 키
     * @param result 저장할 결과
     * @param ttl 보존 기간 (양수)
     * @throws IllegalArgumentException 파라미터가 유효하지 않은 경우
     * @throws IllegalStateException 이미 COMPLETED인 유효한 기록이 있는 경우
     */
    void complete(IdempotencyKey key, Result<?, DispatchError> result, Duration ttl);

    /**
     * 결과 없이 IN_FLIGHT 표시 제거.
     *
     * <p>대기 중인 호출자는 empty를 받고 begin을 다시 시도합니다.
     * COMPLETED 기록에는 영향을 주지 않습니다.</p>
     *
     * @param key 멱등성 키
     */
    void release(IdempotencyKey key);

    /**
     * 유효한 기록 조회 (조회만).
     *
     * @param key 멱등성 키
     * @return 기록 (없거나 만료된 경우 empty)
     */
    Optional<IdempotencyRecord> find(IdempotencyKey key);

    /**
     * 만료된 COMPLETED 기록 삭제.
     *
     * @return 삭제된 기록 수
     */
    int purgeExpired();

    /**
     * 모든 기록 삭제 (테스트 격리용).
     *
     * <p>대기 중인 호출자는 release와 동일하게 empty를 받습니다.</p>
     */
    void reset();
}
