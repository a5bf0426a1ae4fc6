package com.ryuqq.dispatch.core.contract;

import com.ryuqq.dispatch.core.model.IdempotencyKey;

import java.time.Duration;
import java.util.Optional;

/**
 * 쓰기(부수 효과) 의도를 나타내는 메시지.
 *
 * <p>Command는 선택적으로 {@link IdempotencyKey}를 가질 수 있습니다.
 * 키가 있는 Command는 멱등성 단계를 통해 키당 최대 한 번만 실행됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>{@code
 * record PlaceOrder(String orderId, long amount, IdempotencyKey key) implements Command<OrderId> {
 *
 *     public MessageType type() {
 *         return MessageType.of("order.place");
 *     }
 *
 *     public Optional<IdempotencyKey> idempotencyKey() {
 *         return Optional.ofNullable(key);
 *     }
 * }
 * }</pre>
 *
 * @param <R> 성공 값 타입
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public interface Command<R> extends Message<R> {

    /**
     * 멱등성 키 조회.
     *
     * @return 멱등성 키 (없으면 empty, 기본값)
     */
    default Optional<IdempotencyKey> idempotencyKey() {
        return Optional.empty();
    }

    /**
     * Command별 멱등성 기록 보존 기간.
     *
     * <p>empty인 경우 멱등성 단계의 기본 TTL을 사용합니다.</p>
     *
     * @return 보존 기간 (없으면 empty, 기본값)
     */
    default Optional<Duration> idempotencyTtl() {
        return Optional.empty();
    }
}
