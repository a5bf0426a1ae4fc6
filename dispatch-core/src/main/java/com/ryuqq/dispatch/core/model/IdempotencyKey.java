package com.ryuqq.dispatch.core.model;

import com.ryuqq.dispatch.core.contract.MessageType;

/**
 * 멱등성 키 (Idempotency Key).
 *
 * <p>IdempotencyKey는 동일 Command의 중복 실행을 방지하기 위해 호출자가 제공하는 고유 키입니다.</p>
 *
 * <p><strong>사용 시나리오:</strong></p>
 * <ul>
 *   <li>클라이언트가 요청별로 고유 키 생성 (UUID 권장)</li>
 *   <li>타임아웃 후 재시도 시 동일 키 사용</li>
 *   <li>Bus는 키당 최대 한 번만 Handler를 실행하고, 이후 호출에는 첫 결과를 반환</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * <p>Bus 내부에서는 {@link #scopedTo(MessageType)}로 Command 타입별 범위를 한정한 키를 사용하므로,
 * 서로 다른 Command 타입은 같은 키 값을 독립적으로 사용할 수 있습니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public final class IdempotencyKey {

    private final String value;

    private IdempotencyKey(String value) {
        this.value = value;
    }

    /**
     * IdempotencyKey 생성.
     *
     * @param value 키 값
     * @return IdempotencyKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static IdempotencyKey of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("IdempotencyKey length cannot exceed 255 characters");
        }
        return new IdempotencyKey(value);
    }

    /**
     * 메시지 타입으로 범위를 한정한 키 생성 ({@code type:key}).
     *
     * <p>두 구성 요소가 이미 검증되었으므로 길이 제한을 다시 적용하지 않습니다.</p>
     *
     * @param type 메시지 타입
     * @return 범위가 한정된 IdempotencyKey
     * @throws IllegalArgumentException type이 null인 경우
     */
    public IdempotencyKey scopedTo(MessageType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return new IdempotencyKey(type.getValue() + ":" + value);
    }

    /**
     * 키 값 조회.
     *
     * @return 키 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IdempotencyKey that = (IdempotencyKey) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "IdempotencyKey{" + value + '}';
    }
}
