package com.ryuqq.dispatch.core.contract;

import java.util.regex.Pattern;

/**
 * 메시지 타입 식별자.
 *
 * <p>MessageType은 Handler Registry의 키로 사용되는 안정적인 문자열 식별자입니다.
 * 하나의 MessageType에는 정확히 하나의 Handler만 등록될 수 있습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>MessageType.of("order.place") - 주문 생성 Command</li>
 *   <li>MessageType.of("order.get-by-id") - 주문 조회 Query</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 점(.), 콜론(:), 하이픈(-), 언더스코어(_), 달러($)만 허용</li>
 * </ul>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public final class MessageType {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9._:\\-$]+$");

    private final String value;

    private MessageType(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("MessageType cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("MessageType length cannot exceed 255 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("MessageType contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * MessageType 생성.
     *
     * @param value 타입 식별자
     * @return MessageType 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static MessageType of(String value) {
        return new MessageType(value);
    }

    /**
     * 클래스 이름으로 MessageType 생성.
     *
     * <p>메시지 클래스 하나가 하나의 타입을 나타내는 경우에 사용합니다.</p>
     *
     * @param messageClass 메시지 클래스
     * @return MessageType 인스턴스 (값: 클래스의 binary name)
     * @throws IllegalArgumentException messageClass가 null인 경우
     */
    public static MessageType forClass(Class<?> messageClass) {
        if (messageClass == null) {
            throw new IllegalArgumentException("messageClass cannot be null");
        }
        return new MessageType(messageClass.getName());
    }

    /**
     * 타입 식별자 값 조회.
     *
     * @return 타입 식별자
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageType that = (MessageType) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "MessageType{" + value + '}';
    }
}
