package com.ryuqq.dispatch.core.model;

import com.ryuqq.dispatch.core.contract.MessageType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IdempotencyKey 테스트.
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
class IdempotencyKeyTest {

    @Test
    void of_ValidValue_CreatesKey() {
        // When
        IdempotencyKey key = IdempotencyKey.of("order-123");

        // Then
        assertEquals("order-123", key.getValue());
        assertEquals("IdempotencyKey{order-123}", key.toString());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> IdempotencyKey.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> IdempotencyKey.of(" "));
    }

    @Test
    void of_TooLong_ThrowsException() {
        // Given
        String tooLong = "k".repeat(256);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> IdempotencyKey.of(tooLong));
    }

    @Test
    void of_MaxLength_IsAccepted() {
        // Given
        String maxLength = "k".repeat(255);

        // When
        IdempotencyKey key = IdempotencyKey.of(maxLength);

        // Then
        assertEquals(255, key.getValue().length());
    }

    @Test
    void equals_SameValue_AreEqual() {
        // Given
        IdempotencyKey first = IdempotencyKey.of("same");
        IdempotencyKey second = IdempotencyKey.of("same");

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, IdempotencyKey.of("other"));
    }

    @Test
    void scopedTo_DifferentTypes_ProduceDistinctKeys() {
        // Given
        IdempotencyKey key = IdempotencyKey.of("abc");

        // When
        IdempotencyKey order = key.scopedTo(MessageType.of("order.place"));
        IdempotencyKey refund = key.scopedTo(MessageType.of("order.refund"));

        // Then
        assertEquals("order.place:abc", order.getValue());
        assertNotEquals(order, refund);
        assertEquals(order, IdempotencyKey.of("abc").scopedTo(MessageType.of("order.place")));
    }

    @Test
    void scopedTo_LongParts_SkipsLengthLimit() {
        // Given
        IdempotencyKey key = IdempotencyKey.of("k".repeat(255));

        // When
        IdempotencyKey scoped = key.scopedTo(MessageType.of("t".repeat(255)));

        // Then
        assertEquals(511, scoped.getValue().length());
    }

    @Test
    void scopedTo_NullType_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> IdempotencyKey.of("abc").scopedTo(null));
    }
}
