package com.ryuqq.dispatch.core.metrics;

import com.ryuqq.dispatch.core.contract.MessageType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DispatchStatistics 테스트.
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
class DispatchStatisticsTest {

    private static final MessageType TYPE = MessageType.of("order.place");

    @Test
    void empty_HasZeroCountsAndRate() {
        // When
        DispatchStatistics stats = DispatchStatistics.empty(TYPE);

        // Then
        assertEquals(0, stats.totalExecutions());
        assertEquals(0.0, stats.successRate());
        assertEquals(Duration.ZERO, stats.maxDuration());
    }

    @Test
    void successRate_CountsOnlySuccesses() {
        // Given
        DispatchStatistics stats = new DispatchStatistics(
            TYPE, 3, 1, Duration.ofMillis(10), Duration.ofMillis(5), Duration.ofMillis(20)
        );

        // Then
        assertEquals(4, stats.totalExecutions());
        assertEquals(0.75, stats.successRate());
    }

    @Test
    void constructor_NegativeCount_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new DispatchStatistics(TYPE, -1, 0, Duration.ZERO, Duration.ZERO, Duration.ZERO));
    }

    @Test
    void constructor_NullType_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> DispatchStatistics.empty(null));
    }
}
