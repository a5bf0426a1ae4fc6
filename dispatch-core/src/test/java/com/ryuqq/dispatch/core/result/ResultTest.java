package com.ryuqq.dispatch.core.result;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Result 테스트.
 *
 * <p>정확히 하나의 variant만 존재하며, 반대 variant에서는 콜백이 호출되지 않는지 검증합니다.</p>
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
class ResultTest {

    @Test
    void isOk_isErr_ExactlyOneIsTrue() {
        // Given
        List<Result<String, String>> results = List.of(
            Result.ok("value"),
            Result.ok(null),
            Result.err("error")
        );

        // When & Then
        for (Result<String, String> result : results) {
            assertNotEquals(result.isOk(), result.isErr(), "exactly one variant for " + result);
        }
    }

    @Test
    void map_Ok_TransformsValue() {
        // Given
        Result<Integer, String> result = Result.ok(21);

        // When
        Result<Integer, String> mapped = result.map(v -> v * 2);

        // Then
        assertTrue(mapped.isOk());
        assertEquals(42, mapped.unwrap());
    }

    @Test
    void map_Err_NeverInvokesCallback() {
        // Given
        Result<Integer, String> result = Result.err("boom");
        AtomicBoolean called = new AtomicBoolean(false);

        // When
        Result<Integer, String> mapped = result.map(v -> {
            called.set(true);
            return v * 2;
        });

        // Then
        assertFalse(called.get());
        assertTrue(mapped.isErr());
        assertEquals("boom", mapped.unwrapErr());
    }

    @Test
    void andThen_Ok_ChainsNextResult() {
        // Given
        Result<Integer, String> result = Result.ok(5);

        // When
        Result<String, String> chained = result.andThen(v -> v > 0 ? Result.ok("positive") : Result.err("negative"));

        // Then
        assertEquals("positive", chained.unwrap());
    }

    @Test
    void andThen_Ok_CanTurnIntoErr() {
        // When
        Result<String, String> chained = Result.<Integer, String>ok(-1)
            .andThen(v -> v > 0 ? Result.ok("positive") : Result.err("negative"));

        // Then
        assertTrue(chained.isErr());
        assertEquals("negative", chained.unwrapErr());
    }

    @Test
    void andThen_Err_NeverInvokesCallback() {
        // Given
        Result<Integer, String> result = Result.err("first");
        AtomicBoolean called = new AtomicBoolean(false);

        // When
        Result<String, String> chained = result.andThen(v -> {
            called.set(true);
            return Result.ok("unreachable");
        });

        // Then
        assertFalse(called.get());
        assertEquals("first", chained.unwrapErr());
    }

    @Test
    void mapErr_Ok_NeverInvokesCallback() {
        // Given
        AtomicBoolean called = new AtomicBoolean(false);

        // When
        Result<String, Integer> mapped = Result.<String, String>ok("value").mapErr(e -> {
            called.set(true);
            return e.length();
        });

        // Then
        assertFalse(called.get());
        assertEquals("value", mapped.unwrap());
    }

    @Test
    void mapErr_Err_TransformsError() {
        // When
        Result<String, Integer> mapped = Result.<String, String>err("four").mapErr(String::length);

        // Then
        assertEquals(4, mapped.unwrapErr());
    }

    @Test
    void orElse_Err_Recovers() {
        // When
        Result<String, String> recovered = Result.<String, String>err("missing").orElse(e -> Result.ok("default"));

        // Then
        assertEquals("default", recovered.unwrap());
    }

    @Test
    void orElse_Ok_KeepsOriginal() {
        // Given
        Result<String, String> original = Result.ok("kept");

        // When
        Result<String, String> result = original.orElse(e -> Result.ok("other"));

        // Then
        assertSame(original, result);
    }

    @Test
    void fold_CallsMatchingBranchOnly() {
        // When
        String ok = Result.<Integer, String>ok(1).fold(v -> "ok:" + v, e -> "err:" + e);
        String err = Result.<Integer, String>err("x").fold(v -> "ok:" + v, e -> "err:" + e);

        // Then
        assertEquals("ok:1", ok);
        assertEquals("err:x", err);
    }

    @Test
    void getOrElse_ReturnsFallbackOnlyForErr() {
        assertEquals("v", Result.<String, String>ok("v").getOrElse("fallback"));
        assertEquals("fallback", Result.<String, String>err("e").getOrElse("fallback"));
    }

    @Test
    void findValue_findError_ReturnOptionals() {
        assertEquals(Optional.of("v"), Result.<String, String>ok("v").findValue());
        assertEquals(Optional.empty(), Result.<String, String>ok(null).findValue());
        assertEquals(Optional.empty(), Result.<String, String>ok("v").findError());
        assertEquals(Optional.of("e"), Result.<String, String>err("e").findError());
        assertEquals(Optional.empty(), Result.<String, String>err("e").findValue());
    }

    @Test
    void unwrap_Err_ThrowsIllegalState() {
        // Given
        Result<String, String> result = Result.err("boom");

        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class, result::unwrap);
        assertTrue(exception.getMessage().contains("boom"));
    }

    @Test
    void unwrapErr_Ok_ThrowsIllegalState() {
        // Given
        Result<String, String> result = Result.ok("fine");

        // When & Then
        assertThrows(IllegalStateException.class, result::unwrapErr);
    }

    @Test
    void ifOk_ifErr_RunOnlyOnMatchingVariant() {
        // Given
        AtomicReference<String> seen = new AtomicReference<>("none");

        // When
        Result.<String, String>ok("value")
            .ifErr(e -> seen.set("err"))
            .ifOk(v -> seen.set("ok:" + v));

        // Then
        assertEquals("ok:value", seen.get());

        // When
        Result.<String, String>err("problem")
            .ifOk(v -> seen.set("ok"))
            .ifErr(e -> seen.set("err:" + e));

        // Then
        assertEquals("err:problem", seen.get());
    }

    @Test
    void err_NullError_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Result.err(null)
        );
        assertTrue(exception.getMessage().contains("error cannot be null"));
    }

    @Test
    void equals_SameVariantAndValue_AreEqual() {
        assertEquals(Result.ok("a"), Result.ok("a"));
        assertEquals(Result.err("e"), Result.err("e"));
        assertNotEquals(Result.ok("a"), Result.err("a"));
    }
}
