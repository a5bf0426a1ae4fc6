package com.ryuqq.dispatch.core.result;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 실패 결과.
 *
 * @param error 오류 값 (null 불가)
 * @param <T> 성공 값 타입
 * @param <E> 오류 타입
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record Err<T, E>(E error) implements Result<T, E> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Err {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <U> Result<U, E> map(Function<? super T, ? extends U> fn) {
        return (Result<U, E>) this;
    }

    @Override
    public <F> Result<T, F> mapErr(Function<? super E, ? extends F> fn) {
        return new Err<>(fn.apply(error));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> fn) {
        return (Result<U, E>) this;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Result<T, E> orElse(Function<? super E, ? extends Result<T, E>> fn) {
        return (Result<T, E>) fn.apply(error);
    }

    @Override
    public <U> U fold(Function<? super T, ? extends U> onOk, Function<? super E, ? extends U> onErr) {
        return onErr.apply(error);
    }

    @Override
    public T getOrElse(T fallback) {
        return fallback;
    }

    @Override
    public Optional<T> findValue() {
        return Optional.empty();
    }

    @Override
    public Optional<E> findError() {
        return Optional.of(error);
    }

    @Override
    public T unwrap() {
        throw new IllegalStateException("Called unwrap on Err: " + error);
    }

    @Override
    public E unwrapErr() {
        return error;
    }

    @Override
    public Result<T, E> ifOk(Consumer<? super T> action) {
        return this;
    }

    @Override
    public Result<T, E> ifErr(Consumer<? super E> action) {
        action.accept(error);
        return this;
    }
}
