package com.ryuqq.dispatch.core.result;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 성공 결과.
 *
 * @param value 성공 값 (null 허용)
 * @param <T> 성공 값 타입
 * @param <E> 오류 타입
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record Ok<T, E>(T value) implements Result<T, E> {

    @Override
    public <U> Result<U, E> map(Function<? super T, ? extends U> fn) {
        return new Ok<>(fn.apply(value));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <F> Result<T, F> mapErr(Function<? super E, ? extends F> fn) {
        return (Result<T, F>) this;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> fn) {
        return (Result<U, E>) fn.apply(value);
    }

    @Override
    public Result<T, E> orElse(Function<? super E, ? extends Result<T, E>> fn) {
        return this;
    }

    @Override
    public <U> U fold(Function<? super T, ? extends U> onOk, Function<? super E, ? extends U> onErr) {
        return onOk.apply(value);
    }

    @Override
    public T getOrElse(T fallback) {
        return value;
    }

    @Override
    public Optional<T> findValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public Optional<E> findError() {
        return Optional.empty();
    }

    @Override
    public T unwrap() {
        return value;
    }

    @Override
    public E unwrapErr() {
        throw new IllegalStateException("Called unwrapErr on Ok: " + value);
    }

    @Override
    public Result<T, E> ifOk(Consumer<? super T> action) {
        action.accept(value);
        return this;
    }

    @Override
    public Result<T, E> ifErr(Consumer<? super E> action) {
        return this;
    }
}
