package com.ryuqq.dispatch.core.result;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 처리 결과 (성공 값 또는 타입이 있는 오류).
 *
 * <p>Result는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공 값 보유</li>
 *   <li>{@link Err}: 오류 값 보유</li>
 * </ul>
 *
 * <p>Handler와 Middleware는 예상 가능한 실패를 예외로 던지지 않고
 * {@link Err}로 반환합니다. 정확히 하나의 variant만 존재하며,
 * {@code map}, {@code andThen} 등은 반대 variant에서 콜백을 호출하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Result<Order, DispatchError> result = commandBus.dispatch(placeOrder);
 *
 * String text = result.fold(
 *     order -> "Placed: " + order.id(),
 *     error -> "Failed: " + error.code()
 * );
 * }</pre>
 *
 * @param <T> 성공 값 타입
 * @param <E> 오류 타입
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public sealed interface Result<T, E> permits Ok, Err {

    /**
     * 성공 결과 생성.
     *
     * @param value 성공 값 (null 허용, {@code Result<Void, E>} 용도)
     * @param <T> 성공 값 타입
     * @param <E> 오류 타입
     * @return Ok 인스턴스
     */
    static <T, E> Result<T, E> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 오류 값
     * @param <T> 성공 값 타입
     * @param <E> 오류 타입
     * @return Err 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <T, E> Result<T, E> err(E error) {
        return new Err<>(error);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isErr() {
        return this instanceof Err;
    }

    /**
     * 성공 값 변환. Err인 경우 fn은 호출되지 않습니다.
     *
     * @param fn 변환 함수
     * @param <U> 변환 후 타입
     * @return 변환된 Result
     */
    <U> Result<U, E> map(Function<? super T, ? extends U> fn);

    /**
     * 오류 값 변환. Ok인 경우 fn은 호출되지 않습니다.
     *
     * @param fn 변환 함수
     * @param <F> 변환 후 오류 타입
     * @return 변환된 Result
     */
    <F> Result<T, F> mapErr(Function<? super E, ? extends F> fn);

    /**
     * Result를 반환하는 연산 연결 (bind). Err인 경우 fn은 호출되지 않습니다.
     *
     * @param fn 다음 연산
     * @param <U> 다음 연산의 성공 값 타입
     * @return 다음 연산의 Result 또는 기존 Err
     */
    <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> fn);

    /**
     * 오류 복구. Ok인 경우 fn은 호출되지 않습니다.
     *
     * @param fn 복구 함수
     * @return 복구 결과 또는 기존 Ok
     */
    Result<T, E> orElse(Function<? super E, ? extends Result<T, E>> fn);

    /**
     * 두 variant를 하나의 값으로 접기.
     *
     * @param onOk Ok인 경우 호출
     * @param onErr Err인 경우 호출
     * @param <U> 반환 타입
     * @return 호출된 함수의 반환값
     */
    <U> U fold(Function<? super T, ? extends U> onOk, Function<? super E, ? extends U> onErr);

    /**
     * 성공 값 또는 기본값 반환.
     *
     * @param fallback Err인 경우 반환할 값
     * @return 성공 값 또는 fallback
     */
    T getOrElse(T fallback);

    /**
     * 성공 값 조회.
     *
     * @return 성공 값 (Err이거나 값이 null이면 empty)
     */
    Optional<T> findValue();

    /**
     * 오류 값 조회.
     *
     * @return 오류 값 (Ok이면 empty)
     */
    Optional<E> findError();

    /**
     * 성공 값 조회 (Err인 경우 예외).
     *
     * @return 성공 값
     * @throws IllegalStateException Err인 경우
     */
    T unwrap();

    /**
     * 오류 값 조회 (Ok인 경우 예외).
     *
     * @return 오류 값
     * @throws IllegalStateException Ok인 경우
     */
    E unwrapErr();

    /**
     * Ok인 경우 부수 효과 실행.
     *
     * @param action 실행할 동작
     * @return this
     */
    Result<T, E> ifOk(Consumer<? super T> action);

    /**
     * Err인 경우 부수 효과 실행.
     *
     * @param action 실행할 동작
     * @return this
     */
    Result<T, E> ifErr(Consumer<? super E> action);
}
