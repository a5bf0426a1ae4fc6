package com.ryuqq.dispatch.application.bus;

import com.ryuqq.dispatch.application.fixture.RecordingMiddleware;
import com.ryuqq.dispatch.application.fixture.SampleQuery;
import com.ryuqq.dispatch.application.pipeline.MiddlewareChain;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.error.DuplicateHandlerException;
import com.ryuqq.dispatch.core.error.Fatal;
import com.ryuqq.dispatch.core.error.UnregisteredHandlerError;
import com.ryuqq.dispatch.core.handler.Handler;
import com.ryuqq.dispatch.core.result.Result;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * QueryBus 테스트.
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
class QueryBusTest {

    private static final Map<String, Integer> STOCK = Map.of("sku-1", 7);

    private final Handler<SampleQuery, Integer> stockHandler = query -> {
        Integer quantity = STOCK.get(query.id());
        return quantity != null ? Result.ok(quantity) : Result.ok(0);
    };

    @Test
    void dispatch_등록된_handler의_결과를_반환() {
        // Given
        QueryBus bus = new QueryBus();
        bus.register(SampleQuery.TYPE, stockHandler);

        // When
        Result<Integer, DispatchError> result = bus.dispatch(new SampleQuery("sku-1"));

        // Then
        assertThat(result.unwrap()).isEqualTo(7);
    }

    @Test
    void dispatch_미등록_타입이면_UnregisteredHandlerError() {
        // Given
        List<String> trace = new ArrayList<>();
        QueryBus bus = new QueryBus(MiddlewareChain.of(new RecordingMiddleware("logging", trace)));

        // When
        Result<Integer, DispatchError> result = bus.dispatch(new SampleQuery("sku-1"));

        // Then
        assertThat(result.unwrapErr()).isInstanceOf(UnregisteredHandlerError.class);
        assertThat(trace).isEmpty();
    }

    @Test
    void register_중복이면_DuplicateHandlerException() {
        // Given
        QueryBus bus = new QueryBus();
        bus.register(SampleQuery.TYPE, stockHandler);

        // When & Then
        assertThatThrownBy(() -> bus.register(SampleQuery.TYPE, stockHandler))
            .isInstanceOf(DuplicateHandlerException.class);
    }

    @Test
    void dispatch_handler_예외면_Fatal() {
        // Given
        QueryBus bus = new QueryBus();
        Handler<SampleQuery, Integer> failing = query -> {
            throw new IllegalStateException("read model unavailable");
        };
        bus.register(SampleQuery.TYPE, failing);

        // When
        Result<Integer, DispatchError> result = bus.dispatch(new SampleQuery("sku-1"));

        // Then
        assertThat(result.unwrapErr()).isInstanceOf(Fatal.class);
    }

    @Test
    void dispatchAsync_결과로_완료() throws Exception {
        // Given
        QueryBus bus = new QueryBus(MiddlewareChain.empty(), Runnable::run);
        bus.register(SampleQuery.TYPE, stockHandler);

        // When
        Result<Integer, DispatchError> result = bus.dispatchAsync(new SampleQuery("missing"))
            .get(5, TimeUnit.SECONDS);

        // Then
        assertThat(result.unwrap()).isZero();
    }

    @Test
    void commandBus와_queryBus의_registry는_독립적() {
        // Given
        QueryBus queryBus = new QueryBus();
        CommandBus commandBus = new CommandBus();
        queryBus.register(SampleQuery.TYPE, stockHandler);

        // Then
        assertThat(queryBus.isRegistered(SampleQuery.TYPE)).isTrue();
        assertThat(commandBus.isRegistered(SampleQuery.TYPE)).isFalse();
    }
}
