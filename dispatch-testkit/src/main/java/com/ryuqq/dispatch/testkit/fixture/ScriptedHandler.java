package com.ryuqq.dispatch.testkit.fixture;

import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.handler.Handler;
import com.ryuqq.dispatch.core.result.Result;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handler that plays back a fixed script of steps and records every call.
 *
 * <p>Each invocation runs the next step; the last step repeats once the script is exhausted.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedHandler&lt;TestCommand, String&gt; handler = ScriptedHandler.sequence(
 *     Result.err(TransientError.of("TIMEOUT", "timed out")),
 *     Result.ok("done")
 * );
 * </pre>
 *
 * @param <M> message type
 * @param <R> success value type
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public class ScriptedHandler<M extends Message<R>, R> implements Handler<M, R> {

    private final List<Handler<M, R>> steps;
    private final AtomicInteger invocations = new AtomicInteger();
    private final List<M> received = new CopyOnWriteArrayList<>();

    private ScriptedHandler(List<Handler<M, R>> steps) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("steps cannot be empty");
        }
        this.steps = List.copyOf(steps);
    }

    /**
     * Creates a handler running the given steps in order.
     *
     * @param steps steps (the last one repeats)
     * @param <M> message type
     * @param <R> success value type
     * @return handler
     */
    @SafeVarargs
    public static <M extends Message<R>, R> ScriptedHandler<M, R> of(Handler<M, R>... steps) {
        return new ScriptedHandler<>(Arrays.asList(steps));
    }

    /**
     * Creates a handler that always returns the given result.
     *
     * @param result result to return
     * @param <M> message type
     * @param <R> success value type
     * @return handler
     */
    public static <M extends Message<R>, R> ScriptedHandler<M, R> always(Result<R, DispatchError> result) {
        Handler<M, R> step = message -> result;
        return new ScriptedHandler<>(List.of(step));
    }

    /**
     * Creates a handler returning the given results in order.
     *
     * @param results results (the last one repeats)
     * @param <M> message type
     * @param <R> success value type
     * @return handler
     */
    @SafeVarargs
    public static <M extends Message<R>, R> ScriptedHandler<M, R> sequence(Result<R, DispatchError>... results) {
        List<Handler<M, R>> steps = new ArrayList<>();
        for (Result<R, DispatchError> result : results) {
            Handler<M, R> step = message -> result;
            steps.add(step);
        }
        return new ScriptedHandler<>(steps);
    }

    /**
     * Creates a handler that always throws the given exception.
     *
     * @param exception exception to throw
     * @param <M> message type
     * @param <R> success value type
     * @return handler
     */
    public static <M extends Message<R>, R> ScriptedHandler<M, R> throwing(Exception exception) {
        Handler<M, R> step = message -> {
            throw exception;
        };
        return new ScriptedHandler<>(List.of(step));
    }

    @Override
    public Result<R, DispatchError> handle(M message) throws Exception {
        int index = invocations.getAndIncrement();
        received.add(message);
        return steps.get(Math.min(index, steps.size() - 1)).handle(message);
    }

    /**
     * Returns how many times the handler was invoked.
     *
     * @return invocation count
     */
    public int getInvocations() {
        return invocations.get();
    }

    /**
     * Returns the messages received, in call order.
     *
     * @return immutable snapshot
     */
    public List<M> getReceived() {
        return List.copyOf(received);
    }
}
