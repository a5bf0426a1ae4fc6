package com.ryuqq.dispatch.testkit.fixture;

import com.ryuqq.dispatch.core.contract.Message;
import com.ryuqq.dispatch.core.error.DispatchError;
import com.ryuqq.dispatch.core.handler.Handler;
import com.ryuqq.dispatch.core.result.Result;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handler that blocks inside {@code handle} until the test opens the gate.
 *
 * <p>Used to hold a dispatch in flight while other callers race against it.</p>
 *
 * @param <M> message type
 * @param <R> success value type
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public class GatedHandler<M extends Message<R>, R> implements Handler<M, R> {

    private final Result<R, DispatchError> result;
    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch gate = new CountDownLatch(1);
    private final AtomicInteger invocations = new AtomicInteger();

    /**
     * Creates a gated handler.
     *
     * @param result result returned once the gate opens
     */
    public GatedHandler(Result<R, DispatchError> result) {
        this.result = result;
    }

    @Override
    public Result<R, DispatchError> handle(M message) throws Exception {
        invocations.incrementAndGet();
        entered.countDown();
        gate.await();
        return result;
    }

    /**
     * Waits until a call is blocked inside the handler.
     *
     * @param timeout maximum wait
     * @param unit time unit
     * @return true if a call entered in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitEntered(long timeout, TimeUnit unit) throws InterruptedException {
        return entered.await(timeout, unit);
    }

    /**
     * Lets every blocked and future call proceed.
     */
    public void open() {
        gate.countDown();
    }

    /**
     * Returns how many times the handler was invoked.
     *
     * @return invocation count
     */
    public int getInvocations() {
        return invocations.get();
    }
}
