package com.ryuqq.offload.testkit.contract;

import com.ryuqq.offload.core.diagnostic.LoggingUnobservedExceptionSink;
import com.ryuqq.offload.core.exception.DisposedException;
import com.ryuqq.offload.core.result.Completion;
import com.ryuqq.offload.core.result.Result;
import com.ryuqq.offload.core.result.ValueResult;
import com.ryuqq.offload.core.spi.Dispatcher;
import com.ryuqq.offload.core.spi.UnobservedExceptionSink;
import com.ryuqq.offload.core.task.Task;
import com.ryuqq.offload.core.task.Work;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Synchronous implementation of Dispatcher for testing purposes.
 *
 * <p>Runs every submission on the calling thread before {@code submit} returns, so results are
 * always complete when handed back. Useful as a deterministic stand-in for a worker pool in
 * tests of code that accepts a {@link Dispatcher}.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Deterministic ordering (execution order = submission order)</li>
 *   <li>Counts executed submissions for assertions</li>
 *   <li>Honors the disposal contract of {@link Dispatcher}</li>
 * </ul>
 *
 * @author Offload Team
 * @since 1.0.0
 */
public class InlineDispatcher implements Dispatcher, AutoCloseable {

    private final UnobservedExceptionSink sink;
    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong executed = new AtomicLong();
    private volatile boolean closed;

    /**
     * Creates a new InlineDispatcher reporting to the logging sink.
     */
    public InlineDispatcher() {
        this(LoggingUnobservedExceptionSink.INSTANCE);
    }

    /**
     * Creates a new InlineDispatcher with a custom sink.
     *
     * @param sink the sink receiving unobserved failures
     * @throws IllegalArgumentException if sink is null
     */
    public InlineDispatcher(UnobservedExceptionSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.sink = sink;
    }

    @Override
    public Result submit(Work work) {
        Task<Void> task = Task.of(work, sink);
        run(task);
        return task.result();
    }

    @Override
    public <T> ValueResult<T> submitTyped(Callable<T> callback) {
        Task<T> task = Task.ofValue(callback, sink);
        run(task);
        return task.result();
    }

    @Override
    public long pendingCount() {
        return pending.get();
    }

    /**
     * Returns how many submissions were executed.
     *
     * @return executed submission count
     */
    public long executedCount() {
        return executed.get();
    }

    @Override
    public void close() {
        closed = true;
    }

    private <T> void run(Task<T> task) {
        if (closed) {
            throw new DisposedException("InlineDispatcher", "InlineDispatcher is closed");
        }

        pending.incrementAndGet();
        Completion<T> completion = task.execute();
        pending.decrementAndGet();
        executed.incrementAndGet();
        task.finish(completion);
    }
}
