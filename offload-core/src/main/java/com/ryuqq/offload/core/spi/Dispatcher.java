package com.ryuqq.offload.core.spi;

import com.ryuqq.offload.core.result.Result;
import com.ryuqq.offload.core.result.ValueResult;
import com.ryuqq.offload.core.task.Work;

import java.util.concurrent.Callable;

/**
 * Dispatcher of asynchronous work.
 *
 * <p>A dispatcher accepts units of work, returns a {@link Result} immediately and runs the work
 * somewhere else: on a pool of worker threads, or on one designated owning thread.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Wrap each submission in a task observed by a fresh result</li>
 *   <li>Capture every exception thrown by the work into its result</li>
 *   <li>Track how many submissions are queued or executing</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: {@code submit} may be called from any thread</li>
 *   <li>Non-blocking: {@code submit} never waits for the work to run</li>
 *   <li>Containment: a failing submission never affects other submissions</li>
 *   <li>Disposal: submitting to a closed dispatcher throws
 *       {@link com.ryuqq.offload.core.exception.DisposedException}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ValueResult&lt;byte[]&gt; encoded = dispatcher.submitTyped(() -&gt; codec.encode(message));
 * Result flushed = dispatcher.submit(() -&gt; channel.flush());
 *
 * byte[] bytes = encoded.getValue(); // blocks until done
 * </pre>
 *
 * @author Offload Team
 * @since 1.0.0
 */
public interface Dispatcher {

    /**
     * Submits work that returns no value.
     *
     * @param work the work to run
     * @return a result completed once the work ran
     * @throws IllegalArgumentException if work is null
     * @throws com.ryuqq.offload.core.exception.DisposedException if the dispatcher is closed
     */
    Result submit(Work work);

    /**
     * Submits work that returns a value.
     *
     * @param callback the work to run
     * @param <T> the value type
     * @return a result carrying the returned value once the work ran
     * @throws IllegalArgumentException if callback is null
     * @throws com.ryuqq.offload.core.exception.DisposedException if the dispatcher is closed
     */
    <T> ValueResult<T> submitTyped(Callable<T> callback);

    /**
     * Returns the number of submissions queued or executing.
     *
     * @return pending submission count, never negative
     */
    long pendingCount();

    /**
     * Submits work whose value is stored at {@code array[index]}.
     *
     * @param array the destination array
     * @param index the destination slot
     * @param callback the work producing the value
     * @param <T> the element type
     * @return a result completed once the slot was written
     * @throws IllegalArgumentException if array or callback is null
     * @throws IndexOutOfBoundsException if index is not a valid index of array
     */
    default <T> Result submitToSlot(T[] array, int index, Callable<? extends T> callback) {
        if (array == null) {
            throw new IllegalArgumentException("array cannot be null");
        }
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (index < 0 || index >= array.length) {
            throw new IndexOutOfBoundsException(String.format(
                "Index '%d' is not a valid index. Accepted values are [0:%d]", index, array.length - 1));
        }
        return submit(() -> array[index] = callback.call());
    }
}
