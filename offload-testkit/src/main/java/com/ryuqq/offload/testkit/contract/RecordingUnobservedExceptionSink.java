package com.ryuqq.offload.testkit.contract;

import com.ryuqq.offload.core.spi.UnobservedExceptionSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of UnobservedExceptionSink for testing purposes.
 *
 * <p>Records every reported exception instead of logging it, so tests can assert on
 * which failures went unobserved.</p>
 *
 * @author Offload Team
 * @since 1.0.0
 */
public class RecordingUnobservedExceptionSink implements UnobservedExceptionSink {

    private final List<Throwable> reported = new CopyOnWriteArrayList<>();

    @Override
    public void report(Throwable exception) {
        reported.add(exception);
    }

    /**
     * Returns the exceptions reported so far, in report order.
     *
     * @return an immutable snapshot of reported exceptions
     */
    public List<Throwable> reported() {
        return List.copyOf(reported);
    }

    /**
     * Clears all recorded exceptions.
     */
    public void clear() {
        reported.clear();
    }
}
