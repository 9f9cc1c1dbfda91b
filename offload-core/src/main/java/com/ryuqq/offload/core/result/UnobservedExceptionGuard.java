package com.ryuqq.offload.core.result;

import com.ryuqq.offload.core.spi.UnobservedExceptionSink;

/**
 * Cleaner action attached to a failed {@link Result}.
 *
 * <p>Holds no reference to the result itself, otherwise the result would never become
 * phantom reachable.</p>
 */
final class UnobservedExceptionGuard implements Runnable {

    private final Throwable exception;
    private final UnobservedExceptionSink sink;
    private volatile boolean observed;

    UnobservedExceptionGuard(Throwable exception, UnobservedExceptionSink sink) {
        this.exception = exception;
        this.sink = sink;
    }

    void markObserved() {
        observed = true;
    }

    boolean isObserved() {
        return observed;
    }

    @Override
    public void run() {
        if (!observed) {
            sink.report(exception);
        }
    }
}
