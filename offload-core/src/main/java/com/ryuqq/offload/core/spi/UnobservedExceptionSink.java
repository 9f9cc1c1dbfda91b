package com.ryuqq.offload.core.spi;

/**
 * Diagnostic sink for exceptions nobody looked at.
 *
 * <p>A failed {@link com.ryuqq.offload.core.result.Result} whose exception was never read
 * (via {@code getException()}, {@code isSuccess()}, {@code getCompletion()} or {@code getValue()})
 * reports the exception here once the result becomes unreachable. This is a debugging aid so that
 * failures are not silently lost; it is not a retry mechanism.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: reports arrive on the JVM cleaner thread</li>
 *   <li>Non-blocking: must not wait on locks held by task code</li>
 *   <li>Must not throw</li>
 * </ul>
 *
 * @author Offload Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface UnobservedExceptionSink {

    /**
     * Reports an exception that was captured by a result and never observed.
     *
     * @param exception the captured exception
     */
    void report(Throwable exception);
}
