package com.ryuqq.offload.core.diagnostic;

import com.ryuqq.offload.core.spi.UnobservedExceptionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link UnobservedExceptionSink}: logs the exception at error level.
 *
 * @author Offload Team
 * @since 1.0.0
 */
public final class LoggingUnobservedExceptionSink implements UnobservedExceptionSink {

    /**
     * Shared instance.
     */
    public static final LoggingUnobservedExceptionSink INSTANCE = new LoggingUnobservedExceptionSink();

    private static final Logger log = LoggerFactory.getLogger(LoggingUnobservedExceptionSink.class);

    private LoggingUnobservedExceptionSink() {
    }

    @Override
    public void report(Throwable exception) {
        log.error("Unobserved exception in asynchronous task: {}", exception.toString(), exception);
    }
}
