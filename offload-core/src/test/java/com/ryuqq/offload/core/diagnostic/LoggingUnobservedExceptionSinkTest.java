package com.ryuqq.offload.core.diagnostic;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * LoggingUnobservedExceptionSink 테스트.
 *
 * @author Offload Team
 * @since 1.0.0
 */
class LoggingUnobservedExceptionSinkTest {

    @Test
    void report_LogsExceptionAtErrorLevel() {
        // Given
        Logger logger = (Logger) LoggerFactory.getLogger(LoggingUnobservedExceptionSink.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        boolean originalAdditive = logger.isAdditive();
        logger.setAdditive(false);
        appender.start();
        logger.addAppender(appender);

        IllegalStateException boom = new IllegalStateException("socket closed");

        // When
        try {
            LoggingUnobservedExceptionSink.INSTANCE.report(boom);
        } finally {
            logger.detachAppender(appender);
            logger.setAdditive(originalAdditive);
            appender.stop();
        }

        // Then
        List<ILoggingEvent> events = appender.list;
        assertThat(events).hasSize(1);
        assertThat(events.get(0).getLevel()).isEqualTo(Level.ERROR);
        assertThat(events.get(0).getFormattedMessage()).contains("socket closed");
        assertThat(events.get(0).getThrowableProxy().getClassName())
            .isEqualTo(IllegalStateException.class.getName());
    }
}
