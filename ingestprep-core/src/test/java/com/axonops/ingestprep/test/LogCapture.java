package com.axonops.ingestprep.test;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Captures log events of one logger for assertions.
 *
 * <pre>{@code
 * try (LogCapture logs = LogCapture.attach(LabelLimitsValidator.class)) {
 *     validator.exceeds(labels);
 *     assertThat(logs.count(Level.WARN)).isEqualTo(1);
 * }
 * }</pre>
 */
public final class LogCapture implements AutoCloseable {

    private final Logger logger;
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    private LogCapture(Logger logger) {
        this.logger = logger;
        appender.start();
        logger.addAppender(appender);
    }

    public static LogCapture attach(Class<?> type) {
        return new LogCapture((Logger) LoggerFactory.getLogger(type));
    }

    public List<ILoggingEvent> events() {
        return List.copyOf(appender.list);
    }

    public long count(Level level) {
        return appender.list.stream().filter(e -> e.getLevel() == level).count();
    }

    public List<String> messages(Level level) {
        return appender.list.stream()
            .filter(e -> e.getLevel() == level)
            .map(ILoggingEvent::getFormattedMessage)
            .collect(Collectors.toList());
    }

    @Override
    public void close() {
        logger.detachAppender(appender);
        appender.stop();
    }
}
