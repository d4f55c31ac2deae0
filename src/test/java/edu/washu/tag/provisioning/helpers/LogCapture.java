package edu.washu.tag.provisioning.helpers;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.LoggerFactory;

/**
 * Collects logback events of one logger for the duration of a test.
 */
public class LogCapture implements AutoCloseable {

    private final Logger logger;
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    public LogCapture(Class<?> loggerClass) {
        logger = (Logger) LoggerFactory.getLogger(loggerClass);
        appender.start();
        logger.addAppender(appender);
    }

    public List<ILoggingEvent> events(Level level) {
        return appender.list.stream()
            .filter(event -> event.getLevel() == level)
            .collect(Collectors.toList());
    }

    public List<String> messages(Level level) {
        return events(level).stream()
            .map(ILoggingEvent::getFormattedMessage)
            .collect(Collectors.toList());
    }

    @Override
    public void close() {
        logger.detachAppender(appender);
        appender.stop();
    }

}
