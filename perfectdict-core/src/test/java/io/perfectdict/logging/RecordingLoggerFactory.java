package io.perfectdict.logging;

import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.LegacyAbstractLogger;
import org.slf4j.helpers.MessageFormatter;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public final class RecordingLoggerFactory implements ILoggerFactory {

    private static final List<LogEvent> EVENTS = new CopyOnWriteArrayList<>();

    private final ConcurrentHashMap<String, Logger> loggers = new ConcurrentHashMap<>();

    @Override
    public Logger getLogger(String name) {
        return loggers.computeIfAbsent(name, RecordingLogger::new);
    }

    public static void clear() {
        EVENTS.clear();
    }

    public static List<LogEvent> events() {
        return List.copyOf(EVENTS);
    }

    public static List<LogEvent> events(Class<?> loggerClass, Level level) {
        return EVENTS.stream()
                .filter(event -> event.logger().equals(loggerClass.getName()) && event.level() == level)
                .collect(Collectors.toList());
    }

    public record LogEvent(String logger, Level level, String message) {
    }

    private static final class RecordingLogger extends LegacyAbstractLogger {

        RecordingLogger(String name) {
            this.name = name;
        }

        @Override
        public boolean isTraceEnabled() {
            return true;
        }

        @Override
        public boolean isDebugEnabled() {
            return true;
        }

        @Override
        public boolean isInfoEnabled() {
            return true;
        }

        @Override
        public boolean isWarnEnabled() {
            return true;
        }

        @Override
        public boolean isErrorEnabled() {
            return true;
        }

        @Override
        protected String getFullyQualifiedCallerName() {
            return null;
        }

        @Override
        protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
                                                   Object[] arguments, Throwable throwable) {
            EVENTS.add(new LogEvent(name, level, MessageFormatter.basicArrayFormat(messagePattern, arguments)));
        }
    }
}
