package org.prefixwatch;

import org.slf4j.Logger;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class LogContext {
    private static final LogContext EMPTY = new LogContext(Map.of());
    private final Map<String, Object> entries;

    private LogContext(Map<String, Object> entries) {
        this.entries = entries;
    }

    public static LogContext empty() {
        return EMPTY;
    }

    public static LogContext of(String key, Object value) {
        return EMPTY.with(key, value);
    }

    public LogContext with(String key, Object value) {
        final var copy = new LinkedHashMap<>(entries);
        copy.put(key, value);
        return new LogContext(Collections.unmodifiableMap(copy));
    }

    public Map<String, Object> entries() {
        return entries;
    }

    public LoggingEventBuilder at(Logger logger, Level level) {
        var builder = logger.atLevel(level);
        for (final var entry : entries.entrySet()) {
            builder = builder.addKeyValue(entry.getKey(), entry.getValue());
        }
        return builder;
    }

    public LoggingEventBuilder atDebug(Logger logger) {
        return at(logger, Level.DEBUG);
    }

    public LoggingEventBuilder atInfo(Logger logger) {
        return at(logger, Level.INFO);
    }

    public LoggingEventBuilder atWarn(Logger logger) {
        return at(logger, Level.WARN);
    }

    public LoggingEventBuilder atError(Logger logger) {
        return at(logger, Level.ERROR);
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
