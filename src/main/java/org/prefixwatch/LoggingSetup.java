package org.prefixwatch;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Locale;

public final class LoggingSetup {
    static final String TEXT_PATTERN = "[%d{yyyy-MM-dd HH:mm:ss}] %-5level %logger{0}: %msg %kvp%n";

    private LoggingSetup() {
    }

    public static void apply(Config.Logging logging) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) return;
        final var root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        final var level = toLevel(logging.level());
        root.setLevel(level);
        context.getLogger("org.prefixwatch").setLevel(level);

        final var console = new ConsoleAppender<ILoggingEvent>();
        console.setContext(context);
        console.setName("console");
        console.setTarget("System.err");
        console.setEncoder(encoder(context, logging.format()));
        console.start();
        root.addAppender(console);

        if (logging.file() != null) {
            try {
                final var parent = logging.file().toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
            } catch (IOException ex) {
                throw new IllegalStateException("Unable to create log directory for " + logging.file(), ex);
            }
            final var file = new FileAppender<ILoggingEvent>();
            file.setContext(context);
            file.setName("file");
            file.setFile(logging.file().toString());
            file.setAppend(true);
            file.setEncoder(encoder(context, logging.format()));
            file.start();
            root.addAppender(file);
        }
    }

    static Level toLevel(String name) {
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "WARNING" -> Level.WARN;
            case "CRITICAL" -> Level.ERROR;
            default -> Level.toLevel(name.trim(), Level.INFO);
        };
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            final var json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        final var pattern = new PatternLayoutEncoder();
        pattern.setContext(context);
        pattern.setPattern(TEXT_PATTERN);
        pattern.start();
        return pattern;
    }
}
