package io.tasklint.standalone;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.LoggerFactory;

/**
 * Switches the console log output between text and structured JSON once the lint configuration is
 * loaded.
 *
 * <p>
 * The {@code STDERR} appender declared in {@code logback.xml} is kept and only its encoder is
 * swapped; it is created when the file did not declare it. Log output stays on standard error so
 * that the lint report on standard output stays machine-readable.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    static final String APPENDER_NAME = "STDERR";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Sets the root level and re-encodes the {@code STDERR} appender.
     *
     * @param format "json" for structured output, anything else for text
     * @param level  log level (TRACE, DEBUG, INFO, WARN, ERROR); unknown values fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(Level.toLevel(level, Level.INFO));

        ConsoleAppender<ILoggingEvent> appender = stderrAppender(context, rootLogger);
        appender.stop();
        appender.setTarget("System.err");
        appender.setEncoder(encoderFor(format, context));
        appender.start();

        // Schema library chatter is not useful to linter users.
        context.getLogger("com.networknt").setLevel(Level.WARN);
    }

    @SuppressWarnings("unchecked")
    private static ConsoleAppender<ILoggingEvent> stderrAppender(LoggerContext context, Logger rootLogger) {
        Appender<ILoggingEvent> declared = rootLogger.getAppender(APPENDER_NAME);
        if (declared instanceof ConsoleAppender) {
            return (ConsoleAppender<ILoggingEvent>) declared;
        }
        if (declared != null) {
            rootLogger.detachAppender(declared);
            declared.stop();
        }
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        rootLogger.addAppender(appender);
        return appender;
    }

    private static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            return encoder;
        }
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }
}
