package com.glimpse.logging;

import java.io.UnsupportedEncodingException;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Configures the {@code com.glimpse} logger once: a single-line console handler plus the optional
 * central JDBC handler. Class loggers below {@code com.glimpse} inherit both.
 */
public final class AppLogger {
    private static final String ROOT_LOGGER = "com.glimpse";
    private static final String LEVEL_PROPERTY = "glimpse.log.level";
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");
    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger(ROOT_LOGGER);
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String line = "%s %-7s [%s] %s%n".formatted(
                    LocalTime.now().format(TIME),
                    record.getLevel().getName(),
                    shortName(record.getLoggerName()),
                    formatMessage(record));
                if (record.getThrown() != null) {
                    line += "    caused by " + record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.err, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (UnsupportedEncodingException ignored) {
            // platform default encoding stays in effect
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(resolveLevel());

        try {
            JdbcLogHandler dbHandler = new JdbcLogHandler();
            dbHandler.setLevel(Level.INFO);
            logger.addHandler(dbHandler);
        } catch (IllegalStateException ex) {
            logger.fine("Central logging disabled: " + ex.getMessage());
        } catch (Exception ex) {
            logger.warning("Failed to initialize central logging: " + ex.getMessage());
        }
        return logger;
    }

    private static Level resolveLevel() {
        String configured = System.getProperty(LEVEL_PROPERTY);
        if (configured == null || configured.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(configured.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return Level.INFO;
        }
    }

    private static String shortName(String loggerName) {
        if (loggerName == null) {
            return "";
        }
        int dot = loggerName.lastIndexOf('.');
        return dot < 0 ? loggerName : loggerName.substring(dot + 1);
    }
}
