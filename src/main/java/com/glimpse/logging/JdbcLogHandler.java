package com.glimpse.logging;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.ErrorManager;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

/**
 * Ships log records to a central database in batches from a background thread. Construction
 * fails with {@link IllegalStateException} when no JDBC URL is configured.
 */
public final class JdbcLogHandler extends Handler {

    static final String URL_PROPERTY = "glimpse.log.jdbc.url";
    static final String USER_PROPERTY = "glimpse.log.jdbc.user";
    static final String PASSWORD_PROPERTY = "glimpse.log.jdbc.password";
    static final String POOL_PROPERTY = "glimpse.log.jdbc.poolSize";
    private static final String SETTINGS_RESOURCE = "glimpse-logging.properties";
    private static final int BATCH_SIZE = 50;

    private static final String INSERT_SQL = """
        INSERT INTO viewer_log (
            logged_at,
            level,
            logger,
            message,
            thread_id,
            host,
            thrown_type,
            thrown_msg
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final BlockingQueue<LogRecord> pending = new LinkedBlockingQueue<>(2048);
    private final Formatter messageFormatter = new SimpleFormatter();
    private final HikariDataSource dataSource;
    private final String host;
    private final Thread writer;

    private volatile boolean open = true;

    public JdbcLogHandler() {
        Settings settings = Settings.resolve();
        if (settings.url() == null) {
            throw new IllegalStateException("no JDBC URL configured for central logging");
        }
        this.dataSource = openPool(settings);
        this.host = hostName();
        this.writer = new Thread(this::writeLoop, "log-shipper");
        this.writer.setDaemon(true);
        this.writer.start();
        setLevel(Level.ALL);
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!open || !isLoggable(record)) {
            return;
        }
        // drop the oldest record rather than block the caller
        while (!pending.offer(record)) {
            pending.poll();
        }
    }

    @Override
    public void flush() {
        // records are shipped by the writer thread
    }

    @Override
    public void close() {
        open = false;
        writer.interrupt();
        try {
            writer.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
    }

    private void writeLoop() {
        List<LogRecord> batch = new ArrayList<>(BATCH_SIZE);
        while (open) {
            try {
                LogRecord first = pending.poll(1, TimeUnit.SECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                pending.drainTo(batch, BATCH_SIZE - 1);
                writeBatch(batch);
            } catch (InterruptedException ex) {
                break;
            } catch (SQLException ex) {
                reportError("Central log write failed", ex, ErrorManager.WRITE_FAILURE);
            } finally {
                batch.clear();
            }
        }
        Thread.interrupted();
        pending.drainTo(batch);
        if (!batch.isEmpty()) {
            try {
                writeBatch(batch);
            } catch (SQLException ex) {
                reportError("Central log flush on close failed", ex, ErrorManager.CLOSE_FAILURE);
            }
        }
    }

    private void writeBatch(List<LogRecord> batch) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            for (LogRecord record : batch) {
                statement.setTimestamp(1, Timestamp.from(Instant.ofEpochMilli(record.getMillis())));
                statement.setString(2, record.getLevel().getName());
                statement.setString(3, record.getLoggerName());
                statement.setString(4, messageFormatter.formatMessage(record));
                statement.setLong(5, record.getLongThreadID());
                statement.setString(6, host);
                Throwable thrown = record.getThrown();
                statement.setString(7, thrown == null ? null : thrown.getClass().getName());
                statement.setString(8, thrown == null ? null : thrown.getMessage());
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private static HikariDataSource openPool(Settings settings) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.url());
        config.setUsername(settings.user());
        config.setPassword(settings.password());
        config.setMaximumPoolSize(settings.poolSize());
        config.setPoolName("GlimpseLogPool");
        config.setAutoCommit(true);
        config.setInitializationFailTimeout(-1);
        return new HikariDataSource(config);
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    record Settings(String url, String user, String password, int poolSize) {

        static Settings resolve() {
            Properties file = loadResource();
            return new Settings(
                pick(System.getProperty(URL_PROPERTY), System.getenv("GLIMPSE_LOG_JDBC_URL"), file.getProperty("jdbc.url")),
                pick(System.getProperty(USER_PROPERTY), System.getenv("GLIMPSE_LOG_JDBC_USER"), file.getProperty("jdbc.user")),
                pick(System.getProperty(PASSWORD_PROPERTY), System.getenv("GLIMPSE_LOG_JDBC_PASSWORD"), file.getProperty("jdbc.password")),
                poolSize(pick(System.getProperty(POOL_PROPERTY), System.getenv("GLIMPSE_LOG_JDBC_POOL"), file.getProperty("jdbc.poolSize"))));
        }

        private static Properties loadResource() {
            Properties props = new Properties();
            try (InputStream stream = JdbcLogHandler.class.getClassLoader().getResourceAsStream(SETTINGS_RESOURCE)) {
                if (stream != null) {
                    props.load(stream);
                }
            } catch (IOException ignored) {
                // unreadable settings file: system properties and environment still apply
            }
            return props;
        }

        private static String pick(String... candidates) {
            for (String candidate : candidates) {
                if (candidate != null && !candidate.isBlank()) {
                    return candidate.trim();
                }
            }
            return null;
        }

        private static int poolSize(String raw) {
            try {
                return raw == null ? 2 : Math.max(1, Integer.parseInt(raw));
            } catch (NumberFormatException ex) {
                return 2;
            }
        }
    }
}
