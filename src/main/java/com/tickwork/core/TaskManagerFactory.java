package com.tickwork.core;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Properties;

/**
 * Creates {@link TaskManager} instances from configuration. Values come from an optional
 * properties file; a system property or environment variable with the same key wins over the
 * file. Environment variables may also use the upper-case form, e.g. {@code TICKWORK_JDBC_URL}.
 */
public class TaskManagerFactory implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskManagerFactory.class);

    public static final String NAME = "tickwork.name";
    public static final String JDBC_URL = "tickwork.jdbc.url";
    public static final String JDBC_USER = "tickwork.jdbc.user";
    public static final String JDBC_PASSWORD = "tickwork.jdbc.password";
    public static final String JDBC_POOL_SIZE = "tickwork.jdbc.poolSize";
    public static final String TIMEZONE = "tickwork.timezone";
    public static final String POLL_INTERVAL_MILLIS = "tickwork.pollIntervalMillis";
    public static final String EXECUTION_TIMEOUT_MINUTES = "tickwork.executionTimeoutMinutes";
    public static final String WORKER_THREADS = "tickwork.workerThreads";
    public static final String ALLOW_OVERLAPPING_RUNS = "tickwork.allowOverlappingRuns";
    public static final String ADMIN_PORT = "tickwork.admin.port";

    static final String DEFAULT_JDBC_URL = "jdbc:h2:file:./data/tickwork;AUTO_SERVER=TRUE";

    private final Properties fileProps;
    private HikariDataSource dataSource;

    public TaskManagerFactory() {
        this(getDefaultPath());
    }

    public TaskManagerFactory(String path) {
        this(Paths.get(path));
    }

    public TaskManagerFactory(Path path) {
        this(loadProps(path));
    }

    public TaskManagerFactory(Properties props) {
        this.fileProps = props;
    }

    /** Returns a new manager backed by a JDBC store on this factory's pool. */
    public TaskManager create(JobFunctionRegistry registry) throws JobStoreException {
        return new TaskManager(createStore(), registry, getConfig());
    }

    public JobStore createStore() throws JobStoreException {
        try {
            return new JdbcJobStore(getDataSource());
        } catch (SQLException e) {
            throw new JobStoreException("failed to initialize job tables", e);
        }
    }

    public TaskManagerConfig getConfig() {
        String zone = get(TIMEZONE, "UTC");
        ZoneId zoneId;
        try {
            zoneId = ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid " + TIMEZONE + ": " + zone, e);
        }
        return new TaskManagerConfig(
                get(NAME, "tickwork"),
                zoneId,
                Duration.ofMillis(getLong(POLL_INTERVAL_MILLIS, TaskManagerConfig.DEFAULT_POLL_INTERVAL.toMillis())),
                Duration.ofMinutes(getLong(EXECUTION_TIMEOUT_MINUTES,
                        TaskManagerConfig.DEFAULT_EXECUTION_TIMEOUT.toMinutes())),
                (int) getLong(WORKER_THREADS, TaskManagerConfig.DEFAULT_WORKER_THREADS),
                Boolean.parseBoolean(get(ALLOW_OVERLAPPING_RUNS, "false")));
    }

    /** Port of the admin HTTP server; negative when it should not be started. */
    public int getAdminPort() {
        return (int) getLong(ADMIN_PORT, 8089);
    }

    public synchronized DataSource getDataSource() {
        if (dataSource == null) {
            HikariConfig hc = new HikariConfig();
            hc.setJdbcUrl(get(JDBC_URL, DEFAULT_JDBC_URL));
            hc.setUsername(get(JDBC_USER, "sa"));
            hc.setPassword(get(JDBC_PASSWORD, ""));
            hc.setMaximumPoolSize((int) getLong(JDBC_POOL_SIZE, 5));
            hc.setPoolName(get(NAME, "tickwork") + "-db");
            dataSource = new HikariDataSource(hc);
            log.info("Connection pool {} opened for {}", hc.getPoolName(), hc.getJdbcUrl());
        }
        return dataSource;
    }

    @Override
    public synchronized void close() {
        if (dataSource != null) {
            dataSource.close();
            log.info("Connection pool {} closed", dataSource.getPoolName());
            dataSource = null;
        }
    }

    String get(String key, String def) {
        String v = System.getProperty(key);
        if (v == null || v.isEmpty()) {
            v = System.getenv(key);
        }
        if (v == null || v.isEmpty()) {
            v = System.getenv(key.toUpperCase(Locale.ROOT).replace('.', '_'));
        }
        if (v == null || v.isEmpty()) {
            v = fileProps.getProperty(key);
        }
        return v == null || v.isEmpty() ? def : v.trim();
    }

    private long getLong(String key, long def) {
        String v = get(key, null);
        if (v == null) {
            return def;
        }
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + key + ": " + v, e);
        }
    }

    private static Path getDefaultPath() {
        String p = System.getProperty("tickwork.properties");
        if (p == null || p.isEmpty()) {
            p = System.getenv("TICKWORK_PROPERTIES");
        }
        if (p == null || p.isEmpty()) {
            p = "tickwork.properties";
        }
        return Paths.get(p);
    }

    private static Properties loadProps(Path path) {
        Properties p = new Properties();
        if (!Files.exists(path)) {
            log.debug("No properties file at {}, using defaults", path.toAbsolutePath());
            return p;
        }
        try (InputStream in = Files.newInputStream(path)) {
            p.load(in);
            log.info("Loaded configuration from {}", path.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("cannot read " + path, e);
        }
        return p;
    }
}
