package com.tickwork.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class TaskManagerFactoryTest {

    @Test
    public void testDefaults(@TempDir Path dir) {
        TaskManagerFactory factory = new TaskManagerFactory(dir.resolve("missing.properties"));
        TaskManagerConfig config = factory.getConfig();
        assertEquals("tickwork", config.name());
        assertEquals(ZoneOffset.UTC.normalized(), config.zone().normalized());
        assertEquals(Duration.ofSeconds(1), config.pollInterval());
        assertEquals(Duration.ofMinutes(30), config.executionTimeout());
        assertEquals(4, config.workerThreads());
        assertFalse(config.allowOverlappingRuns());
        assertEquals(8089, factory.getAdminPort());
    }

    @Test
    public void testLoadsPropertiesFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("tickwork.properties");
        Properties p = new Properties();
        p.setProperty("tickwork.name", "nightly");
        p.setProperty("tickwork.timezone", "Europe/Berlin");
        p.setProperty("tickwork.pollIntervalMillis", "250");
        p.setProperty("tickwork.executionTimeoutMinutes", "5");
        p.setProperty("tickwork.workerThreads", "2");
        p.setProperty("tickwork.allowOverlappingRuns", "true");
        p.setProperty("tickwork.admin.port", "-1");
        try (var out = Files.newOutputStream(file)) {
            p.store(out, "");
        }

        TaskManagerFactory factory = new TaskManagerFactory(file.toString());
        TaskManagerConfig config = factory.getConfig();
        assertEquals("nightly", config.name());
        assertEquals(ZoneId.of("Europe/Berlin"), config.zone());
        assertEquals(Duration.ofMillis(250), config.pollInterval());
        assertEquals(Duration.ofMinutes(5), config.executionTimeout());
        assertEquals(2, config.workerThreads());
        assertTrue(config.allowOverlappingRuns());
        assertEquals(-1, factory.getAdminPort());
    }

    @Test
    public void testSystemPropertyOverridesFile() {
        Properties p = new Properties();
        p.setProperty(TaskManagerFactory.WORKER_THREADS, "2");
        System.setProperty(TaskManagerFactory.WORKER_THREADS, "7");
        try {
            assertEquals(7, new TaskManagerFactory(p).getConfig().workerThreads());
        } finally {
            System.clearProperty(TaskManagerFactory.WORKER_THREADS);
        }
    }

    @Test
    public void testRejectsBadValues() {
        Properties p = new Properties();
        p.setProperty(TaskManagerFactory.POLL_INTERVAL_MILLIS, "soon");
        assertThrows(IllegalArgumentException.class, () -> new TaskManagerFactory(p).getConfig());

        Properties zone = new Properties();
        zone.setProperty(TaskManagerFactory.TIMEZONE, "Mars/Olympus");
        assertThrows(IllegalArgumentException.class, () -> new TaskManagerFactory(zone).getConfig());
    }

    @Test
    public void testCreatesManagerOnPooledDatabase() throws Exception {
        Properties p = new Properties();
        p.setProperty(TaskManagerFactory.JDBC_URL, "jdbc:h2:mem:factory;DB_CLOSE_DELAY=-1");
        p.setProperty(TaskManagerFactory.POLL_INTERVAL_MILLIS, "0");
        try (TaskManagerFactory factory = new TaskManagerFactory(p)) {
            JobFunctionRegistry registry = new JobFunctionRegistry();
            registry.register("noop", (context, args, execution) -> { });
            TaskManager manager = factory.create(registry);
            manager.start();
            try {
                manager.addJob("pooled", "noop", null, 0, "@hourly");
                assertEquals(1, manager.listJobs().size());
                assertNotNull(manager.getJob("pooled").getNextRunAt());
            } finally {
                manager.stop();
            }
        }
    }
}
