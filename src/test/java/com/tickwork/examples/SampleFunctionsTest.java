package com.tickwork.examples;

import com.tickwork.core.JobContext;
import com.tickwork.core.JobExecution;
import com.tickwork.core.JobFunction;
import com.tickwork.core.JobFunctionRegistry;
import com.tickwork.core.RecurringJob;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class SampleFunctionsTest {

    private static JobContext context(Duration timeout) {
        RecurringJob job = new RecurringJob();
        job.setName("sample");
        Clock clock = Clock.systemUTC();
        return new JobContext(job, Instant.now().plus(timeout), clock);
    }

    @Test
    public void testRegistersAllFunctions() {
        JobFunctionRegistry registry = new JobFunctionRegistry();
        SampleFunctions.registerAll(registry);
        assertEquals(java.util.Set.of("fail", "log", "test"), registry.names());
    }

    @Test
    public void testMessageParsing() {
        assertEquals("hello", SampleFunctions.message("\"hello\"".getBytes(StandardCharsets.UTF_8)));
        assertEquals("plain text", SampleFunctions.message("plain text".getBytes(StandardCharsets.UTF_8)));
        assertEquals("{\"a\":1}", SampleFunctions.message("{\"a\":1}".getBytes(StandardCharsets.UTF_8)));
        assertEquals(SampleFunctions.DEFAULT_MESSAGE, SampleFunctions.message(new byte[0]));
    }

    @Test
    public void testLogWarnsAboutLongMessages() throws Exception {
        JobFunctionRegistry registry = new JobFunctionRegistry();
        SampleFunctions.registerAll(registry, Duration.ZERO, Duration.ZERO);
        JobFunction log = registry.lookup("log").orElseThrow();
        JobExecution execution = new JobExecution();
        String message = "x".repeat(SampleFunctions.LONG_MESSAGE + 1);

        log.execute(context(Duration.ofMinutes(1)), ("\"" + message + "\"").getBytes(StandardCharsets.UTF_8), execution);

        assertTrue(execution.getOutput().contains("[WARN] Message is long: 101 characters"));
        assertTrue(execution.getOutput().endsWith("[INFO] Job finished"));
    }

    @Test
    public void testTestFunctionStopsWhenDeadlinePasses() {
        JobFunctionRegistry registry = new JobFunctionRegistry();
        SampleFunctions.registerAll(registry, Duration.ZERO, Duration.ofSeconds(30));
        JobFunction test = registry.lookup("test").orElseThrow();

        long started = System.nanoTime();
        assertThrows(InterruptedException.class,
                () -> test.execute(context(Duration.ofMillis(100)), new byte[0], new JobExecution()));
        assertTrue(System.nanoTime() - started < Duration.ofSeconds(10).toNanos());
    }

    @Test
    public void testFailAlwaysFails() {
        JobFunctionRegistry registry = new JobFunctionRegistry();
        SampleFunctions.registerAll(registry);
        JobExecution execution = new JobExecution();
        Exception e = assertThrows(Exception.class,
                () -> registry.lookup("fail").orElseThrow().execute(context(Duration.ofMinutes(1)), new byte[0], execution));
        assertEquals("this job always fails", e.getMessage());
        assertTrue(execution.getOutput().contains("[ERROR] About to fail"));
    }
}
