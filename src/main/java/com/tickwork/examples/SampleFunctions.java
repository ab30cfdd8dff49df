package com.tickwork.examples;

import com.fasterxml.jackson.databind.JsonNode;
import com.tickwork.core.JobContext;
import com.tickwork.core.JobFunctionRegistry;
import com.tickwork.core.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Demo functions: {@code log} writes a message to the execution output, {@code test} works for
 * two seconds, {@code fail} always fails.
 */
public final class SampleFunctions {
    private static final Logger log = LoggerFactory.getLogger(SampleFunctions.class);

    static final String DEFAULT_MESSAGE = "Running scheduled log job";
    static final int LONG_MESSAGE = 100;

    private SampleFunctions() {}

    public static void registerAll(JobFunctionRegistry registry) {
        registerAll(registry, Duration.ofMillis(100), Duration.ofSeconds(2));
    }

    /**
     * @param stepDelay pause between the steps of {@code log}
     * @param testWork  how long {@code test} works
     */
    public static void registerAll(JobFunctionRegistry registry, Duration stepDelay, Duration testWork) {
        registry.register("log", (context, args, execution) -> {
            String message = message(args);
            execution.info("Job started");
            execution.info("Log job: %s", message);
            pause(context, stepDelay);
            execution.debug("Step 1: preparing data");
            pause(context, stepDelay.multipliedBy(2));
            execution.debug("Step 2: processing data");
            if (message.length() > LONG_MESSAGE) {
                execution.warn("Message is long: %d characters", message.length());
            }
            execution.info("Job finished");
        });
        registry.register("test", (context, args, execution) -> {
            log.info("Running test job {}", context.getJobName());
            pause(context, testWork);
        });
        registry.register("fail", (context, args, execution) -> {
            log.info("Running failing job {}", context.getJobName());
            execution.error("About to fail");
            throw new Exception("this job always fails");
        });
    }

    /** The message is a JSON string; other argument text is used as is. */
    static String message(byte[] args) {
        if (args == null || args.length == 0) {
            return DEFAULT_MESSAGE;
        }
        String text = new String(args, StandardCharsets.UTF_8);
        try {
            JsonNode node = JsonUtil.mapper().readTree(text);
            if (node != null && node.isTextual()) {
                return node.asText();
            }
        } catch (IOException e) {
            log.debug("Arguments of log job are not JSON, using them verbatim");
        }
        return text;
    }

    private static void pause(JobContext context, Duration duration) throws InterruptedException {
        long end = System.nanoTime() + duration.toNanos();
        long remaining = duration.toNanos();
        while (remaining > 0) {
            context.throwIfCancelled();
            Thread.sleep(Math.max(1, Math.min(50, remaining / 1_000_000)));
            remaining = end - System.nanoTime();
        }
        context.throwIfCancelled();
    }
}
