package com.tickwork.core;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Runtime settings of a {@link TaskManager}.
 *
 * @param name                 instance name, used for thread names and the JMX bean
 * @param zone                 time zone cron expressions are evaluated in
 * @param pollInterval         dispatcher period; zero or negative starts no dispatcher thread
 * @param executionTimeout     upper bound for one invocation of a job function
 * @param workerThreads        size of the worker pool running executions
 * @param allowOverlappingRuns whether a job may start while a previous invocation is still running
 */
public record TaskManagerConfig(String name,
                                ZoneId zone,
                                Duration pollInterval,
                                Duration executionTimeout,
                                int workerThreads,
                                boolean allowOverlappingRuns) {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_EXECUTION_TIMEOUT = Duration.ofMinutes(30);
    public static final int DEFAULT_WORKER_THREADS = 4;

    public TaskManagerConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        if (zone == null) {
            throw new IllegalArgumentException("zone required");
        }
        if (pollInterval == null) {
            pollInterval = Duration.ZERO;
        }
        if (executionTimeout == null || executionTimeout.isZero() || executionTimeout.isNegative()) {
            throw new IllegalArgumentException("executionTimeout must be positive");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
    }

    public static TaskManagerConfig defaults() {
        return new TaskManagerConfig("tickwork", ZoneOffset.UTC, DEFAULT_POLL_INTERVAL,
                DEFAULT_EXECUTION_TIMEOUT, DEFAULT_WORKER_THREADS, false);
    }

    public TaskManagerConfig withPollInterval(Duration interval) {
        return new TaskManagerConfig(name, zone, interval, executionTimeout, workerThreads, allowOverlappingRuns);
    }

    public TaskManagerConfig withExecutionTimeout(Duration timeout) {
        return new TaskManagerConfig(name, zone, pollInterval, timeout, workerThreads, allowOverlappingRuns);
    }

    public TaskManagerConfig withAllowOverlappingRuns(boolean allow) {
        return new TaskManagerConfig(name, zone, pollInterval, executionTimeout, workerThreads, allow);
    }

    public TaskManagerConfig withName(String newName) {
        return new TaskManagerConfig(newName, zone, pollInterval, executionTimeout, workerThreads, allowOverlappingRuns);
    }
}
