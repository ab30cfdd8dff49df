package com.tickwork.core;

/**
 * JMX view of a scheduler's execution counters.
 */
public interface MetricsMBean {
    int getSuccessCount();
    int getFailureCount();
    int getSkippedCount();
    long getTotalDurationMillis();
    double getAverageDurationMillis();
}
