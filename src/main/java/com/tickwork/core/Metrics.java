package com.tickwork.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.management.JMException;
import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Execution counters of one {@link TaskManager}, exposed via JMX while the manager runs.
 */
public final class Metrics implements MetricsMBean {
    private static final Logger log = LoggerFactory.getLogger(Metrics.class);

    private final String name;
    private final AtomicInteger successCount = new AtomicInteger();
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicInteger skippedCount = new AtomicInteger();
    private final AtomicLong totalDuration = new AtomicLong();
    private final AtomicInteger durationSamples = new AtomicInteger();
    private ObjectName registeredAs;

    public Metrics(String name) {
        this.name = name;
    }

    /**
     * Registers this instance with the platform MBean server. Failures are logged and otherwise
     * ignored; the counters keep working without JMX.
     */
    synchronized void register() {
        if (registeredAs != null) {
            return;
        }
        try {
            MBeanServer server = ManagementFactory.getPlatformMBeanServer();
            ObjectName objectName = new ObjectName("com.tickwork.core:type=Metrics,name=" + ObjectName.quote(name));
            if (!server.isRegistered(objectName)) {
                server.registerMBean(this, objectName);
                registeredAs = objectName;
            }
        } catch (JMException e) {
            log.warn("Could not register metrics MBean for {}", name, e);
        }
    }

    synchronized void unregister() {
        if (registeredAs == null) {
            return;
        }
        try {
            ManagementFactory.getPlatformMBeanServer().unregisterMBean(registeredAs);
        } catch (JMException e) {
            log.warn("Could not unregister metrics MBean {}", registeredAs, e);
        }
        registeredAs = null;
    }

    /** Record a successful execution. */
    public void recordSuccess() {
        successCount.incrementAndGet();
    }

    /** Record a failed execution. */
    public void recordFailure() {
        failureCount.incrementAndGet();
    }

    /** Record a fire that was skipped because of the job's or the manager's state. */
    public void recordSkipped() {
        skippedCount.incrementAndGet();
    }

    /** Record the duration of an execution in milliseconds. */
    public void recordDuration(long millis) {
        totalDuration.addAndGet(millis);
        durationSamples.incrementAndGet();
    }

    public String getName() {
        return name;
    }

    @Override
    public int getSuccessCount() {
        return successCount.get();
    }

    @Override
    public int getFailureCount() {
        return failureCount.get();
    }

    @Override
    public int getSkippedCount() {
        return skippedCount.get();
    }

    @Override
    public long getTotalDurationMillis() {
        return totalDuration.get();
    }

    @Override
    public double getAverageDurationMillis() {
        int samples = durationSamples.get();
        if (samples == 0) {
            return 0.0;
        }
        return totalDuration.get() / (double) samples;
    }
}
