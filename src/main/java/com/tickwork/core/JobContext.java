package com.tickwork.core;

import java.time.Clock;
import java.time.Instant;

/**
 * Cancellable context handed to a {@link JobFunction}. The runner cancels it when the execution
 * timeout elapses.
 */
public class JobContext {
    private final RecurringJob job;
    private final Instant deadline;
    private final Clock clock;
    private volatile boolean cancelled;

    public JobContext(RecurringJob job, Instant deadline, Clock clock) {
        this.job = job;
        this.deadline = deadline;
        this.clock = clock;
    }

    /** Snapshot of the job taken when the execution was admitted. */
    public RecurringJob getJob() {
        return job;
    }

    public String getJobName() {
        return job.getName();
    }

    public Instant getDeadline() {
        return deadline;
    }

    public boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted() || !clock.instant().isBefore(deadline);
    }

    /** Throws {@link InterruptedException} once the context has been cancelled. */
    public void throwIfCancelled() throws InterruptedException {
        if (isCancelled()) {
            throw new InterruptedException("execution of " + job.getName() + " cancelled");
        }
    }

    void cancel() {
        cancelled = true;
    }
}
