package com.tickwork.core;

import java.util.Optional;

/**
 * Base type of the errors reported by {@link TaskManager} operations.
 */
public abstract class JobException extends Exception {
    private transient RecurringJob job;

    protected JobException(String message) {
        super(message);
    }

    protected JobException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Job that was persisted before this error occurred. Present when scheduling failed after the
     * row was written and the job was left in {@link JobStatus#ERROR} for inspection.
     */
    public Optional<RecurringJob> getJob() {
        return Optional.ofNullable(job);
    }

    JobException withJob(RecurringJob job) {
        this.job = job == null ? null : new RecurringJob(job);
        return this;
    }
}
