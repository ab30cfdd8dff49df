package com.tickwork.core;

/**
 * Listener notified when an execution of a job finishes.
 */
public interface JobResultListener {
    /**
     * Invoked after the execution and the job's counters have been stored.
     *
     * @param job       the job as stored after this run
     * @param execution the finished execution
     */
    void jobFinished(RecurringJob job, JobExecution execution);
}
