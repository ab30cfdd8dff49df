package com.tickwork.core;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for recurring job definitions and their execution history.
 * All returned objects are detached copies.
 */
public interface JobStore {
    /** Persist a new job, assigning its id and bookkeeping timestamps. */
    RecurringJob insertJob(RecurringJob job) throws JobStoreException;

    Optional<RecurringJob> findJob(long id) throws JobStoreException;

    Optional<RecurringJob> findJobByName(String name) throws JobStoreException;

    /** True when another job (other than {@code excludingId}, if given) already uses the name. */
    boolean nameExists(String name, Long excludingId) throws JobStoreException;

    List<RecurringJob> listJobs() throws JobStoreException;

    List<RecurringJob> listJobsByStatus(JobStatus status) throws JobStoreException;

    /**
     * Rewrite the configuration of an existing job: name, key, function, schedule, args, budget,
     * status and next run time. Run counters, {@code last_run_at} and {@code last_error} are left
     * as stored.
     */
    void updateJob(RecurringJob job) throws JobStoreException;

    void updateStatus(long id, JobStatus status) throws JobStoreException;

    /** Set {@code status=error} and record the reason in {@code last_error}. */
    void markError(long id, String error) throws JobStoreException;

    /** Record the key and next fire time of a freshly created live timer. */
    void updateSchedule(long id, String jobKey, Instant nextRunAt) throws JobStoreException;

    /** Hard delete. Returns false when no such job existed. */
    boolean deleteJob(long id) throws JobStoreException;

    /** Persist a started execution. Fails when the owning job no longer exists. */
    JobExecution insertExecution(JobExecution execution) throws JobStoreException;

    /** Write the final state of an execution. */
    void finishExecution(JobExecution execution) throws JobStoreException;

    /** Executions of a job, newest first. */
    List<JobExecution> listExecutions(long jobId) throws JobStoreException;

    /**
     * Mark executions that never finished (e.g. because the process died) as failed.
     *
     * @return number of executions updated
     */
    int failUnfinishedExecutions(Instant finishedAt, String error) throws JobStoreException;

    /**
     * Atomically apply the outcome of one run to the job's counters: increments
     * {@code times_run}, sets {@code last_run_at}, counts failures and marks the job
     * {@link JobStatus#COMPLETED} once its run budget is used up.
     *
     * @return the job after the update, or empty when it no longer exists
     */
    Optional<RecurringJob> recordRun(long jobId, RunOutcome outcome) throws JobStoreException;
}
