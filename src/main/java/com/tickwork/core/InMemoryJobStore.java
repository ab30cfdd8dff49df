package com.tickwork.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Simple in-memory JobStore. Nothing survives a restart; used for tests and throwaway setups.
 */
public class InMemoryJobStore implements JobStore {
    private final Map<Long, RecurringJob> jobs = new LinkedHashMap<>();
    private final Map<Long, JobExecution> executions = new LinkedHashMap<>();
    private long nextJobId = 1;
    private long nextExecutionId = 1;

    @Override
    public synchronized RecurringJob insertJob(RecurringJob job) throws JobStoreException {
        if (nameTaken(job.getName(), null)) {
            throw new JobStoreException("unique constraint violated for job name " + job.getName());
        }
        Instant now = Instant.now();
        RecurringJob saved = new RecurringJob(job);
        saved.setId(nextJobId++);
        saved.setCreatedAt(now);
        saved.setUpdatedAt(now);
        jobs.put(saved.getId(), saved);
        return new RecurringJob(saved);
    }

    @Override
    public synchronized Optional<RecurringJob> findJob(long id) {
        RecurringJob job = jobs.get(id);
        return job == null ? Optional.empty() : Optional.of(new RecurringJob(job));
    }

    @Override
    public synchronized Optional<RecurringJob> findJobByName(String name) {
        return jobs.values().stream()
                .filter(job -> job.getName().equals(name))
                .findFirst()
                .map(RecurringJob::new);
    }

    @Override
    public synchronized boolean nameExists(String name, Long excludingId) {
        return nameTaken(name, excludingId);
    }

    @Override
    public synchronized List<RecurringJob> listJobs() {
        List<RecurringJob> list = new ArrayList<>();
        for (RecurringJob job : jobs.values()) {
            list.add(new RecurringJob(job));
        }
        return list;
    }

    @Override
    public synchronized List<RecurringJob> listJobsByStatus(JobStatus status) {
        List<RecurringJob> list = new ArrayList<>();
        for (RecurringJob job : jobs.values()) {
            if (job.getStatus() == status) {
                list.add(new RecurringJob(job));
            }
        }
        return list;
    }

    @Override
    public synchronized void updateJob(RecurringJob job) throws JobStoreException {
        RecurringJob existing = require(job.getId());
        if (nameTaken(job.getName(), job.getId())) {
            throw new JobStoreException("unique constraint violated for job name " + job.getName());
        }
        existing.setName(job.getName());
        existing.setJobKey(job.getJobKey());
        existing.setFunctionName(job.getFunctionName());
        existing.setCronExpression(job.getCronExpression());
        existing.setArgs(job.getArgs());
        existing.setTimes(job.getTimes());
        existing.setStatus(job.getStatus());
        existing.setNextRunAt(job.getNextRunAt());
        existing.setUpdatedAt(Instant.now());
    }

    @Override
    public synchronized void updateStatus(long id, JobStatus status) throws JobStoreException {
        RecurringJob job = require(id);
        job.setStatus(status);
        if (status != JobStatus.ACTIVE) {
            job.setNextRunAt(null);
        }
        job.setUpdatedAt(Instant.now());
    }

    @Override
    public synchronized void markError(long id, String error) throws JobStoreException {
        RecurringJob job = require(id);
        job.setStatus(JobStatus.ERROR);
        job.setLastError(error);
        job.setNextRunAt(null);
        job.setUpdatedAt(Instant.now());
    }

    @Override
    public synchronized void updateSchedule(long id, String jobKey, Instant nextRunAt) throws JobStoreException {
        RecurringJob job = require(id);
        job.setJobKey(jobKey);
        job.setNextRunAt(nextRunAt);
        job.setUpdatedAt(Instant.now());
    }

    @Override
    public synchronized boolean deleteJob(long id) {
        boolean removed = jobs.remove(id) != null;
        if (removed) {
            for (JobExecution execution : executions.values()) {
                if (execution.getJobId() != null && execution.getJobId() == id) {
                    execution.setJobId(null);
                }
            }
        }
        return removed;
    }

    @Override
    public synchronized JobExecution insertExecution(JobExecution execution) throws JobStoreException {
        if (execution.getJobId() == null || !jobs.containsKey(execution.getJobId())) {
            throw new JobStoreException("foreign key violated: job " + execution.getJobId() + " does not exist");
        }
        execution.setId(nextExecutionId++);
        executions.put(execution.getId(), new JobExecution(execution));
        return execution;
    }

    @Override
    public synchronized void finishExecution(JobExecution execution) throws JobStoreException {
        JobExecution stored = executions.get(execution.getId());
        if (stored == null || stored.isFinished()) {
            throw new JobStoreException("execution " + execution.getId() + " missing or already finished");
        }
        JobExecution finished = new JobExecution(execution);
        finished.setJobId(stored.getJobId());
        executions.put(finished.getId(), finished);
    }

    @Override
    public synchronized List<JobExecution> listExecutions(long jobId) {
        List<JobExecution> list = new ArrayList<>();
        for (JobExecution execution : executions.values()) {
            if (execution.getJobId() != null && execution.getJobId() == jobId) {
                list.add(new JobExecution(execution));
            }
        }
        list.sort(Comparator.comparing(JobExecution::getStartedAt).thenComparing(JobExecution::getId).reversed());
        return list;
    }

    @Override
    public synchronized int failUnfinishedExecutions(Instant finishedAt, String error) {
        int count = 0;
        for (JobExecution execution : executions.values()) {
            if (!execution.isFinished()) {
                execution.setFinishedAt(finishedAt);
                execution.setSuccess(false);
                execution.setError(error);
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized Optional<RecurringJob> recordRun(long jobId, RunOutcome outcome) {
        RecurringJob job = jobs.get(jobId);
        if (job == null) {
            return Optional.empty();
        }
        job.setTimesRun(job.getTimesRun() + 1);
        job.setLastRunAt(outcome.startedAt());
        if (!outcome.success()) {
            job.setErrorCount(job.getErrorCount() + 1);
            job.setLastError(outcome.error());
        }
        if (outcome.nextRunAt() != null) {
            job.setNextRunAt(outcome.nextRunAt());
        }
        if (job.getStatus() == JobStatus.ACTIVE && job.isBudgetExhausted()) {
            job.setStatus(JobStatus.COMPLETED);
            job.setNextRunAt(null);
        }
        job.setUpdatedAt(Instant.now());
        return Optional.of(new RecurringJob(job));
    }

    private RecurringJob require(long id) throws JobStoreException {
        RecurringJob job = jobs.get(id);
        if (job == null) {
            throw new JobStoreException("job " + id + " does not exist");
        }
        return job;
    }

    private boolean nameTaken(String name, Long excludingId) {
        for (RecurringJob job : jobs.values()) {
            if (job.getName().equals(name) && (excludingId == null || job.getId() != excludingId)) {
                return true;
            }
        }
        return false;
    }
}
