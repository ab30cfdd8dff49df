package com.tickwork.core;

import java.time.Instant;

/**
 * Persisted definition of a named job bound to a registered function and a cron schedule.
 * Instances handed out by a {@link JobStore} are detached copies; mutating them has no effect
 * until they are written back.
 */
public class RecurringJob {
    private long id;
    private String name;
    private String jobKey;
    private String functionName;
    private String cronExpression;
    private String args = "";
    private int times;
    private int timesRun;
    private JobStatus status = JobStatus.ACTIVE;
    private Instant lastRunAt;
    private Instant nextRunAt;
    private int errorCount;
    private String lastError = "";
    private Instant createdAt;
    private Instant updatedAt;

    public RecurringJob() {
    }

    public RecurringJob(RecurringJob other) {
        this.id = other.id;
        this.name = other.name;
        this.jobKey = other.jobKey;
        this.functionName = other.functionName;
        this.cronExpression = other.cronExpression;
        this.args = other.args;
        this.times = other.times;
        this.timesRun = other.timesRun;
        this.status = other.status;
        this.lastRunAt = other.lastRunAt;
        this.nextRunAt = other.nextRunAt;
        this.errorCount = other.errorCount;
        this.lastError = other.lastError;
        this.createdAt = other.createdAt;
        this.updatedAt = other.updatedAt;
    }

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getJobKey() { return jobKey; }
    public void setJobKey(String jobKey) { this.jobKey = jobKey; }

    public String getFunctionName() { return functionName; }
    public void setFunctionName(String functionName) { this.functionName = functionName; }

    public String getCronExpression() { return cronExpression; }
    public void setCronExpression(String cronExpression) { this.cronExpression = cronExpression; }

    /** Raw JSON argument text, empty when the job has no arguments. */
    public String getArgs() { return args; }
    public void setArgs(String args) { this.args = args == null ? "" : args; }

    /** Maximum number of runs, 0 for unbounded. */
    public int getTimes() { return times; }
    public void setTimes(int times) { this.times = times; }

    public int getTimesRun() { return timesRun; }
    public void setTimesRun(int timesRun) { this.timesRun = timesRun; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public Instant getLastRunAt() { return lastRunAt; }
    public void setLastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; }

    public Instant getNextRunAt() { return nextRunAt; }
    public void setNextRunAt(Instant nextRunAt) { this.nextRunAt = nextRunAt; }

    public int getErrorCount() { return errorCount; }
    public void setErrorCount(int errorCount) { this.errorCount = errorCount; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError == null ? "" : lastError; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    /** True when a bounded job has used up its run budget. */
    public boolean isBudgetExhausted() {
        return times > 0 && timesRun >= times;
    }

    /** Runs so far against the budget, e.g. {@code 2 / 5} or {@code 7 / ∞}. */
    public String runsLabel() {
        return timesRun + " / " + (times > 0 ? String.valueOf(times) : "∞");
    }

    @Override
    public String toString() {
        return "RecurringJob{id=" + id + ", name='" + name + "', function='" + functionName
                + "', cron='" + cronExpression + "', status=" + status + ", runs=" + runsLabel() + '}';
    }
}
