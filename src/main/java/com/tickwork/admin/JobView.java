package com.tickwork.admin;

import com.tickwork.core.RecurringJob;

import java.time.Instant;

/**
 * JSON shape of a job in admin responses.
 */
public record JobView(long id,
                      String name,
                      String jobKey,
                      String functionName,
                      String cronExpression,
                      String args,
                      int times,
                      int timesRun,
                      String runs,
                      String status,
                      Instant lastRunAt,
                      Instant nextRunAt,
                      int errorCount,
                      String lastError,
                      Instant createdAt,
                      Instant updatedAt) {

    static JobView of(RecurringJob job) {
        if (job == null) {
            return null;
        }
        return new JobView(job.getId(), job.getName(), job.getJobKey(), job.getFunctionName(),
                job.getCronExpression(), job.getArgs(), job.getTimes(), job.getTimesRun(), job.runsLabel(),
                job.getStatus().dbValue(), job.getLastRunAt(), job.getNextRunAt(), job.getErrorCount(),
                job.getLastError(), job.getCreatedAt(), job.getUpdatedAt());
    }
}
