package com.tickwork.admin;

import com.tickwork.core.JobExecution;

import java.time.Instant;

/**
 * JSON shape of an execution in admin responses.
 */
public record ExecutionView(long id,
                            Long jobId,
                            Instant startedAt,
                            Instant finishedAt,
                            boolean finished,
                            boolean success,
                            String error,
                            String output,
                            long duration,
                            String durationText) {

    static ExecutionView of(JobExecution execution) {
        return new ExecutionView(execution.getId(), execution.getJobId(), execution.getStartedAt(),
                execution.getFinishedAt(), execution.isFinished(), execution.isSuccess(), execution.getError(),
                execution.getOutput(), execution.getDuration(), execution.formatDuration());
    }
}
