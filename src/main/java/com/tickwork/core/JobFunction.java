package com.tickwork.core;

/**
 * Logic executed when a recurring job fires.
 *
 * <p>Arguments arrive as the raw JSON bytes stored with the job; each function owns its own
 * decoding. Functions should check {@link JobContext#isCancelled()} (or respond to interruption)
 * so that the execution timeout can take effect. Throwing marks the execution as failed.
 */
@FunctionalInterface
public interface JobFunction {
    void execute(JobContext context, byte[] args, JobExecution execution) throws Exception;
}
