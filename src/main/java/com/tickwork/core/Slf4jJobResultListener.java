package com.tickwork.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Result listener that logs each finished execution to an SLF4J logger named after the job.
 */
public class Slf4jJobResultListener implements JobResultListener {
    @Override
    public void jobFinished(RecurringJob job, JobExecution execution) {
        Logger log = LoggerFactory.getLogger("tickwork.job." + job.getName());
        if (execution.isSuccess()) {
            log.info("Execution {} succeeded in {} (runs {})",
                    execution.getId(), execution.formatDuration(), job.runsLabel());
        } else {
            log.warn("Execution {} failed after {}: {} (runs {})",
                    execution.getId(), execution.formatDuration(), execution.getError(), job.runsLabel());
        }
    }
}
