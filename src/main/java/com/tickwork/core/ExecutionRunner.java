package com.tickwork.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.function.BooleanSupplier;

/**
 * Runs one invocation of a job: re-checks the stored state under the manager lock, invokes the
 * registered function outside the lock with a timeout, then records the execution and the job's
 * counters.
 */
final class ExecutionRunner {
    private static final Logger log = LoggerFactory.getLogger(ExecutionRunner.class);

    static final String STOPPED_ERROR = "scheduler stopped";

    private final JobStore store;
    private final JobFunctionRegistry registry;
    private final Lock lock;
    private final LiveTimers timers;
    private final BooleanSupplier accepting;
    private final Clock clock;
    private final ExecutorService invocationPool;
    private final Duration timeout;
    private final boolean allowOverlappingRuns;
    private final Metrics metrics;
    private final List<JobResultListener> listeners;
    private final Set<Long> running = ConcurrentHashMap.newKeySet();

    ExecutionRunner(JobStore store, JobFunctionRegistry registry, Lock lock, LiveTimers timers,
                    BooleanSupplier accepting, Clock clock, ExecutorService invocationPool,
                    Duration timeout, boolean allowOverlappingRuns, Metrics metrics,
                    List<JobResultListener> listeners) {
        this.store = store;
        this.registry = registry;
        this.lock = lock;
        this.timers = timers;
        this.accepting = accepting;
        this.clock = clock;
        this.invocationPool = invocationPool;
        this.timeout = timeout;
        this.allowOverlappingRuns = allowOverlappingRuns;
        this.metrics = metrics;
        this.listeners = listeners;
    }

    /**
     * Execute the job with the given id if its current state allows it.
     *
     * @param trigger short label for logs, e.g. {@code scheduled} or {@code manual}
     */
    void run(long jobId, String trigger) {
        RecurringJob job = admit(jobId, trigger);
        if (job == null) {
            return;
        }
        try {
            execute(job);
        } finally {
            if (!allowOverlappingRuns) {
                running.remove(jobId);
            }
        }
    }

    private RecurringJob admit(long jobId, String trigger) {
        lock.lock();
        try {
            Optional<RecurringJob> current;
            try {
                current = store.findJob(jobId);
            } catch (JobStoreException e) {
                log.error("Failed to load job {} before {} run", jobId, trigger, e);
                return null;
            }
            if (current.isEmpty()) {
                log.info("Job {} no longer exists, skipping {} run", jobId, trigger);
                return null;
            }
            RecurringJob job = current.get();
            if (!accepting.getAsBoolean()) {
                log.info("Scheduler stopped, skipping {} run of job {}", trigger, job.getName());
                metrics.recordSkipped();
                return null;
            }
            if (job.getStatus() != JobStatus.ACTIVE) {
                log.info("Job {} is {}, skipping {} run", job.getName(), job.getStatus().dbValue(), trigger);
                metrics.recordSkipped();
                return null;
            }
            if (job.isBudgetExhausted()) {
                log.info("Job {} reached its run limit ({}), marking completed", job.getName(), job.runsLabel());
                try {
                    store.updateStatus(job.getId(), JobStatus.COMPLETED);
                } catch (JobStoreException e) {
                    log.error("Failed to mark job {} completed", job.getName(), e);
                }
                timers.removeForJob(job.getId());
                metrics.recordSkipped();
                return null;
            }
            if (!allowOverlappingRuns && !running.add(jobId)) {
                log.warn("Job {} is still running, skipping overlapping {} run", job.getName(), trigger);
                metrics.recordSkipped();
                return null;
            }
            return job;
        } finally {
            lock.unlock();
        }
    }

    private void execute(RecurringJob job) {
        Instant startedAt = clock.instant();
        JobExecution execution = new JobExecution();
        execution.setJobId(job.getId());
        execution.setStartedAt(startedAt);
        try {
            store.insertExecution(execution);
        } catch (JobStoreException e) {
            log.error("Failed to create execution record for job {}, not running it", job.getName(), e);
            return;
        }

        String error = invoke(job, execution);
        boolean success = error == null;

        Instant finishedAt = clock.instant();
        execution.setFinishedAt(finishedAt);
        execution.setDuration(Math.max(0, Duration.between(startedAt, finishedAt).toMillis()));
        execution.setSuccess(success);
        execution.setError(success ? "" : error);
        try {
            store.finishExecution(execution);
        } catch (JobStoreException e) {
            log.error("Failed to finish execution {} of job {}", execution.getId(), job.getName(), e);
        }
        if (success) {
            metrics.recordSuccess();
        } else {
            metrics.recordFailure();
        }
        metrics.recordDuration(execution.getDuration());

        Instant nextRunAt;
        lock.lock();
        try {
            nextRunAt = timers.forJob(job.getId()).map(LiveTimers.Timer::nextFireAt).orElse(null);
        } finally {
            lock.unlock();
        }

        Optional<RecurringJob> updated;
        try {
            updated = store.recordRun(job.getId(), new RunOutcome(startedAt, success, error, nextRunAt));
        } catch (JobStoreException e) {
            log.error("Failed to update counters of job {}", job.getName(), e);
            return;
        }
        if (updated.isEmpty()) {
            log.info("Job {} was removed while execution {} was running", job.getName(), execution.getId());
            return;
        }
        RecurringJob after = updated.get();
        if (after.getStatus() == JobStatus.COMPLETED) {
            lock.lock();
            try {
                timers.removeForJob(after.getId());
            } finally {
                lock.unlock();
            }
            log.info("Job {} reached its run limit ({}), marked completed", after.getName(), after.runsLabel());
        }
        notifyListeners(after, execution);
    }

    private String invoke(RecurringJob job, JobExecution execution) {
        Optional<JobFunction> function = registry.lookup(job.getFunctionName());
        if (function.isEmpty()) {
            return new InvalidFunctionException(job.getFunctionName()).getMessage();
        }
        JobContext context = new JobContext(new RecurringJob(job), clock.instant().plus(timeout), clock);
        byte[] args = job.getArgs().getBytes(StandardCharsets.UTF_8);
        Future<Object> future;
        try {
            future = invocationPool.submit(() -> {
                function.get().execute(context, args, execution);
                return null;
            });
        } catch (RejectedExecutionException e) {
            log.warn("Scheduler stopped before job {} could be invoked", job.getName());
            return STOPPED_ERROR;
        }
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return null;
        } catch (TimeoutException e) {
            context.cancel();
            future.cancel(true);
            log.warn("Job {} timed out after {}", job.getName(), timeout);
            execution.error("execution timed out after %s", timeout);
            return "execution timed out after " + timeout;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException || cause instanceof Error) {
                log.warn("Job {} crashed", job.getName(), cause);
            } else {
                log.debug("Job {} failed", job.getName(), cause);
            }
            return describe(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.cancel();
            future.cancel(true);
            return "execution interrupted";
        }
    }

    private void notifyListeners(RecurringJob job, JobExecution execution) {
        for (JobResultListener listener : listeners) {
            try {
                listener.jobFinished(job, execution);
            } catch (RuntimeException e) {
                log.warn("Result listener {} failed for job {}", listener, job.getName(), e);
            }
        }
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getName() : message;
    }
}
