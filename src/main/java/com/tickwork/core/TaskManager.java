package com.tickwork.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Recurring job scheduler. Jobs are persisted in a {@link JobStore}; active jobs get a live
 * timer while the manager runs, and every fire is handed to an {@link ExecutionRunner} on the
 * worker pool.
 *
 * <p>All mutations and the timer table are guarded by one lock. Function bodies never run
 * while it is held.
 */
public class TaskManager {
    private static final Logger log = LoggerFactory.getLogger(TaskManager.class);
    private static final Duration STOP_GRACE = Duration.ofSeconds(30);
    static final String RESTART_ERROR = "interrupted by restart";

    private final JobStore store;
    private final JobFunctionRegistry registry;
    private final TaskManagerConfig config;
    private final Clock clock;
    private final Executor workerExecutor;
    private final ReentrantLock lock = new ReentrantLock();
    private final LiveTimers timers = new LiveTimers();
    private final List<JobResultListener> listeners = new CopyOnWriteArrayList<>();
    private final Metrics metrics;

    private volatile boolean running = false;
    private ScheduledExecutorService dispatcher;
    private ExecutorService ownedWorkers;
    private ExecutorService invocationPool;
    private Executor workers;
    private ExecutionRunner runner;

    public TaskManager(JobStore store, JobFunctionRegistry registry, TaskManagerConfig config) {
        this(store, registry, config, Clock.systemUTC(), null);
    }

    /**
     * @param workerExecutor executor for executions, or null to let the manager own a pool of
     *                       {@link TaskManagerConfig#workerThreads()} threads
     */
    public TaskManager(JobStore store, JobFunctionRegistry registry, TaskManagerConfig config,
                       Clock clock, Executor workerExecutor) {
        this.store = store;
        this.registry = registry;
        this.config = config;
        this.clock = clock;
        this.workerExecutor = workerExecutor;
        this.metrics = new Metrics(config.name());
    }

    /**
     * Starts scheduling. Executions left unfinished by a previous process are marked failed, then
     * every active job gets a live timer. A job that cannot be scheduled is marked
     * {@link JobStatus#ERROR} and start continues with the others.
     */
    public void start() throws JobStoreException {
        lock.lock();
        try {
            if (running) {
                return;
            }
            int recovered = store.failUnfinishedExecutions(clock.instant(), RESTART_ERROR);
            if (recovered > 0) {
                log.warn("Marked {} unfinished execution(s) from a previous run as failed", recovered);
            }
            List<RecurringJob> active = store.listJobsByStatus(JobStatus.ACTIVE);

            invocationPool = Executors.newCachedThreadPool(threadFactory(config.name() + "-invoke"));
            if (workerExecutor != null) {
                workers = workerExecutor;
            } else {
                ownedWorkers = Executors.newFixedThreadPool(config.workerThreads(),
                        threadFactory(config.name() + "-worker"));
                workers = ownedWorkers;
            }
            runner = new ExecutionRunner(store, registry, lock, timers, () -> running, clock, invocationPool,
                    config.executionTimeout(), config.allowOverlappingRuns(), metrics, listeners);
            running = true;

            for (RecurringJob job : active) {
                try {
                    schedule(job);
                } catch (JobException e) {
                    log.error("Failed to schedule job {}: {}", job.getName(), e.getMessage());
                    markError(job, e.getMessage());
                }
            }
            metrics.register();

            Duration poll = config.pollInterval();
            if (!poll.isZero() && !poll.isNegative()) {
                dispatcher = Executors.newSingleThreadScheduledExecutor(threadFactory(config.name() + "-dispatcher"));
                dispatcher.scheduleWithFixedDelay(this::dispatchQuietly, poll.toMillis(), poll.toMillis(),
                        TimeUnit.MILLISECONDS);
            }
            log.info("Scheduler {} started with {} scheduled job(s)", config.name(), timers.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops dispatching and drops all live timers. Executions already in flight get a grace
     * period to finish; persisted jobs are left untouched.
     */
    public void stop() {
        ScheduledExecutorService stoppedDispatcher;
        ExecutorService stoppedWorkers;
        ExecutorService stoppedInvocations;
        lock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            timers.clear();
            stoppedDispatcher = dispatcher;
            stoppedWorkers = ownedWorkers;
            stoppedInvocations = invocationPool;
            dispatcher = null;
            ownedWorkers = null;
        } finally {
            lock.unlock();
        }
        if (stoppedDispatcher != null) {
            stoppedDispatcher.shutdownNow();
        }
        if (stoppedWorkers != null) {
            stoppedWorkers.shutdown();
            awaitTermination(stoppedWorkers);
        }
        stoppedInvocations.shutdown();
        awaitTermination(stoppedInvocations);
        metrics.unregister();
        log.info("Scheduler {} stopped", config.name());
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Creates a job and schedules it when the manager is running.
     *
     * @param args value serialized as JSON and handed to the function on every run; null means none
     * @param times run budget, 0 for unlimited
     * @throws JobException when validation fails, or with {@link JobException#getJob()} set when
     *                      the job was stored but could not be scheduled
     */
    public RecurringJob addJob(String name, String functionName, Object args, int times, String schedule)
            throws JobException {
        validate(name, functionName, times, schedule);
        String encodedArgs = encodeArgs(args);
        lock.lock();
        try {
            if (store.nameExists(name, null)) {
                throw new DuplicateNameException(name);
            }
            checkFunctionAndSchedule(functionName, schedule);

            RecurringJob job = new RecurringJob();
            job.setName(name);
            job.setFunctionName(functionName);
            job.setCronExpression(schedule);
            job.setArgs(encodedArgs);
            job.setTimes(times);
            job.setStatus(JobStatus.ACTIVE);
            RecurringJob saved = store.insertJob(job);
            if (running) {
                scheduleOrFail(saved);
            }
            log.info("Added job {} running {} on '{}' ({} runs)", name, functionName, schedule,
                    times == 0 ? "unlimited" : times);
            return new RecurringJob(saved);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rewrites the configuration of a job. Counters and history are kept. With
     * {@code keepStatus=false} a completed or failed job becomes active again.
     */
    public RecurringJob updateJob(long id, String name, String functionName, Object args, int times,
                                  String schedule, boolean keepStatus) throws JobException {
        validate(name, functionName, times, schedule);
        String encodedArgs = encodeArgs(args);
        lock.lock();
        try {
            RecurringJob existing = store.findJob(id)
                    .orElseThrow(() -> new JobNotFoundException(String.valueOf(id)));
            if (store.nameExists(name, id)) {
                throw new DuplicateNameException(name);
            }
            checkFunctionAndSchedule(functionName, schedule);

            timers.removeForJob(id);
            RecurringJob updated = new RecurringJob(existing);
            updated.setName(name);
            updated.setFunctionName(functionName);
            updated.setCronExpression(schedule);
            updated.setArgs(encodedArgs);
            updated.setTimes(times);
            if (!keepStatus && (existing.getStatus() == JobStatus.COMPLETED || existing.getStatus() == JobStatus.ERROR)) {
                updated.setStatus(JobStatus.ACTIVE);
            }
            updated.setNextRunAt(null);
            store.updateJob(updated);
            // Counters may have moved since the read above.
            updated = store.findJob(id).orElseThrow(() -> new JobNotFoundException(String.valueOf(id)));
            if (running && updated.getStatus() == JobStatus.ACTIVE) {
                scheduleOrFail(updated);
            }
            log.info("Updated job {} ({}), status {}", name, id, updated.getStatus().dbValue());
            return new RecurringJob(updated);
        } finally {
            lock.unlock();
        }
    }

    /** Deletes the job. Its executions stay in the history without a job reference. */
    public void removeJob(String name) throws JobException {
        lock.lock();
        try {
            RecurringJob job = requireJob(name);
            timers.removeForJob(job.getId());
            store.deleteJob(job.getId());
            log.info("Removed job {}", name);
        } finally {
            lock.unlock();
        }
    }

    public RecurringJob pauseJob(String name) throws JobException {
        lock.lock();
        try {
            RecurringJob job = requireJob(name);
            if (job.getStatus() != JobStatus.ACTIVE) {
                throw new InvalidStateException("job " + name + " is " + job.getStatus().dbValue()
                        + ", only active jobs can be paused");
            }
            timers.removeForJob(job.getId());
            store.updateStatus(job.getId(), JobStatus.PAUSED);
            job.setStatus(JobStatus.PAUSED);
            job.setNextRunAt(null);
            log.info("Paused job {}", name);
            return job;
        } finally {
            lock.unlock();
        }
    }

    public RecurringJob resumeJob(String name) throws JobException {
        lock.lock();
        try {
            RecurringJob job = requireJob(name);
            if (job.getStatus() != JobStatus.PAUSED) {
                throw new InvalidStateException("job " + name + " is " + job.getStatus().dbValue()
                        + ", only paused jobs can be resumed");
            }
            store.updateStatus(job.getId(), JobStatus.ACTIVE);
            job.setStatus(JobStatus.ACTIVE);
            if (running) {
                scheduleOrFail(job);
            }
            log.info("Resumed job {}", name);
            return job;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Submits an immediate execution outside the schedule. Whether it actually runs is decided
     * by the same checks as a scheduled fire, so a paused or completed job records nothing.
     */
    public void runJobNow(String name) throws JobException {
        RecurringJob job;
        Executor target;
        ExecutionRunner current;
        lock.lock();
        try {
            job = requireJob(name);
            if (!running) {
                throw new InvalidStateException("scheduler is not running");
            }
            target = workers;
            current = runner;
        } finally {
            lock.unlock();
        }
        long jobId = job.getId();
        try {
            target.execute(() -> current.run(jobId, "manual"));
        } catch (RejectedExecutionException e) {
            throw new InvalidStateException("scheduler is shutting down");
        }
        log.info("Triggered job {} manually", name);
    }

    public RecurringJob getJob(String name) throws JobException {
        lock.lock();
        try {
            return requireJob(name);
        } finally {
            lock.unlock();
        }
    }

    public RecurringJob getJob(long id) throws JobException {
        return store.findJob(id).orElseThrow(() -> new JobNotFoundException(String.valueOf(id)));
    }

    public List<RecurringJob> listJobs() throws JobStoreException {
        return store.listJobs();
    }

    /** Executions of the named job, newest first. */
    public List<JobExecution> listExecutions(String name) throws JobException {
        RecurringJob job = getJob(name);
        return store.listExecutions(job.getId());
    }

    public void registerFunction(String name, JobFunction function) {
        registry.register(name, function);
    }

    public void addResultListener(JobResultListener listener) {
        listeners.add(listener);
    }

    public JobFunctionRegistry getRegistry() {
        return registry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public TaskManagerConfig getConfig() {
        return config;
    }

    /**
     * Fires every live timer that is due and hands the jobs to the worker pool.
     *
     * @return number of executions submitted
     */
    public int dispatchDue() {
        List<LiveTimers.Timer> due;
        Executor target;
        ExecutionRunner current;
        lock.lock();
        try {
            if (!running) {
                return 0;
            }
            due = timers.takeDue(clock.instant());
            target = workers;
            current = runner;
        } finally {
            lock.unlock();
        }
        int submitted = 0;
        for (LiveTimers.Timer timer : due) {
            long jobId = timer.jobId();
            try {
                target.execute(() -> current.run(jobId, "scheduled"));
                submitted++;
            } catch (RejectedExecutionException e) {
                log.warn("Could not submit scheduled run of job {}", timer.jobName(), e);
            }
        }
        return submitted;
    }

    int scheduledCount() {
        lock.lock();
        try {
            return timers.size();
        } finally {
            lock.unlock();
        }
    }

    private void dispatchQuietly() {
        try {
            dispatchDue();
        } catch (RuntimeException e) {
            log.error("Dispatch pass failed", e);
        }
    }

    /**
     * Gives the job a fresh key and live timer and persists its next fire time. A job without
     * remaining budget is marked completed instead. Caller holds the lock.
     */
    private void schedule(RecurringJob job) throws JobException {
        if (!registry.contains(job.getFunctionName())) {
            throw new InvalidFunctionException(job.getFunctionName());
        }
        if (job.isBudgetExhausted()) {
            store.updateStatus(job.getId(), JobStatus.COMPLETED);
            job.setStatus(JobStatus.COMPLETED);
            job.setNextRunAt(null);
            log.info("Job {} has no runs left ({}), marked completed", job.getName(), job.runsLabel());
            return;
        }
        CronSchedule schedule = CronSchedule.parse(job.getCronExpression(), config.zone());
        Instant next = schedule.nextAfter(clock.instant())
                .orElseThrow(() -> new InvalidScheduleException(job.getCronExpression(), "never fires again"));
        timers.removeForJob(job.getId());
        String jobKey = job.getName() + "_" + UUID.randomUUID();
        store.updateSchedule(job.getId(), jobKey, next);
        timers.put(new LiveTimers.Timer(job.getId(), job.getName(), jobKey, schedule, next));
        job.setJobKey(jobKey);
        job.setNextRunAt(next);
        log.debug("Scheduled job {} as {}, next run at {}", job.getName(), jobKey, next);
    }

    private void scheduleOrFail(RecurringJob job) throws JobException {
        try {
            schedule(job);
        } catch (JobException e) {
            log.error("Failed to schedule job {}: {}", job.getName(), e.getMessage());
            markError(job, e.getMessage());
            throw e.withJob(job);
        }
    }

    private void markError(RecurringJob job, String error) {
        timers.removeForJob(job.getId());
        try {
            store.markError(job.getId(), error);
        } catch (JobStoreException e) {
            log.error("Failed to mark job {} as failed", job.getName(), e);
        }
        job.setStatus(JobStatus.ERROR);
        job.setLastError(error);
        job.setNextRunAt(null);
    }

    private RecurringJob requireJob(String name) throws JobException {
        return store.findJobByName(name).orElseThrow(() -> new JobNotFoundException(name));
    }

    private void checkFunctionAndSchedule(String functionName, String schedule) throws JobException {
        if (!registry.contains(functionName)) {
            throw new InvalidFunctionException(functionName);
        }
        CronSchedule.parse(schedule, config.zone());
    }

    private static void validate(String name, String functionName, int times, String schedule) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("job name required");
        }
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("function name required");
        }
        if (times < 0) {
            throw new IllegalArgumentException("times must be >= 0, got " + times);
        }
        if (schedule == null || schedule.isBlank()) {
            throw new IllegalArgumentException("schedule required");
        }
    }

    private static String encodeArgs(Object args) throws JobStoreException {
        if (args == null) {
            return "";
        }
        try {
            return JsonUtil.mapper().writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("cannot serialize job arguments", e);
        }
    }

    private static void awaitTermination(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Executions still running after {}, interrupting them", STOP_GRACE);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
