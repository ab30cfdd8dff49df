package com.tickwork.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory table of scheduled jobs, keyed by job key. Timers only remember the job id, never a
 * snapshot of the job, so every fire goes back to the store for the current state.
 *
 * <p>Not thread-safe; every access happens under the owning {@link TaskManager}'s lock.
 */
final class LiveTimers {

    static final class Timer {
        private final long jobId;
        private final String jobName;
        private final String jobKey;
        private final CronSchedule schedule;
        private Instant nextFireAt;

        Timer(long jobId, String jobName, String jobKey, CronSchedule schedule, Instant nextFireAt) {
            this.jobId = jobId;
            this.jobName = jobName;
            this.jobKey = jobKey;
            this.schedule = schedule;
            this.nextFireAt = nextFireAt;
        }

        long jobId() { return jobId; }
        String jobName() { return jobName; }
        String jobKey() { return jobKey; }
        CronSchedule schedule() { return schedule; }
        Instant nextFireAt() { return nextFireAt; }
    }

    private final Map<String, Timer> byKey = new HashMap<>();
    private final Map<Long, String> keyByJob = new HashMap<>();

    /** Adds a timer, replacing any timer the same job already had. */
    void put(Timer timer) {
        removeForJob(timer.jobId());
        byKey.put(timer.jobKey(), timer);
        keyByJob.put(timer.jobId(), timer.jobKey());
    }

    Optional<Timer> remove(String jobKey) {
        if (jobKey == null) {
            return Optional.empty();
        }
        Timer timer = byKey.remove(jobKey);
        if (timer != null) {
            keyByJob.remove(timer.jobId());
        }
        return Optional.ofNullable(timer);
    }

    Optional<Timer> removeForJob(long jobId) {
        return remove(keyByJob.get(jobId));
    }

    Optional<Timer> get(String jobKey) {
        return jobKey == null ? Optional.empty() : Optional.ofNullable(byKey.get(jobKey));
    }

    Optional<Timer> forJob(long jobId) {
        return get(keyByJob.get(jobId));
    }

    /**
     * Collects the timers due at {@code now} and moves each of them to its next fire time.
     * A timer whose schedule has no further fire time is dropped after this last fire.
     */
    List<Timer> takeDue(Instant now) {
        List<Timer> due = new ArrayList<>();
        for (Timer timer : new ArrayList<>(byKey.values())) {
            if (timer.nextFireAt.isAfter(now)) {
                continue;
            }
            due.add(timer);
            Optional<Instant> next = timer.schedule.nextAfter(now);
            if (next.isPresent()) {
                timer.nextFireAt = next.get();
            } else {
                remove(timer.jobKey());
            }
        }
        return due;
    }

    int size() {
        return byKey.size();
    }

    void clear() {
        byKey.clear();
        keyByJob.clear();
    }
}
