package com.tickwork.core;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * One attempt to run a job's function. Job functions receive the live record and may append
 * leveled lines to its output through {@link #info}, {@link #warn}, {@link #error} and
 * {@link #debug}.
 */
public class JobExecution {
    private static final DateTimeFormatter LINE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private long id;
    private Long jobId;
    private Instant startedAt;
    private Instant finishedAt;
    private boolean success;
    private String error = "";
    private final StringBuilder output = new StringBuilder();
    private long duration;

    public JobExecution() {
    }

    public JobExecution(JobExecution other) {
        this.id = other.id;
        this.jobId = other.jobId;
        this.startedAt = other.startedAt;
        this.finishedAt = other.finishedAt;
        this.success = other.success;
        this.error = other.error;
        this.output.append(other.getOutput());
        this.duration = other.duration;
    }

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    /** Owning job id; {@code null} once the job has been deleted. */
    public Long getJobId() { return jobId; }
    public void setJobId(Long jobId) { this.jobId = jobId; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error == null ? "" : error; }

    public synchronized String getOutput() { return output.toString(); }

    public synchronized void setOutput(String text) {
        output.setLength(0);
        if (text != null) {
            output.append(text);
        }
    }

    /** Milliseconds between start and finish. */
    public long getDuration() { return duration; }
    public void setDuration(long duration) { this.duration = duration; }

    public boolean isFinished() {
        return finishedAt != null;
    }

    public void info(String format, Object... args) {
        append(ExecutionLogLevel.INFO, format, args);
    }

    public void warn(String format, Object... args) {
        append(ExecutionLogLevel.WARN, format, args);
    }

    public void error(String format, Object... args) {
        append(ExecutionLogLevel.ERROR, format, args);
    }

    public void debug(String format, Object... args) {
        append(ExecutionLogLevel.DEBUG, format, args);
    }

    private synchronized void append(ExecutionLogLevel level, String format, Object... args) {
        String message = args == null || args.length == 0 ? format : String.format(format, args);
        if (output.length() > 0) {
            output.append('\n');
        }
        output.append('[').append(LocalDateTime.now().format(LINE_TIMESTAMP)).append("] ")
                .append(level.tag()).append(' ').append(message);
    }

    /** Human readable duration: {@code 850ms}, {@code 2.50s} or {@code 3m12s}. */
    public String formatDuration() {
        if (duration < 1000) {
            return duration + "ms";
        }
        if (duration < 60_000) {
            return String.format(Locale.ROOT, "%.2fs", duration / 1000.0);
        }
        return (duration / 60_000) + "m" + (duration % 60_000) / 1000 + "s";
    }
}
