package com.tickwork.core;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JobStore backed by a JDBC DataSource. Jobs live in {@code recurring_jobs} and their run history
 * in {@code recurring_job_executions}; both tables are created on construction if missing.
 * The SQL sticks to what H2 and PostgreSQL both accept.
 */
public class JdbcJobStore implements JobStore {
    private static final String JOB_COLUMNS = "id, name, job_key, function_name, cron_expression, args, times, "
            + "times_run, status, last_run_at, next_run_at, error_count, last_error, created_at, updated_at";
    private static final String EXECUTION_COLUMNS = "id, recurring_job_id, started_at, finished_at, success, "
            + "error, output, duration";

    private final DataSource dataSource;

    public JdbcJobStore(DataSource dataSource) throws SQLException {
        this.dataSource = dataSource;
        initSchema();
    }

    private void initSchema() throws SQLException {
        try (Connection c = dataSource.getConnection();
             Statement s = c.createStatement()) {
            s.executeUpdate("""
                    CREATE TABLE IF NOT EXISTS recurring_jobs (
                        id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                        name VARCHAR(255) NOT NULL,
                        job_key VARCHAR(255),
                        function_name VARCHAR(255) NOT NULL,
                        cron_expression VARCHAR(100) NOT NULL,
                        args TEXT,
                        times INT DEFAULT 0 NOT NULL,
                        times_run INT DEFAULT 0 NOT NULL,
                        status VARCHAR(50) NOT NULL,
                        last_run_at TIMESTAMP WITH TIME ZONE,
                        next_run_at TIMESTAMP WITH TIME ZONE,
                        error_count INT DEFAULT 0 NOT NULL,
                        last_error TEXT,
                        created_at TIMESTAMP WITH TIME ZONE NOT NULL,
                        updated_at TIMESTAMP WITH TIME ZONE NOT NULL,
                        CONSTRAINT uk_recurring_jobs_name UNIQUE (name)
                    )""");
            s.executeUpdate("""
                    CREATE TABLE IF NOT EXISTS recurring_job_executions (
                        id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                        recurring_job_id BIGINT,
                        started_at TIMESTAMP WITH TIME ZONE NOT NULL,
                        finished_at TIMESTAMP WITH TIME ZONE,
                        success BOOLEAN DEFAULT FALSE NOT NULL,
                        error TEXT,
                        output TEXT,
                        duration BIGINT DEFAULT 0 NOT NULL,
                        CONSTRAINT fk_recurring_job_executions_job FOREIGN KEY (recurring_job_id)
                            REFERENCES recurring_jobs (id) ON DELETE SET NULL
                    )""");
            s.executeUpdate("CREATE INDEX IF NOT EXISTS idx_recurring_job_executions_job "
                    + "ON recurring_job_executions (recurring_job_id)");
        }
    }

    @Override
    public RecurringJob insertJob(RecurringJob job) throws JobStoreException {
        Instant now = Instant.now();
        String sql = "INSERT INTO recurring_jobs (name, job_key, function_name, cron_expression, args, times, "
                + "times_run, status, last_run_at, next_run_at, error_count, last_error, created_at, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, job.getName());
            ps.setString(2, job.getJobKey());
            ps.setString(3, job.getFunctionName());
            ps.setString(4, job.getCronExpression());
            ps.setString(5, job.getArgs());
            ps.setInt(6, job.getTimes());
            ps.setInt(7, job.getTimesRun());
            ps.setString(8, job.getStatus().dbValue());
            setInstant(ps, 9, job.getLastRunAt());
            setInstant(ps, 10, job.getNextRunAt());
            ps.setInt(11, job.getErrorCount());
            ps.setString(12, job.getLastError());
            setInstant(ps, 13, now);
            setInstant(ps, 14, now);
            ps.executeUpdate();
            RecurringJob saved = new RecurringJob(job);
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new JobStoreException("no id generated for job " + job.getName());
                }
                saved.setId(keys.getLong(1));
            }
            saved.setCreatedAt(now);
            saved.setUpdatedAt(now);
            return saved;
        } catch (SQLException e) {
            throw new JobStoreException("failed to insert job " + job.getName(), e);
        }
    }

    @Override
    public Optional<RecurringJob> findJob(long id) throws JobStoreException {
        try (Connection c = dataSource.getConnection()) {
            return selectJob(c, "WHERE id = ?", id);
        } catch (SQLException e) {
            throw new JobStoreException("failed to load job " + id, e);
        }
    }

    @Override
    public Optional<RecurringJob> findJobByName(String name) throws JobStoreException {
        try (Connection c = dataSource.getConnection()) {
            return selectJob(c, "WHERE name = ?", name);
        } catch (SQLException e) {
            throw new JobStoreException("failed to load job " + name, e);
        }
    }

    @Override
    public boolean nameExists(String name, Long excludingId) throws JobStoreException {
        String sql = excludingId == null
                ? "SELECT COUNT(*) FROM recurring_jobs WHERE name = ?"
                : "SELECT COUNT(*) FROM recurring_jobs WHERE name = ? AND id <> ?";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, name);
            if (excludingId != null) {
                ps.setLong(2, excludingId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        } catch (SQLException e) {
            throw new JobStoreException("failed to check job name " + name, e);
        }
    }

    @Override
    public List<RecurringJob> listJobs() throws JobStoreException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + JOB_COLUMNS + " FROM recurring_jobs ORDER BY id");
             ResultSet rs = ps.executeQuery()) {
            List<RecurringJob> list = new ArrayList<>();
            while (rs.next()) {
                list.add(mapJob(rs));
            }
            return list;
        } catch (SQLException e) {
            throw new JobStoreException("failed to list jobs", e);
        }
    }

    @Override
    public List<RecurringJob> listJobsByStatus(JobStatus status) throws JobStoreException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + JOB_COLUMNS + " FROM recurring_jobs WHERE status = ? ORDER BY id")) {
            ps.setString(1, status.dbValue());
            List<RecurringJob> list = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    list.add(mapJob(rs));
                }
            }
            return list;
        } catch (SQLException e) {
            throw new JobStoreException("failed to list " + status.dbValue() + " jobs", e);
        }
    }

    @Override
    public void updateJob(RecurringJob job) throws JobStoreException {
        String sql = "UPDATE recurring_jobs SET name = ?, job_key = ?, function_name = ?, cron_expression = ?, "
                + "args = ?, times = ?, status = ?, next_run_at = ?, updated_at = ? WHERE id = ?";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, job.getName());
            ps.setString(2, job.getJobKey());
            ps.setString(3, job.getFunctionName());
            ps.setString(4, job.getCronExpression());
            ps.setString(5, job.getArgs());
            ps.setInt(6, job.getTimes());
            ps.setString(7, job.getStatus().dbValue());
            setInstant(ps, 8, job.getNextRunAt());
            setInstant(ps, 9, Instant.now());
            ps.setLong(10, job.getId());
            requireRow(ps.executeUpdate(), job.getId());
        } catch (SQLException e) {
            throw new JobStoreException("failed to update job " + job.getName(), e);
        }
    }

    @Override
    public void updateStatus(long id, JobStatus status) throws JobStoreException {
        // Only active jobs keep a meaningful next run time.
        String sql = status == JobStatus.ACTIVE
                ? "UPDATE recurring_jobs SET status = ?, updated_at = ? WHERE id = ?"
                : "UPDATE recurring_jobs SET status = ?, next_run_at = NULL, updated_at = ? WHERE id = ?";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status.dbValue());
            setInstant(ps, 2, Instant.now());
            ps.setLong(3, id);
            requireRow(ps.executeUpdate(), id);
        } catch (SQLException e) {
            throw new JobStoreException("failed to set status of job " + id, e);
        }
    }

    @Override
    public void markError(long id, String error) throws JobStoreException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE recurring_jobs SET status = ?, last_error = ?, "
                     + "next_run_at = NULL, updated_at = ? WHERE id = ?")) {
            ps.setString(1, JobStatus.ERROR.dbValue());
            ps.setString(2, error);
            setInstant(ps, 3, Instant.now());
            ps.setLong(4, id);
            requireRow(ps.executeUpdate(), id);
        } catch (SQLException e) {
            throw new JobStoreException("failed to mark job " + id + " as failed", e);
        }
    }

    @Override
    public void updateSchedule(long id, String jobKey, Instant nextRunAt) throws JobStoreException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE recurring_jobs SET job_key = ?, next_run_at = ?, updated_at = ? WHERE id = ?")) {
            ps.setString(1, jobKey);
            setInstant(ps, 2, nextRunAt);
            setInstant(ps, 3, Instant.now());
            ps.setLong(4, id);
            requireRow(ps.executeUpdate(), id);
        } catch (SQLException e) {
            throw new JobStoreException("failed to update schedule of job " + id, e);
        }
    }

    @Override
    public boolean deleteJob(long id) throws JobStoreException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM recurring_jobs WHERE id = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new JobStoreException("failed to delete job " + id, e);
        }
    }

    @Override
    public JobExecution insertExecution(JobExecution execution) throws JobStoreException {
        if (execution.getJobId() == null) {
            throw new JobStoreException("execution has no job");
        }
        String sql = "INSERT INTO recurring_job_executions (recurring_job_id, started_at, success, error, output, duration) "
                + "VALUES (?, ?, ?, ?, ?, ?)";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, execution.getJobId());
            setInstant(ps, 2, execution.getStartedAt());
            ps.setBoolean(3, false);
            ps.setString(4, execution.getError());
            ps.setString(5, execution.getOutput());
            ps.setLong(6, 0L);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new JobStoreException("no id generated for execution of job " + execution.getJobId());
                }
                execution.setId(keys.getLong(1));
            }
            return execution;
        } catch (SQLException e) {
            throw new JobStoreException("failed to create execution for job " + execution.getJobId(), e);
        }
    }

    @Override
    public void finishExecution(JobExecution execution) throws JobStoreException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE recurring_job_executions SET finished_at = ?, "
                     + "success = ?, error = ?, output = ?, duration = ? WHERE id = ? AND finished_at IS NULL")) {
            setInstant(ps, 1, execution.getFinishedAt());
            ps.setBoolean(2, execution.isSuccess());
            ps.setString(3, execution.getError());
            ps.setString(4, execution.getOutput());
            ps.setLong(5, execution.getDuration());
            ps.setLong(6, execution.getId());
            if (ps.executeUpdate() == 0) {
                throw new JobStoreException("execution " + execution.getId() + " missing or already finished");
            }
        } catch (SQLException e) {
            throw new JobStoreException("failed to finish execution " + execution.getId(), e);
        }
    }

    @Override
    public List<JobExecution> listExecutions(long jobId) throws JobStoreException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + EXECUTION_COLUMNS
                     + " FROM recurring_job_executions WHERE recurring_job_id = ? ORDER BY started_at DESC, id DESC")) {
            ps.setLong(1, jobId);
            List<JobExecution> list = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    list.add(mapExecution(rs));
                }
            }
            return list;
        } catch (SQLException e) {
            throw new JobStoreException("failed to list executions of job " + jobId, e);
        }
    }

    @Override
    public int failUnfinishedExecutions(Instant finishedAt, String error) throws JobStoreException {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE recurring_job_executions SET finished_at = ?, "
                     + "success = FALSE, error = ? WHERE finished_at IS NULL")) {
            setInstant(ps, 1, finishedAt);
            ps.setString(2, error);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new JobStoreException("failed to close unfinished executions", e);
        }
    }

    @Override
    public Optional<RecurringJob> recordRun(long jobId, RunOutcome outcome) throws JobStoreException {
        try (Connection c = dataSource.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                Optional<RecurringJob> current = selectJob(c, "WHERE id = ? FOR UPDATE", jobId);
                if (current.isEmpty()) {
                    c.rollback();
                    return Optional.empty();
                }
                RecurringJob job = current.get();
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
                try (PreparedStatement ps = c.prepareStatement("UPDATE recurring_jobs SET times_run = ?, "
                        + "last_run_at = ?, error_count = ?, last_error = ?, next_run_at = ?, status = ?, "
                        + "updated_at = ? WHERE id = ?")) {
                    ps.setInt(1, job.getTimesRun());
                    setInstant(ps, 2, job.getLastRunAt());
                    ps.setInt(3, job.getErrorCount());
                    ps.setString(4, job.getLastError());
                    setInstant(ps, 5, job.getNextRunAt());
                    ps.setString(6, job.getStatus().dbValue());
                    setInstant(ps, 7, job.getUpdatedAt());
                    ps.setLong(8, jobId);
                    ps.executeUpdate();
                }
                c.commit();
                return Optional.of(job);
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new JobStoreException("failed to record run of job " + jobId, e);
        }
    }

    private Optional<RecurringJob> selectJob(Connection c, String where, Object key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + JOB_COLUMNS + " FROM recurring_jobs " + where)) {
            ps.setObject(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapJob(rs)) : Optional.empty();
            }
        }
    }

    private static RecurringJob mapJob(ResultSet rs) throws SQLException {
        RecurringJob job = new RecurringJob();
        job.setId(rs.getLong("id"));
        job.setName(rs.getString("name"));
        job.setJobKey(rs.getString("job_key"));
        job.setFunctionName(rs.getString("function_name"));
        job.setCronExpression(rs.getString("cron_expression"));
        job.setArgs(rs.getString("args"));
        job.setTimes(rs.getInt("times"));
        job.setTimesRun(rs.getInt("times_run"));
        job.setStatus(JobStatus.fromDb(rs.getString("status")));
        job.setLastRunAt(getInstant(rs, "last_run_at"));
        job.setNextRunAt(getInstant(rs, "next_run_at"));
        job.setErrorCount(rs.getInt("error_count"));
        job.setLastError(rs.getString("last_error"));
        job.setCreatedAt(getInstant(rs, "created_at"));
        job.setUpdatedAt(getInstant(rs, "updated_at"));
        return job;
    }

    private static JobExecution mapExecution(ResultSet rs) throws SQLException {
        JobExecution execution = new JobExecution();
        execution.setId(rs.getLong("id"));
        long jobId = rs.getLong("recurring_job_id");
        execution.setJobId(rs.wasNull() ? null : jobId);
        execution.setStartedAt(getInstant(rs, "started_at"));
        execution.setFinishedAt(getInstant(rs, "finished_at"));
        execution.setSuccess(rs.getBoolean("success"));
        execution.setError(rs.getString("error"));
        execution.setOutput(rs.getString("output"));
        execution.setDuration(rs.getLong("duration"));
        return execution;
    }

    private static void requireRow(int updated, long id) throws JobStoreException {
        if (updated == 0) {
            throw new JobStoreException("job " + id + " does not exist");
        }
    }

    private static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(index, value.atOffset(ZoneOffset.UTC));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
