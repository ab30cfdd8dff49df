package com.tickwork.admin;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.tickwork.core.JobException;
import com.tickwork.core.JobExecution;
import com.tickwork.core.JobStoreException;
import com.tickwork.core.JsonUtil;
import com.tickwork.core.Metrics;
import com.tickwork.core.RecurringJob;
import com.tickwork.core.TaskManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Admin operations over a {@link TaskManager}. Jobs are referenced by numeric id or by name;
 * mutations report their outcome as an {@link AdminResult} instead of throwing.
 */
public class JobAdminService {
    private static final Logger log = LoggerFactory.getLogger(JobAdminService.class);

    private final TaskManager manager;

    public JobAdminService(TaskManager manager) {
        this.manager = manager;
    }

    public List<RecurringJob> listJobs() throws JobStoreException {
        return manager.listJobs();
    }

    public RecurringJob getJob(String ref) throws JobException {
        if (isId(ref)) {
            return manager.getJob(Long.parseLong(ref));
        }
        return manager.getJob(ref);
    }

    public List<JobExecution> listExecutions(String ref) throws JobException {
        return manager.listExecutions(getJob(ref).getName());
    }

    public Set<String> functionNames() {
        return manager.getRegistry().names();
    }

    public Metrics metrics() {
        return manager.getMetrics();
    }

    public AdminResult create(JobForm form) {
        try {
            RecurringJob job = manager.addJob(form.name(), form.functionName(), parseArgs(form.args()),
                    form.timesOrUnlimited(), form.cronExpression());
            return AdminResult.ok("Job " + job.getName() + " created", job);
        } catch (JobException e) {
            return failed("Create failed", e);
        } catch (IllegalArgumentException e) {
            return AdminResult.failed(e.getMessage(), null, AdminResult.Failure.INVALID);
        }
    }

    /** Updates the job keeping its status, as an edit from the admin form does. */
    public AdminResult update(long id, JobForm form) {
        return update(id, form, true);
    }

    public AdminResult update(long id, JobForm form, boolean keepStatus) {
        try {
            RecurringJob job = manager.updateJob(id, form.name(), form.functionName(), parseArgs(form.args()),
                    form.timesOrUnlimited(), form.cronExpression(), keepStatus);
            return AdminResult.ok("Job " + job.getName() + " updated", job);
        } catch (JobException e) {
            return failed("Update failed", e);
        } catch (IllegalArgumentException e) {
            return AdminResult.failed(e.getMessage(), null, AdminResult.Failure.INVALID);
        }
    }

    public AdminResult delete(String ref) {
        try {
            RecurringJob job = getJob(ref);
            manager.removeJob(job.getName());
            return AdminResult.ok("Job " + job.getName() + " deleted", job);
        } catch (JobException e) {
            return failed("Delete failed", e);
        }
    }

    public AdminResult pause(String ref) {
        try {
            RecurringJob job = manager.pauseJob(getJob(ref).getName());
            return AdminResult.ok("Job " + job.getName() + " paused", job);
        } catch (JobException e) {
            return failed("Pause failed", e);
        }
    }

    public AdminResult resume(String ref) {
        try {
            RecurringJob job = manager.resumeJob(getJob(ref).getName());
            return AdminResult.ok("Job " + job.getName() + " resumed", job);
        } catch (JobException e) {
            return failed("Resume failed", e);
        }
    }

    public AdminResult runNow(String ref) {
        try {
            RecurringJob job = getJob(ref);
            manager.runJobNow(job.getName());
            return AdminResult.ok("Job " + job.getName() + " queued for execution", job);
        } catch (JobException e) {
            return failed("Run failed", e);
        }
    }

    /**
     * Turns the argument text of a form into the value stored for the job: JSON text is parsed,
     * anything else is taken as a plain string. Blank text means no arguments.
     */
    static Object parseArgs(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return JsonUtil.mapper().reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).readTree(text);
        } catch (IOException e) {
            return text;
        }
    }

    private static AdminResult failed(String action, JobException e) {
        AdminResult.Failure failure = AdminResult.Failure.of(e);
        if (failure == AdminResult.Failure.STORE) {
            log.error("{}: {}", action, e.getMessage(), e);
        }
        return AdminResult.failed(action + ": " + e.getMessage(), e.getJob().orElse(null), failure);
    }

    private static boolean isId(String ref) {
        if (ref == null || ref.isEmpty() || ref.length() > 18) {
            return false;
        }
        for (int i = 0; i < ref.length(); i++) {
            if (!Character.isDigit(ref.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
