package com.tickwork.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryJobStoreTest {

    @Test
    public void testMirrorsJdbcConstraints() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        RecurringJob job = new RecurringJob();
        job.setName("dup");
        job.setFunctionName("log");
        job.setCronExpression("* * * * *");
        RecurringJob saved = store.insertJob(job);
        assertThrows(JobStoreException.class, () -> store.insertJob(job));

        JobExecution orphan = new JobExecution();
        orphan.setJobId(saved.getId() + 1);
        orphan.setStartedAt(Instant.now());
        assertThrows(JobStoreException.class, () -> store.insertExecution(orphan));

        JobExecution execution = new JobExecution();
        execution.setJobId(saved.getId());
        execution.setStartedAt(Instant.now());
        store.insertExecution(execution);
        assertEquals(1, store.listExecutions(saved.getId()).size());

        assertTrue(store.deleteJob(saved.getId()));
        assertTrue(store.listExecutions(saved.getId()).isEmpty());
        assertTrue(store.recordRun(saved.getId(), new RunOutcome(Instant.now(), true, null, null)).isEmpty());
    }

    @Test
    public void testUpdateLeavesCountersAlone() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        RecurringJob job = new RecurringJob();
        job.setName("tally");
        job.setFunctionName("log");
        job.setCronExpression("* * * * *");
        RecurringJob stale = store.insertJob(job);
        store.recordRun(stale.getId(), new RunOutcome(Instant.now(), true, null, null));

        stale.setFunctionName("fail");
        store.updateJob(stale);

        RecurringJob loaded = store.findJob(stale.getId()).orElseThrow();
        assertEquals("fail", loaded.getFunctionName());
        assertEquals(1, loaded.getTimesRun());
        assertNotNull(loaded.getLastRunAt());
    }

    @Test
    public void testReturnsCopies() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        RecurringJob job = new RecurringJob();
        job.setName("copy");
        job.setFunctionName("log");
        job.setCronExpression("* * * * *");
        RecurringJob saved = store.insertJob(job);

        saved.setTimesRun(99);
        store.findJob(saved.getId()).orElseThrow().setStatus(JobStatus.PAUSED);

        RecurringJob loaded = store.findJob(saved.getId()).orElseThrow();
        assertEquals(0, loaded.getTimesRun());
        assertEquals(JobStatus.ACTIVE, loaded.getStatus());
    }
}
