package com.tickwork.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class CronScheduleTest {
    private static final ZoneId UTC = ZoneOffset.UTC;

    private static Instant next(String expression, String after) throws Exception {
        return CronSchedule.parse(expression, UTC).nextAfter(Instant.parse(after)).orElseThrow();
    }

    @Test
    public void testConvertsToQuartz() throws Exception {
        assertEquals("0 * * * * ?", CronSchedule.parse("* * * * *", UTC).quartzExpression());
        assertEquals("0 */5 * * * ?", CronSchedule.parse("*/5 * * * *", UTC).quartzExpression());
        assertEquals("0 30 9 ? * 2-6", CronSchedule.parse("30 9 * * 1-5", UTC).quartzExpression());
        assertEquals("0 0 0 1 * ?", CronSchedule.parse("0 0 1 * *", UTC).quartzExpression());
        assertEquals("0 0 12 ? * 1", CronSchedule.parse("0 12 * * 0", UTC).quartzExpression());
        assertEquals("0 0 12 ? * 1", CronSchedule.parse("0 12 * * 7", UTC).quartzExpression());
        assertEquals("0 0 12 ? * 6-7,1", CronSchedule.parse("0 12 * * 5-7", UTC).quartzExpression());
        assertEquals("0 0 0 ? * 1", CronSchedule.parse("@weekly", UTC).quartzExpression());
    }

    @Test
    public void testNextFireTimes() throws Exception {
        assertEquals(Instant.parse("2024-01-01T00:01:00Z"), next("* * * * *", "2024-01-01T00:00:30Z"));
        assertEquals(Instant.parse("2024-01-01T00:05:00Z"), next("*/5 * * * *", "2024-01-01T00:00:00Z"));
        // 2024-01-06 is a Saturday
        assertEquals(Instant.parse("2024-01-08T09:30:00Z"), next("30 9 * * 1-5", "2024-01-06T00:00:00Z"));
        assertEquals(Instant.parse("2024-01-07T12:00:00Z"), next("0 12 * * 0", "2024-01-06T00:00:00Z"));
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), next("@daily", "2024-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), next("@yearly", "2024-01-01T00:00:00Z"));
    }

    @Test
    public void testTimeZone() throws Exception {
        CronSchedule schedule = CronSchedule.parse("0 9 * * *", ZoneId.of("Asia/Shanghai"));
        assertEquals(Instant.parse("2024-01-02T01:00:00Z"),
                schedule.nextAfter(Instant.parse("2024-01-01T02:00:00Z")).orElseThrow());
    }

    @Test
    public void testRejectsInvalidExpressions() {
        assertThrows(InvalidScheduleException.class, () -> CronSchedule.parse("", UTC));
        assertThrows(InvalidScheduleException.class, () -> CronSchedule.parse("* * * *", UTC));
        assertThrows(InvalidScheduleException.class, () -> CronSchedule.parse("0 0 * * * *", UTC));
        assertThrows(InvalidScheduleException.class, () -> CronSchedule.parse("60 * * * *", UTC));
        assertThrows(InvalidScheduleException.class, () -> CronSchedule.parse("0 0 1 * 1", UTC));
        assertThrows(InvalidScheduleException.class, () -> CronSchedule.parse("0 0 * * 8", UTC));
        assertThrows(InvalidScheduleException.class, () -> CronSchedule.parse("@fortnightly", UTC));
        assertThrows(InvalidScheduleException.class, () -> CronSchedule.parse("bogus * * * *", UTC));
    }

    @Test
    public void testInvalidScheduleMessage() {
        InvalidScheduleException e = assertThrows(InvalidScheduleException.class,
                () -> CronSchedule.parse("* * *", UTC));
        assertTrue(e.getMessage().contains("expected 5 fields"), e.getMessage());
    }

    @Test
    public void testScheduleThatNeverFires() throws Exception {
        CronSchedule schedule = CronSchedule.parse("0 0 30 2 *", UTC);
        assertTrue(schedule.nextAfter(Instant.parse("2024-01-01T00:00:00Z")).isEmpty());
    }
}
