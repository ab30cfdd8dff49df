package com.tickwork.core;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TimeZone;

/**
 * Standard five-field cron schedule ({@code minute hour day-of-month month day-of-week}),
 * evaluated through Quartz's {@link CronExpression}.
 *
 * <p>Unix cron numbers Sunday as 0 (or 7) while Quartz uses 1-7 starting at Sunday, and Quartz
 * requires {@code ?} in one of the two day fields, so expressions are rewritten before parsing.
 * Restricting both day fields at once is rejected.
 */
public final class CronSchedule {
    private static final Map<String, String> DESCRIPTORS = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *");

    private final String expression;
    private final String quartzExpression;
    private final CronExpression cron;

    private CronSchedule(String expression, String quartzExpression, CronExpression cron) {
        this.expression = expression;
        this.quartzExpression = quartzExpression;
        this.cron = cron;
    }

    public static CronSchedule parse(String expression, ZoneId zone) throws InvalidScheduleException {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(String.valueOf(expression), "expression is required");
        }
        String trimmed = expression.trim();
        String fiveField = trimmed.startsWith("@")
                ? DESCRIPTORS.get(trimmed.toLowerCase(Locale.ROOT))
                : trimmed;
        if (fiveField == null) {
            throw new InvalidScheduleException(trimmed, "unknown descriptor");
        }
        String[] fields = fiveField.split("\\s+");
        if (fields.length != 5) {
            throw new InvalidScheduleException(trimmed, "expected 5 fields but found " + fields.length);
        }

        String dom = fields[2];
        String dow = fields[4];
        boolean anyDom = "*".equals(dom) || "?".equals(dom);
        boolean anyDow = "*".equals(dow) || "?".equals(dow);
        if (!anyDom && !anyDow) {
            throw new InvalidScheduleException(trimmed, "day-of-month and day-of-week cannot both be restricted");
        }
        String quartzDom = anyDom && !anyDow ? "?" : dom;
        String quartzDow = anyDow ? "?" : convertDayOfWeek(trimmed, dow);
        String quartz = String.join(" ", "0", fields[0], fields[1], quartzDom, fields[3], quartzDow);

        CronExpression cron;
        try {
            cron = new CronExpression(quartz);
        } catch (ParseException | RuntimeException e) {
            throw new InvalidScheduleException(trimmed, String.valueOf(e.getMessage()), e);
        }
        cron.setTimeZone(TimeZone.getTimeZone(zone));
        return new CronSchedule(trimmed, quartz, cron);
    }

    /** First fire time strictly after {@code after}; empty when the schedule never fires again. */
    public Optional<Instant> nextAfter(Instant after) {
        Date next = cron.getNextValidTimeAfter(Date.from(after));
        return next == null ? Optional.empty() : Optional.of(next.toInstant());
    }

    /** Expression as supplied by the user. */
    public String expression() {
        return expression;
    }

    /** Equivalent six-field Quartz expression. */
    public String quartzExpression() {
        return quartzExpression;
    }

    private static String convertDayOfWeek(String expression, String field) throws InvalidScheduleException {
        StringBuilder out = new StringBuilder();
        for (String part : field.split(",")) {
            if (out.length() > 0) {
                out.append(',');
            }
            out.append(convertDayOfWeekPart(expression, part));
        }
        return out.toString();
    }

    private static String convertDayOfWeekPart(String expression, String part) throws InvalidScheduleException {
        String step = "";
        String range = part;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            step = part.substring(slash);
            range = part.substring(0, slash);
        }
        if ("*".equals(range)) {
            return step.isEmpty() ? "*" : "1" + step;
        }
        int dash = range.indexOf('-');
        if (dash > 0) {
            String from = range.substring(0, dash);
            String to = range.substring(dash + 1);
            if (isNumber(from) && isNumber(to)) {
                int start = dayNumber(expression, from);
                int end = dayNumber(expression, to);
                if (end == 7 && start == 0) {
                    return "1-7" + step;
                }
                if (end == 7) {
                    if (!step.isEmpty()) {
                        throw new InvalidScheduleException(expression, "stepped day-of-week range ending at 7 is not supported");
                    }
                    // Sunday written as 7 closes the range; Quartz needs it as a separate day.
                    return start == 6 ? "7,1" : (start + 1) + "-7,1";
                }
                return (start + 1) + "-" + (end % 7 + 1) + step;
            }
            return range + step;
        }
        if (isNumber(range)) {
            return (dayNumber(expression, range) % 7 + 1) + step;
        }
        return part;
    }

    private static int dayNumber(String expression, String value) throws InvalidScheduleException {
        int day = value.length() > 2 ? Integer.MAX_VALUE : Integer.parseInt(value);
        if (day > 7) {
            throw new InvalidScheduleException(expression, "day-of-week out of range: " + value);
        }
        return day;
    }

    private static boolean isNumber(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return expression;
    }
}
