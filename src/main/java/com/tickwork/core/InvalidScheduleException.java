package com.tickwork.core;

/**
 * Raised for cron expressions that cannot be parsed or never fire.
 */
public class InvalidScheduleException extends JobException {
    private final String expression;

    public InvalidScheduleException(String expression, String reason) {
        super("invalid cron expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public InvalidScheduleException(String expression, String reason, Throwable cause) {
        super("invalid cron expression '" + expression + "': " + reason, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
