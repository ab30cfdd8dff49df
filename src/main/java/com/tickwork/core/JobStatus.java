package com.tickwork.core;

import java.util.Locale;

/**
 * Lifecycle state of a recurring job. Only {@link #ACTIVE} jobs own a live timer.
 */
public enum JobStatus {
    ACTIVE,
    PAUSED,
    COMPLETED,
    ERROR;

    /** Value stored in the {@code status} column. */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromDb(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("status is required");
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
