package com.tickwork.core;

/**
 * Levels used in execution output lines. Viewers style each line by the level tag it carries.
 */
public enum ExecutionLogLevel {
    INFO,
    WARN,
    ERROR,
    DEBUG;

    /** Tag as written into the output, e.g. {@code [WARN]}. */
    public String tag() {
        return "[" + name() + "]";
    }
}
