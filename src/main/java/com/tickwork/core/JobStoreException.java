package com.tickwork.core;

/**
 * Wraps failures of the underlying persistence layer.
 */
public class JobStoreException extends JobException {
    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobStoreException(String message) {
        super(message);
    }
}
