package com.tickwork.core;

/**
 * Raised when an operation is not allowed in the job's (or the manager's) current state,
 * e.g. resuming a job that is not paused.
 */
public class InvalidStateException extends JobException {
    public InvalidStateException(String message) {
        super(message);
    }
}
