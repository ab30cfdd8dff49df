package com.tickwork.admin;

import com.tickwork.core.DuplicateNameException;
import com.tickwork.core.InvalidStateException;
import com.tickwork.core.JobNotFoundException;
import com.tickwork.core.JobStoreException;
import com.tickwork.core.RecurringJob;

/**
 * Outcome of an admin action: a user-facing message plus the affected job when there is one.
 */
public record AdminResult(boolean success, String message, RecurringJob job, Failure failure) {

    /** Why an action failed. */
    public enum Failure {
        NOT_FOUND,
        CONFLICT,
        INVALID,
        STORE;

        static Failure of(Exception e) {
            if (e instanceof JobNotFoundException) {
                return NOT_FOUND;
            }
            if (e instanceof DuplicateNameException || e instanceof InvalidStateException) {
                return CONFLICT;
            }
            if (e instanceof JobStoreException) {
                return STORE;
            }
            return INVALID;
        }
    }

    static AdminResult ok(String message, RecurringJob job) {
        return new AdminResult(true, message, job, null);
    }

    static AdminResult failed(String message, RecurringJob job, Failure failure) {
        return new AdminResult(false, message, job, failure);
    }
}
