package com.tickwork.core;

public class JobNotFoundException extends JobException {
    public JobNotFoundException(String reference) {
        super("job not found: " + reference);
    }
}
