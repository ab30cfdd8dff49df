package com.tickwork.core;

public class DuplicateNameException extends JobException {
    private final String name;

    public DuplicateNameException(String name) {
        super("job name already exists: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
