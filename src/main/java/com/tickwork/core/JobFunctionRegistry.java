package com.tickwork.core;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps function names to job logic. Registering a name twice replaces the earlier function.
 */
public class JobFunctionRegistry {
    private final ConcurrentMap<String, JobFunction> functions = new ConcurrentHashMap<>();

    public void register(String name, JobFunction function) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("function name is required");
        }
        if (function == null) {
            throw new IllegalArgumentException("function is required");
        }
        functions.put(name, function);
    }

    public Optional<JobFunction> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return name != null && functions.containsKey(name);
    }

    /** Registered names in alphabetical order. */
    public Set<String> names() {
        return new TreeSet<>(functions.keySet());
    }
}
