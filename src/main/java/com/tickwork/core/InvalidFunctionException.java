package com.tickwork.core;

/**
 * Raised when a job refers to a function name that is not registered.
 */
public class InvalidFunctionException extends JobException {
    private final String functionName;

    public InvalidFunctionException(String functionName) {
        super("function is not registered: " + functionName);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
