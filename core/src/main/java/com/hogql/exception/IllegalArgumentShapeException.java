package com.hogql.exception;

/**
 * Thrown when an argument has a shape the target function cannot accept, such as a
 * sub-second datetime passed where ClickHouse requires a whole-second {@code DateTime}.
 */
public class IllegalArgumentShapeException extends QueryCompilationException {

    private final String functionName;
    private final int argumentIndex;

    public IllegalArgumentShapeException(String functionName, int argumentIndex, String message) {
        super("Argument " + (argumentIndex + 1) + " of '" + functionName + "': " + message);
        this.functionName = functionName;
        this.argumentIndex = argumentIndex;
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Returns the zero-based position of the offending argument.
     */
    public int argumentIndex() {
        return argumentIndex;
    }
}
