package com.hogql.exception;

/**
 * Thrown when a call names a function that is not in any registry namespace.
 *
 * <p>Unknown names are never passed through to ClickHouse.
 */
public class UnknownFunctionException extends QueryCompilationException {

    private final String functionName;

    public UnknownFunctionException(String functionName) {
        super("Unsupported function call '" + functionName + "(...)'", functionName + "(...)");
        this.functionName = functionName;
    }

    /**
     * Returns the name that failed to resolve.
     *
     * @return the unknown function name
     */
    public String functionName() {
        return functionName;
    }

    @Override
    public String getUserMessage() {
        return "Function '" + functionName + "' is not supported in HogQL. " +
               "Function names are case-sensitive.";
    }
}
