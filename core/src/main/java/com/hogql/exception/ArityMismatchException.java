package com.hogql.exception;

import com.hogql.functions.Arity;

/**
 * Thrown when a call supplies a number of arguments outside the declared bounds.
 */
public class ArityMismatchException extends QueryCompilationException {

    private final String functionName;
    private final int actual;
    private final Arity arity;

    public ArityMismatchException(String functionName, int actual, Arity arity) {
        super("Function '" + functionName + "' expects " + arity.describe() +
              " argument" + (arity.isSingular() ? "" : "s") + ", found " + actual);
        this.functionName = functionName;
        this.actual = actual;
        this.arity = arity;
    }

    public String functionName() {
        return functionName;
    }

    public int actual() {
        return actual;
    }

    public Arity arity() {
        return arity;
    }
}
