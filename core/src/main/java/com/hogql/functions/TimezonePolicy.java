package com.hogql.functions;

/**
 * Decides whether a call to a timezone-aware function already carries an explicit
 * timezone argument.
 *
 * @see SpecialRule#ADD_TIMEZONE_ARG
 */
public enum TimezonePolicy {

    /**
     * The timezone slot is the position directly after the required arguments. A call
     * supplies an explicit timezone when it has more than {@code minArgs} arguments.
     */
    ARGUMENT_COUNT {
        @Override
        public boolean timezoneSupplied(FunctionSignature signature, int argumentCount) {
            return argumentCount > signature.arity().effectiveMin();
        }
    },

    /**
     * Callers never supply the timezone; it is always appended.
     */
    ALWAYS_APPEND {
        @Override
        public boolean timezoneSupplied(FunctionSignature signature, int argumentCount) {
            return false;
        }
    };

    /**
     * Returns whether the caller already supplied the timezone argument.
     *
     * @param signature the resolved signature
     * @param argumentCount the number of explicit arguments
     * @return true if no timezone should be appended
     */
    public abstract boolean timezoneSupplied(FunctionSignature signature, int argumentCount);
}
