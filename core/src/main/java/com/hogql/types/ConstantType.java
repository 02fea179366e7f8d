package com.hogql.types;

/**
 * The closed set of value kinds HogQL recognizes for constants.
 *
 * <p>Every literal encountered during compilation maps to exactly one of these kinds.
 * {@link #UNKNOWN} is the fallback for values whose type cannot be determined locally.
 * It is permissive: consumers must accept it wherever a concrete kind would be accepted.
 *
 * <p>Nullability is orthogonal to the kind, see {@link ResolvedConstantType}.
 */
public enum ConstantType {
    INTEGER("int"),
    FLOAT("float"),
    STRING("str"),
    BOOLEAN("bool"),
    ARRAY("array"),
    TUPLE("tuple"),
    DATE("date"),
    DATETIME("datetime"),
    UUID("uuid"),
    UNKNOWN("unknown");

    private final String typeName;

    ConstantType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * Returns the HogQL name of this kind.
     *
     * @return the type name, e.g. "int" or "datetime"
     */
    public String typeName() {
        return typeName;
    }

    /**
     * Returns whether a value of kind {@code actual} may be used where this kind is expected.
     *
     * <p>{@link #UNKNOWN} on either side is always accepted.
     *
     * @param actual the kind of the supplied value
     * @return true if compatible
     */
    public boolean accepts(ConstantType actual) {
        return this == UNKNOWN || actual == UNKNOWN || this == actual;
    }

    /**
     * Returns whether this kind is a container of other constants.
     */
    public boolean isContainer() {
        return this == ARRAY || this == TUPLE;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
