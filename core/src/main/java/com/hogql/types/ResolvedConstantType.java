package com.hogql.types;

import java.util.Objects;

/**
 * A constant kind together with its nullability.
 *
 * <p>Every {@link ConstantType} may additionally be "or null". An absent value resolves to
 * a nullable {@link ConstantType#UNKNOWN}.
 */
public record ResolvedConstantType(ConstantType type, boolean nullable) {

    public ResolvedConstantType {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static ResolvedConstantType of(ConstantType type) {
        return new ResolvedConstantType(type, false);
    }

    public static ResolvedConstantType nullableOf(ConstantType type) {
        return new ResolvedConstantType(type, true);
    }

    /**
     * Returns a copy of this type that admits null.
     */
    public ResolvedConstantType orNull() {
        return nullable ? this : new ResolvedConstantType(type, true);
    }

    @Override
    public String toString() {
        return nullable ? type.typeName() + " | null" : type.typeName();
    }
}
