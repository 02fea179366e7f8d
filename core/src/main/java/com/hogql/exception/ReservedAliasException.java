package com.hogql.exception;

/**
 * Thrown when a user-chosen alias collides with the reserved vocabulary.
 */
public class ReservedAliasException extends QueryCompilationException {

    private final String alias;

    public ReservedAliasException(String alias) {
        super("Alias '" + alias + "' is a reserved keyword");
        this.alias = alias;
    }

    public String alias() {
        return alias;
    }

    @Override
    public String getUserMessage() {
        return "Cannot use '" + alias + "' as an alias. Choose a different name.";
    }
}
