package com.hogql.functions;

import com.hogql.expression.Call;
import com.hogql.expression.Expression;

import java.util.List;
import java.util.Objects;

/**
 * The ClickHouse call produced by {@link CallRewriter}: the target name and the final
 * argument list, including any injected arguments.
 */
public record RewrittenCall(String targetName, List<Expression> arguments) {

    public RewrittenCall {
        Objects.requireNonNull(targetName, "targetName must not be null");
        arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments must not be null"));
    }

    /**
     * Converts this result into an AST node the caller can substitute into its tree.
     *
     * @return the call expression
     */
    public Call toCall() {
        return new Call(targetName, arguments);
    }

    public String toSQL() {
        return toCall().toSQL();
    }
}
