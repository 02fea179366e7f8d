package com.hogql.exception;

/**
 * Exception thrown when a HogQL expression cannot be compiled to ClickHouse SQL.
 *
 * <p>This is the root of every failure raised by the translation core. None of these
 * failures are recoverable locally: the tables they are checked against are immutable,
 * so retrying the same input always fails the same way.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Unknown function names</li>
 *   <li>Wrong number of arguments</li>
 *   <li>Illegal argument shapes for precision-sensitive functions</li>
 *   <li>Aliases colliding with reserved keywords</li>
 *   <li>Unknown or invalid query settings</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       String sql = translator.generate(expression);
 *   } catch (QueryCompilationException e) {
 *       response.error(e.getUserMessage());
 *   }
 * </pre>
 *
 * @see com.hogql.generator.ExpressionTranslator
 */
public class QueryCompilationException extends RuntimeException {

    private final String expression;

    /**
     * Creates a compilation exception.
     *
     * @param message the error message
     */
    public QueryCompilationException(String message) {
        this(message, (String) null);
    }

    /**
     * Creates a compilation exception for a specific expression.
     *
     * @param message the error message
     * @param expression the HogQL text of the failing expression (may be null)
     */
    public QueryCompilationException(String message, String expression) {
        super(message);
        this.expression = expression;
    }

    /**
     * Creates a compilation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public QueryCompilationException(String message, Throwable cause) {
        super(message, cause);
        this.expression = null;
    }

    /**
     * Returns the expression that failed to compile.
     *
     * @return the failing expression, or null if not available
     */
    public String getExpression() {
        return expression;
    }

    /**
     * Returns a message suitable for showing to the author of the query.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        return getMessage();
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("HogQL Compilation Failed\n");
        sb.append("Error: ").append(getClass().getSimpleName()).append(": ").append(getMessage()).append("\n");

        if (expression != null) {
            sb.append("Expression: ").append(expression).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
