package com.hogql.generator;

import java.util.regex.Pattern;

/**
 * Utilities for safely quoting ClickHouse identifiers and string literals.
 *
 * <p>ClickHouse treats the backslash as an escape character inside both quoted
 * identifiers and string literals, so doubling the quote character alone is not enough.
 * Every character that could terminate the quoted token or start an escape sequence is
 * escaped here.
 *
 * <p>Example usage:
 * <pre>
 *   ClickHouseQuoting.quoteIdentifier("event");      // `event`
 *   ClickHouseQuoting.quoteLiteral("O'Reilly");      // 'O\'Reilly'
 *   ClickHouseQuoting.quoteIdentifierIfNeeded("a b") // `a b`
 * </pre>
 */
public final class ClickHouseQuoting {

    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private ClickHouseQuoting() {
        // Utility class - prevent instantiation
    }

    /**
     * Quotes an identifier (column name, alias) with backticks.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "`" + escape(identifier, '`') + "`";
    }

    /**
     * Returns the identifier bare when it is a plain word, quoted otherwise.
     *
     * @param identifier the identifier
     * @return the identifier, quoted only if necessary
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        if (SIMPLE_IDENTIFIER.matcher(identifier).matches()) {
            return identifier;
        }
        return quoteIdentifier(identifier);
    }

    /**
     * Quotes a string literal value.
     *
     * <p>Returns {@code null} (without quotes) if the value is null.
     *
     * @param value the string value to quote
     * @return quoted literal safe for SQL
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "null";
        }
        return "'" + escape(value, '\'') + "'";
    }

    private static String escape(String value, char quote) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\0':
                    sb.append("\\0");
                    break;
                default:
                    if (c == quote) {
                        sb.append('\\').append(c);
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }
}
