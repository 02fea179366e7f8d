package com.hogql.exception;

import com.hogql.functions.Arity;
import com.hogql.test.TestBase;
import com.hogql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the compilation exception hierarchy and its messages.
 */
@DisplayName("Error Handling Tests")
@TestCategories.Unit
public class ErrorHandlingTest extends TestBase {

    @Test
    @DisplayName("Technical message carries type, message and expression")
    void testTechnicalMessage() {
        QueryCompilationException exception = new QueryCompilationException("bad node", "lower(DISTINCT name)");

        String technical = exception.getTechnicalMessage();

        logData("Technical message", technical);
        assertThat(technical)
            .startsWith("HogQL Compilation Failed\n")
            .contains("QueryCompilationException: bad node")
            .contains("Expression: lower(DISTINCT name)");
        assertThat(exception.getUserMessage()).isEqualTo("bad node");
        assertThat(exception.getExpression()).isEqualTo("lower(DISTINCT name)");
    }

    @Test
    @DisplayName("Technical message includes the cause")
    void testCause() {
        SettingsValidationException exception =
            new SettingsValidationException("Failed to parse settings JSON", new IllegalStateException("EOF"));

        assertThat(exception.getTechnicalMessage()).contains("Cause: EOF");
        assertThat(exception.getExpression()).isNull();
    }

    @Test
    @DisplayName("Unknown functions explain case sensitivity to the user")
    void testUnknownFunctionUserMessage() {
        UnknownFunctionException exception = new UnknownFunctionException("Count");

        assertThat(exception.getMessage()).isEqualTo("Unsupported function call 'Count(...)'");
        assertThat(exception.getUserMessage())
            .contains("'Count'")
            .contains("case-sensitive");
    }

    @Test
    @DisplayName("Arity messages describe every bound shape")
    void testArityMessages() {
        assertThat(new ArityMismatchException("f", 3, Arity.exactly(2)).getMessage())
            .isEqualTo("Function 'f' expects exactly 2 arguments, found 3");
        assertThat(new ArityMismatchException("f", 0, Arity.between(1, 3)).getMessage())
            .isEqualTo("Function 'f' expects between 1 and 3 arguments, found 0");
        assertThat(new ArityMismatchException("f", 0, Arity.atLeast(1)).getMessage())
            .isEqualTo("Function 'f' expects at least 1 argument, found 0");
        assertThat(new ArityMismatchException("f", 4, Arity.of(null, 3)).getMessage())
            .isEqualTo("Function 'f' expects at most 3 arguments, found 4");
    }

    @Test
    @DisplayName("Every compilation failure shares one base type")
    void testHierarchy() {
        assertThat(new UnknownFunctionException("x")).isInstanceOf(QueryCompilationException.class);
        assertThat(new ArityMismatchException("x", 1, Arity.exactly(0))).isInstanceOf(QueryCompilationException.class);
        assertThat(new IllegalArgumentShapeException("x", 0, "y")).isInstanceOf(QueryCompilationException.class);
        assertThat(new ReservedAliasException("team_id")).isInstanceOf(QueryCompilationException.class);
        assertThat(new UnknownSettingKeyException("k")).isInstanceOf(SettingsValidationException.class);
        assertThat(new InvalidSettingValueException("k", 1, "c")).isInstanceOf(SettingsValidationException.class);
        assertThat(new QueryCompilationException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    @DisplayName("Arity rejects inverted and negative bounds")
    void testInvalidArity() {
        assertThatThrownBy(() -> Arity.between(3, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Arity.atLeast(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
