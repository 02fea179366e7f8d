package com.hogql.generator;

import com.hogql.exception.QueryCompilationException;
import com.hogql.exception.UnknownFunctionException;
import com.hogql.exception.UnknownSettingKeyException;
import com.hogql.expression.Alias;
import com.hogql.expression.Call;
import com.hogql.expression.Expression;
import com.hogql.expression.FieldReference;
import com.hogql.test.TestBase;
import com.hogql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.ArrayList;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for QueryCompiler.
 */
@DisplayName("QueryCompiler Tests")
@TestCategories.Integration
public class QueryCompilerTest extends TestBase {

    private final QueryCompiler compiler = new QueryCompiler(new ExpressionTranslator(new QueryContext(1, "UTC")));

    private static final List<Expression> COLUMNS = List.of(
        new Alias(Call.of("count"), "total"),
        Call.of("toStartOfDay", Call.of("toDateTime", FieldReference.of("timestamp"))),
        FieldReference.of("event"));

    @Test
    @DisplayName("A query compiles with default settings and limit")
    void testDefaults() {
        logStep("When compiling a query without settings or limit");
        CompiledQuery query = compiler.compile(COLUMNS, Map.of(), OptionalLong.empty());

        logStep("Then columns keep their order and defaults apply");
        logData("Select list", query.selectList());
        assertThat(query.columns()).containsExactly(
            "count() AS total",
            "toStartOfDay(parseDateTime64BestEffortOrNull(timestamp, 'UTC'))",
            "event");
        assertThat(query.limit()).isEqualTo(100);
        assertThat(query.limitClause()).isEqualTo("LIMIT 100");
        assertThat(query.settingsClause()).isEqualTo("SETTINGS readonly=2, max_execution_time=60");
    }

    @Test
    @DisplayName("Requested settings and limits are enforced")
    void testOverrides() {
        CompiledQuery query = compiler.compile(COLUMNS, Map.of("max_execution_time", 300), OptionalLong.of(50_000));

        assertThat(query.limit()).isEqualTo(10_000);
        assertThat(query.settings().maxExecutionTimeSeconds()).isEqualTo(300);
        assertThat(query.settingsClause()).isEqualTo("SETTINGS readonly=2, max_execution_time=300");
    }

    @Test
    @DisplayName("Invalid settings fail before any column is compiled")
    void testSettingsFirst() {
        List<Expression> broken = List.of(Call.of("notAFunction"));

        assertThatThrownBy(() -> compiler.compile(broken, Map.of("bogus", 1), OptionalLong.empty()))
            .isInstanceOf(UnknownSettingKeyException.class);
    }

    @Test
    @DisplayName("One bad column fails the whole query")
    void testBadColumn() {
        List<Expression> columns = List.of(FieldReference.of("event"), Call.of("system.numbers"));

        assertThatThrownBy(() -> compiler.compile(columns, Map.of(), OptionalLong.empty()))
            .isInstanceOf(UnknownFunctionException.class);
    }

    @Test
    @DisplayName("A query must select something")
    void testNoColumns() {
        assertThatThrownBy(() -> compiler.compile(List.of(), Map.of(), OptionalLong.empty()))
            .isInstanceOf(QueryCompilationException.class);
    }

    @Test
    @DisplayName("Compiled columns are immutable")
    void testImmutableResult() {
        CompiledQuery query = compiler.compile(COLUMNS, Map.of(), OptionalLong.of(5));

        assertThatThrownBy(() -> query.columns().add("1"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Concurrent compilations produce identical results")
    void testConcurrentCompilation() throws Exception {
        CompiledQuery expected = compiler.compile(COLUMNS, Map.of(), OptionalLong.empty());
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<CompiledQuery>> tasks = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                tasks.add(() -> compiler.compile(COLUMNS, Map.of(), OptionalLong.empty()));
            }
            for (Future<CompiledQuery> future : executor.invokeAll(tasks)) {
                assertThat(future.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
    }
}
