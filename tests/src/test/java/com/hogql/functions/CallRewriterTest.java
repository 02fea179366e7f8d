package com.hogql.functions;

import com.hogql.exception.ArityMismatchException;
import com.hogql.exception.IllegalArgumentShapeException;
import com.hogql.expression.Call;
import com.hogql.expression.Constant;
import com.hogql.expression.Expression;
import com.hogql.expression.FieldReference;
import com.hogql.test.TestBase;
import com.hogql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for CallRewriter: arity checks, datetime narrowing, OrNull confirmation and
 * timezone injection.
 */
@DisplayName("CallRewriter Tests")
@TestCategories.Unit
public class CallRewriterTest extends TestBase {

    private final CallRewriter rewriter = new CallRewriter();

    private static final Expression TIMESTAMP = FieldReference.of("timestamp");

    // ==================== Arity Tests ====================

    @Nested
    @DisplayName("Arity Check")
    class ArityCheck {

        @Test
        @DisplayName("Too many arguments report name, bound and count")
        void testTooManyArguments() {
            FunctionSignature plus = FunctionRegistry.require("plus");

            assertThatThrownBy(() -> rewriter.rewrite(plus,
                    List.of(Constant.of(1), Constant.of(2), Constant.of(3)), "UTC"))
                .isInstanceOf(ArityMismatchException.class)
                .hasMessage("Function 'plus' expects exactly 2 arguments, found 3");
        }

        @Test
        @DisplayName("Too few arguments to a variadic function report the lower bound")
        void testTooFewArguments() {
            FunctionSignature concat = FunctionRegistry.require("concat");

            assertThatThrownBy(() -> rewriter.rewrite(concat, List.of(Constant.of("a")), "UTC"))
                .isInstanceOf(ArityMismatchException.class)
                .hasMessage("Function 'concat' expects at least 2 arguments, found 1")
                .isInstanceOfSatisfying(ArityMismatchException.class, e -> {
                    assertThat(e.functionName()).isEqualTo("concat");
                    assertThat(e.actual()).isEqualTo(1);
                    assertThat(e.arity()).isEqualTo(Arity.atLeast(2));
                });
        }

        @Test
        @DisplayName("Single-argument bounds use the singular form")
        void testSingularMessage() {
            FunctionSignature lower = FunctionRegistry.require("lower");

            assertThatThrownBy(() -> rewriter.rewrite(lower, List.of(), "UTC"))
                .hasMessage("Function 'lower' expects exactly 1 argument, found 0");
        }

        @Test
        @DisplayName("Arity is checked before any other rule")
        void testArityBeforeNarrowing() {
            FunctionSignature tumble = FunctionRegistry.require("tumble");

            assertThatThrownBy(() -> rewriter.rewrite(tumble, List.of(Constant.of(42)), "UTC"))
                .isInstanceOf(ArityMismatchException.class);
        }

        @Test
        @DisplayName("Plain functions are rewritten to their target unchanged")
        void testPlainFunction() {
            FunctionSignature toInt = FunctionRegistry.require("toInt");

            RewrittenCall result = rewriter.rewrite(toInt, List.of(FieldReference.of("properties", "$os")), "UTC");

            assertThat(result.targetName()).isEqualTo("toInt64OrNull");
            assertThat(result.toSQL()).isEqualTo("toInt64OrNull(properties.$os)");
        }
    }

    // ==================== Timezone Injection Tests ====================

    @Nested
    @DisplayName("Timezone Injection")
    class TimezoneInjection {

        @ParameterizedTest
        @ValueSource(strings = {"now", "NOW"})
        @DisplayName("now() gains exactly one timezone argument")
        void testNowGainsTimezone(String name) {
            logStep("Given a zero-argument timezone-aware function");
            FunctionSignature signature = FunctionRegistry.require(name);

            logStep("When it is rewritten twice");
            RewrittenCall first = rewriter.rewrite(signature, List.of(), "Europe/Berlin");
            RewrittenCall second = rewriter.rewrite(signature, List.of(), "Europe/Berlin");

            logStep("Then both results carry the same single timezone argument");
            assertThat(first).isEqualTo(second);
            assertThat(first.arguments()).containsExactly(Constant.of("Europe/Berlin"));
            assertThat(first.toSQL()).isEqualTo("now64('Europe/Berlin')");
        }

        @Test
        @DisplayName("The timezone is appended after all explicit arguments")
        void testTimezoneIsLast() {
            FunctionSignature parse = FunctionRegistry.require("parseDateTime");

            RewrittenCall result = rewriter.rewrite(parse,
                List.of(FieldReference.of("created"), Constant.of("%Y-%m-%d")), "America/New_York");

            assertThat(result.arguments()).hasSize(3);
            assertThat(result.arguments().get(2)).isEqualTo(Constant.of("America/New_York"));
            assertThat(result.toSQL())
                .isEqualTo("parseDateTimeOrNull(created, '%Y-%m-%d', 'America/New_York')");
        }

        @Test
        @DisplayName("toDateTime targets the OrNull parser and gains the timezone")
        void testToDateTime() {
            RewrittenCall result = rewriter.rewrite(FunctionRegistry.require("toDateTime"), List.of(TIMESTAMP), "UTC");

            assertThat(result.toSQL()).isEqualTo("parseDateTime64BestEffortOrNull(timestamp, 'UTC')");
        }

        @Test
        @DisplayName("Functions without the rule never gain arguments")
        void testUntaggedFunction() {
            RewrittenCall result = rewriter.rewrite(FunctionRegistry.require("plus"),
                List.of(Constant.of(1), Constant.of(2)), "UTC");

            assertThat(result.arguments()).hasSize(2);
        }

        @Test
        @DisplayName("An argument past the required ones counts as an explicit timezone")
        void testExplicitTimezoneCounted() {
            FunctionSignature optionalZone = new FunctionSignature("toZoned", "toZoned",
                Arity.between(1, 2), EnumSet.of(SpecialRule.ADD_TIMEZONE_ARG));

            RewrittenCall implicit = rewriter.rewrite(optionalZone, List.of(TIMESTAMP), "UTC");
            RewrittenCall explicit = rewriter.rewrite(optionalZone, List.of(TIMESTAMP, Constant.of("Asia/Tokyo")), "UTC");

            assertThat(implicit.toSQL()).isEqualTo("toZoned(timestamp, 'UTC')");
            assertThat(explicit.toSQL()).isEqualTo("toZoned(timestamp, 'Asia/Tokyo')");
        }

        @Test
        @DisplayName("ALWAYS_APPEND ignores explicit timezones")
        void testAlwaysAppendPolicy() {
            CallRewriter appending = new CallRewriter(TimezonePolicy.ALWAYS_APPEND);
            FunctionSignature optionalZone = new FunctionSignature("toZoned", "toZoned",
                Arity.between(1, 2), EnumSet.of(SpecialRule.ADD_TIMEZONE_ARG));

            RewrittenCall result = appending.rewrite(optionalZone, List.of(TIMESTAMP, Constant.of("Asia/Tokyo")), "UTC");

            assertThat(appending.timezonePolicy()).isEqualTo(TimezonePolicy.ALWAYS_APPEND);
            assertThat(result.toSQL()).isEqualTo("toZoned(timestamp, 'Asia/Tokyo', 'UTC')");
        }

        @Test
        @DisplayName("Timezone-aware rewrites require a timezone")
        void testNullTimezone() {
            assertThatThrownBy(() -> rewriter.rewrite(FunctionRegistry.require("now"), List.of(), null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("timezone");
        }

        @Test
        @DisplayName("Timezone strings are quoted as literals")
        void testTimezoneIsQuoted() {
            RewrittenCall result = rewriter.rewrite(FunctionRegistry.require("now"), List.of(), "x') OR 1=1 --");

            assertThat(result.toSQL()).isEqualTo("now64('x\\') OR 1=1 --')");
        }
    }

    // ==================== Datetime Narrowing Tests ====================

    @Nested
    @DisplayName("Datetime Narrowing")
    class DatetimeNarrowing {

        @Test
        @DisplayName("The first argument of tumble is narrowed to DateTime")
        void testTumbleNarrowing() {
            Call interval = Call.of("toIntervalDay", Constant.of(1));

            RewrittenCall result = rewriter.rewrite(FunctionRegistry.require("tumble"), List.of(TIMESTAMP, interval), "UTC");

            logData("Rewritten", result.toSQL());
            assertThat(result.toSQL()).isEqualTo("tumble(assumeNotNull(toDateTime(timestamp)), toIntervalDay(1))");
        }

        @Test
        @DisplayName("Only the first argument is narrowed")
        void testOnlyFirstArgument() {
            RewrittenCall result = rewriter.rewrite(FunctionRegistry.require("tumbleStart"),
                List.of(TIMESTAMP, FieldReference.of("interval")), "UTC");

            assertThat(result.arguments().get(1)).isEqualTo(FieldReference.of("interval"));
        }

        @Test
        @DisplayName("Whole-second datetime and string constants are accepted")
        void testAcceptedConstants() {
            FunctionSignature hopStart = FunctionRegistry.require("hopStart");

            RewrittenCall fromDateTime = rewriter.rewrite(hopStart,
                List.of(Constant.of(LocalDateTime.of(2024, 1, 1, 12, 0, 0))), "UTC");
            RewrittenCall fromString = rewriter.rewrite(hopStart, List.of(Constant.of("2024-01-01")), "UTC");
            RewrittenCall fromDate = rewriter.rewrite(hopStart, List.of(Constant.of(LocalDate.of(2024, 1, 1))), "UTC");

            assertThat(fromDateTime.toSQL())
                .isEqualTo("hopStart(assumeNotNull(toDateTime(toDateTime('2024-01-01 12:00:00'))))");
            assertThat(fromString.toSQL()).isEqualTo("hopStart(assumeNotNull(toDateTime('2024-01-01')))");
            assertThat(fromDate.toSQL()).isEqualTo("hopStart(assumeNotNull(toDateTime(toDate('2024-01-01'))))");
        }

        @Test
        @DisplayName("Sub-second datetime constants are rejected")
        void testFractionalSecondsRejected() {
            Constant fractional = Constant.of(LocalDateTime.of(2024, 1, 1, 12, 0, 0, 500_000_000));

            assertThatThrownBy(() -> rewriter.rewrite(FunctionRegistry.require("tumbleEnd"), List.of(fractional), "UTC"))
                .isInstanceOf(IllegalArgumentShapeException.class)
                .hasMessageStartingWith("Argument 1 of 'tumbleEnd'")
                .hasMessageContaining("sub-second");
        }

        @Test
        @DisplayName("Timestamps with nanoseconds below one millisecond are rejected")
        void testTimestampNanosRejected() {
            Timestamp timestamp = new Timestamp(1_704_110_400_000L);
            timestamp.setNanos(500);

            assertThatThrownBy(() -> rewriter.rewrite(FunctionRegistry.require("tumbleEnd"),
                    List.of(Constant.of(timestamp)), "UTC"))
                .isInstanceOf(IllegalArgumentShapeException.class)
                .hasMessageContaining("sub-second");
        }

        @Test
        @DisplayName("JDBC dates are accepted like other dates")
        void testJdbcDateAccepted() {
            RewrittenCall result = rewriter.rewrite(FunctionRegistry.require("tumbleStart"),
                List.of(Constant.of(java.sql.Date.valueOf("2024-01-15"))), "UTC");

            assertThat(result.toSQL()).isEqualTo("tumbleStart(assumeNotNull(toDateTime(toDate('2024-01-15'))))");
        }

        @Test
        @DisplayName("Constants that cannot be datetimes are rejected")
        void testNonDateTimeConstantsRejected() {
            FunctionSignature hop = FunctionRegistry.require("hop");
            List<Constant> invalid = List.of(
                Constant.of(42), Constant.of(1.5), Constant.of(true),
                Constant.of(List.of(1, 2)), Constant.of(UUID.randomUUID()));

            for (Constant constant : invalid) {
                assertThatThrownBy(() -> rewriter.rewrite(hop, List.of(constant, TIMESTAMP, TIMESTAMP), "UTC"))
                    .as(constant.toSQL())
                    .isInstanceOf(IllegalArgumentShapeException.class)
                    .isInstanceOfSatisfying(IllegalArgumentShapeException.class,
                        e -> assertThat(e.argumentIndex()).isZero());
            }
        }
    }

    // ==================== OrNull Tests ====================

    @Nested
    @DisplayName("OrNull Confirmation")
    class OrNullConfirmation {

        @Test
        @DisplayName("An OrNull-preferring signature with a throwing target is refused")
        void testThrowingTargetRefused() {
            FunctionSignature widened = new FunctionSignature("toDateTime", "parseDateTime64BestEffort",
                Arity.exactly(1), EnumSet.of(SpecialRule.PREFER_OR_NULL_VARIANT));

            assertThatThrownBy(() -> rewriter.rewrite(widened, List.of(TIMESTAMP), "UTC"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OrNull");
        }

        @Test
        @DisplayName("Registered OrNull-preferring functions keep their target")
        void testRegisteredTargetKept() {
            RewrittenCall result = rewriter.rewrite(FunctionRegistry.require("parseDateTimeBestEffort"),
                List.of(Constant.of("2024-01-01T00:00:00Z")), "UTC");

            assertThat(result.targetName()).isEqualTo("parseDateTime64BestEffortOrNull");
        }
    }

    // ==================== Aggregate Tests ====================

    @Nested
    @DisplayName("Aggregates")
    class Aggregates {

        @Test
        @DisplayName("Aggregates keep their name and DISTINCT flag")
        void testDistinctAggregate() {
            AggregateSignature count = FunctionRegistry.resolveAggregate("count").orElseThrow();

            Call result = rewriter.rewriteAggregate(count, List.of(FieldReference.of("person_id")), true);

            assertThat(result.toSQL()).isEqualTo("count(DISTINCT person_id)");
        }

        @Test
        @DisplayName("Conditional aggregates require the filter argument")
        void testConditionalAggregateArity() {
            AggregateSignature sumIf = FunctionRegistry.resolveAggregate("sumIf").orElseThrow();

            assertThatThrownBy(() -> rewriter.rewriteAggregate(sumIf, List.of(FieldReference.of("amount")), false))
                .isInstanceOf(ArityMismatchException.class)
                .hasMessage("Function 'sumIf' expects exactly 2 arguments, found 1");
        }
    }
}
