package com.hogql.functions;

import com.hogql.exception.ArityMismatchException;
import com.hogql.exception.IllegalArgumentShapeException;
import com.hogql.expression.Call;
import com.hogql.expression.Constant;
import com.hogql.expression.Expression;
import com.hogql.types.ConstantType;
import com.hogql.types.ConstantTypeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a resolved HogQL call into the exact ClickHouse call.
 *
 * <p>Steps, always in this order:
 * <ol>
 *   <li>Arity check against the signature</li>
 *   <li>First-argument narrowing to {@code DateTime} for time-window functions</li>
 *   <li>Confirmation that OrNull-preferring functions still target an OrNull variant</li>
 *   <li>Timezone injection for timezone-aware functions</li>
 * </ol>
 *
 * <p>The rewriter holds no mutable state. The same signature, arguments and timezone
 * always produce an equal {@link RewrittenCall}.
 *
 * <p>Example:
 * <pre>
 *   rewriter.rewrite(FunctionRegistry.require("now"), List.of(), "Europe/Berlin");
 *   // now64('Europe/Berlin')
 * </pre>
 */
public final class CallRewriter {

    private static final Logger logger = LoggerFactory.getLogger(CallRewriter.class);

    /** Constant kinds that can never be converted to a DateTime */
    private static final Set<ConstantType> NON_DATETIME_KINDS = EnumSet.of(
        ConstantType.INTEGER, ConstantType.FLOAT, ConstantType.BOOLEAN,
        ConstantType.ARRAY, ConstantType.TUPLE, ConstantType.UUID
    );

    private final TimezonePolicy timezonePolicy;

    /**
     * Creates a rewriter with the argument-count timezone policy.
     */
    public CallRewriter() {
        this(TimezonePolicy.ARGUMENT_COUNT);
    }

    public CallRewriter(TimezonePolicy timezonePolicy) {
        this.timezonePolicy = Objects.requireNonNull(timezonePolicy, "timezonePolicy must not be null");
    }

    public TimezonePolicy timezonePolicy() {
        return timezonePolicy;
    }

    /**
     * Rewrites a function call.
     *
     * @param signature the resolved signature
     * @param arguments the already-translated arguments
     * @param timezone the query timezone, e.g. "UTC" or "America/New_York"
     * @return the ClickHouse call
     * @throws ArityMismatchException if the argument count is out of bounds
     * @throws IllegalArgumentShapeException if a narrowed first argument is not a whole-second datetime
     * @throws IllegalStateException if an OrNull-preferring signature targets a throwing variant
     */
    public RewrittenCall rewrite(FunctionSignature signature, List<? extends Expression> arguments, String timezone) {
        Objects.requireNonNull(signature, "signature must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");

        checkArity(signature.sourceName(), signature.arity(), arguments.size());

        List<Expression> rewritten = new ArrayList<>(arguments);

        if (signature.hasRule(SpecialRule.FIRST_ARG_MUST_BE_NON_FRACTIONAL_DATETIME) && !rewritten.isEmpty()) {
            rewritten.set(0, narrowToDateTime(signature.sourceName(), rewritten.get(0)));
        }

        if (signature.hasRule(SpecialRule.PREFER_OR_NULL_VARIANT) && !signature.targetName().endsWith("OrNull")) {
            throw new IllegalStateException("Function '" + signature.sourceName() +
                "' must target an OrNull variant, found '" + signature.targetName() + "'");
        }

        if (signature.hasRule(SpecialRule.ADD_TIMEZONE_ARG)
                && !timezonePolicy.timezoneSupplied(signature, arguments.size())) {
            Objects.requireNonNull(timezone, "timezone must not be null");
            logger.debug("Appending timezone '{}' to {}", timezone, signature.sourceName());
            rewritten.add(Constant.of(timezone));
        }

        return new RewrittenCall(signature.targetName(), rewritten);
    }

    /**
     * Checks an aggregate call and returns the ClickHouse call.
     *
     * @param signature the resolved aggregate
     * @param arguments the already-translated arguments
     * @param distinct whether DISTINCT applies to the arguments
     * @return the ClickHouse call
     * @throws ArityMismatchException if the argument count is out of bounds
     */
    public Call rewriteAggregate(AggregateSignature signature, List<? extends Expression> arguments, boolean distinct) {
        Objects.requireNonNull(signature, "signature must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");
        checkArity(signature.sourceName(), signature.arity(), arguments.size());
        return new Call(signature.targetName(), arguments, distinct);
    }

    /**
     * Fails unless {@code count} arguments are within the arity bounds.
     *
     * @param name the function name, for the error message
     * @param arity the declared bounds
     * @param count the supplied argument count
     * @throws ArityMismatchException if out of bounds
     */
    public static void checkArity(String name, Arity arity, int count) {
        if (!arity.accepts(count)) {
            throw new ArityMismatchException(name, count, arity);
        }
    }

    private static Expression narrowToDateTime(String functionName, Expression first) {
        if (first instanceof Constant) {
            Constant constant = (Constant) first;
            ConstantType kind = constant.constantType();
            if (NON_DATETIME_KINDS.contains(kind)) {
                throw new IllegalArgumentShapeException(functionName, 0,
                    "expected a DateTime, found a constant of type " + kind.typeName());
            }
            if (kind == ConstantType.DATETIME && ConstantTypeResolver.hasFractionalSeconds(constant.value())) {
                throw new IllegalArgumentShapeException(functionName, 0,
                    "expected a whole-second DateTime, found sub-second precision in " + constant.toSQL());
            }
        }
        logger.debug("Narrowing first argument of {} to DateTime", functionName);
        return Call.of("assumeNotNull", Call.of("toDateTime", first));
    }
}
