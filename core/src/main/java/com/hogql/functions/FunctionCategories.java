package com.hogql.functions;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Source function names grouped by the special rewrite rules they need.
 *
 * <p>Membership is keyed by the HogQL (source) name, so {@code now} and {@code NOW} are
 * listed separately.
 */
public final class FunctionCategories {

    private FunctionCategories() {
        // Utility class - prevent instantiation
    }

    /**
     * Functions that receive the query timezone as a trailing argument.
     */
    public static final Set<String> ADD_TIMEZONE = Set.of(
        "now", "NOW", "toDateTime", "parseDateTime", "parseDateTimeBestEffort"
    );

    /**
     * Functions mapped to an {@code -OrNull} ClickHouse variant by default.
     */
    public static final Set<String> PREFER_OR_NULL = Set.of(
        "toDateTime", "parseDateTime", "parseDateTimeBestEffort"
    );

    /**
     * Time-window functions whose first argument must be {@code DateTime}, not
     * {@code DateTime64}.
     */
    public static final Set<String> FIRST_ARG_DATETIME = Set.of(
        "tumble", "tumbleStart", "tumbleEnd", "hop", "hopStart", "hopEnd"
    );

    /**
     * Returns the rules that apply to a source function name.
     *
     * @param sourceName the HogQL function name (case-sensitive)
     * @return an unmodifiable set of rules, empty if none apply
     */
    public static Set<SpecialRule> rulesFor(String sourceName) {
        EnumSet<SpecialRule> rules = EnumSet.noneOf(SpecialRule.class);
        if (ADD_TIMEZONE.contains(sourceName)) {
            rules.add(SpecialRule.ADD_TIMEZONE_ARG);
        }
        if (PREFER_OR_NULL.contains(sourceName)) {
            rules.add(SpecialRule.PREFER_OR_NULL_VARIANT);
        }
        if (FIRST_ARG_DATETIME.contains(sourceName)) {
            rules.add(SpecialRule.FIRST_ARG_MUST_BE_NON_FRACTIONAL_DATETIME);
        }
        return Collections.unmodifiableSet(rules);
    }
}
