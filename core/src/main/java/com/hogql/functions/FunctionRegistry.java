package com.hogql.functions;

import com.hogql.exception.UnknownFunctionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the HogQL functions that may be sent to ClickHouse.
 *
 * <p>The registry is the allow-list of the compiler: a name that does not resolve here is
 * never passed through to ClickHouse. It holds three disjoint namespaces:
 * <ul>
 *   <li>Functions: HogQL name, ClickHouse name, arity and special rules</li>
 *   <li>Aggregates: name and arity, including the {@code -If} conditional variants</li>
 *   <li>Language-level functions ({@code cohort}, {@code sparkline}): HogQL-only
 *       constructs that the caller expands</li>
 * </ul>
 *
 * <p>Lookups are exact and case-sensitive: {@code now} and {@code NOW} are two entries
 * mapped to the same ClickHouse function.
 *
 * <p>All tables are built once during class initialization and are unmodifiable
 * afterwards, so lookups need no locking.
 *
 * @see CallRewriter
 */
public final class FunctionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(FunctionRegistry.class);

    private static final Map<String, FunctionSignature> FUNCTIONS;
    private static final Map<String, AggregateSignature> AGGREGATES;
    private static final Map<String, LanguageFunctionSignature> LANGUAGE_FUNCTIONS;

    static {
        TableBuilder table = new TableBuilder();

        registerArithmeticFunctions(table);
        registerArrayAndStringFunctions(table);
        registerArrayFunctions(table);
        registerComparisonFunctions(table);
        registerLogicalFunctions(table);
        registerTypeConversionFunctions(table);
        registerDateTimeFunctions(table);
        registerStringFunctions(table);
        registerStringSearchFunctions(table);
        registerStringReplaceFunctions(table);
        registerConditionalFunctions(table);
        registerMathFunctions(table);
        registerRoundingFunctions(table);
        registerMapFunctions(table);
        registerStringSplitFunctions(table);
        registerBitFunctions(table);
        registerBitmapFunctions(table);
        registerUrlFunctions(table);
        registerJsonFunctions(table);
        registerMembershipFunctions(table);
        registerGeoFunctions(table);
        registerNullableFunctions(table);
        registerTupleFunctions(table);
        registerMiscFunctions(table);
        registerTimeWindowFunctions(table);
        registerDistanceFunctions(table);
        registerWindowFunctions(table);
        registerStandardAggregates(table);
        registerClickHouseAggregates(table);

        registerLanguageFunctions(table);

        table.checkNamespacesDisjoint();

        FUNCTIONS = Collections.unmodifiableMap(table.functions);
        AGGREGATES = Collections.unmodifiableMap(table.aggregates);
        LANGUAGE_FUNCTIONS = Collections.unmodifiableMap(table.languageFunctions);

        logger.info("HogQL function registry initialized: {} functions, {} aggregates, {} language functions",
            FUNCTIONS.size(), AGGREGATES.size(), LANGUAGE_FUNCTIONS.size());
    }

    private FunctionRegistry() {
        // Utility class - prevent instantiation
    }

    /**
     * Resolves a HogQL function name.
     *
     * @param name the function name (case-sensitive)
     * @return the signature, or empty if the name is not a registered function
     */
    public static Optional<FunctionSignature> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(FUNCTIONS.get(name));
    }

    /**
     * Resolves a HogQL aggregate name.
     *
     * @param name the aggregate name (case-sensitive)
     * @return the signature, or empty if the name is not a registered aggregate
     */
    public static Optional<AggregateSignature> resolveAggregate(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(AGGREGATES.get(name));
    }

    /**
     * Resolves a function that only exists in HogQL.
     *
     * @param name the function name (case-sensitive)
     * @return the signature, or empty if the name is not a language-level function
     */
    public static Optional<LanguageFunctionSignature> resolveLanguageLevelFunction(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(LANGUAGE_FUNCTIONS.get(name));
    }

    /**
     * Resolves a function name, failing if it is not registered.
     *
     * @param name the function name
     * @return the signature
     * @throws UnknownFunctionException if the name is not a registered function
     */
    public static FunctionSignature require(String name) {
        return resolve(name).orElseThrow(() -> new UnknownFunctionException(String.valueOf(name)));
    }

    /**
     * Checks whether a name is known in any namespace.
     *
     * @param name the name
     * @return true if the name is a function, aggregate or language-level function
     */
    public static boolean isSupported(String name) {
        if (name == null) {
            return false;
        }
        return FUNCTIONS.containsKey(name) ||
               AGGREGATES.containsKey(name) ||
               LANGUAGE_FUNCTIONS.containsKey(name);
    }

    public static boolean isAggregate(String name) {
        return name != null && AGGREGATES.containsKey(name);
    }

    /**
     * Returns all registered function names.
     */
    public static Set<String> functionNames() {
        return FUNCTIONS.keySet();
    }

    /**
     * Returns all registered aggregate names.
     */
    public static Set<String> aggregateNames() {
        return AGGREGATES.keySet();
    }

    /**
     * Returns all registered language-level function names.
     */
    public static Set<String> languageFunctionNames() {
        return LANGUAGE_FUNCTIONS.keySet();
    }

    // ==================== Functions ====================

    private static void registerArithmeticFunctions(TableBuilder table) {
        table.function("plus", 2, 2);
        table.function("minus", 2, 2);
        table.function("multiply", 2, 2);
        table.function("divide", 2, 2);
        table.function("intDiv", 2, 2);
        table.function("intDivOrZero", 2, 2);
        table.function("modulo", 2, 2);
        table.function("moduloOrZero", 2, 2);
        table.function("positiveModulo", 2, 2);
        table.function("negate", 1, 1);
        table.function("abs", 1, 1);
        table.function("gcd", 2, 2);
        table.function("lcm", 2, 2);
        table.function("max2", 2, 2);
        table.function("min2", 2, 2);
        table.function("multiplyDecimal", 2, 3);
        table.function("divideDecimal", 2, 3);
    }

    private static void registerArrayAndStringFunctions(TableBuilder table) {
        table.function("empty", 1, 1);
        table.function("notEmpty", 1, 1);
        table.function("length", 1, 1);
        table.function("reverse", 1, 1);
    }

    private static void registerArrayFunctions(TableBuilder table) {
        table.unbounded("array");
        table.function("range", 1, 3);
        table.variadic("arrayConcat", 2);
        table.function("arrayElement", 2, 2);
        table.function("has", 2, 2);
        table.function("hasAll", 2, 2);
        table.function("hasAny", 2, 2);
        table.function("hasSubstr", 2, 2);
        table.function("indexOf", 2, 2);
        table.variadic("arrayCount", 1);
        table.function("countEqual", 2, 2);
        table.function("arrayEnumerate", 1, 1);
        table.variadic("arrayEnumerateUniq", 2);
        table.function("arrayPopBack", 1, 1);
        table.function("arrayPopFront", 1, 1);
        table.function("arrayPushBack", 2, 2);
        table.function("arrayPushFront", 2, 2);
        table.function("arrayResize", 2, 3);
        table.function("arraySlice", 2, 3);
        table.variadic("arraySort", 1);
        table.variadic("arrayReverseSort", "arraySort", 1);
        table.variadic("arrayUniq", 1);
        table.function("arrayJoin", 1, 1);
        table.function("arrayDifference", 1, 1);
        table.function("arrayDistinct", 1, 1);
        table.function("arrayEnumerateDense", 1, 1);
        table.variadic("arrayIntersect", 1);
        table.function("arrayReverse", 1, 1);
        table.variadic("arrayFilter", 2);
        table.function("arrayFlatten", 1, 1);
        table.function("arrayCompact", 1, 1);
        table.variadic("arrayZip", 2);
        table.function("arrayAUC", 2, 2);
        table.variadic("arrayMap", 2);
        table.variadic("arrayFill", 2);
        table.variadic("arraySplit", 2);
        table.variadic("arrayReverseFill", 2);
        table.variadic("arrayReverseSplit", 2);
        table.variadic("arrayExists", 1);
        table.variadic("arrayAll", 1);
        table.variadic("arrayFirst", 2);
        table.variadic("arrayLast", 2);
        table.variadic("arrayFirstIndex", 2);
        table.variadic("arrayLastIndex", 2);
        table.function("arrayMin", 1, 2);
        table.function("arrayMax", 1, 2);
        table.function("arraySum", 1, 2);
        table.function("arrayAvg", 1, 2);
        table.variadic("arrayCumSum", 1);
        table.variadic("arrayCumSumNonNegative", 1);
        table.function("arrayProduct", 1, 1);
    }

    private static void registerComparisonFunctions(TableBuilder table) {
        table.function("equals", 2, 2);
        table.function("notEquals", 2, 2);
        table.function("less", 2, 2);
        table.function("greater", 2, 2);
        table.function("lessOrEquals", 2, 2);
        table.function("greaterOrEquals", 2, 2);
    }

    private static void registerLogicalFunctions(TableBuilder table) {
        table.variadic("and", 2);
        table.variadic("or", 2);
        table.variadic("xor", 2);
        table.function("not", 1, 1);
    }

    private static void registerTypeConversionFunctions(TableBuilder table) {
        // Conversions return NULL on unparseable input instead of failing the query
        table.function("toInt", "toInt64OrNull", 1, 1);
        table.function("toFloat", "toFloat64OrNull", 1, 1);
        table.function("toDecimal", "toDecimal64OrNull", 1, 1);
        table.function("toDate", "toDateOrNull", 1, 1);
        table.function("toDateTime", "parseDateTime64BestEffortOrNull", 1, 1);
        table.function("toUUID", "toUUIDOrNull", 1, 1);
        table.function("toString", 1, 1);
        table.function("toJSONString", 1, 1);
        table.function("parseDateTime", "parseDateTimeOrNull", 2, 2);
        table.function("parseDateTimeBestEffort", "parseDateTime64BestEffortOrNull", 1, 1);
    }

    private static void registerDateTimeFunctions(TableBuilder table) {
        table.function("toTimeZone", 2, 2);
        table.function("timeZoneOf", 1, 1);
        table.function("timeZoneOffset", 1, 1);
        table.function("toYear", 1, 1);
        table.function("toQuarter", 1, 1);
        table.function("toMonth", 1, 1);
        table.function("toDayOfYear", 1, 1);
        table.function("toDayOfMonth", 1, 1);
        table.function("toDayOfWeek", 1, 3);
        table.function("toHour", 1, 1);
        table.function("toMinute", 1, 1);
        table.function("toSecond", 1, 1);
        table.function("toUnixTimestamp", 1, 2);
        table.function("toStartOfYear", 1, 1);
        table.function("toStartOfISOYear", 1, 1);
        table.function("toStartOfQuarter", 1, 1);
        table.function("toStartOfMonth", 1, 1);
        table.function("toLastDayOfMonth", 1, 1);
        table.function("toMonday", 1, 1);
        table.function("toStartOfWeek", 1, 2);
        table.function("toStartOfDay", 1, 1);
        table.function("toStartOfHour", 1, 1);
        table.function("toStartOfMinute", 1, 1);
        table.function("toStartOfSecond", 1, 1);
        table.function("toStartOfFiveMinutes", 1, 1);
        table.function("toStartOfTenMinutes", 1, 1);
        table.function("toStartOfFifteenMinutes", 1, 1);
        table.function("toTime", 1, 1);
        table.function("toISOYear", 1, 1);
        table.function("toISOWeek", 1, 1);
        table.function("toWeek", 1, 3);
        table.function("toYearWeek", 1, 3);
        table.function("age", 3, 3);
        table.function("dateDiff", 3, 3);
        table.function("dateTrunc", 2, 2);
        table.function("dateAdd", 3, 3);
        table.function("dateSub", 3, 3);
        table.function("timeStampAdd", 2, 2);
        table.function("timeStampSub", 2, 2);
        // Both spellings are accepted and receive the query timezone
        table.function("now", "now64", 0, 0);
        table.function("NOW", "now64", 0, 0);
        table.function("nowInBlock", 1, 1);
        table.function("today", 0, 0);
        table.function("yesterday", 0, 0);
        table.function("timeSlot", 1, 1);
        table.function("toYYYYMM", 1, 1);
        table.function("toYYYYMMDD", 1, 1);
        table.function("toYYYYMMDDhhmmss", 1, 1);
        table.function("addYears", 2, 2);
        table.function("addMonths", 2, 2);
        table.function("addWeeks", 2, 2);
        table.function("addDays", 2, 2);
        table.function("addHours", 2, 2);
        table.function("addMinutes", 2, 2);
        table.function("addSeconds", 2, 2);
        table.function("addQuarters", 2, 2);
        table.function("subtractYears", 2, 2);
        table.function("subtractMonths", 2, 2);
        table.function("subtractWeeks", 2, 2);
        table.function("subtractDays", 2, 2);
        table.function("subtractHours", 2, 2);
        table.function("subtractMinutes", 2, 2);
        table.function("subtractSeconds", 2, 2);
        table.function("subtractQuarters", 2, 2);
        table.function("timeSlots", 2, 3);
        table.function("formatDateTime", 2, 2);
        table.function("dateName", 2, 2);
        table.function("monthName", 1, 1);
        table.function("fromUnixTimestamp", 1, 1);
        table.function("toModifiedJulianDay", "toModifiedJulianDayOrNull", 1, 1);
        table.function("fromModifiedJulianDay", "fromModifiedJulianDayOrNull", 1, 1);
        table.function("toIntervalSecond", 1, 1);
        table.function("toIntervalMinute", 1, 1);
        table.function("toIntervalHour", 1, 1);
        table.function("toIntervalDay", 1, 1);
        table.function("toIntervalWeek", 1, 1);
        table.function("toIntervalMonth", 1, 1);
        table.function("toIntervalQuarter", 1, 1);
        table.function("toIntervalYear", 1, 1);
    }

    private static void registerStringFunctions(TableBuilder table) {
        table.function("lengthUTF8", 1, 1);
        table.function("leftPad", 2, 3);
        table.function("rightPad", 2, 3);
        table.function("leftPadUTF8", 2, 3);
        table.function("rightPadUTF8", 2, 3);
        table.function("lower", 1, 1);
        table.function("upper", 1, 1);
        table.function("lowerUTF8", 1, 1);
        table.function("upperUTF8", 1, 1);
        table.function("isValidUTF8", 1, 1);
        table.function("toValidUTF8", 1, 1);
        table.function("repeat", 2, 2);
        table.variadic("format", 2);
        table.function("reverseUTF8", 1, 1);
        table.variadic("concat", 2);
        table.function("substring", 3, 3);
        table.function("substringUTF8", 3, 3);
        table.function("appendTrailingCharIfAbsent", 2, 2);
        table.function("convertCharset", 3, 3);
        table.function("base58Encode", 1, 1);
        table.function("base58Decode", 1, 1);
        table.function("tryBase58Decode", 1, 1);
        table.function("base64Encode", 1, 1);
        table.function("base64Decode", 1, 1);
        table.function("tryBase64Decode", 1, 1);
        table.function("endsWith", 2, 2);
        table.function("startsWith", 2, 2);
        table.function("trim", "trimBoth", 1, 1);
        table.function("trimLeft", 1, 1);
        table.function("trimRight", 1, 1);
        table.function("encodeXMLComponent", 1, 1);
        table.function("decodeXMLComponent", 1, 1);
        table.function("extractTextFromHTML", 1, 1);
        table.function("ascii", 1, 1);
        table.variadic("concatWithSeparator", 2);
    }

    private static void registerStringSearchFunctions(TableBuilder table) {
        table.function("position", 2, 3);
        table.function("positionCaseInsensitive", 2, 3);
        table.function("positionUTF8", 2, 3);
        table.function("positionCaseInsensitiveUTF8", 2, 3);
        table.function("multiSearchAllPositions", 2, 2);
        table.function("multiSearchAllPositionsUTF8", 2, 2);
        table.function("multiSearchFirstPosition", 2, 2);
        table.function("multiSearchFirstIndex", 2, 2);
        table.function("multiSearchAny", 2, 2);
        table.function("match", 2, 2);
        table.function("multiMatchAny", 2, 2);
        table.function("multiMatchAnyIndex", 2, 2);
        table.function("multiMatchAllIndices", 2, 2);
        table.function("multiFuzzyMatchAny", 3, 3);
        table.function("multiFuzzyMatchAnyIndex", 3, 3);
        table.function("multiFuzzyMatchAllIndices", 3, 3);
        table.function("extract", 2, 2);
        table.function("extractAll", 2, 2);
        table.function("extractAllGroupsHorizontal", 2, 2);
        table.function("extractAllGroupsVertical", 2, 2);
        table.function("like", 2, 2);
        table.function("ilike", 2, 2);
        table.function("notLike", 2, 2);
        table.function("notILike", 2, 2);
        table.function("ngramDistance", 2, 2);
        table.function("ngramSearch", 2, 2);
        table.function("countSubstrings", 2, 3);
        table.function("countSubstringsCaseInsensitive", 2, 3);
        table.function("countSubstringsCaseInsensitiveUTF8", 2, 3);
        table.function("countMatches", 2, 2);
        table.function("regexpExtract", 2, 3);
    }

    private static void registerStringReplaceFunctions(TableBuilder table) {
        table.function("replace", 3, 3);
        table.function("replaceAll", 3, 3);
        table.function("replaceOne", 3, 3);
        table.function("replaceRegexpAll", 3, 3);
        table.function("replaceRegexpOne", 3, 3);
        table.function("regexpQuoteMeta", 1, 1);
        table.function("translate", 3, 3);
        table.function("translateUTF8", 3, 3);
    }

    private static void registerConditionalFunctions(TableBuilder table) {
        table.function("if", 3, 3);
        table.variadic("multiIf", 3);
    }

    private static void registerMathFunctions(TableBuilder table) {
        table.function("e", 0, 0);
        table.function("pi", 0, 0);
        table.function("exp", 1, 1);
        table.function("log", 1, 1);
        table.function("ln", 1, 1);
        table.function("exp2", 1, 1);
        table.function("log2", 1, 1);
        table.function("exp10", 1, 1);
        table.function("log10", 1, 1);
        table.function("sqrt", 1, 1);
        table.function("cbrt", 1, 1);
        table.function("erf", 1, 1);
        table.function("erfc", 1, 1);
        table.function("lgamma", 1, 1);
        table.function("tgamma", 1, 1);
        table.function("sin", 1, 1);
        table.function("cos", 1, 1);
        table.function("tan", 1, 1);
        table.function("asin", 1, 1);
        table.function("acos", 1, 1);
        table.function("atan", 1, 1);
        table.function("pow", 2, 2);
        table.function("power", 2, 2);
        table.function("intExp2", 1, 1);
        table.function("intExp10", 1, 1);
        table.function("cosh", 1, 1);
        table.function("acosh", 1, 1);
        table.function("sinh", 1, 1);
        table.function("asinh", 1, 1);
        table.function("atanh", 1, 1);
        table.function("atan2", 2, 2);
        table.function("hypot", 2, 2);
        table.function("log1p", 1, 1);
        table.function("sign", 1, 1);
        table.function("degrees", 1, 1);
        table.function("radians", 1, 1);
        table.function("factorial", 1, 1);
        table.function("width_bucket", 4, 4);
    }

    private static void registerRoundingFunctions(TableBuilder table) {
        table.function("floor", 1, 2);
        table.function("ceil", 1, 2);
        table.function("trunc", 1, 2);
        table.function("round", 1, 2);
        table.function("roundBankers", 1, 2);
        table.function("roundToExp2", 1, 1);
        table.function("roundDuration", 1, 1);
        table.function("roundAge", 1, 1);
        table.function("roundDown", 2, 2);
    }

    private static void registerMapFunctions(TableBuilder table) {
        table.variadic("map", 2);
        table.function("mapFromArrays", 2, 2);
        table.variadic("mapAdd", 2);
        table.variadic("mapSubtract", 2);
        table.function("mapPopulateSeries", 1, 3);
        table.function("mapContains", 2, 2);
        table.function("mapKeys", 1, 1);
        table.function("mapValues", 1, 1);
        table.function("mapContainsKeyLike", 2, 2);
        table.function("mapExtractKeyLike", 2, 2);
        table.function("mapApply", 2, 2);
        table.function("mapFilter", 2, 2);
        table.function("mapUpdate", 2, 2);
    }

    private static void registerStringSplitFunctions(TableBuilder table) {
        table.function("splitByChar", 2, 3);
        table.function("splitByString", 2, 3);
        table.function("splitByRegexp", 2, 3);
        table.function("splitByWhitespace", 1, 2);
        table.function("splitByNonAlpha", 1, 2);
        table.function("arrayStringConcat", 1, 2);
        table.function("alphaTokens", 1, 2);
        table.function("extractAllGroups", 2, 2);
        table.function("ngrams", 2, 2);
        table.function("tokens", 1, 1);
    }

    private static void registerBitFunctions(TableBuilder table) {
        table.function("bitAnd", 2, 2);
        table.function("bitOr", 2, 2);
        table.function("bitXor", 2, 2);
        table.function("bitNot", 1, 1);
        table.function("bitShiftLeft", 2, 2);
        table.function("bitShiftRight", 2, 2);
        table.function("bitRotateLeft", 2, 2);
        table.function("bitRotateRight", 2, 2);
        table.function("bitSlice", 3, 3);
        table.function("bitTest", 2, 2);
        table.variadic("bitTestAll", 3);
        table.variadic("bitTestAny", 3);
        table.function("bitCount", 1, 1);
        table.function("bitHammingDistance", 2, 2);
    }

    private static void registerBitmapFunctions(TableBuilder table) {
        table.function("bitmapBuild", 1, 1);
        table.function("bitmapToArray", 1, 1);
        table.function("bitmapSubsetInRange", 3, 3);
        table.function("bitmapSubsetLimit", 3, 3);
        table.function("subBitmap", 3, 3);
        table.function("bitmapContains", 2, 2);
        table.function("bitmapHasAny", 2, 2);
        table.function("bitmapHasAll", 2, 2);
        table.function("bitmapCardinality", 1, 1);
        table.function("bitmapMin", 1, 1);
        table.function("bitmapMax", 1, 1);
        table.function("bitmapTransform", 3, 3);
        table.function("bitmapAnd", 2, 2);
        table.function("bitmapOr", 2, 2);
        table.function("bitmapXor", 2, 2);
        table.function("bitmapAndnot", 2, 2);
        table.function("bitmapAndCardinality", 2, 2);
        table.function("bitmapOrCardinality", 2, 2);
        table.function("bitmapXorCardinality", 2, 2);
        table.function("bitmapAndnotCardinality", 2, 2);
    }

    private static void registerUrlFunctions(TableBuilder table) {
        table.function("protocol", 1, 1);
        table.function("domain", 1, 1);
        table.function("domainWithoutWWW", 1, 1);
        table.function("topLevelDomain", 1, 1);
        table.function("firstSignificantSubdomain", 1, 1);
        table.function("cutToFirstSignificantSubdomain", 1, 1);
        table.function("cutToFirstSignificantSubdomainWithWWW", 1, 1);
        table.function("port", 1, 2);
        table.function("path", 1, 1);
        table.function("pathFull", 1, 1);
        table.function("queryString", 1, 1);
        table.function("fragment", 1, 1);
        table.function("queryStringAndFragment", 1, 1);
        table.function("extractURLParameter", 2, 2);
        table.function("extractURLParameters", 1, 1);
        table.function("extractURLParameterNames", 1, 1);
        table.function("URLHierarchy", 1, 1);
        table.function("URLPathHierarchy", 1, 1);
        table.function("encodeURLComponent", 1, 1);
        table.function("decodeURLComponent", 1, 1);
        table.function("encodeURLFormComponent", 1, 1);
        table.function("decodeURLFormComponent", 1, 1);
        table.function("netloc", 1, 1);
        table.function("cutWWW", 1, 1);
        table.function("cutQueryString", 1, 1);
        table.function("cutFragment", 1, 1);
        table.function("cutQueryStringAndFragment", 1, 1);
        table.function("cutURLParameter", 2, 2);
    }

    private static void registerJsonFunctions(TableBuilder table) {
        table.function("isValidJSON", 1, 1);
        table.variadic("JSONHas", 1);
        table.variadic("JSONLength", 1);
        table.variadic("JSONArrayLength", 1);
        table.variadic("JSONType", 1);
        table.variadic("JSONExtractUInt", 1);
        table.variadic("JSONExtractInt", 1);
        table.variadic("JSONExtractFloat", 1);
        table.variadic("JSONExtractBool", 1);
        table.variadic("JSONExtractString", 1);
        table.variadic("JSONExtractKey", 1);
        table.variadic("JSONExtractKeys", 1);
        table.variadic("JSONExtractRaw", 1);
        table.variadic("JSONExtractArrayRaw", 1);
        table.variadic("JSONExtractKeysAndValuesRaw", 1);
    }

    private static void registerMembershipFunctions(TableBuilder table) {
        table.function("in", 2, 2);
        table.function("notIn", 2, 2);
    }

    private static void registerGeoFunctions(TableBuilder table) {
        table.function("greatCircleDistance", 4, 4);
        table.function("geoDistance", 4, 4);
        table.function("greatCircleAngle", 4, 4);
        table.variadic("pointInEllipses", 6);
        table.variadic("pointInPolygon", 2);
    }

    private static void registerNullableFunctions(TableBuilder table) {
        table.function("isNull", 1, 1);
        table.function("isNotNull", 1, 1);
        table.variadic("coalesce", 1);
        table.function("ifNull", 2, 2);
        table.function("nullIf", 2, 2);
        table.function("assumeNotNull", 1, 1);
        table.function("toNullable", 1, 1);
    }

    private static void registerTupleFunctions(TableBuilder table) {
        table.unbounded("tuple");
        table.function("tupleElement", 2, 3);
        table.function("untuple", 1, 1);
        table.function("tupleHammingDistance", 2, 2);
        table.function("tupleToNameValuePairs", 1, 1);
        table.function("tuplePlus", 2, 2);
        table.function("tupleMinus", 2, 2);
        table.function("tupleMultiply", 2, 2);
        table.function("tupleDivide", 2, 2);
        table.function("tupleNegate", 1, 1);
        table.function("tupleMultiplyByNumber", 2, 2);
        table.function("tupleDivideByNumber", 2, 2);
        table.function("dotProduct", 2, 2);
    }

    private static void registerMiscFunctions(TableBuilder table) {
        table.function("isFinite", 1, 1);
        table.function("isInfinite", 1, 1);
        table.function("ifNotFinite", 1, 1);
        table.function("isNaN", 1, 1);
        table.function("bar", 4, 4);
        table.function("transform", 3, 4);
        table.function("formatReadableDecimalSize", 1, 1);
        table.function("formatReadableSize", 1, 1);
        table.function("formatReadableQuantity", 1, 1);
        table.function("formatReadableTimeDelta", 1, 2);
    }

    private static void registerTimeWindowFunctions(TableBuilder table) {
        // First argument is narrowed to DateTime by CallRewriter
        table.function("tumble", 2, 2);
        table.function("hop", 3, 3);
        table.function("tumbleStart", 1, 3);
        table.function("tumbleEnd", 1, 3);
        table.function("hopStart", 1, 3);
        table.function("hopEnd", 1, 3);
    }

    private static void registerDistanceFunctions(TableBuilder table) {
        table.function("L1Norm", 1, 1);
        table.function("L2Norm", 1, 1);
        table.function("LinfNorm", 1, 1);
        table.function("LpNorm", 2, 2);
        table.function("L1Distance", 2, 2);
        table.function("L2Distance", 2, 2);
        table.function("LinfDistance", 2, 2);
        table.function("LpDistance", 3, 3);
        table.function("L1Normalize", 1, 1);
        table.function("L2Normalize", 1, 1);
        table.function("LinfNormalize", 1, 1);
        table.function("LpNormalize", 2, 2);
        table.function("cosineDistance", 2, 2);
    }

    private static void registerWindowFunctions(TableBuilder table) {
        table.function("rank", 0, 0);
        table.function("dense_rank", 0, 0);
        table.function("row_number", 0, 0);
        table.function("first_value", 1, 1);
        table.function("last_value", 1, 1);
        table.function("nth_value", 2, 2);
        table.function("lagInFrame", 1, 1);
        table.function("leadInFrame", 1, 1);
    }

    // ==================== Aggregates ====================

    private static void registerStandardAggregates(TableBuilder table) {
        table.aggregate("count", 0, 1);
        table.aggregate("countIf", 1, 2);
        table.aggregate("min", 1);
        table.aggregate("minIf", 2);
        table.aggregate("max", 1);
        table.aggregate("maxIf", 2);
        table.aggregate("sum", 1);
        table.aggregate("sumIf", 2);
        table.aggregate("avg", 1);
        table.aggregate("avgIf", 2);
        table.aggregate("any", 1);
        table.aggregate("anyIf", 2);
        table.aggregate("stddevPop", 1);
        table.aggregate("stddevPopIf", 2);
        table.aggregate("stddevSamp", 1);
        table.aggregate("stddevSampIf", 2);
        table.aggregate("varPop", 1);
        table.aggregate("varPopIf", 2);
        table.aggregate("varSamp", 1);
        table.aggregate("varSampIf", 2);
        table.aggregate("covarPop", 1);
        table.aggregate("covarPopIf", 2);
        table.aggregate("covarSamp", 1);
        table.aggregate("covarSampIf", 2);
    }

    private static void registerClickHouseAggregates(TableBuilder table) {
        table.aggregate("anyHeavy", 1);
        table.aggregate("anyHeavyIf", 2);
        table.aggregate("anyLast", 1);
        table.aggregate("anyLastIf", 2);
        table.aggregate("argMin", 2);
        table.aggregate("argMinIf", 3);
        table.aggregate("argMax", 2);
        table.aggregate("argMaxIf", 3);
        table.aggregate("argMinMerge", 1);
        table.aggregate("avgWeighted", 2);
        table.aggregate("avgWeightedIf", 3);
        table.aggregate("groupArray", 1);
        table.aggregate("groupUniqArray", 1);
        table.aggregate("groupArrayInsertAt", 2);
        table.aggregate("groupArrayInsertAtIf", 3);
        table.aggregate("groupArrayMovingAvg", 1);
        table.aggregate("groupArrayMovingAvgIf", 2);
        table.aggregate("groupArrayMovingSum", 1);
        table.aggregate("groupArrayMovingSumIf", 2);
        table.aggregate("groupBitAnd", 1);
        table.aggregate("groupBitAndIf", 2);
        table.aggregate("groupBitOr", 1);
        table.aggregate("groupBitOrIf", 2);
        table.aggregate("groupBitXor", 1);
        table.aggregate("groupBitXorIf", 2);
        table.aggregate("groupBitmap", 1);
        table.aggregate("groupBitmapIf", 2);
        table.aggregate("groupBitmapAnd", 1);
        table.aggregate("groupBitmapAndIf", 2);
        table.aggregate("groupBitmapOr", 1);
        table.aggregate("groupBitmapOrIf", 2);
        table.aggregate("groupBitmapXor", 1);
        table.aggregate("groupBitmapXorIf", 2);
        table.aggregate("sumWithOverflow", 1);
        table.aggregate("sumWithOverflowIf", 2);
        table.aggregate("deltaSum", 1);
        table.aggregate("deltaSumIf", 2);
        table.aggregate("deltaSumTimestamp", 2);
        table.aggregate("deltaSumTimestampIf", 3);
        table.aggregate("sumMap", 1, 2);
        table.aggregate("sumMapIf", 2, 3);
        table.aggregate("minMap", 1, 2);
        table.aggregate("minMapIf", 2, 3);
        table.aggregate("maxMap", 1, 2);
        table.aggregate("maxMapIf", 2, 3);
        table.aggregate("skewSamp", 1);
        table.aggregate("skewSampIf", 2);
        table.aggregate("skewPop", 1);
        table.aggregate("skewPopIf", 2);
        table.aggregate("kurtSamp", 1);
        table.aggregate("kurtSampIf", 2);
        table.aggregate("kurtPop", 1);
        table.aggregate("kurtPopIf", 2);
        table.variadicAggregate("uniq", 1);
        table.variadicAggregate("uniqIf", 2);
        table.variadicAggregate("uniqExact", 1);
        table.variadicAggregate("uniqExactIf", 2);
        table.variadicAggregate("uniqHLL12", 1);
        table.variadicAggregate("uniqHLL12If", 2);
        table.variadicAggregate("uniqTheta", 1);
        table.variadicAggregate("uniqThetaIf", 2);
        table.aggregate("median", 1);
        table.aggregate("medianIf", 2);
        table.aggregate("medianExact", 1);
        table.aggregate("medianExactIf", 2);
        table.aggregate("medianExactLow", 1);
        table.aggregate("medianExactLowIf", 2);
        table.aggregate("medianExactHigh", 1);
        table.aggregate("medianExactHighIf", 2);
        table.aggregate("medianExactWeighted", 1);
        table.aggregate("medianExactWeightedIf", 2);
        table.aggregate("medianTiming", 1);
        table.aggregate("medianTimingIf", 2);
        table.aggregate("medianTimingWeighted", 1);
        table.aggregate("medianTimingWeightedIf", 2);
        table.aggregate("medianDeterministic", 1);
        table.aggregate("medianDeterministicIf", 2);
        table.aggregate("medianTDigest", 1);
        table.aggregate("medianTDigestIf", 2);
        table.aggregate("medianTDigestWeighted", 1);
        table.aggregate("medianTDigestWeightedIf", 2);
        table.aggregate("medianBFloat16", 1);
        table.aggregate("medianBFloat16If", 2);
        table.aggregate("simpleLinearRegression", 2);
        table.aggregate("simpleLinearRegressionIf", 3);
        table.aggregate("contingency", 2);
        table.aggregate("contingencyIf", 3);
        table.aggregate("cramersV", 2);
        table.aggregate("cramersVIf", 3);
        table.aggregate("cramersVBiasCorrected", 2);
        table.aggregate("cramersVBiasCorrectedIf", 3);
        table.aggregate("theilsU", 2);
        table.aggregate("theilsUIf", 3);
        table.aggregate("maxIntersections", 2);
        table.aggregate("maxIntersectionsIf", 3);
        table.aggregate("maxIntersectionsPosition", 2);
        table.aggregate("maxIntersectionsPositionIf", 3);
    }
    // ==================== Language-level Functions ====================

    private static void registerLanguageFunctions(TableBuilder table) {
        table.languageFunction("sparkline", 1);
        table.languageFunction("cohort", 1);
    }

    /**
     * Mutable staging area for the tables, discarded once they are frozen.
     */
    private static final class TableBuilder {

        private final Map<String, FunctionSignature> functions = new HashMap<>();
        private final Map<String, AggregateSignature> aggregates = new HashMap<>();
        private final Map<String, LanguageFunctionSignature> languageFunctions = new HashMap<>();

        void function(String name, int min, int max) {
            function(name, name, min, max);
        }

        void function(String name, String target, int min, int max) {
            add(name, target, Arity.between(min, max));
        }

        void variadic(String name, int min) {
            variadic(name, name, min);
        }

        void variadic(String name, String target, int min) {
            add(name, target, Arity.atLeast(min));
        }

        void unbounded(String name) {
            add(name, name, Arity.unbounded());
        }

        private void add(String name, String target, Arity arity) {
            Set<SpecialRule> rules = FunctionCategories.rulesFor(name);
            if (rules.contains(SpecialRule.PREFER_OR_NULL_VARIANT) && !target.endsWith("OrNull")) {
                throw new IllegalStateException(
                    "Function '" + name + "' must map to an OrNull variant, found '" + target + "'");
            }
            put(functions, name, new FunctionSignature(name, target, arity, rules));
        }

        void aggregate(String name, int count) {
            put(aggregates, name, new AggregateSignature(name, Arity.exactly(count)));
        }

        void aggregate(String name, int min, int max) {
            put(aggregates, name, new AggregateSignature(name, Arity.between(min, max)));
        }

        void variadicAggregate(String name, int min) {
            put(aggregates, name, new AggregateSignature(name, Arity.atLeast(min)));
        }

        void languageFunction(String name, int count) {
            put(languageFunctions, name, new LanguageFunctionSignature(name, Arity.exactly(count)));
        }

        private static <T> void put(Map<String, T> table, String name, T signature) {
            if (table.putIfAbsent(name, signature) != null) {
                throw new IllegalStateException("Duplicate registry entry: " + name);
            }
        }

        void checkNamespacesDisjoint() {
            Set<String> seen = new HashSet<>(functions.keySet());
            for (String name : aggregates.keySet()) {
                if (!seen.add(name)) {
                    throw new IllegalStateException("Aggregate '" + name + "' is also registered as a function");
                }
            }
            for (String name : languageFunctions.keySet()) {
                if (!seen.add(name)) {
                    throw new IllegalStateException("Language function '" + name + "' is already registered");
                }
            }
        }
    }
}
