package com.hogql.validation;

import com.hogql.exception.ReservedAliasException;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Identifiers with fixed meaning in HogQL.
 *
 * <p>Two vocabularies:
 * <ul>
 *   <li><b>Keyword literals</b> ({@code true}, {@code false}, {@code null}) are passed to
 *       ClickHouse unchanged and are never resolved as function calls.</li>
 *   <li><b>Reserved keywords</b> are the keyword literals plus the implicit tenant-scoping
 *       column {@code team_id}. None of them may be used as an alias.</li>
 * </ul>
 *
 * <p>Both sets are immutable. Matching is exact and case-sensitive.
 */
public final class ReservedVocabulary {

    /** Keywords passed to ClickHouse without transformation */
    public static final List<String> KEYWORDS = List.of("true", "false", "null");

    /** Keywords that cannot be used as aliases */
    public static final Set<String> RESERVED_KEYWORDS;

    static {
        Set<String> reserved = new HashSet<>(KEYWORDS);
        reserved.add("team_id");
        RESERVED_KEYWORDS = Set.copyOf(reserved);
    }

    private ReservedVocabulary() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns whether an identifier may not be used as an alias.
     *
     * @param identifier the identifier
     * @return true if reserved
     */
    public static boolean isReservedKeyword(String identifier) {
        return identifier != null && RESERVED_KEYWORDS.contains(identifier);
    }

    /**
     * Returns whether an identifier is a keyword literal passed through untransformed.
     *
     * @param identifier the identifier
     * @return true for {@code true}, {@code false} and {@code null}
     */
    public static boolean isKeywordLiteral(String identifier) {
        return identifier != null && KEYWORDS.contains(identifier);
    }

    /**
     * Fails if an alias collides with a reserved keyword.
     *
     * @param alias the user-chosen alias
     * @throws ReservedAliasException if the alias is reserved
     */
    public static void validateAlias(String alias) {
        Objects.requireNonNull(alias, "alias must not be null");
        if (isReservedKeyword(alias)) {
            throw new ReservedAliasException(alias);
        }
    }
}
