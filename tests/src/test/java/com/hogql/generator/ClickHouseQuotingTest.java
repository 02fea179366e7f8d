package com.hogql.generator;

import com.hogql.test.TestBase;
import com.hogql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Injection tests for identifier and literal quoting.
 */
@DisplayName("ClickHouseQuoting Tests")
@TestCategories.Unit
@TestCategories.Security
public class ClickHouseQuotingTest extends TestBase {

    @Test
    @DisplayName("Quotes inside literals are escaped")
    void testLiteralQuoteEscaping() {
        logStep("Given a classic injection payload");
        String payload = "'; DROP TABLE events; --";

        logStep("When it is quoted as a literal");
        String quoted = ClickHouseQuoting.quoteLiteral(payload);

        logStep("Then the quote cannot terminate the literal");
        logData("Quoted", quoted);
        assertThat(quoted).isEqualTo("'\\'; DROP TABLE events; --'");
    }

    @Test
    @DisplayName("Backslashes are escaped before quotes")
    void testBackslashEscaping() {
        assertThat(ClickHouseQuoting.quoteLiteral("\\'")).isEqualTo("'\\\\\\''");
    }

    @Test
    @DisplayName("Control characters are escaped")
    void testControlCharacters() {
        assertThat(ClickHouseQuoting.quoteLiteral("a\nb\tc\rd\0e\bf\fg"))
            .isEqualTo("'a\\nb\\tc\\rd\\0e\\bf\\fg'");
    }

    @Test
    @DisplayName("Null literals render as null")
    void testNullLiteral() {
        assertThat(ClickHouseQuoting.quoteLiteral(null)).isEqualTo("null");
    }

    @Test
    @DisplayName("Backticks inside identifiers are escaped")
    void testIdentifierBacktick() {
        assertThat(ClickHouseQuoting.quoteIdentifier("a`b")).isEqualTo("`a\\`b`");
        assertThat(ClickHouseQuoting.quoteIdentifierIfNeeded("x` FROM system.users --"))
            .isEqualTo("`x\\` FROM system.users --`");
    }

    @ParameterizedTest
    @ValueSource(strings = {"event", "_private", "$pageview", "person_id2"})
    @DisplayName("Plain identifiers stay bare")
    void testPlainIdentifiers(String identifier) {
        assertThat(ClickHouseQuoting.quoteIdentifierIfNeeded(identifier)).isEqualTo(identifier);
    }

    @ParameterizedTest
    @ValueSource(strings = {"my column", "1abc", "a-b", "événement"})
    @DisplayName("Other identifiers are quoted")
    void testQuotedIdentifiers(String identifier) {
        assertThat(ClickHouseQuoting.quoteIdentifierIfNeeded(identifier)).isEqualTo("`" + identifier + "`");
    }

    @Test
    @DisplayName("Empty identifiers are rejected")
    void testEmptyIdentifier() {
        assertThatThrownBy(() -> ClickHouseQuoting.quoteIdentifier(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Identifier cannot be null or empty");
        assertThatThrownBy(() -> ClickHouseQuoting.quoteIdentifierIfNeeded(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
