package org.apiwatch.client;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KeyValueParserTest {

    @Test
    void parsesLinesKeepingOrderAndSplittingOnFirstColon() {
        Map<String, Object> parsed = KeyValueParser.parse("""
                page: 2
                verbose: TRUE
                q: status: open
                Authorization: Bearer abc
                """);

        assertThat(parsed).containsExactly(
                Map.entry("page", 2),
                Map.entry("verbose", true),
                Map.entry("q", "status: open"),
                Map.entry("Authorization", "Bearer abc"));
    }

    @Test
    void ignoresLinesWithoutColonOrKey() {
        Map<String, Object> parsed = KeyValueParser.parse("no colon here\r\n: orphan\r\nlimit: 50");

        assertThat(parsed).containsOnlyKeys("limit");
    }

    @Test
    void blankOrMissingTextGivesEmptyMap() {
        assertThat(KeyValueParser.parse(null)).isEmpty();
        assertThat(KeyValueParser.parse("   \n ")).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "42, java.lang.Integer",
            "9876543210, java.lang.Long",
            "99999999999999999999, java.lang.String",
            "-5, java.lang.String",
            "1.5, java.lang.String",
            "false, java.lang.Boolean"
    })
    void coercesDigitsAndBooleans(String raw, Class<?> expected) {
        assertThat(KeyValueParser.coerce(raw)).isInstanceOf(expected);
    }
}
