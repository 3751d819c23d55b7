package com.machinebridge.core.codechange;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StringLiterals}.
 */
class StringLiteralsTest {

    @Test
    void literal_escapesQuoteAndControlCharacters() {
        assertThat(StringLiterals.literal("say \"hi\"", '"', false)).isEqualTo("\"say \\\"hi\\\"\"");
        assertThat(StringLiterals.literal("it's", '\'', false)).isEqualTo("'it\\'s'");
        assertThat(StringLiterals.literal("a\tb\\c", '"', false)).isEqualTo("\"a\\tb\\\\c\"");
        assertThat(StringLiterals.literal("\u0001", '"', false)).isEqualTo("\"\\x01\"");
        assertThat(StringLiterals.literal("\u2028", '"', false)).isEqualTo("\"\\u2028\"");
    }

    @Test
    void literal_multiline_usesTemplateOnlyWhenAllowed() {
        assertThat(StringLiterals.literal("a\nb", '"', false)).isEqualTo("\"a\\nb\"");
        assertThat(StringLiterals.literal("a\nb", '"', true)).isEqualTo("`a\nb`");
        assertThat(StringLiterals.literal("cost ${x}\n", '"', true)).isEqualTo("`cost \\${x}\n`");
        assertThat(StringLiterals.literal("single line", '"', true)).isEqualTo("\"single line\"");
    }

    @ParameterizedTest
    @ValueSource(strings = {"idle", "_private", "$store", "state2"})
    void propertyName_identifier_isBare(String name) {
        assertThat(StringLiterals.propertyName(name, '"')).isEqualTo(name);
    }

    @Test
    void propertyName_otherNames_areQuoted() {
        assertThat(StringLiterals.propertyName("2fast", '"')).isEqualTo("\"2fast\"");
        assertThat(StringLiterals.propertyName("with space", '\'')).isEqualTo("'with space'");
        assertThat(StringLiterals.propertyName("a.b", '"')).isEqualTo("\"a.b\"");
        assertThat(StringLiterals.propertyName("two\nlines", '"')).isEqualTo("[`two\nlines`]");
    }
}
