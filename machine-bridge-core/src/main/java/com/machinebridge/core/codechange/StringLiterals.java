package com.machinebridge.core.codechange;

import java.util.regex.Pattern;

/**
 * Writes string values and property names as JavaScript source text.
 */
public final class StringLiterals {

    private static final Pattern IDENTIFIER = Pattern.compile("^(?!\\d)[\\w$]+$");

    private StringLiterals() {
        // Utility class - no instantiation
    }

    /**
     * Writes a string literal.
     *
     * @param value string value
     * @param quote quote character, {@code "} or {@code '}
     * @param allowMultiline whether a value with line breaks is written as a template literal
     * @return literal source text
     */
    public static String literal(String value, char quote, boolean allowMultiline) {
        if (allowMultiline && value.indexOf('\n') >= 0) {
            return template(value);
        }
        return quoted(value, quote);
    }

    /**
     * Writes a property name: identifiers as-is, anything else as a string literal.
     *
     * @param name property key
     * @param quote quote character
     * @return property name source text
     */
    public static String propertyName(String name, char quote) {
        if (IDENTIFIER.matcher(name).matches()) {
            return name;
        }
        String literal = literal(name, quote, true);
        return literal.charAt(0) == '`' ? "[" + literal + "]" : literal;
    }

    static String quoted(String value, char quote) {
        StringBuilder out = new StringBuilder(value.length() + 2).append(quote);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                case '\u000B' -> out.append("\\v");
                case '\u2028' -> out.append("\\u2028");
                case '\u2029' -> out.append("\\u2029");
                default -> {
                    if (ch == quote) {
                        out.append('\\').append(ch);
                    } else if (ch < 0x20) {
                        out.append(String.format("\\x%02X", (int) ch));
                    } else {
                        out.append(ch);
                    }
                }
            }
        }
        return out.append(quote).toString();
    }

    static String template(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2).append('`');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '\\' || ch == '`') {
                out.append('\\').append(ch);
            } else if (ch == '$' && i + 1 < value.length() && value.charAt(i + 1) == '{') {
                out.append("\\$");
            } else if (ch == '\r') {
                out.append("\\r");
            } else {
                out.append(ch);
            }
        }
        return out.append('`').toString();
    }
}
