package com.machinebridge.core.ast.javascript;

/**
 * Decodes the bodies of JavaScript string and template literals.
 */
final class JsStrings {

    private JsStrings() {
        // Utility class - no instantiation
    }

    /**
     * Decodes escape sequences of a quoted string body (quotes already stripped).
     *
     * @param body raw literal body
     * @return cooked value
     */
    static String decode(String body) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char ch = body.charAt(i);
            if (ch != '\\' || i + 1 >= body.length()) {
                out.append(ch);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'v' -> out.append('\u000B');
                case '0' -> {
                    if (i < body.length() && Character.isDigit(body.charAt(i))) {
                        out.append('0');
                    } else {
                        out.append('\0');
                    }
                }
                case 'x' -> i = appendHex(body, i, 2, out, "\\x");
                case 'u' -> i = appendUnicode(body, i, out);
                case '\r' -> {
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\n', '\u2028', '\u2029' -> {
                    // line continuation
                }
                default -> out.append(next);
            }
        }
        return out.toString();
    }

    /**
     * Cooks a template literal body: normalizes line terminators and decodes escapes.
     *
     * @param body raw template body (backticks stripped)
     * @return cooked value
     */
    static String decodeTemplate(String body) {
        String normalized = body.replace("\r\n", "\n").replace('\r', '\n');
        return decode(normalized);
    }

    /**
     * Returns true if a template body contains an unescaped {@code ${} substitution.
     */
    static boolean hasSubstitution(String body) {
        for (int i = 0; i < body.length() - 1; i++) {
            char ch = body.charAt(i);
            if (ch == '\\') {
                i++;
            } else if (ch == '$' && body.charAt(i + 1) == '{') {
                return true;
            }
        }
        return false;
    }

    private static int appendUnicode(String body, int i, StringBuilder out) {
        if (i < body.length() && body.charAt(i) == '{') {
            int close = body.indexOf('}', i);
            if (close < 0) {
                out.append("\\u");
                return i;
            }
            try {
                out.appendCodePoint(Integer.parseInt(body.substring(i + 1, close), 16));
                return close + 1;
            } catch (IllegalArgumentException e) {
                out.append("\\u");
                return i;
            }
        }
        return appendHex(body, i, 4, out, "\\u");
    }

    private static int appendHex(String body, int i, int digits, StringBuilder out, String fallback) {
        if (i + digits > body.length()) {
            out.append(fallback);
            return i;
        }
        try {
            out.append((char) Integer.parseInt(body.substring(i, i + digits), 16));
            return i + digits;
        } catch (NumberFormatException e) {
            out.append(fallback);
            return i;
        }
    }
}
