package com.machinebridge.core.extraction;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Numeric literal helpers following JavaScript number semantics.
 */
final class JsNumbers {

    private static final int MAX_PLAIN_EXPONENT = 21;
    private static final int MIN_PLAIN_EXPONENT = -6;

    private JsNumbers() {
        // Utility class - no instantiation
    }

    /**
     * Parses a numeric literal as written in source.
     *
     * @param raw literal text, e.g. {@code 0x1F}, {@code 1_000}, {@code .5}
     * @return the number, or null for BigInt literals and unparseable text
     */
    static Double parse(String raw) {
        String text = raw.replace("_", "");
        if (text.endsWith("n")) {
            return null;
        }
        try {
            if (text.length() > 2 && text.charAt(0) == '0') {
                switch (Character.toLowerCase(text.charAt(1))) {
                    case 'x':
                        return new BigInteger(text.substring(2), 16).doubleValue();
                    case 'o':
                        return new BigInteger(text.substring(2), 8).doubleValue();
                    case 'b':
                        return new BigInteger(text.substring(2), 2).doubleValue();
                    default:
                        break;
                }
            }
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Formats a number the way JavaScript's {@code Number.prototype.toString()} does.
     *
     * @param value number
     * @return canonical text
     */
    static String toJsString(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == 0) {
            return "0";
        }
        if (value < 0) {
            return "-" + toJsString(-value);
        }
        BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        String digits = decimal.unscaledValue().toString();
        int k = digits.length();
        int n = k - decimal.scale();

        if (k <= n && n <= MAX_PLAIN_EXPONENT) {
            return digits + "0".repeat(n - k);
        }
        if (0 < n && n <= MAX_PLAIN_EXPONENT) {
            return digits.substring(0, n) + "." + digits.substring(n);
        }
        if (MIN_PLAIN_EXPONENT < n && n <= 0) {
            return "0." + "0".repeat(-n) + digits;
        }
        int exponent = n - 1;
        String mantissa = k == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        return mantissa + "e" + (exponent >= 0 ? "+" : "-") + Math.abs(exponent);
    }
}
