package com.typeguesser.decider;

import com.typeguesser.config.CultureConfig;

import java.math.BigDecimal;

/**
 * Culture-aware recognizer for numeric text.
 *
 * <p>Accepts an optional sign, digits optionally split into groups of three by
 * the grouping separator, an optional decimal separator with fraction digits
 * and, when allowed, an exponent. Currency symbols, parentheses and
 * non-finite words are not numbers.
 */
final class NumberText {

    /**
     * A recognized number.
     *
     * @param value the exact value
     * @param integral true if written without a decimal separator or exponent
     */
    record ParsedNumber(BigDecimal value, boolean integral) {}

    private NumberText() {}

    /**
     * Parses a stripped token.
     *
     * @param token the text, without surrounding whitespace
     * @param culture separators to honour
     * @param allowExponent whether {@code 1.5E3} style is accepted
     * @return the number, or null if the token is not numeric
     */
    static ParsedNumber parse(String token, CultureConfig culture, boolean allowExponent) {
        int length = token.length();
        if (length == 0) {
            return null;
        }
        char decimal = culture.decimalSeparator();
        char grouping = culture.groupingSeparator();
        StringBuilder normalized = new StringBuilder(length);
        int i = 0;

        char first = token.charAt(0);
        if (first == '+' || first == '-') {
            if (first == '-') {
                normalized.append('-');
            }
            i++;
        }

        // integer part, with optional grouping
        int intDigits = 0;
        int groupDigits = 0;
        boolean grouped = false;
        while (i < length) {
            char c = token.charAt(i);
            if (isDigit(c)) {
                normalized.append(c);
                intDigits++;
                groupDigits++;
                i++;
            } else if (c == grouping) {
                if (intDigits == 0 || (grouped ? groupDigits != 3 : groupDigits > 3)) {
                    return null;
                }
                grouped = true;
                groupDigits = 0;
                i++;
            } else {
                break;
            }
        }
        if (grouped && groupDigits != 3) {
            return null;
        }

        boolean integral = true;
        int fractionDigits = 0;
        if (i < length && token.charAt(i) == decimal) {
            integral = false;
            normalized.append('.');
            i++;
            while (i < length && isDigit(token.charAt(i))) {
                normalized.append(token.charAt(i));
                fractionDigits++;
                i++;
            }
        }
        if (intDigits + fractionDigits == 0) {
            return null;
        }

        if (i < length && allowExponent && (token.charAt(i) == 'e' || token.charAt(i) == 'E')) {
            integral = false;
            normalized.append('E');
            i++;
            if (i < length && (token.charAt(i) == '+' || token.charAt(i) == '-')) {
                normalized.append(token.charAt(i));
                i++;
            }
            int exponentDigits = 0;
            while (i < length && isDigit(token.charAt(i))) {
                normalized.append(token.charAt(i));
                exponentDigits++;
                i++;
            }
            if (exponentDigits == 0 || exponentDigits > 3) {
                return null;
            }
        }

        if (i != length) {
            return null;
        }
        return new ParsedNumber(new BigDecimal(normalized.toString()), integral);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
