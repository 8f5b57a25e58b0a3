package com.telcobright.reviewstats.core.source;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Lenient numeric parsing for dataset cells. Non-numeric text yields
 * {@code null} rather than an exception, so callers can skip bad rows inline.
 */
public final class NumericValues {

    private static final Pattern DECIMAL =
        Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d{1,4})?");

    private NumericValues() {
    }

    public static BigDecimal parseDecimal(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            return null;
        }
        return new BigDecimal(trimmed);
    }

    /**
     * Parse a rating and truncate it toward zero, so {@code "4.0"} and
     * {@code "4.7"} both count as 4. A rating outside the {@code long} range
     * is treated as non-numeric.
     */
    public static Long parseTruncatedInteger(String text) {
        BigDecimal value = parseDecimal(text);
        if (value == null || value.toBigInteger().bitLength() > 63) {
            return null;
        }
        return value.longValue();
    }
}
