package com.di.organizer.util;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Converts loosely typed table and JSON values (cells read from a spreadsheet, JSON numbers and
 * strings) to the integer and text types of a production order.
 * <p>
 * Conversions never throw: a value that cannot be read as a number becomes 0 and a missing text
 * value becomes an empty string.
 */
@Slf4j
public final class ValueCoercion {

    private static final BigDecimal INT_MAX = BigDecimal.valueOf(Integer.MAX_VALUE);
    private static final BigDecimal INT_MIN = BigDecimal.valueOf(Integer.MIN_VALUE);

    private ValueCoercion() {
        // Utility class - prevent instantiation
    }

    /**
     * Lenient numeric coercion. Accepts numbers, booleans and numeric strings (including decimals
     * and exponents); fractions truncate toward zero and values beyond the int range saturate.
     *
     * @param value any raw value, may be null
     * @return the integer value, or 0 when the value is missing or not numeric
     */
    public static int toInt(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        if (value instanceof Double || value instanceof Float) {
            return fromDouble(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal || value instanceof BigInteger) {
            return fromBig(new BigDecimal(value.toString()));
        }
        if (value instanceof Number) {
            return saturate(((Number) value).longValue());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return 0;
        }
        try {
            return saturate(Long.parseLong(text));
        } catch (NumberFormatException ignored) {
            // fall through to decimal parsing
        }
        try {
            return fromBig(new BigDecimal(text));
        } catch (NumberFormatException e) {
            log.debug("Value '{}' is not numeric; using 0", text);
            return 0;
        }
    }

    /**
     * Strict integer reading used for requested ranks: integral numbers, booleans and strings
     * holding an integer literal. Decimal strings, blanks and non-finite numbers are rejected.
     *
     * @param value any raw value, may be null
     * @return the integer, or empty when the value is not an integer
     */
    public static Optional<Integer> tryParseInt(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Boolean) {
            return Optional.of(((Boolean) value) ? 1 : 0);
        }
        if (value instanceof BigDecimal || value instanceof BigInteger) {
            return Optional.of(fromBig(new BigDecimal(value.toString())));
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            return Optional.of(fromDouble(d));
        }
        if (value instanceof Number) {
            return Optional.of(saturate(((Number) value).longValue()));
        }
        String text = value.toString().trim();
        try {
            return Optional.of(fromBig(new BigDecimal(new BigInteger(text))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Text coercion: null and NaN become "", whole doubles lose their ".0" (spreadsheets store
     * every number as a double), everything else uses {@code toString()}.
     */
    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return "";
            }
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    private static int fromDouble(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return 0;
        }
        // (long) truncates toward zero and saturates
        return saturate((long) d);
    }

    /** Truncates toward zero and saturates; arbitrary-precision values never wrap. */
    private static int fromBig(BigDecimal value) {
        // compare before rescaling so exponents like 1e999999999 are never expanded
        if (value.compareTo(INT_MAX) >= 0) return Integer.MAX_VALUE;
        if (value.compareTo(INT_MIN) <= 0) return Integer.MIN_VALUE;
        if (value.abs().compareTo(BigDecimal.ONE) < 0) return 0;
        BigInteger whole = value.setScale(0, RoundingMode.DOWN).toBigInteger();
        return whole.intValue();
    }

    private static int saturate(long value) {
        if (value > Integer.MAX_VALUE) return Integer.MAX_VALUE;
        if (value < Integer.MIN_VALUE) return Integer.MIN_VALUE;
        return (int) value;
    }
}
