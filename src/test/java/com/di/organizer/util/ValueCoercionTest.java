package com.di.organizer.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ValueCoercion utility class.
 */
@DisplayName("ValueCoercion Tests")
class ValueCoercionTest {

    // ============================================================================
    // toInt Tests
    // ============================================================================

    @Test
    @DisplayName("Should keep integral numbers")
    void testToInt_Numbers() {
        assertEquals(12, ValueCoercion.toInt(12));
        assertEquals(12, ValueCoercion.toInt(12L));
        assertEquals(12, ValueCoercion.toInt((short) 12));
        assertEquals(-3, ValueCoercion.toInt(-3));
    }

    @Test
    @DisplayName("Should truncate fractional numbers toward zero")
    void testToInt_Fractions() {
        assertEquals(2, ValueCoercion.toInt(2.9d));
        assertEquals(-2, ValueCoercion.toInt(-2.9d));
        assertEquals(7, ValueCoercion.toInt(7.5f));
        assertEquals(3, ValueCoercion.toInt(new BigDecimal("3.99")));
    }

    @ParameterizedTest
    @CsvSource({
        "'42', 42",
        "' 42 ', 42",
        "'-7', -7",
        "'3.7', 3",
        "'1e3', 1000",
        "'+5', 5"
    })
    @DisplayName("Should parse numeric strings")
    void testToInt_NumericStrings(String input, int expected) {
        assertEquals(expected, ValueCoercion.toInt(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "abc", "NaN", "Infinity", "12abc", "1,000"})
    @DisplayName("Should coerce non-numeric strings to 0")
    void testToInt_NonNumericStrings(String input) {
        assertEquals(0, ValueCoercion.toInt(input));
    }

    @Test
    @DisplayName("Should coerce null, NaN and infinities to 0")
    void testToInt_MissingAndNonFinite() {
        assertEquals(0, ValueCoercion.toInt(null));
        assertEquals(0, ValueCoercion.toInt(Double.NaN));
        assertEquals(0, ValueCoercion.toInt(Double.POSITIVE_INFINITY));
        assertEquals(0, ValueCoercion.toInt(Float.NEGATIVE_INFINITY));
    }

    @Test
    @DisplayName("Should map booleans to 1 and 0")
    void testToInt_Booleans() {
        assertEquals(1, ValueCoercion.toInt(Boolean.TRUE));
        assertEquals(0, ValueCoercion.toInt(Boolean.FALSE));
    }

    @Test
    @DisplayName("Should saturate at the int range")
    void testToInt_Saturates() {
        assertEquals(Integer.MAX_VALUE, ValueCoercion.toInt(Long.MAX_VALUE));
        assertEquals(Integer.MIN_VALUE, ValueCoercion.toInt("-99999999999"));
        assertEquals(Integer.MAX_VALUE, ValueCoercion.toInt(1e300));
    }

    @Test
    @DisplayName("Should saturate arbitrary-precision numbers instead of wrapping")
    void testToInt_BigNumbers() {
        assertEquals(Integer.MAX_VALUE, ValueCoercion.toInt(new BigInteger("18446744073709551617")));
        assertEquals(Integer.MIN_VALUE, ValueCoercion.toInt(new BigInteger("-18446744073709551617")));
        assertEquals(42, ValueCoercion.toInt(BigInteger.valueOf(42)));
        assertEquals(Integer.MAX_VALUE, ValueCoercion.toInt(new BigDecimal("1e400")));
        assertEquals(Integer.MAX_VALUE, ValueCoercion.toInt("18446744073709551617"));
        assertEquals(Integer.MAX_VALUE, ValueCoercion.toInt("1e999999999"));
        assertEquals(0, ValueCoercion.toInt("1e-999999999"));
        assertEquals(-3, ValueCoercion.toInt(new BigDecimal("-3.9")));
    }

    // ============================================================================
    // tryParseInt Tests
    // ============================================================================

    @Test
    @DisplayName("Should accept integers and integer literals only")
    void testTryParseInt() {
        assertEquals(Optional.of(5), ValueCoercion.tryParseInt(5));
        assertEquals(Optional.of(5), ValueCoercion.tryParseInt(" 5 "));
        assertEquals(Optional.of(3), ValueCoercion.tryParseInt(3.7d));
        assertEquals(Optional.of(1), ValueCoercion.tryParseInt(true));
        assertTrue(ValueCoercion.tryParseInt(null).isEmpty());
        assertTrue(ValueCoercion.tryParseInt("").isEmpty());
        assertTrue(ValueCoercion.tryParseInt("3.7").isEmpty());
        assertTrue(ValueCoercion.tryParseInt("abc").isEmpty());
        assertTrue(ValueCoercion.tryParseInt(Double.NaN).isEmpty());
    }

    @Test
    @DisplayName("Should saturate integers beyond the long range")
    void testTryParseInt_BigNumbers() {
        assertEquals(Optional.of(Integer.MAX_VALUE), ValueCoercion.tryParseInt(new BigInteger("18446744073709551617")));
        assertEquals(Optional.of(Integer.MAX_VALUE), ValueCoercion.tryParseInt("18446744073709551617"));
        assertEquals(Optional.of(Integer.MIN_VALUE), ValueCoercion.tryParseInt("-18446744073709551617"));
        assertEquals(Optional.of(2), ValueCoercion.tryParseInt(new BigDecimal("2.5")));
    }

    // ============================================================================
    // toText Tests
    // ============================================================================

    @Test
    @DisplayName("Should convert values to text")
    void testToText() {
        assertEquals("", ValueCoercion.toText(null));
        assertEquals("Active", ValueCoercion.toText("Active"));
        assertEquals("401001", ValueCoercion.toText(401001.0d));
        assertEquals("2.5", ValueCoercion.toText(2.5d));
        assertEquals("7", ValueCoercion.toText(7));
        assertEquals("true", ValueCoercion.toText(Boolean.TRUE));
        assertEquals("", ValueCoercion.toText(Double.NaN));
    }
}
