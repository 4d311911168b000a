package com.di.organizer.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for DateFormatUtils utility class.
 */
@DisplayName("DateFormatUtils Tests")
class DateFormatUtilsTest {

    // ============================================================================
    // parseDate Tests
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
        "2024-01-15, 2024-01-15",
        "2024/01/15, 2024-01-15",
        "2024.01.15, 2024-01-15",
        "01/15/2024, 2024-01-15",
        "01-15-2024, 2024-01-15",
        "15/01/2024, 2024-01-15",
        "15-01-2024, 2024-01-15",
        "15.01.2024, 2024-01-15",
        "20240115, 2024-01-15",
        "2024-1-5, 2024-01-05",
        "1/5/2024, 2024-01-05",
        "2017/9/26, 2017-09-26",
        "26 Sep 2017, 2017-09-26",
        "26 sep 2017, 2017-09-26",
        "6 September 2017, 2017-09-06",
        "2024-01-15T08:30:00, 2024-01-15",
        "2024-01-15 08:30:00, 2024-01-15",
        "2024-01-15T08:30:00+02:00, 2024-01-15"
    })
    @DisplayName("Should parse supported date formats")
    void testParseDate_ValidFormats(String input, String expected) {
        assertEquals(LocalDate.parse(expected), DateFormatUtils.parseDate(input).orElseThrow());
    }

    @Test
    @DisplayName("Should read ambiguous day/month input month-first")
    void testParseDate_AmbiguousIsMonthFirst() {
        assertEquals(LocalDate.of(2024, 3, 4), DateFormatUtils.parseDate("03/04/2024").orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {"invalid-date", "2024-02-30", "13/13/2024", "31 Feb 2017", "tomorrow", "   "})
    @DisplayName("Should return empty for unrecognized or impossible dates")
    void testParseDate_Invalid(String input) {
        assertTrue(DateFormatUtils.parseDate(input).isEmpty());
    }

    @Test
    @DisplayName("Should return empty for null")
    void testParseDate_Null() {
        assertTrue(DateFormatUtils.parseDate(null).isEmpty());
    }

    // ============================================================================
    // toIsoDateString Tests
    // ============================================================================

    @Test
    @DisplayName("Should format java.time values as yyyy-MM-dd")
    void testToIsoDateString_JavaTime() {
        assertEquals("2017-09-26", DateFormatUtils.toIsoDateString(LocalDate.of(2017, 9, 26)));
        assertEquals("2017-09-26", DateFormatUtils.toIsoDateString(LocalDateTime.of(2017, 9, 26, 13, 45)));
    }

    @Test
    @DisplayName("Should format java.util.Date and Instant in the system zone")
    void testToIsoDateString_LegacyDate() {
        LocalDate day = LocalDate.of(2018, 10, 4);
        Instant noon = day.atTime(12, 0).atZone(ZoneId.systemDefault()).toInstant();
        assertEquals("2018-10-04", DateFormatUtils.toIsoDateString(java.util.Date.from(noon)));
        assertEquals("2018-10-04", DateFormatUtils.toIsoDateString(noon));
        assertEquals("2018-10-04", DateFormatUtils.toIsoDateString(java.sql.Date.valueOf(day)));
    }

    @Test
    @DisplayName("Should reformat parsable strings")
    void testToIsoDateString_String() {
        assertEquals("2017-10-02", DateFormatUtils.toIsoDateString("10/02/2017"));
        assertEquals("2017-10-02", DateFormatUtils.toIsoDateString(" 2017-10-02 "));
    }

    @Test
    @DisplayName("Should return empty string for null, unparsable and non-date values")
    void testToIsoDateString_Fallbacks() {
        assertEquals("", DateFormatUtils.toIsoDateString(null));
        assertEquals("", DateFormatUtils.toIsoDateString(""));
        assertEquals("", DateFormatUtils.toIsoDateString("not a date"));
        assertEquals("", DateFormatUtils.toIsoDateString(42));
        assertEquals("", DateFormatUtils.toIsoDateString(Boolean.TRUE));
    }

    @Test
    @DisplayName("Should be a fixed point on its own output")
    void testToIsoDateString_Idempotent() {
        String once = DateFormatUtils.toIsoDateString("15.01.2024");
        assertEquals(once, DateFormatUtils.toIsoDateString(once));
    }
}
