package com.di.organizer.codec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for TabularCodecs.
 */
@DisplayName("TabularCodecs Tests")
class TabularCodecsTest {

    @ParameterizedTest
    @CsvSource({
        "data/production_orders.xlsx, XLSX",
        "orders.XLSX, XLSX",
        "orders.csv, CSV",
        "ORDERS.CSV, CSV",
        "orders, XLSX",
        "orders.txt, XLSX"
    })
    @DisplayName("Should detect the format from the file extension")
    void testDetect(String file, TabularFormat expected) {
        assertEquals(expected, TabularCodecs.detect(Path.of(file)));
    }

    @Test
    @DisplayName("Should pick the codec for AUTO by extension")
    void testForPath_Auto() {
        assertInstanceOf(CsvTabularCodec.class, TabularCodecs.forPath(Path.of("orders.csv"), TabularFormat.AUTO, "Orders"));
        assertInstanceOf(XlsxTabularCodec.class, TabularCodecs.forPath(Path.of("orders.xlsx"), null, "Orders"));
    }

    @Test
    @DisplayName("Should honour an explicit format over the extension")
    void testForPath_Explicit() {
        assertInstanceOf(CsvTabularCodec.class, TabularCodecs.forPath(Path.of("orders.xlsx"), TabularFormat.CSV, "Orders"));
        assertInstanceOf(XlsxTabularCodec.class, TabularCodecs.forPath(Path.of("orders.csv"), TabularFormat.XLSX, "Orders"));
    }
}
