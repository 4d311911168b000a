package com.di.organizer.exception;

import com.fasterxml.jackson.core.JsonParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.io.FileNotFoundException;
import java.nio.file.AccessDeniedException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ErrorCategory enum.
 */
@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    // ============================================================================
    // Categorization Tests
    // ============================================================================

    static Stream<Arguments> categorizedExceptions() {
        return Stream.of(
                Arguments.of(new JsonParseException(null, "Unexpected end-of-input"), ErrorCategory.SERIALIZATION_ERROR),
                Arguments.of(new HttpMessageNotReadableException("bad body", new MockHttpInputMessage(new byte[0])),
                        ErrorCategory.SERIALIZATION_ERROR),
                Arguments.of(new IllegalArgumentException("Invalid argument"), ErrorCategory.VALIDATION_ERROR),
                Arguments.of(new IllegalStateException("Invalid state"), ErrorCategory.VALIDATION_ERROR),
                Arguments.of(new IndexOutOfBoundsException(3), ErrorCategory.VALIDATION_ERROR),
                Arguments.of(new OutOfMemoryError("Java heap space"), ErrorCategory.RESOURCE_ERROR),
                Arguments.of(new FileNotFoundException("orders.xlsx"), ErrorCategory.RESOURCE_ERROR),
                Arguments.of(new AccessDeniedException("orders.xlsx"), ErrorCategory.RESOURCE_ERROR),
                Arguments.of(new MaxUploadSizeExceededException(10L), ErrorCategory.RESOURCE_ERROR)
        );
    }

    @ParameterizedTest
    @MethodSource("categorizedExceptions")
    @DisplayName("Should categorize known exception types")
    void testCategorize(Throwable exception, ErrorCategory expected) {
        assertEquals(expected, ErrorCategory.categorize(exception));
    }

    @Test
    @DisplayName("Should return UNKNOWN for null exception")
    void testCategorize_Null() {
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
    }

    @Test
    @DisplayName("Should return APPLICATION_ERROR for unclassified exceptions")
    void testCategorize_UnclassifiedException() {
        assertEquals(ErrorCategory.APPLICATION_ERROR, ErrorCategory.categorize(new RuntimeException("Generic error")));
        assertEquals(ErrorCategory.APPLICATION_ERROR, ErrorCategory.categorize(new java.net.ConnectException("Connection refused")));
    }

    // ============================================================================
    // Helper Method Tests
    // ============================================================================

    @Test
    @DisplayName("Should return the constant name from toString")
    void testToString() {
        assertEquals("VALIDATION_ERROR", ErrorCategory.VALIDATION_ERROR.toString());
    }

    @ParameterizedTest
    @EnumSource(ErrorCategory.class)
    @DisplayName("Should have non-empty name and description for all categories")
    void testAllCategoriesHaveNameAndDescription(ErrorCategory category) {
        assertFalse(category.getName().isEmpty());
        assertFalse(category.getDescription().isEmpty());
    }
}
