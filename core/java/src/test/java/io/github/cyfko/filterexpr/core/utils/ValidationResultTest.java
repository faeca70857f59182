package io.github.cyfko.filterexpr.core.utils;

import io.github.cyfko.filterexpr.core.exception.ErrorCode;
import io.github.cyfko.filterexpr.core.exception.FilterValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultTest {

    @Test
    void successCarriesNoError() {
        ValidationResult result = ValidationResult.success();

        assertTrue(result.isValid());
        assertNull(result.getError());
        assertNull(result.getErrorCode());
        assertNull(result.getErrorMessage());
        assertSame(result, ValidationResult.success());
        assertEquals("ValidationResult[valid=true]", result.toString());
    }

    @Test
    void failureCarriesTheError() {
        FilterValidationException error = new FilterValidationException(ErrorCode.EMPTY_LIST, "list is empty");
        ValidationResult result = ValidationResult.failure(error);

        assertFalse(result.isValid());
        assertSame(error, result.getError());
        assertEquals(ErrorCode.EMPTY_LIST, result.getErrorCode());
        assertEquals("EmptyList: list is empty", result.getErrorMessage());
        assertTrue(result.toString().contains("valid=false"));
    }

    @Test
    void failureRequiresAnError() {
        assertThrows(NullPointerException.class, () -> ValidationResult.failure(null));
    }
}
