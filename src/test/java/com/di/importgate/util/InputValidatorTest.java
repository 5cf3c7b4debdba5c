package com.di.importgate.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for InputValidator utility class.
 */
@DisplayName("InputValidator Tests")
class InputValidatorTest {

    // ============================================================================
    // Rule Id Tests
    // ============================================================================

    @ParameterizedTest
    @ValueSource(strings = {"check_min_value", "check_csv_row_count", "a", "rule2"})
    @DisplayName("Should accept snake_case rule ids")
    void testIsRuleId_Valid(String ruleId) {
        assertTrue(InputValidator.isRuleId(ruleId));
    }

    @ParameterizedTest
    @ValueSource(strings = {"CheckMinValue", "check-min-value", "_check", "1check", "", "check min"})
    @DisplayName("Should reject rule ids that are not snake_case")
    void testIsRuleId_Invalid(String ruleId) {
        assertFalse(InputValidator.isRuleId(ruleId));
    }

    @Test
    @DisplayName("Should reject null rule id")
    void testIsRuleId_Null() {
        assertFalse(InputValidator.isRuleId(null));
    }

    // ============================================================================
    // Dataset and Run Id Tests
    // ============================================================================

    @Test
    @DisplayName("Should accept and trim path-safe dataset ids")
    void testValidateDatasetId_Valid() {
        assertEquals("child_birth", InputValidator.validateDatasetId("child_birth"));
        assertEquals("wb-gdp.v2", InputValidator.validateDatasetId("  wb-gdp.v2 "));
        assertEquals("20240101-120000-ab12cd34", InputValidator.validateRunId("20240101-120000-ab12cd34"));
    }

    @Test
    @DisplayName("Should reject null dataset id")
    void testValidateDatasetId_Null() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> InputValidator.validateDatasetId(null));
        assertTrue(ex.getMessage().contains("cannot be null"));
    }

    @Test
    @DisplayName("Should reject blank run id")
    void testValidateRunId_Blank() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> InputValidator.validateRunId("   "));
        assertTrue(ex.getMessage().contains("cannot be empty"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"../etc", "a/b", "a\\b", ".hidden", "data set", "run;rm", "x..y"})
    @DisplayName("Should reject ids that are not a single safe path segment")
    void testValidateDatasetId_Traversal(String id) {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> InputValidator.validateDatasetId(id));
        assertTrue(ex.getMessage().contains("Invalid Dataset id"));
    }

    @Test
    @DisplayName("Should reject ids longer than the maximum length")
    void testValidateRunId_TooLong() {
        String longId = "r".repeat(129);
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> InputValidator.validateRunId(longId));
        assertTrue(ex.getMessage().contains("maximum length"));
    }
}
