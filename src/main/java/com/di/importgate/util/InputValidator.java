package com.di.importgate.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Input validation for identifiers that end up in file paths or rule documents.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // Identifier Patterns
    // ============================================================================

    /** snake_case, starting with a lowercase letter. */
    private static final Pattern RULE_ID_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

    /**
     * Dataset and run ids become directory names under the output base dir:
     * letters, digits, dot, dash and underscore, not starting with a dot.
     */
    private static final Pattern PATH_SEGMENT_PATTERN = Pattern.compile("^[A-Za-z0-9_\\-][A-Za-z0-9_.\\-]*$");

    private static final int MAX_PATH_SEGMENT_LENGTH = 128;

    // ============================================================================
    // Rule Ids
    // ============================================================================

    public static boolean isRuleId(String ruleId) {
        return ruleId != null && RULE_ID_PATTERN.matcher(ruleId).matches();
    }

    // ============================================================================
    // Path-safe Identifiers
    // ============================================================================

    /**
     * Validates a dataset identifier.
     *
     * @return the trimmed id
     * @throws IllegalArgumentException if the id is blank or not path-safe
     */
    public static String validateDatasetId(String datasetId) {
        return validatePathSegment(datasetId, "Dataset id");
    }

    /**
     * Validates a run identifier.
     *
     * @return the trimmed id
     * @throws IllegalArgumentException if the id is blank or not path-safe
     */
    public static String validateRunId(String runId) {
        return validatePathSegment(runId, "Run id");
    }

    private static String validatePathSegment(String value, String label) {
        if (value == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", label));
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", label));
        }
        if (trimmed.length() > MAX_PATH_SEGMENT_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("%s exceeds maximum length of %d characters: %s", label, MAX_PATH_SEGMENT_LENGTH, trimmed));
        }
        if (trimmed.contains("..") || !PATH_SEGMENT_PATTERN.matcher(trimmed).matches()) {
            log.warn("Rejected {} '{}': not a safe path segment", label, trimmed);
            throw new IllegalArgumentException(
                    String.format("Invalid %s: '%s'. Only letters, digits, '.', '-' and '_' are allowed.", label, trimmed));
        }
        return trimmed;
    }
}
