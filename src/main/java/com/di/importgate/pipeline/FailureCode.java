package com.di.importgate.pipeline;

/**
 * Stage-level failure codes. Finding codes reuse these names where a stage has one
 * kind of failure; checkers with many sub-checks define their own finding codes.
 */
public enum FailureCode {
    USAGE_ERROR,
    CONFIG_INVALID,
    MISSING_FILE,
    WRONG_EXTENSION,
    MISSING_HEADER,
    DUPLICATE_COLUMN,
    EMPTY_COLUMN,
    DUPLICATE_ROW,
    NON_NUMERIC_VALUE,
    DATA_QUALITY_FAILED,
    ROW_COUNT_EXCEEDED,
    SCHEMA_REVIEW_FAILED,
    REVIEWER_FAILED,
    DATA_PROCESSING_FAILED,
    SUMMARY_MISSING,
    VALIDATION_FAILED,
    VALIDATION_INCOMPLETE,
    COUNTERS_MISMATCH,
    TIMEOUT,
    IO_ERROR,
    INTERNAL_ERROR
}
