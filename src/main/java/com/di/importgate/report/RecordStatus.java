package com.di.importgate.report;

/**
 * Status of one record in the result document.
 */
public enum RecordStatus {
    PASSED,
    FAILED,
    WARNING,
    SKIPPED
}
