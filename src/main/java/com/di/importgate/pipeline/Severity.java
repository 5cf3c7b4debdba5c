package com.di.importgate.pipeline;

/**
 * Whether a failed check stops the run.
 */
public enum Severity {
    /** Counts as a failure; aborts the pipeline when carried by a failed stage. */
    BLOCKING,
    /** Reported but never fails the run. */
    ADVISORY
}
