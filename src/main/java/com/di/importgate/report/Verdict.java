package com.di.importgate.report;

/**
 * Overall outcome of a run.
 */
public enum Verdict {
    PASS,
    FAIL;

    public int exitCode() {
        return this == PASS ? 0 : 1;
    }
}
