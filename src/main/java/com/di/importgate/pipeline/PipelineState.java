package com.di.importgate.pipeline;

/**
 * States of a single pipeline run, in execution order.
 *
 * <pre>
 * INIT → PREFLIGHT → QUALITY → ROW_VOLUME → SCHEMA_REVIEW → GENERATE → VALIDATE
 *      → RECONCILE → RECLASSIFY → REPORT → DONE_PASS | DONE_FAIL
 * </pre>
 */
public enum PipelineState {
    INIT("init"),
    PREFLIGHT("preflight"),
    QUALITY("data_quality"),
    ROW_VOLUME("row_volume"),
    SCHEMA_REVIEW("schema_review"),
    GENERATE("generation"),
    VALIDATE("validation"),
    RECONCILE("counters_reconciliation"),
    RECLASSIFY("reclassification"),
    REPORT("report"),
    DONE_PASS("done"),
    DONE_FAIL("done");

    private final String stageName;

    PipelineState(String stageName) {
        this.stageName = stageName;
    }

    /** Name used for this stage in the result document. */
    public String stageName() {
        return stageName;
    }

    public boolean isTerminal() {
        return this == DONE_PASS || this == DONE_FAIL;
    }

    /**
     * The state that follows this one when the stage did not abort the run.
     * REPORT has no fixed successor; it resolves to a terminal state from the verdict.
     */
    PipelineState successor() {
        if (this == REPORT || isTerminal()) {
            throw new IllegalStateException("No fixed successor for " + this);
        }
        return values()[ordinal() + 1];
    }
}
