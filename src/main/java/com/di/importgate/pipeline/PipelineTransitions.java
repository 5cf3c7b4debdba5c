package com.di.importgate.pipeline;

import com.di.importgate.report.Verdict;

/**
 * Transition function of the pipeline state machine. Any blocking failure goes
 * straight to REPORT; everything else moves to the next state in order.
 */
public final class PipelineTransitions {

    private PipelineTransitions() {
    }

    /**
     * @param completed state whose work just finished
     * @param result    its stage result, or null for states that produce none
     */
    public static PipelineState next(PipelineState completed, StageResult result) {
        if (completed == PipelineState.REPORT || completed.isTerminal()) {
            throw new IllegalStateException("No transition out of " + completed + " without a verdict");
        }
        if (result != null && result.isBlockingFailure()) {
            return PipelineState.REPORT;
        }
        return completed.successor();
    }

    public static PipelineState terminal(Verdict verdict) {
        return verdict == Verdict.PASS ? PipelineState.DONE_PASS : PipelineState.DONE_FAIL;
    }
}
