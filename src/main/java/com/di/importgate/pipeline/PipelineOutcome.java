package com.di.importgate.pipeline;

import com.di.importgate.report.ResultDocument;
import com.di.importgate.report.Verdict;

/**
 * What a finished run hands back to its caller.
 *
 * @param verdict   overall verdict
 * @param exitCode  process exit status: 0 pass, 1 fail, 2 usage error
 * @param document  the emitted result document
 * @param abortedAt stage that aborted the run, or null
 * @param workspace directory holding the run's files
 */
public record PipelineOutcome(Verdict verdict, int exitCode, ResultDocument document, PipelineState abortedAt,
                              RunWorkspace workspace) {
}
