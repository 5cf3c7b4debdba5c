package com.di.importgate.external;

import com.di.importgate.pipeline.FailureCode;
import com.di.importgate.pipeline.Finding;
import com.di.importgate.pipeline.Locator;
import com.di.importgate.pipeline.PipelineState;
import com.di.importgate.pipeline.Severity;
import com.di.importgate.pipeline.StageResult;
import com.di.importgate.pipeline.StageStatus;

import java.util.List;

/**
 * Maps an {@link ExternalResult} to a stage failure. Timeouts and cancellations
 * always use {@link FailureCode#TIMEOUT}; launch errors and non-zero exits use the
 * caller's code.
 */
public final class ExternalStepOutcomes {

    private static final int MAX_TAIL_IN_MESSAGE = 500;

    private ExternalStepOutcomes() {
    }

    public static Finding failureFinding(String tool, ExternalResult result, FailureCode onError, Severity severity) {
        FailureCode code;
        String message;
        if (result.timedOut()) {
            code = FailureCode.TIMEOUT;
            message = String.format("%s did not finish within its time limit (stopped after %ds)",
                    tool, result.elapsed().toSeconds());
        } else if (result.launchError() != null) {
            code = onError;
            message = String.format("%s could not be started: %s", tool, result.launchError());
        } else {
            code = onError;
            message = String.format("%s exited with status %d", tool, result.exitCode());
        }
        String tail = result.outputTail();
        if (tail != null && !tail.isBlank()) {
            message += ": " + abbreviate(tail.strip());
        }
        return Finding.builder().code(code.name()).message(message).locator(Locator.of(tool)).severity(severity).build();
    }

    public static StageResult failure(PipelineState stage, String tool, ExternalResult result, FailureCode onError, Severity severity) {
        Finding finding = failureFinding(tool, result, onError, severity);
        return StageResult.builder()
                .stage(stage)
                .status(StageStatus.FAILED)
                .severity(severity)
                .failureCode(finding.getCode())
                .findings(List.of(finding))
                .error(result.launchError())
                .build();
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_TAIL_IN_MESSAGE ? text : "..." + text.substring(text.length() - MAX_TAIL_IN_MESSAGE);
    }
}
