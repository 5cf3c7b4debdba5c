package com.di.importgate.stage;

import com.di.importgate.artifact.StructuredReport;
import com.di.importgate.artifact.SummaryArtifact;
import com.di.importgate.pipeline.FailureCode;
import com.di.importgate.pipeline.Finding;
import com.di.importgate.pipeline.Locator;
import com.di.importgate.pipeline.PipelineState;
import com.di.importgate.pipeline.Severity;
import com.di.importgate.pipeline.StageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Cross-checks the summary table against the generation report: the NumObservations
 * column must add up to the report's {@code LEVEL_INFO.NumNodeSuccesses}.
 *
 * <p>Both inputs must come from the same genmcf run; the lint report is never used
 * here. Always advisory; missing inputs skip the check.
 */
@Slf4j
@Service
public class CountersReconciler {

    static final String NODE_SUCCESSES = "NumNodeSuccesses";

    public StageResult reconcile(Path summary, Path generationReport) {
        if (summary == null || !Files.isRegularFile(summary)) {
            return skip("summary table not available");
        }
        if (generationReport == null || !Files.isRegularFile(generationReport)) {
            return skip("generation report not available");
        }
        OptionalLong observations;
        Optional<Long> successes;
        try {
            observations = SummaryArtifact.read(summary).totalObservations();
            successes = StructuredReport.read(generationReport).counter(StructuredReport.LEVEL_INFO, NODE_SUCCESSES);
        } catch (IOException e) {
            log.warn("[RECONCILE] Cannot read counters: {}", e.getMessage());
            return skip("counters unreadable: " + e.getMessage());
        }
        if (observations.isEmpty()) {
            return skip(SummaryArtifact.NUM_OBSERVATIONS + " missing or non-numeric in summary table");
        }
        if (successes.isEmpty()) {
            return skip(NODE_SUCCESSES + " not in generation report");
        }

        long actual = observations.getAsLong();
        long expected = successes.get();
        if (actual == expected) {
            log.info("[RECONCILE] Counters match: {} observation(s)", actual);
            return StageResult.passed(PipelineState.RECONCILE);
        }
        log.warn("[RECONCILE] {} sum {} != {} {}", SummaryArtifact.NUM_OBSERVATIONS, actual, NODE_SUCCESSES, expected);
        Finding finding = Finding.builder()
                .code(FailureCode.COUNTERS_MISMATCH.name())
                .message(String.format("%s sum (%d) != %s (%d)", SummaryArtifact.NUM_OBSERVATIONS, actual, NODE_SUCCESSES, expected))
                .locator(Locator.of(generationReport.toString()))
                .severity(Severity.ADVISORY)
                .build();
        return StageResult.failed(PipelineState.RECONCILE, Severity.ADVISORY, FailureCode.COUNTERS_MISMATCH.name(), List.of(finding));
    }

    private static StageResult skip(String reason) {
        log.info("[RECONCILE] Skipped: {}", reason);
        return StageResult.skipped(PipelineState.RECONCILE, reason);
    }
}
