package com.di.importgate.pipeline;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one pipeline stage.
 *
 * <p>Created by the stage on completion and never mutated afterwards. The only
 * rewrite is {@link #downgraded(String)}, used by warn-only overrides, which returns
 * a new instance carrying an audit note with the original classification.
 */
@Value
@Builder(toBuilder = true)
public class StageResult {

    PipelineState stage;
    StageStatus status;
    Severity severity;
    @Singular
    List<Finding> findings;
    @Singular
    List<RuleOutcome> outcomes;
    /** Diagnostic for tool or internal errors; not a finding. */
    String error;
    /** Code reported in the failure sidecar when this result aborts the run. */
    String failureCode;
    /** Rule id used to look up warn-only overrides for this stage's own failure. */
    String policyRuleId;
    String auditNote;
    @Singular
    Map<ArtifactKind, Path> artifacts;

    public static StageResult passed(PipelineState stage) {
        return StageResult.builder().stage(stage).status(StageStatus.PASSED).severity(Severity.BLOCKING).build();
    }

    public static StageResult skipped(PipelineState stage, String reason) {
        return StageResult.builder().stage(stage).status(StageStatus.SKIPPED).severity(Severity.ADVISORY)
                .auditNote(reason).build();
    }

    public static StageResult failed(PipelineState stage, Severity severity, String failureCode, List<Finding> findings) {
        return StageResult.builder().stage(stage).status(StageStatus.FAILED).severity(severity)
                .failureCode(failureCode).findings(findings).build();
    }

    /**
     * Failure caused by a single finding; the finding carries the stage severity.
     */
    public static StageResult failed(PipelineState stage, Finding finding) {
        return failed(stage, finding.getSeverity(), finding.getCode(), List.of(finding));
    }

    public boolean isBlockingFailure() {
        return status == StageStatus.FAILED && severity == Severity.BLOCKING;
    }

    /**
     * Reclassifies a failed result as advisory; all of its findings become advisory.
     * Results that did not fail, or are already advisory, are returned unchanged.
     */
    public StageResult downgraded(String reason) {
        if (status != StageStatus.FAILED || severity == Severity.ADVISORY) {
            return this;
        }
        return toBuilder()
                .severity(Severity.ADVISORY)
                .clearFindings()
                .findings(findings.stream().map(Finding::asAdvisory).toList())
                .auditNote(String.format("%s (was %s/%s)", reason, status, severity))
                .build();
    }
}
