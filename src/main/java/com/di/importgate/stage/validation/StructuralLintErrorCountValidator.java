package com.di.importgate.stage.validation;

import com.di.importgate.artifact.StructuredReport;
import com.di.importgate.config.Rule;
import com.di.importgate.pipeline.OutcomeStatus;
import com.di.importgate.pipeline.RuleOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts LEVEL_ERROR counters of the lint report, leaving out existence-resolution
 * diagnostics ({@code Existence_FailedDcCall_*}), and fails when the count exceeds
 * {@code params.threshold} (default 0). A missing report counts as zero errors.
 */
@Slf4j
@Component
public class StructuralLintErrorCountValidator implements LocalValidator {

    public static final String NAME = "STRUCTURAL_LINT_ERROR_COUNT";
    static final String EXCLUDED_PREFIX = "Existence_FailedDcCall_";

    @Override
    public String validatorName() {
        return NAME;
    }

    @Override
    public RuleOutcome evaluate(Rule rule, Path report) {
        long threshold = threshold(rule.getParams());
        long count = 0;
        if (report != null && Files.isRegularFile(report)) {
            try {
                count = StructuredReport.read(report)
                        .sumCounters(StructuredReport.LEVEL_ERROR, key -> !key.startsWith(EXCLUDED_PREFIX));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read lint report " + report, e);
            }
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("lint_error_count", count);
        boolean failed = count > threshold;
        log.info("[VALIDATE] {}: {} structural lint error(s), threshold {}", rule.getRuleId(), count, threshold);
        return RuleOutcome.builder()
                .ruleId(rule.getRuleId())
                .status(failed ? OutcomeStatus.FAILED : OutcomeStatus.PASSED)
                .message(failed
                        ? String.format("Found %d structural schema/MCF lint errors (non-resolution), which exceeds the threshold of %d.",
                        count, threshold)
                        : "")
                .details(details)
                .params(rule.getParams())
                .build();
    }

    static long threshold(Map<String, Object> params) {
        Object value = params == null ? null : params.get("threshold");
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("threshold is not an integer: " + s, e);
            }
        }
        return 0;
    }
}
