package com.di.importgate.stage;

import com.di.importgate.config.ImportGateProperties;
import com.di.importgate.pipeline.FailureCode;
import com.di.importgate.pipeline.Finding;
import com.di.importgate.pipeline.Locator;
import com.di.importgate.pipeline.PipelineState;
import com.di.importgate.pipeline.Severity;
import com.di.importgate.pipeline.StageResult;
import com.di.importgate.pipeline.StageStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Counts data rows (non-blank lines after the header) against the configured limit.
 *
 * <p>The result names {@code importgate.row-volume.rule-id} as its policy rule: row
 * volume limits are a deployment policy rather than a data-correctness property, so
 * whether a breach blocks the run is decided by the dataset's warn-only overrides.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RowVolumeChecker {

    private final ImportGateProperties properties;

    public StageResult check(Path dataTable) {
        long threshold = properties.getRowVolume().getThreshold();
        String ruleId = properties.getRowVolume().getRuleId();
        long rows = countDataRows(dataTable);

        if (rows <= threshold) {
            log.info("[ROW-VOLUME] {} data row(s), limit {}", rows, threshold);
            return StageResult.passed(PipelineState.ROW_VOLUME).toBuilder().policyRuleId(ruleId).build();
        }
        log.warn("[ROW-VOLUME] {} data row(s) exceeds limit {}", rows, threshold);
        Finding finding = Finding.builder()
                .code(FailureCode.ROW_COUNT_EXCEEDED.name())
                .message(String.format("Data table has %d rows, which exceeds the limit of %d rows", rows, threshold))
                .locator(Locator.of(dataTable.toString()))
                .limit(threshold)
                .suggestion("Split the table, or list " + ruleId + " as warn-only for this dataset")
                .build();
        return StageResult.builder()
                .stage(PipelineState.ROW_VOLUME)
                .status(StageStatus.FAILED)
                .severity(Severity.BLOCKING)
                .failureCode(FailureCode.ROW_COUNT_EXCEEDED.name())
                .policyRuleId(ruleId)
                .findings(List.of(finding))
                .build();
    }

    static long countDataRows(Path dataTable) {
        try (Stream<String> lines = Files.lines(dataTable, StandardCharsets.UTF_8)) {
            long nonBlank = lines.filter(l -> !l.isBlank()).count();
            return Math.max(0, nonBlank - 1);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot count rows of " + dataTable, e);
        }
    }
}
