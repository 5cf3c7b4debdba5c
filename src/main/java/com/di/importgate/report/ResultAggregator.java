package com.di.importgate.report;

import com.di.importgate.pipeline.Finding;
import com.di.importgate.pipeline.Locator;
import com.di.importgate.pipeline.OutcomeStatus;
import com.di.importgate.pipeline.RuleOutcome;
import com.di.importgate.pipeline.Severity;
import com.di.importgate.pipeline.StageResult;
import com.di.importgate.pipeline.StageStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link ResultDocument} from the stage results of a run.
 *
 * <p>Records follow stage execution order; within a stage, findings come before rule
 * outcomes, each in the order the stage reported them. The output depends only on
 * the input list, so aggregating the same results twice gives identical documents.
 * The verdict is FAIL when any record is FAILED or the run was aborted.
 */
@Slf4j
@Service
public class ResultAggregator {

    /**
     * @param results stage results in execution order, already reclassified
     * @param abort   the blocking failure that ended the run early, or null
     */
    public ResultDocument aggregate(String dataset, String runId, List<StageResult> results, StageResult abort) {
        ResultDocument.ResultDocumentBuilder document = ResultDocument.builder().dataset(dataset).runId(runId);
        boolean failed = abort != null;
        for (StageResult result : results) {
            String stage = result.getStage().stageName();
            document.stage(stage, stageLabel(result));
            boolean downgraded = result.getAuditNote() != null && result.getStatus() == StageStatus.FAILED
                    && result.getSeverity() == Severity.ADVISORY;
            for (Finding finding : result.getFindings()) {
                ResultRecord record = fromFinding(stage, finding, downgraded ? result.getAuditNote() : null);
                failed |= record.isFailed();
                document.record(record);
            }
            for (RuleOutcome outcome : result.getOutcomes()) {
                ResultRecord record = fromOutcome(stage, outcome);
                failed |= record.isFailed();
                document.record(record);
            }
            if (result.getStatus() == StageStatus.SKIPPED && result.getFindings().isEmpty() && result.getOutcomes().isEmpty()) {
                document.record(skipped(stage, result.getAuditNote()));
            }
        }
        if (abort != null) {
            Finding first = abort.getFindings().isEmpty() ? null : abort.getFindings().get(0);
            document.abortedAt(abort.getStage().stageName())
                    .abortCode(abort.getFailureCode())
                    .abortMessage(first != null ? first.getMessage() : abort.getError())
                    .abortLimit(first != null ? first.getLimit() : null);
        }
        ResultDocument built = document.verdict(failed ? Verdict.FAIL : Verdict.PASS).build();
        log.info("[REPORT] Aggregated {} record(s) from {} stage(s): verdict={}", built.getRecords().size(),
                results.size(), built.getVerdict());
        return built;
    }

    static ResultRecord fromFinding(String stage, Finding finding, String auditNote) {
        Map<String, Object> details = new LinkedHashMap<>();
        Locator locator = finding.getLocator();
        if (locator != null) {
            putIfPresent(details, "file", locator.file());
            putIfPresent(details, "line", locator.line());
            putIfPresent(details, "column", locator.column());
        }
        putIfPresent(details, "limit", finding.getLimit());
        putIfPresent(details, "suggestion", finding.getSuggestion());
        putIfPresent(details, "audit_note", auditNote);
        boolean blocking = finding.isBlocking();
        return ResultRecord.builder()
                .validationName(finding.getCode())
                .stage(stage)
                .status(blocking ? RecordStatus.FAILED : RecordStatus.WARNING)
                .severity(finding.getSeverity())
                .message(finding.getMessage())
                .details(details)
                .originalStatus(auditNote != null ? RecordStatus.FAILED.name() : null)
                .build();
    }

    static ResultRecord fromOutcome(String stage, RuleOutcome outcome) {
        RecordStatus status = switch (outcome.getStatus()) {
            case PASSED -> RecordStatus.PASSED;
            case FAILED -> RecordStatus.FAILED;
            case WARNING -> RecordStatus.WARNING;
        };
        OutcomeStatus original = outcome.getOriginalStatus();
        return ResultRecord.builder()
                .validationName(outcome.getRuleId())
                .stage(stage)
                .status(status)
                .severity(status == RecordStatus.FAILED ? Severity.BLOCKING : Severity.ADVISORY)
                .message(outcome.getMessage())
                .details(new LinkedHashMap<>(outcome.getDetails()))
                .validationParams(new LinkedHashMap<>(outcome.getParams()))
                .originalStatus(original != null ? original.name() : null)
                .build();
    }

    static ResultRecord skipped(String stage, String reason) {
        return ResultRecord.builder()
                .validationName(stage)
                .stage(stage)
                .status(RecordStatus.SKIPPED)
                .severity(Severity.ADVISORY)
                .message(reason == null ? "" : reason)
                .build();
    }

    private static String stageLabel(StageResult result) {
        if (result.getStatus() == StageStatus.FAILED) {
            return result.getStatus() + "/" + result.getSeverity();
        }
        return result.getStatus().name();
    }

    private static void putIfPresent(Map<String, Object> details, String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
    }
}
