package com.di.importgate.report;

import com.di.importgate.pipeline.RunWorkspace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes a short text summary of the run to the log.
 */
@Slf4j
@Component
public class LoggingReportRenderer implements ReportRenderer {

    @Override
    public void render(ResultDocument document, RunWorkspace workspace) {
        log.info("[SUMMARY] dataset={} run={} verdict={}", document.getDataset(), document.getRunId(), document.getVerdict());
        document.getStages().forEach((stage, status) -> log.info("[SUMMARY]   {} {}", padRight(stage, 24), status));
        log.info("[SUMMARY] {} record(s): {} FAILED, {} WARNING", document.getRecords().size(),
                document.failedCount(), document.warningCount());
        for (ResultRecord record : document.getRecords()) {
            if (record.getStatus() == RecordStatus.FAILED || record.getStatus() == RecordStatus.WARNING) {
                log.info("[SUMMARY]   {} {} [{}] {}", padRight(record.getStatus().name(), 8), record.getValidationName(),
                        record.getStage(), record.getMessage());
            }
        }
        if (document.isAborted()) {
            log.info("[SUMMARY] Aborted at {} ({}): {}", document.getAbortedAt(), document.getAbortCode(),
                    document.getAbortMessage());
        }
        log.info("[SUMMARY] Output: {}", workspace.root());
    }

    private static String padRight(String value, int width) {
        return String.format("%-" + width + "s", value);
    }
}
