package com.di.importgate.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StageResult Tests")
class StageResultTest {

    @Test
    @DisplayName("Should take severity and code from a single finding")
    void testFailed_SingleFinding() {
        StageResult result = StageResult.failed(PipelineState.QUALITY,
            Finding.blocking(FailureCode.EMPTY_COLUMN.name(), "column 'unit' is empty", Locator.of("data.csv")));
        assertEquals(StageStatus.FAILED, result.getStatus());
        assertEquals(Severity.BLOCKING, result.getSeverity());
        assertEquals("EMPTY_COLUMN", result.getFailureCode());
        assertTrue(result.isBlockingFailure());
    }

    @Test
    @DisplayName("Should downgrade a blocking failure and all of its findings")
    void testDowngraded() {
        StageResult result = StageResult.failed(PipelineState.ROW_VOLUME, Severity.BLOCKING,
            FailureCode.ROW_COUNT_EXCEEDED.name(), List.of(
                Finding.blocking("ROW_COUNT_EXCEEDED", "too many rows", Locator.of("data.csv")),
                Finding.blocking("OTHER", "second", Locator.of("data.csv"))));

        StageResult downgraded = result.downgraded("warn-only override for check_csv_row_count");

        assertEquals(StageStatus.FAILED, downgraded.getStatus());
        assertEquals(Severity.ADVISORY, downgraded.getSeverity());
        assertFalse(downgraded.isBlockingFailure());
        assertTrue(downgraded.getFindings().stream().noneMatch(Finding::isBlocking));
        assertEquals("warn-only override for check_csv_row_count (was FAILED/BLOCKING)", downgraded.getAuditNote());
        assertTrue(result.isBlockingFailure(), "original must be unchanged");
    }

    @Test
    @DisplayName("Should return the same instance when there is nothing to downgrade")
    void testDowngraded_Unchanged() {
        StageResult passed = StageResult.passed(PipelineState.PREFLIGHT);
        assertSame(passed, passed.downgraded("x"));

        StageResult advisory = StageResult.failed(PipelineState.RECONCILE,
            Finding.advisory("COUNTERS_MISMATCH", "m", Locator.of("s")));
        assertSame(advisory, advisory.downgraded("x"));
    }

    @Test
    @DisplayName("Should downgrade FAILED rule outcomes to WARNING and remember the original")
    void testRuleOutcome_Downgraded() {
        RuleOutcome failed = RuleOutcome.builder().ruleId("check_min_value").status(OutcomeStatus.FAILED).build();
        RuleOutcome warning = failed.downgraded();
        assertEquals(OutcomeStatus.WARNING, warning.getStatus());
        assertEquals(OutcomeStatus.FAILED, warning.getOriginalStatus());
        assertSame(warning, warning.downgraded());

        RuleOutcome passed = RuleOutcome.builder().ruleId("r").status(OutcomeStatus.PASSED).build();
        assertSame(passed, passed.downgraded());
    }

    @Test
    @DisplayName("Should parse engine statuses case-insensitively")
    void testOutcomeStatus_Parse() {
        assertEquals(OutcomeStatus.FAILED, OutcomeStatus.parse(" failed ").orElseThrow());
        assertTrue(OutcomeStatus.parse("CONFIG_ERROR").isEmpty());
        assertTrue(OutcomeStatus.parse(null).isEmpty());
    }
}
