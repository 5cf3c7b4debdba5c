package com.di.importgate.stage.validation;

import com.di.importgate.config.DataSource;
import com.di.importgate.config.Rule;
import com.di.importgate.config.RuleScope;
import com.di.importgate.pipeline.OutcomeStatus;
import com.di.importgate.pipeline.RuleOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for StructuralLintErrorCountValidator.
 */
@DisplayName("StructuralLintErrorCountValidator Tests")
class StructuralLintErrorCountValidatorTest {

    @TempDir
    Path tempDir;

    private final StructuralLintErrorCountValidator validator = new StructuralLintErrorCountValidator();

    @Test
    @DisplayName("Should count structural errors and leave out existence-check failures")
    void testEvaluate_ExcludesExistence() throws Exception {
        RuleOutcome outcome = validator.evaluate(rule(Map.of("threshold", 0)), report("""
            {"levelSummary": {"LEVEL_ERROR": {"counters": {
              "MCF_UnknownProperty": "2",
              "Existence_FailedDcCall_Place": "40",
              "CSV_MalformedRow": 1}}}}
            """));
        assertEquals(OutcomeStatus.FAILED, outcome.getStatus());
        assertEquals(3L, outcome.getDetails().get("lint_error_count"));
        assertEquals("Found 3 structural schema/MCF lint errors (non-resolution), which exceeds the threshold of 0.",
            outcome.getMessage());
        assertEquals("check_structural_lint_error_count", outcome.getRuleId());
    }

    @Test
    @DisplayName("Should pass at the threshold")
    void testEvaluate_AtThreshold() throws Exception {
        RuleOutcome outcome = validator.evaluate(rule(Map.of("threshold", "2")),
            report("{\"levelSummary\": {\"LEVEL_ERROR\": {\"counters\": {\"MCF_UnknownProperty\": \"2\"}}}}"));
        assertEquals(OutcomeStatus.PASSED, outcome.getStatus());
    }

    @Test
    @DisplayName("Should count zero errors when there is no report")
    void testEvaluate_NoReport() {
        RuleOutcome outcome = validator.evaluate(rule(Map.of()), null);
        assertEquals(OutcomeStatus.PASSED, outcome.getStatus());
        assertEquals(0L, outcome.getDetails().get("lint_error_count"));
    }

    @Test
    @DisplayName("Should read threshold from numbers or strings and reject other text")
    void testThreshold() {
        assertEquals(5, StructuralLintErrorCountValidator.threshold(Map.of("threshold", 5)));
        assertEquals(7, StructuralLintErrorCountValidator.threshold(Map.of("threshold", " 7 ")));
        assertEquals(0, StructuralLintErrorCountValidator.threshold(null));
        Map<String, Object> nullThreshold = new HashMap<>();
        nullThreshold.put("threshold", null);
        assertEquals(0, StructuralLintErrorCountValidator.threshold(nullThreshold));
        assertThrows(IllegalArgumentException.class,
            () -> StructuralLintErrorCountValidator.threshold(Map.of("threshold", "many")));
    }

    private static Rule rule(Map<String, Object> params) {
        return Rule.builder()
            .ruleId("check_structural_lint_error_count")
            .description("structural lint")
            .validator(StructuralLintErrorCountValidator.NAME)
            .scope(new RuleScope(DataSource.LINT))
            .params(params)
            .build();
    }

    private Path report(String json) throws Exception {
        return Files.writeString(tempDir.resolve("report.json"), json);
    }
}
