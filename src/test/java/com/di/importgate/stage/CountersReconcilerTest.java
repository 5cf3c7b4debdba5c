package com.di.importgate.stage;

import com.di.importgate.pipeline.Severity;
import com.di.importgate.pipeline.StageResult;
import com.di.importgate.pipeline.StageStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for CountersReconciler.
 */
@DisplayName("CountersReconciler Tests")
class CountersReconcilerTest {

    @TempDir
    Path tempDir;

    private final CountersReconciler reconciler = new CountersReconciler();

    @Test
    @DisplayName("Should pass when NumObservations adds up to NumNodeSuccesses")
    void testReconcile_Match() throws Exception {
        StageResult result = reconciler.reconcile(summary(10, 5), report("15"));
        assertEquals(StageStatus.PASSED, result.getStatus());
    }

    @Test
    @DisplayName("Should fail advisory on a mismatch with both numbers in the message")
    void testReconcile_Mismatch() throws Exception {
        StageResult result = reconciler.reconcile(summary(10, 5), report("14"));
        assertEquals(StageStatus.FAILED, result.getStatus());
        assertEquals(Severity.ADVISORY, result.getSeverity());
        assertFalse(result.isBlockingFailure());
        assertEquals("COUNTERS_MISMATCH", result.getFailureCode());
        assertEquals("NumObservations sum (15) != NumNodeSuccesses (14)", result.getFindings().get(0).getMessage());
    }

    @Test
    @DisplayName("Should skip when an input or counter is missing")
    void testReconcile_Skipped() throws Exception {
        assertEquals(StageStatus.SKIPPED, reconciler.reconcile(null, report("1")).getStatus());
        assertEquals(StageStatus.SKIPPED, reconciler.reconcile(summary(1), null).getStatus());
        assertEquals(StageStatus.SKIPPED,
            reconciler.reconcile(summary(1), tempDir.resolve("absent.json")).getStatus());

        Path noCounter = Files.writeString(tempDir.resolve("empty_report.json"),
            "{\"levelSummary\": {\"LEVEL_INFO\": {\"counters\": {\"NumRowSuccesses\": \"1\"}}}}");
        StageResult result = reconciler.reconcile(summary(1), noCounter);
        assertEquals(StageStatus.SKIPPED, result.getStatus());
        assertTrue(result.getAuditNote().contains("NumNodeSuccesses"));
    }

    private Path summary(long... observations) throws Exception {
        StringBuilder sb = new StringBuilder("StatVar,NumPlaces,NumObservations\n");
        for (int i = 0; i < observations.length; i++) {
            sb.append("Var_").append(i).append(",1,").append(observations[i]).append('\n');
        }
        return Files.writeString(tempDir.resolve("summary_report.csv"), sb.toString());
    }

    private Path report(String nodeSuccesses) throws Exception {
        return Files.writeString(tempDir.resolve("report.json"), """
            {"levelSummary": {"LEVEL_INFO": {"counters": {"NumRowSuccesses": "2", "NumNodeSuccesses": "%s"}}},
             "entries": [{"level": "LEVEL_INFO", "counterKey": "NumRowSuccesses", "userMessage": "ok"}]}
            """.formatted(nodeSuccesses));
    }
}
