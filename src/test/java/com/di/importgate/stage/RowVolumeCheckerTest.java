package com.di.importgate.stage;

import com.di.importgate.config.ImportGateProperties;
import com.di.importgate.pipeline.Finding;
import com.di.importgate.pipeline.StageResult;
import com.di.importgate.pipeline.StageStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for RowVolumeChecker.
 */
@DisplayName("RowVolumeChecker Tests")
class RowVolumeCheckerTest {

    @TempDir
    Path tempDir;

    private ImportGateProperties properties;
    private RowVolumeChecker checker;

    @BeforeEach
    void setUp() {
        properties = new ImportGateProperties();
        properties.getRowVolume().setThreshold(3);
        checker = new RowVolumeChecker(properties);
    }

    @Test
    @DisplayName("Should pass at exactly the threshold and name the policy rule")
    void testCheck_AtThreshold() throws Exception {
        StageResult result = checker.check(table(3));
        assertEquals(StageStatus.PASSED, result.getStatus());
        assertEquals("check_csv_row_count", result.getPolicyRuleId());
    }

    @Test
    @DisplayName("Should fail one row over the threshold with the limit on the finding")
    void testCheck_OverThreshold() throws Exception {
        StageResult result = checker.check(table(4));
        assertTrue(result.isBlockingFailure());
        assertEquals("ROW_COUNT_EXCEEDED", result.getFailureCode());
        assertEquals("check_csv_row_count", result.getPolicyRuleId());
        Finding finding = result.getFindings().get(0);
        assertEquals(3L, finding.getLimit());
        assertEquals("Data table has 4 rows, which exceeds the limit of 3 rows", finding.getMessage());
    }

    @Test
    @DisplayName("Should ignore blank lines when counting")
    void testCountDataRows_BlankLines() throws Exception {
        Path file = Files.writeString(tempDir.resolve("d.csv"), "a,b\n1,2\n\n   \n3,4\n\n");
        assertEquals(2, RowVolumeChecker.countDataRows(file));
    }

    @Test
    @DisplayName("Should count zero rows for a header-only or empty file")
    void testCountDataRows_Empty() throws Exception {
        assertEquals(0, RowVolumeChecker.countDataRows(Files.writeString(tempDir.resolve("h.csv"), "a,b\n")));
        assertEquals(0, RowVolumeChecker.countDataRows(Files.writeString(tempDir.resolve("e.csv"), "")));
    }

    private Path table(int rows) throws Exception {
        StringBuilder sb = new StringBuilder("place,value\n");
        for (int i = 0; i < rows; i++) {
            sb.append("geoId/").append(i).append(',').append(i).append('\n');
        }
        return Files.writeString(tempDir.resolve("data.csv"), sb.toString());
    }
}
