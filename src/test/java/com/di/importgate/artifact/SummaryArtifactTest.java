package com.di.importgate.artifact;

import com.di.importgate.table.CsvTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SummaryArtifact Tests")
class SummaryArtifactTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should sum the NumObservations column")
    void testTotalObservations() throws Exception {
        SummaryArtifact summary = SummaryArtifact.read(summary("""
            StatVar,NumPlaces,NumObservations,MinDate,MaxDate
            Count_Person,2,10,2019,2020
            Count_BirthEvent,1,5,2019,2020
            """));
        assertEquals(OptionalLong.of(15), summary.totalObservations());
    }

    @Test
    @DisplayName("Should return empty when the column is missing or not numeric")
    void testTotalObservations_Unavailable() throws Exception {
        assertTrue(SummaryArtifact.read(summary("StatVar\nCount_Person\n")).totalObservations().isEmpty());
        assertTrue(SummaryArtifact.read(summary("StatVar,NumObservations\nCount_Person,many\n"))
            .totalObservations().isEmpty());
    }

    @Test
    @DisplayName("Should expand bare-year date columns into a normalized copy")
    void testNormalizeDates() throws Exception {
        Path source = summary("""
            StatVar,NumObservations,MinDate,MaxDate
            Count_Person,10,2019,2020-06
            """);
        Path target = tempDir.resolve("normalized.csv");

        Path result = SummaryArtifact.read(source).normalizeDates(target);

        assertEquals(target, result);
        CsvTable table = CsvTable.read(target);
        assertEquals("2019-01-01", table.cell(0, 2));
        assertEquals("2020-06", table.cell(0, 3));
    }

    @Test
    @DisplayName("Should expand bare years in a date column that also holds month dates")
    void testNormalizeDates_MixedColumn() throws Exception {
        Path source = summary("""
            StatVar,NumObservations,MinDate,MaxDate
            Count_A,2,2019,2020-05
            Count_B,1,2018-03,2021
            """);
        Path target = tempDir.resolve("normalized.csv");

        Path result = SummaryArtifact.read(source).normalizeDates(target);

        assertEquals(target, result);
        CsvTable table = CsvTable.read(target);
        assertEquals("2019-01-01", table.cell(0, 2));
        assertEquals("2020-05", table.cell(0, 3));
        assertEquals("2018-03", table.cell(1, 2));
        assertEquals("2021-01-01", table.cell(1, 3));
        assertEquals("2", table.cell(0, 1));
    }

    @Test
    @DisplayName("Should return the original file when no column needs normalizing")
    void testNormalizeDates_Unchanged() throws Exception {
        Path source = summary("StatVar,MinDate\nCount_Person,2019-01-01\n");
        Path target = tempDir.resolve("normalized.csv");
        assertEquals(source, SummaryArtifact.read(source).normalizeDates(target));
        assertFalse(Files.exists(target));
        assertEquals(List.of(), SummaryArtifact.read(source).bareYearDateColumns());
    }

    private Path summary(String content) throws Exception {
        return Files.writeString(tempDir.resolve("summary_report.csv"), content);
    }
}
