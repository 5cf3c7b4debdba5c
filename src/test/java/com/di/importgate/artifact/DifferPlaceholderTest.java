package com.di.importgate.artifact;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DifferPlaceholder Tests")
class DifferPlaceholderTest {

    private static final String HEADER = "variableMeasured,added,deleted,modified";

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should write a header and an all-zero row when no differ file is given")
    void testResolve_NoDiffer() throws Exception {
        Path target = tempDir.resolve(DifferPlaceholder.FILE_NAME);
        Path resolved = DifferPlaceholder.resolve(null, target, HEADER);
        assertEquals(target, resolved);
        assertEquals(HEADER + "\n,0,0,0\n", Files.readString(target));
    }

    @Test
    @DisplayName("Should replace a header-only differ file")
    void testResolve_HeaderOnly() throws Exception {
        Path differ = Files.writeString(tempDir.resolve("differ.csv"), HEADER + "\n");
        Path target = tempDir.resolve(DifferPlaceholder.FILE_NAME);
        assertEquals(target, DifferPlaceholder.resolve(differ, target, HEADER));
    }

    @Test
    @DisplayName("Should keep a differ file that has data")
    void testResolve_WithData() throws Exception {
        Path differ = Files.writeString(tempDir.resolve("differ.csv"), HEADER + "\nCount_Person,1,0,0\n");
        Path target = tempDir.resolve(DifferPlaceholder.FILE_NAME);
        assertEquals(differ, DifferPlaceholder.resolve(differ, target, HEADER));
        assertFalse(Files.exists(target));
    }
}
