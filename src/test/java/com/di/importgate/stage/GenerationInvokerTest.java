package com.di.importgate.stage;

import com.di.importgate.config.ImportGateProperties;
import com.di.importgate.external.ExternalInvocation;
import com.di.importgate.external.ExternalResult;
import com.di.importgate.pipeline.ArtifactKind;
import com.di.importgate.pipeline.FailureCode;
import com.di.importgate.pipeline.InputFiles;
import com.di.importgate.pipeline.Severity;
import com.di.importgate.pipeline.StageResult;
import com.di.importgate.pipeline.StageStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for GenerationInvoker, with a fake tool standing in for the jar.
 */
@DisplayName("GenerationInvoker Tests")
class GenerationInvokerTest {

    @TempDir
    Path tempDir;

    private ImportGateProperties properties;
    private Path jar;
    private Path outputDir;
    private final List<ExternalInvocation> calls = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        properties = new ImportGateProperties();
        jar = Files.writeString(tempDir.resolve("tool.jar"), "jar");
        outputDir = tempDir.resolve("generation");
    }

    // ============================================================================
    // Success Tests
    // ============================================================================

    @Test
    @DisplayName("Should run genmcf only and collect its artifacts when no metadata is given")
    void testGenerate_GenmcfOnly() throws Exception {
        GenerationInvoker invoker = invoker(inv -> {
            writeOutputs(inv, true);
            return ExternalResult.exited(0, "", Duration.ofMillis(5));
        });

        StageResult result = invoker.generate(inputs(false), jar, outputDir, () -> false);

        assertEquals(StageStatus.PASSED, result.getStatus());
        assertEquals(1, calls.size());
        List<String> command = calls.get(0).getCommand();
        assertEquals(List.of("java", "-jar", jar.toString(), "genmcf"), command.subList(0, 4));
        assertTrue(command.contains("-o=" + outputDir));
        assertTrue(command.contains("--resolution=LOCAL"));
        assertTrue(command.contains("--existence-checks=true"));
        assertEquals(outputDir.resolve("summary_report.csv"), result.getArtifacts().get(ArtifactKind.SUMMARY));
        assertEquals(outputDir.resolve("report.json"), result.getArtifacts().get(ArtifactKind.GENERATION_REPORT));
        assertEquals(outputDir, result.getArtifacts().get(ArtifactKind.GRAPH_DIR));
    }

    @Test
    @DisplayName("Should run lint before genmcf when metadata files are present")
    void testGenerate_LintThenGenmcf() throws Exception {
        GenerationInvoker invoker = invoker(inv -> {
            writeOutputs(inv, true);
            return ExternalResult.exited(0, "", Duration.ZERO);
        });

        StageResult result = invoker.generate(inputs(true), jar, outputDir, () -> false);

        assertEquals(StageStatus.PASSED, result.getStatus());
        assertEquals(List.of("lint", "genmcf"), calls.stream().map(ExternalInvocation::getTool).toList());
        assertTrue(calls.get(0).getCommand().contains("-o=" + outputDir.resolve("lint")));
        assertEquals(outputDir.resolve("lint").resolve("report.json"), result.getArtifacts().get(ArtifactKind.LINT_REPORT));
    }

    @Test
    @DisplayName("Should carry on with genmcf when lint fails")
    void testGenerate_LintFailureIgnored() {
        GenerationInvoker invoker = invoker(inv -> {
            if (inv.getTool().equals("lint")) {
                return ExternalResult.exited(3, "lint broke", Duration.ZERO);
            }
            writeOutputs(inv, false);
            return ExternalResult.exited(0, "", Duration.ZERO);
        });

        StageResult result = invoker.generate(inputs(true), jar, outputDir, () -> false);

        assertEquals(StageStatus.PASSED, result.getStatus());
        assertNull(result.getArtifacts().get(ArtifactKind.LINT_REPORT));
        assertNull(result.getArtifacts().get(ArtifactKind.GENERATION_REPORT));
    }

    // ============================================================================
    // Failure Tests
    // ============================================================================

    @Test
    @DisplayName("Should block when lint times out")
    void testGenerate_LintTimeout() {
        GenerationInvoker invoker = invoker(inv -> ExternalResult.timedOut("", Duration.ofSeconds(2)));

        StageResult result = invoker.generate(inputs(true), jar, outputDir, () -> false);

        assertTrue(result.isBlockingFailure());
        assertEquals(FailureCode.TIMEOUT.name(), result.getFailureCode());
        assertEquals(1, calls.size());
    }

    @Test
    @DisplayName("Should block with the exit status when genmcf fails")
    void testGenerate_GenmcfFails() {
        GenerationInvoker invoker = invoker(inv -> ExternalResult.exited(1, "Exception in thread main", Duration.ZERO));

        StageResult result = invoker.generate(inputs(false), jar, outputDir, () -> false);

        assertTrue(result.isBlockingFailure());
        assertEquals(Severity.BLOCKING, result.getSeverity());
        assertEquals(FailureCode.DATA_PROCESSING_FAILED.name(), result.getFailureCode());
        assertTrue(result.getFindings().get(0).getMessage().startsWith("genmcf exited with status 1"));
    }

    @Test
    @DisplayName("Should block when genmcf leaves no summary table")
    void testGenerate_NoSummary() {
        GenerationInvoker invoker = invoker(inv -> ExternalResult.exited(0, "", Duration.ZERO));

        StageResult result = invoker.generate(inputs(false), jar, outputDir, () -> false);

        assertEquals(FailureCode.SUMMARY_MISSING.name(), result.getFailureCode());
        assertTrue(result.isBlockingFailure());
    }

    @Test
    @DisplayName("Should fail without calling anything when the tool jar is missing")
    void testGenerate_NoJar() {
        GenerationInvoker invoker = invoker(inv -> fail("must not be called"));

        StageResult result = invoker.generate(inputs(false), null, outputDir, () -> false);

        assertEquals(FailureCode.DATA_PROCESSING_FAILED.name(), result.getFailureCode());
        assertTrue(calls.isEmpty());
    }

    private GenerationInvoker invoker(Function<ExternalInvocation, ExternalResult> tool) {
        return new GenerationInvoker(properties, inv -> {
            calls.add(inv);
            return tool.apply(inv);
        });
    }

    private InputFiles inputs(boolean withMetadata) {
        try {
            Path mapping = Files.writeString(tempDir.resolve("data.tmcf"), "Node: E:data->E0\n");
            Path table = Files.writeString(tempDir.resolve("data.csv"), "place,value\ngeoId/06,1\n");
            List<Path> metadata = withMetadata
                    ? List.of(Files.writeString(tempDir.resolve("schema.mcf"), "Node: dcid:Count_X\n"))
                    : List.of();
            return new InputFiles(mapping, table, metadata, null);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeOutputs(ExternalInvocation invocation, boolean withReport) {
        Path dir = invocation.getCommand().stream()
                .filter(a -> a.startsWith("-o="))
                .map(a -> Path.of(a.substring(3)))
                .findFirst().orElseThrow();
        try {
            Files.createDirectories(dir);
            if (invocation.getTool().equals("genmcf")) {
                Files.writeString(dir.resolve("summary_report.csv"), "StatVar,NumPlaces,NumObservations\nCount_X,1,1\n");
            }
            if (withReport) {
                Files.writeString(dir.resolve("report.json"), "{\"levelSummary\": {}}");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
