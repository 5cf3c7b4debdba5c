package com.di.importgate.stage;

import com.di.importgate.artifact.SummaryArtifact;
import com.di.importgate.config.ImportGateProperties;
import com.di.importgate.external.CommandLines;
import com.di.importgate.external.ExternalInvocation;
import com.di.importgate.external.ExternalResult;
import com.di.importgate.external.ExternalStep;
import com.di.importgate.external.ExternalStepOutcomes;
import com.di.importgate.pipeline.ArtifactKind;
import com.di.importgate.pipeline.FailureCode;
import com.di.importgate.pipeline.Finding;
import com.di.importgate.pipeline.InputFiles;
import com.di.importgate.pipeline.Locator;
import com.di.importgate.pipeline.PipelineState;
import com.di.importgate.pipeline.Severity;
import com.di.importgate.pipeline.StageResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Runs the graph generation tool: {@code lint} first when metadata files are present,
 * then {@code genmcf}.
 *
 * <p>A lint failure is logged and ignored; later stages fall back to the generation
 * report. A genmcf failure, or a genmcf run that leaves no summary table, blocks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationInvoker {

    static final String JAR_PLACEHOLDER = "{jar}";
    static final String REPORT_FILE = "report.json";

    private final ImportGateProperties properties;
    private final ExternalStep externalStep;

    /**
     * @param inputs    run inputs
     * @param toolJar   resolved generation tool jar
     * @param outputDir generation output directory; lint writes to {@code outputDir/lint}
     * @param cancelled checked while the tool runs
     */
    public StageResult generate(InputFiles inputs, Path toolJar, Path outputDir, BooleanSupplier cancelled) {
        ImportGateProperties.GenerationConfig config = properties.getGeneration();
        if (toolJar == null && config.getCommand().contains(JAR_PLACEHOLDER)) {
            log.error("[GENERATE] No generation tool jar available");
            return StageResult.failed(PipelineState.GENERATE, Finding.builder()
                    .code(FailureCode.DATA_PROCESSING_FAILED.name())
                    .message("Generation tool jar is not available")
                    .locator(Locator.of(config.getBinDir()))
                    .suggestion("Set importgate.generation.jar-path or check access to importgate.generation.jar-url")
                    .build());
        }
        List<Path> files = new ArrayList<>();
        files.add(inputs.mappingFile());
        files.add(inputs.dataTable());
        files.addAll(inputs.metadataFiles());

        StageResult.StageResultBuilder result = StageResult.passed(PipelineState.GENERATE).toBuilder();

        if (inputs.hasMetadata()) {
            Path lintDir = outputDir.resolve("lint");
            ExternalResult lint = externalStep.invoke(invocation("lint", "lint", toolJar, files, lintDir, config, cancelled));
            Path lintReport = lintDir.resolve(REPORT_FILE);
            if (lint.succeeded() && Files.isRegularFile(lintReport)) {
                log.info("[GENERATE] Lint report available: {}", lintReport);
                result.artifact(ArtifactKind.LINT_REPORT, lintReport);
            } else if (lint.timedOut()) {
                return ExternalStepOutcomes.failure(PipelineState.GENERATE, "lint", lint,
                        FailureCode.DATA_PROCESSING_FAILED, Severity.BLOCKING);
            } else {
                log.warn("[GENERATE] Lint failed or produced no report (exit {}); using the genmcf report",
                        lint.exitCode());
            }
        }

        ExternalResult genmcf = externalStep.invoke(invocation("genmcf", "genmcf", toolJar, files, outputDir, config, cancelled));
        if (!genmcf.succeeded()) {
            log.error("[GENERATE] genmcf failed: exit={}, timedOut={}", genmcf.exitCode(), genmcf.timedOut());
            return ExternalStepOutcomes.failure(PipelineState.GENERATE, "genmcf", genmcf,
                    FailureCode.DATA_PROCESSING_FAILED, Severity.BLOCKING);
        }

        Path summary = outputDir.resolve(SummaryArtifact.FILE_NAME);
        if (!Files.isRegularFile(summary)) {
            log.error("[GENERATE] genmcf finished but wrote no {}", SummaryArtifact.FILE_NAME);
            return StageResult.failed(PipelineState.GENERATE, Finding.builder()
                    .code(FailureCode.SUMMARY_MISSING.name())
                    .message("Generation tool did not produce " + SummaryArtifact.FILE_NAME)
                    .locator(Locator.of(summary.toString()))
                    .suggestion("Check the generation tool output for errors")
                    .build());
        }
        result.artifact(ArtifactKind.SUMMARY, summary);
        result.artifact(ArtifactKind.GRAPH_DIR, outputDir);
        Path report = outputDir.resolve(REPORT_FILE);
        if (Files.isRegularFile(report)) {
            result.artifact(ArtifactKind.GENERATION_REPORT, report);
        }
        log.info("[GENERATE] Generation complete in {} ms: {}", genmcf.elapsed().toMillis(), outputDir);
        return result.build();
    }

    private ExternalInvocation invocation(String tool, String mode, Path toolJar, List<Path> files, Path outputDir,
                                          ImportGateProperties.GenerationConfig config, BooleanSupplier cancelled) {
        ExternalInvocation.ExternalInvocationBuilder builder = ExternalInvocation.builder()
                .tool(tool)
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .cancelled(cancelled);
        for (String arg : CommandLines.split(config.getCommand())) {
            builder.arg(toolJar == null ? arg : arg.replace(JAR_PLACEHOLDER, toolJar.toString()));
        }
        builder.arg(mode);
        files.forEach(f -> builder.arg(f.toString()));
        builder.arg("-o=" + outputDir)
                .arg("--resolution=" + config.getResolutionMode())
                .arg("--existence-checks=" + config.isExistenceChecks());
        return builder.build();
    }
}
