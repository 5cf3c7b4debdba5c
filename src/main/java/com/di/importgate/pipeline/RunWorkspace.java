package com.di.importgate.pipeline;

import com.di.importgate.artifact.DifferPlaceholder;
import com.di.importgate.util.InputValidator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Directory that holds every file of one run: {@code <base>/<dataset>/<runId>/}.
 * Concurrent runs never share one, so nothing here needs locking.
 */
public final class RunWorkspace {

    public static final String RESULT_DOCUMENT = "validation_output.json";
    public static final String RESULT_SUMMARY = "validation_result.json";
    public static final String FAILURE_REASON = "failure_reason.json";

    private final Path root;

    private RunWorkspace(Path root) {
        this.root = root;
    }

    /**
     * Creates (if needed) the workspace for a run.
     *
     * @throws IllegalArgumentException when the dataset or run id is not a safe path segment
     */
    public static RunWorkspace create(Path baseDir, String dataset, String runId) throws IOException {
        Path root = baseDir.resolve(InputValidator.validateDatasetId(dataset))
                .resolve(InputValidator.validateRunId(runId))
                .toAbsolutePath()
                .normalize();
        Files.createDirectories(root);
        return new RunWorkspace(root);
    }

    public Path root() {
        return root;
    }

    public Path generationDir() {
        return root.resolve("generation");
    }

    public Path lintDir() {
        return generationDir().resolve("lint");
    }

    /** Rule configuration after selection, as loaded for this run. */
    public Path selectedRules() {
        return root.resolve("selected_rules.json");
    }

    /** Rule configuration handed to the rule engine: the selected rules it evaluates. */
    public Path ruleConfig() {
        return root.resolve("validation_config.json");
    }

    public Path engineOutput() {
        return root.resolve("engine_output.json");
    }

    public Path normalizedSummary() {
        return root.resolve("summary_report_normalized.csv");
    }

    public Path differPlaceholder() {
        return root.resolve(DifferPlaceholder.FILE_NAME);
    }

    public Path schemaReview() {
        return root.resolve("schema_review.json");
    }

    public Path resultDocument() {
        return root.resolve(RESULT_DOCUMENT);
    }

    public Path resultSummary() {
        return root.resolve(RESULT_SUMMARY);
    }

    public Path failureReason() {
        return root.resolve(FAILURE_REASON);
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
