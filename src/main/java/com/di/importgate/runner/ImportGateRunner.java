package com.di.importgate.runner;

import com.di.importgate.config.ImportGateProperties;
import com.di.importgate.config.RuleSelection;
import com.di.importgate.exception.ExternalToolException;
import com.di.importgate.pipeline.InputFiles;
import com.di.importgate.pipeline.PipelineController;
import com.di.importgate.pipeline.PipelineOutcome;
import com.di.importgate.pipeline.RunRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;

/**
 * Runs one pipeline at startup from {@code importgate.run.*} and keeps its exit status
 * for {@link org.springframework.boot.SpringApplication#exit}.
 *
 * <p>{@code runId} and {@code dataset} are in the MDC for the whole run.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
@ConditionalOnProperty(name = "importgate.run.enabled", havingValue = "true", matchIfMissing = true)
public class ImportGateRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String MDC_RUN_ID = "runId";
    static final String MDC_DATASET = "dataset";

    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ImportGateProperties properties;
    private final PipelineController controller;
    private final ImportToolProvisioner provisioner;
    private final ResourceLoader resourceLoader;

    private volatile int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        ImportGateProperties.RunConfig run = properties.getRun();
        String runId = run.getRunId() == null || run.getRunId().isBlank() ? newRunId() : run.getRunId().trim();
        MDC.put(MDC_RUN_ID, runId);
        MDC.put(MDC_DATASET, String.valueOf(run.getDataset()));
        try {
            PipelineOutcome outcome = controller.run(buildRequest(runId));
            exitCode = outcome.exitCode();
            log.info("[RUNNER] Verdict {} (exit {}); results in {}", outcome.verdict(), exitCode, outcome.workspace());
        } finally {
            MDC.remove(MDC_RUN_ID);
            MDC.remove(MDC_DATASET);
        }
    }

    RunRequest buildRequest(String runId) {
        ImportGateProperties.RunConfig run = properties.getRun();
        List<Path> metadata = run.getMetadataFiles().stream()
                .filter(m -> m != null && !m.isBlank())
                .map(m -> Paths.get(m.trim()))
                .toList();
        InputFiles inputs = new InputFiles(toPath(run.getMappingFile()), toPath(run.getDataTable()), metadata,
                toPath(run.getDifferFile()));

        return RunRequest.builder()
                .dataset(run.getDataset())
                .runId(runId)
                .inputs(inputs)
                .ruleConfig(resource(properties.getRules().getConfigFile()))
                .warnOnlyRules(resource(properties.getRules().getWarnOnlyFile()))
                .selection(RuleSelection.of(run.getRules(), run.getSkipRules()))
                .toolJar(provisionToolJar())
                .outputBaseDir(Paths.get(properties.getOutput().getBaseDir()))
                .build();
    }

    /** Null when the jar cannot be provisioned; the generation stage then reports the failure. */
    private Path provisionToolJar() {
        if (!properties.getGeneration().getCommand().contains("{jar}")) {
            return null;
        }
        try {
            return provisioner.resolve();
        } catch (ExternalToolException e) {
            log.error("[RUNNER] {}", e.getMessage());
            return null;
        }
    }

    /** {@code classpath:} and URL locations go through Spring; anything else is a file path. */
    Resource resource(String location) {
        if (location == null || location.isBlank()) {
            return null;
        }
        String trimmed = location.trim();
        if (trimmed.startsWith("classpath:") || trimmed.matches("^[a-zA-Z][a-zA-Z0-9+.-]+:.*")) {
            return resourceLoader.getResource(trimmed);
        }
        return new FileSystemResource(trimmed);
    }

    private static Path toPath(String value) {
        return value == null || value.isBlank() ? null : Paths.get(value.trim());
    }

    private static String newRunId() {
        return LocalDateTime.now().format(RUN_ID_FORMAT) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
