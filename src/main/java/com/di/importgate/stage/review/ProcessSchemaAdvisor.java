package com.di.importgate.stage.review;

import com.di.importgate.config.ImportGateProperties;
import com.di.importgate.exception.AdvisorUnavailableException;
import com.di.importgate.external.CommandLines;
import com.di.importgate.external.ExternalInvocation;
import com.di.importgate.external.ExternalResult;
import com.di.importgate.external.ExternalStep;
import com.di.importgate.pipeline.FailureCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external review command that writes its findings as a JSON array to
 * {@code --output=<file>}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessSchemaAdvisor implements SchemaAdvisor {

    public static final String TYPE = "process";

    private final ImportGateProperties properties;
    private final ExternalStep externalStep;

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<AdvisorFinding> review(ReviewRequest request) {
        ImportGateProperties.AdvisorConfig config = properties.getReview().getAdvisor();
        if (config.getCommand() == null || config.getCommand().isBlank()) {
            throw new AdvisorUnavailableException("No advisor command configured (importgate.review.advisor.command)");
        }
        ExternalInvocation.ExternalInvocationBuilder invocation = ExternalInvocation.builder()
                .tool("schema-advisor")
                .command(CommandLines.split(config.getCommand()))
                .arg("--mapping=" + request.mappingFile())
                .arg("--output=" + request.outputFile())
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .cancelled(request.cancelled());
        if (request.dataTable() != null) {
            invocation.arg("--table=" + request.dataTable());
        }
        request.metadataFiles().forEach(m -> invocation.arg("--metadata=" + m));

        Path output = request.outputFile();
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            throw new AdvisorUnavailableException("Cannot clear stale advisor output " + output + ": " + e.getMessage(), e);
        }

        ExternalResult result = externalStep.invoke(invocation.build());
        if (result.timedOut()) {
            if (request.cancelled().getAsBoolean()) {
                throw new AdvisorUnavailableException(FailureCode.TIMEOUT, "Schema advisor stopped: run was cancelled");
            }
            throw new AdvisorUnavailableException(FailureCode.TIMEOUT,
                    String.format("Schema advisor timed out after %ds", result.elapsed().toSeconds()));
        }
        if (!result.succeeded()) {
            String reason = result.launchError() != null ? result.launchError() : "exit status " + result.exitCode();
            throw new AdvisorUnavailableException("Schema advisor failed: " + reason);
        }
        if (!Files.exists(output)) {
            log.info("[SCHEMA-REVIEW] Advisor wrote no output file; treating as no findings");
            return List.of();
        }
        try {
            return AdvisorFindingParser.parse(Files.readString(output, StandardCharsets.UTF_8), config.getMaxFindings());
        } catch (IOException e) {
            throw new AdvisorUnavailableException("Cannot read advisor output " + output + ": " + e.getMessage(), e);
        }
    }
}
