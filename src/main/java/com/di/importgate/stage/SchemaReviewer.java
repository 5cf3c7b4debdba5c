package com.di.importgate.stage;

import com.di.importgate.config.ImportGateProperties;
import com.di.importgate.exception.AdvisorUnavailableException;
import com.di.importgate.pipeline.FailureCode;
import com.di.importgate.pipeline.Finding;
import com.di.importgate.pipeline.InputFiles;
import com.di.importgate.pipeline.Locator;
import com.di.importgate.pipeline.PipelineState;
import com.di.importgate.pipeline.Severity;
import com.di.importgate.pipeline.StageResult;
import com.di.importgate.pipeline.StageStatus;
import com.di.importgate.stage.review.AdvisorFinding;
import com.di.importgate.stage.review.DeterministicSchemaChecks;
import com.di.importgate.stage.review.McfNode;
import com.di.importgate.stage.review.McfParser;
import com.di.importgate.stage.review.ReviewRequest;
import com.di.importgate.stage.review.SchemaAdvisor;
import com.di.importgate.stage.review.SchemaAdvisorRegistry;
import com.di.importgate.table.CsvTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Reviews the mapping file. Deterministic checks always run; the configured advisor,
 * when enabled, adds its findings on top.
 *
 * <p>Advisor findings are blocking unless {@code importgate.review.advisor.advisory-mode}
 * is set. An advisor that cannot produce a review fails the stage in either mode.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchemaReviewer {

    private final ImportGateProperties properties;
    private final DeterministicSchemaChecks checks;
    private final SchemaAdvisorRegistry advisors;

    /**
     * @param inputs        run inputs; the mapping file must exist
     * @param advisorOutput file the advisor may write its findings to
     * @param cancelled     checked while the advisor runs
     */
    public StageResult review(InputFiles inputs, Path advisorOutput, BooleanSupplier cancelled) {
        String mappingName = inputs.mappingFile().toString();
        List<McfNode> nodes;
        List<DeterministicSchemaChecks.MetadataFile> metadata = new ArrayList<>();
        try {
            nodes = McfParser.parse(Files.readString(inputs.mappingFile(), StandardCharsets.UTF_8));
            for (Path file : inputs.metadataFiles()) {
                metadata.add(new DeterministicSchemaChecks.MetadataFile(file.toString(),
                        McfParser.parse(Files.readString(file, StandardCharsets.UTF_8))));
            }
        } catch (IOException e) {
            log.error("[SCHEMA-REVIEW] Cannot read input: {}", e.getMessage());
            return StageResult.failed(PipelineState.SCHEMA_REVIEW, Finding.blocking(FailureCode.SCHEMA_REVIEW_FAILED.name(),
                    "Cannot read mapping or metadata file: " + e.getMessage(), Locator.of(mappingName)));
        }

        List<Finding> findings = new ArrayList<>(checks.check(mappingName, nodes, readTable(inputs.dataTable()), metadata));
        log.info("[SCHEMA-REVIEW] Deterministic checks: {} node(s), {} finding(s)", nodes.size(), findings.size());

        ImportGateProperties.AdvisorConfig config = properties.getReview().getAdvisor();
        if (config.isEnabled()) {
            try {
                SchemaAdvisor advisor = advisors.getAdvisor(config.getType());
                List<AdvisorFinding> advised = advisor.review(new ReviewRequest(
                        inputs.mappingFile(), inputs.dataTable(), inputs.metadataFiles(), advisorOutput, cancelled));
                log.info("[SCHEMA-REVIEW] Advisor '{}' reported {} finding(s) (advisory-mode={})",
                        advisor.type(), advised.size(), config.isAdvisoryMode());
                advised.forEach(a -> findings.add(toFinding(a, mappingName, config.isAdvisoryMode())));
            } catch (AdvisorUnavailableException e) {
                log.error("[SCHEMA-REVIEW] Advisor failed: {}", e.getMessage());
                findings.add(Finding.blocking(e.getFailureCode().name(), e.getMessage(), Locator.of(mappingName)));
                return StageResult.failed(PipelineState.SCHEMA_REVIEW, Severity.BLOCKING, e.getFailureCode().name(),
                        deduplicate(findings));
            } catch (IllegalArgumentException e) {
                findings.add(Finding.blocking(FailureCode.CONFIG_INVALID.name(), e.getMessage(), Locator.of(mappingName)));
                return StageResult.failed(PipelineState.SCHEMA_REVIEW, Severity.BLOCKING, FailureCode.CONFIG_INVALID.name(),
                        deduplicate(findings));
            }
        }

        List<Finding> merged = deduplicate(findings);
        boolean blocking = merged.stream().anyMatch(Finding::isBlocking);
        log.info("[SCHEMA-REVIEW] {} finding(s), blocking={}", merged.size(), blocking);
        return StageResult.builder()
                .stage(PipelineState.SCHEMA_REVIEW)
                .status(blocking ? StageStatus.FAILED : StageStatus.PASSED)
                .severity(Severity.BLOCKING)
                .failureCode(blocking ? FailureCode.SCHEMA_REVIEW_FAILED.name() : null)
                .findings(merged)
                .build();
    }

    static Finding toFinding(AdvisorFinding advised, String mappingName, boolean advisoryMode) {
        String file = advised.getFile() == null || advised.getFile().isBlank() ? mappingName : advised.getFile();
        Locator locator = advised.getLine() != null && advised.getLine() > 0
                ? Locator.at(file, advised.getLine())
                : Locator.of(file);
        return Finding.builder()
                .code(advisorCode(advised.getType()))
                .message(advised.getMessage())
                .locator(locator)
                .suggestion(advised.getSuggestion())
                .severity(advisoryMode ? Severity.ADVISORY : Severity.BLOCKING)
                .build();
    }

    /** {@code naming} becomes {@code ADVISOR_NAMING}; a deterministic check code is kept as is. */
    static String advisorCode(String type) {
        String label = type == null ? "" : type.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_");
        label = label.replaceAll("^_+|_+$", "");
        if (label.isEmpty()) {
            return "ADVISOR_GENERAL";
        }
        return DeterministicSchemaChecks.CODES.contains(label) ? label : "ADVISOR_" + label;
    }

    /**
     * Drops findings with the same code, message and file as an earlier one. Messages
     * compare case-insensitively, ignoring whitespace runs and trailing punctuation;
     * files compare by name.
     */
    static List<Finding> deduplicate(List<Finding> findings) {
        Set<String> seen = new HashSet<>();
        List<Finding> kept = new ArrayList<>();
        for (Finding f : findings) {
            String file = f.getLocator() == null || f.getLocator().file() == null ? "" : fileName(f.getLocator().file());
            String key = f.getCode() + "|" + normalizeMessage(f.getMessage()) + "|" + file;
            if (seen.add(key)) {
                kept.add(f);
            }
        }
        return kept;
    }

    static String normalizeMessage(String message) {
        if (message == null) {
            return "";
        }
        return message.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").replaceAll("[.!;:]+$", "");
    }

    private static String fileName(String file) {
        int slash = Math.max(file.lastIndexOf('/'), file.lastIndexOf('\\'));
        return slash < 0 ? file : file.substring(slash + 1);
    }

    private static CsvTable readTable(Path dataTable) {
        if (dataTable == null) {
            return null;
        }
        try {
            return CsvTable.read(dataTable);
        } catch (IOException | RuntimeException e) {
            log.warn("[SCHEMA-REVIEW] Data table unreadable, column checks skipped: {}", e.getMessage());
            return null;
        }
    }
}
