package com.di.importgate.stage;

import com.di.importgate.pipeline.FailureCode;
import com.di.importgate.pipeline.Finding;
import com.di.importgate.pipeline.InputFiles;
import com.di.importgate.pipeline.Locator;
import com.di.importgate.pipeline.PipelineState;
import com.di.importgate.pipeline.Severity;
import com.di.importgate.pipeline.StageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks that the input files exist and carry the expected extension.
 * Pure validation; always blocking.
 */
@Slf4j
@Service
public class PreflightChecker {

    static final Set<String> MAPPING_EXTENSIONS = Set.of(".tmcf", ".mcf");
    static final Set<String> TABLE_EXTENSIONS = Set.of(".csv");
    static final Set<String> METADATA_EXTENSIONS = Set.of(".mcf");

    public StageResult check(InputFiles inputs) {
        List<Finding> findings = new ArrayList<>();
        checkRequired(inputs.mappingFile(), "mapping file", MAPPING_EXTENSIONS, findings);
        checkRequired(inputs.dataTable(), "data table", TABLE_EXTENSIONS, findings);
        for (Path metadata : inputs.metadataFiles()) {
            checkFile(metadata, "metadata file", METADATA_EXTENSIONS, findings);
        }

        if (findings.isEmpty()) {
            log.info("[PREFLIGHT] Input files present: mapping={}, table={}, metadata={}",
                    inputs.mappingFile(), inputs.dataTable(), inputs.metadataFiles().size());
            return StageResult.passed(PipelineState.PREFLIGHT);
        }
        findings.forEach(f -> log.error("[PREFLIGHT] {}: {}", f.getCode(), f.getMessage()));
        return StageResult.failed(PipelineState.PREFLIGHT, Severity.BLOCKING, findings.get(0).getCode(), findings);
    }

    private void checkRequired(Path path, String kind, Set<String> extensions, List<Finding> findings) {
        if (path == null) {
            findings.add(Finding.blocking(FailureCode.MISSING_FILE.name(), "No " + kind + " provided", Locator.of(kind)));
            return;
        }
        checkFile(path, kind, extensions, findings);
    }

    private void checkFile(Path path, String kind, Set<String> extensions, List<Finding> findings) {
        Locator locator = Locator.of(path.toString());
        if (!Files.isRegularFile(path)) {
            findings.add(Finding.blocking(FailureCode.MISSING_FILE.name(),
                    String.format("%s not found: %s", capitalize(kind), path), locator));
            return;
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (extensions.stream().noneMatch(name::endsWith)) {
            findings.add(Finding.blocking(FailureCode.WRONG_EXTENSION.name(),
                    String.format("%s must end with %s: %s", capitalize(kind), String.join(" or ", extensions.stream().sorted().toList()), path),
                    locator));
        }
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
