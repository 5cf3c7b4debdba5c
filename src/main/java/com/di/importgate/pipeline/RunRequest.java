package com.di.importgate.pipeline;

import com.di.importgate.config.RuleSelection;
import lombok.Builder;
import lombok.Value;
import org.springframework.core.io.Resource;

import java.nio.file.Path;
import java.util.function.BooleanSupplier;

/**
 * Everything a pipeline run needs from its caller, resolved once before the run starts.
 */
@Value
@Builder
public class RunRequest {

    String dataset;
    String runId;
    InputFiles inputs;
    Resource ruleConfig;
    /** Warn-only override document; null means no overrides. */
    Resource warnOnlyRules;
    @Builder.Default
    RuleSelection selection = RuleSelection.all();
    /** Resolved generation tool jar; may be null when the generation command does not use one. */
    Path toolJar;
    Path outputBaseDir;
    /** External stop request; checked while external tools run. */
    @Builder.Default
    BooleanSupplier cancelled = () -> false;
}
