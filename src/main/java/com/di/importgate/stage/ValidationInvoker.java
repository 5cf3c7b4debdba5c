package com.di.importgate.stage;

import com.di.importgate.artifact.DifferPlaceholder;
import com.di.importgate.artifact.SummaryArtifact;
import com.di.importgate.config.ImportGateProperties;
import com.di.importgate.config.Rule;
import com.di.importgate.config.RuleConfig;
import com.di.importgate.config.RuleConfigLoader;
import com.di.importgate.external.CommandLines;
import com.di.importgate.external.ExternalInvocation;
import com.di.importgate.external.ExternalResult;
import com.di.importgate.external.ExternalStep;
import com.di.importgate.external.ExternalStepOutcomes;
import com.di.importgate.pipeline.ArtifactKind;
import com.di.importgate.pipeline.FailureCode;
import com.di.importgate.pipeline.Finding;
import com.di.importgate.pipeline.Locator;
import com.di.importgate.pipeline.PipelineState;
import com.di.importgate.pipeline.RuleOutcome;
import com.di.importgate.pipeline.RunWorkspace;
import com.di.importgate.pipeline.Severity;
import com.di.importgate.pipeline.StageResult;
import com.di.importgate.stage.validation.EngineOutputParser;
import com.di.importgate.stage.validation.LocalValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Evaluates the active rules: engine rules through the external rule engine, the
 * rest through {@link LocalValidator}s, merged engine-first.
 *
 * <p>This stage only gates tool errors. Once the engine has produced a readable
 * outcome list the stage passes, whatever the rules said; FAILED rule outcomes decide
 * the verdict after reclassification.
 */
@Slf4j
@Service
public class ValidationInvoker {

    /** Validators never sent to the engine nor run locally. */
    static final Set<String> RETIRED_VALIDATORS = Set.of("LINT_ERROR_COUNT");

    private final ImportGateProperties properties;
    private final ExternalStep externalStep;
    private final RuleConfigLoader ruleConfigLoader;
    private final Map<String, LocalValidator> localValidators;

    public ValidationInvoker(ImportGateProperties properties, ExternalStep externalStep,
                             RuleConfigLoader ruleConfigLoader, List<LocalValidator> localValidators) {
        this.properties = properties;
        this.externalStep = externalStep;
        this.ruleConfigLoader = ruleConfigLoader;
        this.localValidators = localValidators.stream()
                .collect(Collectors.toUnmodifiableMap(v -> normalize(v.validatorName()), Function.identity()));
    }

    /**
     * @param rules      rule configuration after selection
     * @param summary    summary table from generation, or null
     * @param report     effective structured report (lint, else generation), or null
     * @param differFile differ artifact supplied with the import, or null
     * @param workspace  run workspace for the engine config, normalized summary and engine output
     * @param cancelled  checked while the engine runs
     */
    public StageResult validate(RuleConfig rules, Path summary, Path report, Path differFile,
                                RunWorkspace workspace, BooleanSupplier cancelled) throws IOException {
        List<Rule> engineRules = new ArrayList<>();
        List<Rule> localRules = new ArrayList<>();
        for (Rule rule : rules.getRules()) {
            String validator = normalize(rule.getValidator());
            if (!rule.isActive()) {
                log.info("[VALIDATE] Rule {} is disabled", rule.getRuleId());
            } else if (RETIRED_VALIDATORS.contains(validator)) {
                log.info("[VALIDATE] Rule {} uses retired validator {}; not evaluated", rule.getRuleId(), rule.getValidator());
            } else if (localValidators.containsKey(validator)) {
                localRules.add(rule);
            } else {
                engineRules.add(rule);
            }
        }
        log.info("[VALIDATE] {} engine rule(s), {} local rule(s)", engineRules.size(), localRules.size());

        StageResult.StageResultBuilder result = StageResult.passed(PipelineState.VALIDATE).toBuilder();
        if (!engineRules.isEmpty()) {
            StageResult failure = runEngine(rules.withRules(engineRules), summary, report, differFile, workspace, cancelled, result);
            if (failure != null) {
                return failure;
            }
        }
        for (Rule rule : localRules) {
            result.outcome(localValidators.get(normalize(rule.getValidator())).evaluate(rule, report));
        }
        StageResult built = result.build();
        long failed = built.getOutcomes().stream().filter(RuleOutcome::isFailed).count();
        log.info("[VALIDATE] {} outcome(s), {} FAILED", built.getOutcomes().size(), failed);
        return built;
    }

    /**
     * Runs the engine and adds its outcomes to {@code result}.
     *
     * @return a failed stage result, or null when the engine produced a complete outcome list
     */
    private StageResult runEngine(RuleConfig engineConfig, Path summary, Path report, Path differFile,
                                  RunWorkspace workspace, BooleanSupplier cancelled,
                                  StageResult.StageResultBuilder result) throws IOException {
        ImportGateProperties.ValidationConfig config = properties.getValidation();
        Path configFile = workspace.ruleConfig();
        ruleConfigLoader.write(engineConfig, configFile);
        result.artifact(ArtifactKind.RULE_CONFIG, configFile);

        Path output = workspace.engineOutput();
        Files.deleteIfExists(output);

        ExternalInvocation.ExternalInvocationBuilder invocation = ExternalInvocation.builder()
                .tool("rule-engine")
                .command(CommandLines.split(config.getCommand()))
                .arg("--validation_config=" + configFile)
                .arg("--validation_output=" + output)
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .cancelled(cancelled);
        if (config.getWorkingDir() != null && !config.getWorkingDir().isBlank()) {
            invocation.workingDir(Paths.get(config.getWorkingDir()));
        }
        if (summary != null && Files.isRegularFile(summary)) {
            Path normalized = SummaryArtifact.read(summary).normalizeDates(workspace.normalizedSummary());
            invocation.arg("--stats_summary=" + normalized);
        }
        if (report != null && Files.isRegularFile(report)) {
            invocation.arg("--lint_report=" + report);
        }
        Path differ = DifferPlaceholder.resolve(differFile, workspace.differPlaceholder(), config.getEmptyDifferHeader());
        invocation.arg("--differ_output=" + differ);

        ExternalResult engine = externalStep.invoke(invocation.build());
        if (engine.timedOut() || engine.launchError() != null) {
            return ExternalStepOutcomes.failure(PipelineState.VALIDATE, "rule-engine", engine,
                    FailureCode.VALIDATION_FAILED, Severity.BLOCKING);
        }
        if (!Files.isRegularFile(output)) {
            log.error("[VALIDATE] Engine exited with {} and wrote no output", engine.exitCode());
            return ExternalStepOutcomes.failure(PipelineState.VALIDATE, "rule-engine", engine,
                    FailureCode.VALIDATION_FAILED, Severity.BLOCKING);
        }
        result.artifact(ArtifactKind.ENGINE_OUTPUT, output);

        List<RuleOutcome> outcomes;
        try {
            outcomes = EngineOutputParser.parse(output);
        } catch (IOException e) {
            log.error("[VALIDATE] Engine output unreadable: {}", e.getMessage());
            return StageResult.failed(PipelineState.VALIDATE, Finding.blocking(FailureCode.VALIDATION_FAILED.name(),
                    "Rule engine output is not a readable outcome list: " + e.getMessage(), Locator.of(output.toString())));
        }
        if (engine.exitCode() != 0) {
            log.warn("[VALIDATE] Engine exited with {}; using its {} outcome(s)", engine.exitCode(), outcomes.size());
        }
        int expected = engineConfig.getRules().size();
        Set<String> reported = outcomes.stream().map(RuleOutcome::getRuleId).collect(Collectors.toSet());
        List<String> missing = engineConfig.getRules().stream().map(Rule::getRuleId)
                .filter(id -> !reported.contains(id)).toList();
        if (!missing.isEmpty()) {
            log.error("[VALIDATE] Engine returned {} outcome(s) for {} rule(s)", outcomes.size(), expected);
            return StageResult.failed(PipelineState.VALIDATE, Finding.builder()
                    .code(FailureCode.VALIDATION_INCOMPLETE.name())
                    .message(String.format("Rule engine returned %d outcome(s) for %d rule(s); missing: %s",
                            outcomes.size(), expected, missing))
                    .locator(Locator.of(output.toString()))
                    .limit((long) expected)
                    .build()).toBuilder().outcomes(outcomes).build();
        }
        result.outcomes(outcomes);
        return null;
    }

    private static String normalize(String validator) {
        return validator == null ? "" : validator.trim().toUpperCase(Locale.ROOT);
    }
}
