package com.di.importgate.pipeline;

import com.di.importgate.config.RuleConfig;
import com.di.importgate.config.RuleConfigLoader;
import com.di.importgate.config.RuleSelector;
import com.di.importgate.config.WarnOnlyRulesLoader;
import com.di.importgate.exception.ErrorCategory;
import com.di.importgate.report.ReportEmitter;
import com.di.importgate.report.ResultAggregator;
import com.di.importgate.report.ResultDocument;
import com.di.importgate.report.Verdict;
import com.di.importgate.stage.CountersReconciler;
import com.di.importgate.stage.DataQualityChecker;
import com.di.importgate.stage.GenerationInvoker;
import com.di.importgate.stage.OutcomeReclassifier;
import com.di.importgate.stage.PreflightChecker;
import com.di.importgate.stage.RowVolumeChecker;
import com.di.importgate.stage.SchemaReviewer;
import com.di.importgate.stage.ValidationInvoker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.UUID;

/**
 * Runs one import validation as a state machine:
 *
 * <pre>
 * INIT → PREFLIGHT → QUALITY → ROW_VOLUME → SCHEMA_REVIEW → GENERATE → VALIDATE
 *      → RECONCILE → RECLASSIFY → REPORT → DONE_PASS | DONE_FAIL
 * </pre>
 *
 * <p>After each state, {@link PipelineTransitions#next} decides where to go. A FAILED
 * result with BLOCKING severity jumps to REPORT, so no later stage runs; the report
 * is written on every path. A stage whose result names a policy rule (row volume)
 * is checked against the dataset's warn-only overrides before that decision.
 *
 * <p>Exceptions escaping a stage become a FAILED/BLOCKING result for that stage and
 * never leave {@link #run(RunRequest)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineController {

    /** Dataset directory used when the requested dataset or run id cannot be used as a path. */
    static final String REJECTED_DATASET = "_rejected";

    private final RuleConfigLoader ruleConfigLoader;
    private final RuleSelector ruleSelector;
    private final WarnOnlyRulesLoader warnOnlyRulesLoader;
    private final PreflightChecker preflightChecker;
    private final DataQualityChecker dataQualityChecker;
    private final RowVolumeChecker rowVolumeChecker;
    private final SchemaReviewer schemaReviewer;
    private final GenerationInvoker generationInvoker;
    private final ValidationInvoker validationInvoker;
    private final CountersReconciler countersReconciler;
    private final OutcomeReclassifier outcomeReclassifier;
    private final ResultAggregator resultAggregator;
    private final ReportEmitter reportEmitter;

    public PipelineOutcome run(RunRequest request) {
        PipelineContext context = new PipelineContext(request);
        PipelineState state = PipelineState.INIT;
        StageResult abort = null;
        ResultDocument document = null;
        long start = System.currentTimeMillis();
        log.info("[CONTROLLER] Starting run {} for dataset {}", request.getRunId(), request.getDataset());

        while (!state.isTerminal()) {
            if (state == PipelineState.REPORT) {
                document = report(context, abort);
                state = PipelineTransitions.terminal(document.getVerdict());
                continue;
            }
            StageResult result = execute(state, context);
            if (result != null) {
                result = applyPolicyOverride(context, result);
                if (state != PipelineState.INIT || result.getStatus() != StageStatus.PASSED) {
                    context.commit(result);
                }
                if (result.isBlockingFailure()) {
                    abort = result;
                    log.error("[CONTROLLER] {} failed ({}); aborting to report", state.stageName(), result.getFailureCode());
                }
            }
            PipelineState next = PipelineTransitions.next(state, result);
            log.debug("[CONTROLLER] {} -> {}", state, next);
            state = next;
        }

        int exitCode = exitCode(document.getVerdict(), abort);
        log.info("[CONTROLLER] Run {} finished in {} ms: {} (exit {})", request.getRunId(),
                System.currentTimeMillis() - start, state, exitCode);
        return new PipelineOutcome(document.getVerdict(), exitCode, document,
                abort == null ? null : abort.getStage(), context.getWorkspace());
    }

    /**
     * Runs the work of one state.
     *
     * @return the stage result, or null for RECLASSIFY, which rewrites earlier results
     */
    StageResult execute(PipelineState state, PipelineContext context) {
        if (state != PipelineState.INIT && context.getRequest().getCancelled().getAsBoolean()) {
            log.warn("[CONTROLLER] Run cancelled before {}", state.stageName());
            return StageResult.failed(state, Finding.blocking(FailureCode.TIMEOUT.name(),
                    "Run was cancelled before " + state.stageName(), Locator.of(state.stageName())));
        }
        try {
            return switch (state) {
                case INIT -> initialize(context);
                case PREFLIGHT -> preflightChecker.check(context.inputs());
                case QUALITY -> dataQualityChecker.check(context.inputs().dataTable());
                case ROW_VOLUME -> rowVolumeChecker.check(context.inputs().dataTable());
                case SCHEMA_REVIEW -> schemaReviewer.review(context.inputs(), context.getWorkspace().schemaReview(),
                        context.getRequest().getCancelled());
                case GENERATE -> generationInvoker.generate(context.inputs(), context.getRequest().getToolJar(),
                        context.getWorkspace().generationDir(), context.getRequest().getCancelled());
                case VALIDATE -> validationInvoker.validate(context.getActiveRules(),
                        context.artifact(ArtifactKind.SUMMARY), context.effectiveReport(),
                        context.inputs().differFile(), context.getWorkspace(), context.getRequest().getCancelled());
                case RECONCILE -> countersReconciler.reconcile(context.artifact(ArtifactKind.SUMMARY),
                        context.artifact(ArtifactKind.GENERATION_REPORT));
                case RECLASSIFY -> {
                    context.replaceResults(outcomeReclassifier.reclassify(context.dataset(), context.getResults(),
                            context.getWarnOnly()));
                    yield null;
                }
                case REPORT, DONE_PASS, DONE_FAIL -> throw new IllegalStateException("Not a stage: " + state);
            };
        } catch (Exception e) {
            FailureCode code = ErrorCategory.failureCodeOf(e);
            log.error("[CONTROLLER] {} raised {} ({}): {}", state.stageName(), e.getClass().getSimpleName(),
                    ErrorCategory.categorize(e), e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return StageResult.failed(state, Finding.blocking(code.name(), message, Locator.of(state.stageName())))
                    .toBuilder()
                    .error(e.getClass().getName() + ": " + message)
                    .build();
        }
    }

    private StageResult initialize(PipelineContext context) throws IOException {
        RunRequest request = context.getRequest();
        try {
            context.setWorkspace(RunWorkspace.create(request.getOutputBaseDir(), request.getDataset(), request.getRunId()));
        } catch (IllegalArgumentException e) {
            context.setWorkspace(RunWorkspace.create(request.getOutputBaseDir(), REJECTED_DATASET,
                    "run-" + UUID.randomUUID()));
            reportEmitter.seed(context.getWorkspace());
            return StageResult.failed(PipelineState.INIT, Finding.blocking(FailureCode.USAGE_ERROR.name(),
                    e.getMessage(), Locator.of("run")));
        }
        reportEmitter.seed(context.getWorkspace());
        log.info("[CONTROLLER] Workspace: {}", context.getWorkspace());

        RuleConfig loaded = ruleConfigLoader.load(request.getRuleConfig());
        RuleConfig selected = ruleSelector.select(loaded, request.getSelection());
        ruleConfigLoader.write(selected, context.getWorkspace().selectedRules());
        context.setActiveRules(selected);
        log.info("[CONTROLLER] {} of {} rule(s) selected: {}", selected.getRules().size(), loaded.getRules().size(),
                selected.ruleIds());

        context.setWarnOnly(warnOnlyRulesLoader.load(request.getWarnOnlyRules()));
        return StageResult.passed(PipelineState.INIT);
    }

    /**
     * Downgrades a blocking failure whose policy rule is warn-only for this dataset,
     * so that it is carried forward as advisory instead of aborting the run.
     */
    StageResult applyPolicyOverride(PipelineContext context, StageResult result) {
        String ruleId = result.getPolicyRuleId();
        if (ruleId == null || !result.isBlockingFailure() || !context.getWarnOnly().isWarnOnly(context.dataset(), ruleId)) {
            return result;
        }
        log.warn("[CONTROLLER] {} failed but {} is warn-only for dataset {}; continuing",
                result.getStage().stageName(), ruleId, context.dataset());
        return result.downgraded("warn-only override for " + ruleId);
    }

    private ResultDocument report(PipelineContext context, StageResult abort) {
        RunRequest request = context.getRequest();
        ResultDocument document = resultAggregator.aggregate(request.getDataset(), request.getRunId(),
                context.getResults(), abort);
        if (context.getWorkspace() == null) {
            log.error("[REPORT] No workspace could be created under {}; result files not written",
                    request.getOutputBaseDir());
            return document.getVerdict() == Verdict.FAIL ? document : document.toBuilder().verdict(Verdict.FAIL).build();
        }
        try {
            reportEmitter.emit(document, context.getWorkspace());
        } catch (IOException e) {
            log.error("[REPORT] Cannot write result files to {}: {}", context.getWorkspace(), e.getMessage(), e);
            return document.getVerdict() == Verdict.FAIL ? document : document.toBuilder().verdict(Verdict.FAIL).build();
        }
        return document;
    }

    static int exitCode(Verdict verdict, StageResult abort) {
        if (verdict == Verdict.PASS) {
            return 0;
        }
        if (abort != null && FailureCode.USAGE_ERROR.name().equals(abort.getFailureCode())) {
            return 2;
        }
        return 1;
    }
}
