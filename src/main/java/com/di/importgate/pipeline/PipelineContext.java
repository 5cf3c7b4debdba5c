package com.di.importgate.pipeline;

import com.di.importgate.config.RuleConfig;
import com.di.importgate.config.WarnOnlyPolicy;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * State of one run, owned by {@link PipelineController}. Stages never see it; the
 * controller hands each stage only the values it needs.
 */
@Getter
public class PipelineContext {

    private final RunRequest request;
    @Setter
    private RunWorkspace workspace;
    @Setter
    private RuleConfig activeRules;
    @Setter
    private WarnOnlyPolicy warnOnly = WarnOnlyPolicy.NONE;
    private final List<StageResult> results = new ArrayList<>();
    private final Map<ArtifactKind, Path> artifacts = new EnumMap<>(ArtifactKind.class);

    public PipelineContext(RunRequest request) {
        this.request = request;
    }

    public String dataset() {
        return request.getDataset();
    }

    public InputFiles inputs() {
        return request.getInputs();
    }

    /** Appends a stage result and registers its artifacts. */
    public void commit(StageResult result) {
        results.add(result);
        artifacts.putAll(result.getArtifacts());
    }

    /** Replaces all results, e.g. after reclassification. Artifacts are kept. */
    public void replaceResults(List<StageResult> reclassified) {
        results.clear();
        results.addAll(reclassified);
    }

    public List<StageResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public Path artifact(ArtifactKind kind) {
        return artifacts.get(kind);
    }

    /** The lint report when lint produced one, otherwise the generation report. */
    public Path effectiveReport() {
        Path lint = artifacts.get(ArtifactKind.LINT_REPORT);
        return lint != null ? lint : artifacts.get(ArtifactKind.GENERATION_REPORT);
    }
}
