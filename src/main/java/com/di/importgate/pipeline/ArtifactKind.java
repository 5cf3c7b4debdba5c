package com.di.importgate.pipeline;

/**
 * File artifacts handed from one stage to later ones through the pipeline context.
 */
public enum ArtifactKind {
    /** Filtered rule configuration written for the validation engine. */
    RULE_CONFIG,
    /** Per-variable summary table produced by the generation tool. */
    SUMMARY,
    /** Structured report from the generation-mode invocation. */
    GENERATION_REPORT,
    /** Structured report from the lint sub-invocation; supersedes the generation report when present. */
    LINT_REPORT,
    /** Directory holding generated graph files. */
    GRAPH_DIR,
    /** Raw outcome list written by the validation engine. */
    ENGINE_OUTPUT
}
