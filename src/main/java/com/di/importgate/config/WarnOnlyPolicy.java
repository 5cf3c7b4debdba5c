package com.di.importgate.config;

/**
 * Per-dataset override deciding whether a failing rule or policy check is only a warning.
 */
@FunctionalInterface
public interface WarnOnlyPolicy {

    WarnOnlyPolicy NONE = (dataset, ruleId) -> false;

    boolean isWarnOnly(String dataset, String ruleId);
}
