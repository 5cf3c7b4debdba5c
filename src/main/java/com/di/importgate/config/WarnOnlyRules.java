package com.di.importgate.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Warn-only override document: dataset id → rule ids whose failures are downgraded.
 * Rule ids match case-insensitively; dataset ids match exactly.
 */
public final class WarnOnlyRules implements WarnOnlyPolicy {

    private final Map<String, Set<String>> rulesByDataset;

    public WarnOnlyRules(Map<String, ? extends Iterable<String>> raw) {
        Map<String, Set<String>> normalized = new LinkedHashMap<>();
        raw.forEach((dataset, ids) -> {
            Set<String> set = new LinkedHashSet<>();
            ids.forEach(id -> {
                if (id != null && !id.isBlank()) {
                    set.add(normalize(id));
                }
            });
            normalized.put(dataset, Collections.unmodifiableSet(set));
        });
        this.rulesByDataset = Collections.unmodifiableMap(normalized);
    }

    public static WarnOnlyRules empty() {
        return new WarnOnlyRules(Map.of());
    }

    @Override
    public boolean isWarnOnly(String dataset, String ruleId) {
        if (dataset == null || ruleId == null) {
            return false;
        }
        return rulesByDataset.getOrDefault(dataset, Set.of()).contains(normalize(ruleId));
    }

    /** Normalized rule ids configured for a dataset; empty when the dataset has no entry. */
    public Set<String> rulesFor(String dataset) {
        return rulesByDataset.getOrDefault(dataset, Set.of());
    }

    public Set<String> datasets() {
        return rulesByDataset.keySet();
    }

    @Override
    public String toString() {
        return rulesByDataset.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "WarnOnlyRules{", "}"));
    }

    private static String normalize(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
