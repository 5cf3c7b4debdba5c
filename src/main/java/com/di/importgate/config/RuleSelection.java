package com.di.importgate.config;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Requested rule filter: ids to keep or ids to drop. Both empty means all rules.
 */
public record RuleSelection(Set<String> include, Set<String> exclude) {

    public RuleSelection {
        include = include == null ? Set.of() : Set.copyOf(include);
        exclude = exclude == null ? Set.of() : Set.copyOf(exclude);
    }

    public static RuleSelection all() {
        return new RuleSelection(Set.of(), Set.of());
    }

    /**
     * Builds a selection from comma-separated id lists; blank entries are ignored.
     */
    public static RuleSelection of(String rules, String skipRules) {
        return new RuleSelection(parseIds(rules), parseIds(skipRules));
    }

    public boolean isEmpty() {
        return include.isEmpty() && exclude.isEmpty();
    }

    static Set<String> parseIds(String csv) {
        if (csv == null || csv.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
