package com.di.importgate.config;

import com.di.importgate.exception.RuleSelectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Filters a {@link RuleConfig} down to the requested rules.
 *
 * <p>Inclusion and exclusion are mutually exclusive. Any id not present in the
 * config is rejected, as is a filter that leaves no rules. The input config is
 * never modified.
 */
@Slf4j
@Service
public class RuleSelector {

    public RuleConfig select(RuleConfig config, RuleSelection selection) {
        if (selection == null || selection.isEmpty()) {
            return config;
        }
        if (!selection.include().isEmpty() && !selection.exclude().isEmpty()) {
            throw new RuleSelectionException("Use an inclusion set or an exclusion set of rules, not both");
        }

        Set<String> requested = selection.include().isEmpty() ? selection.exclude() : selection.include();
        Set<String> known = config.ruleIds();
        Set<String> unknown = new TreeSet<>(requested);
        unknown.removeAll(known);
        if (!unknown.isEmpty()) {
            throw new RuleSelectionException(String.format("Unknown rule id(s): %s. Valid ids: %s",
                    String.join(", ", unknown), known.isEmpty() ? "(none)" : String.join(", ", new TreeSet<>(known))));
        }

        boolean including = !selection.include().isEmpty();
        List<Rule> filtered = config.getRules().stream()
                .filter(r -> including == requested.contains(r.getRuleId()))
                .toList();
        if (filtered.isEmpty()) {
            throw new RuleSelectionException("No rules left after filter");
        }
        log.info("[RULES] Selected {} of {} rule(s) ({} {})", filtered.size(), config.getRules().size(),
                including ? "include" : "exclude", requested);
        return config.withRules(filtered);
    }
}
