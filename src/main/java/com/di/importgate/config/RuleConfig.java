package com.di.importgate.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered list of rules handed to the validation engine.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuleConfig {

    @JsonProperty("schema_version")
    private String schemaVersion;

    private List<Rule> rules = new ArrayList<>();

    /** Rule ids in declaration order. */
    public Set<String> ruleIds() {
        Set<String> ids = new LinkedHashSet<>();
        rules.forEach(r -> ids.add(r.getRuleId()));
        return ids;
    }

    /** A copy of this config holding only the given rules. */
    public RuleConfig withRules(List<Rule> selected) {
        return new RuleConfig(schemaVersion, new ArrayList<>(selected));
    }
}
