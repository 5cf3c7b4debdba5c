package com.di.importgate.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the rule configuration document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Rule {

    @JsonProperty("rule_id")
    private String ruleId;

    private String description;

    /** Validator name understood by the rule engine or a local validator. */
    private String validator;

    private RuleScope scope;

    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();

    /** Absent means enabled. */
    private Boolean enabled;

    @JsonIgnore
    public boolean isActive() {
        return enabled == null || enabled;
    }
}
