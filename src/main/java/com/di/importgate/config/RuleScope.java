package com.di.importgate.config;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where a rule reads its data from. Keys other than {@code data_source} are
 * engine-specific filters and are passed through untouched.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RuleScope {

    @JsonProperty("data_source")
    private DataSource dataSource;

    private Map<String, Object> filters = new LinkedHashMap<>();

    public RuleScope(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @JsonAnySetter
    public void putFilter(String key, Object value) {
        filters.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getFilters() {
        return filters;
    }
}
