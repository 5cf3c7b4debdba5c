package com.di.importgate.stage.validation;

import com.di.importgate.pipeline.OutcomeStatus;
import com.di.importgate.pipeline.RuleOutcome;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the rule engine's output: a JSON array of
 * {@code {validation_name, status, message, details, validation_params}}.
 *
 * <p>A status outside PASSED/FAILED/WARNING (e.g. {@code CONFIG_ERROR}) is read as
 * FAILED; the raw value is kept in {@code details.raw_status}.
 */
public final class EngineOutputParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EngineOutputParser() {
    }

    public static List<RuleOutcome> parse(Path output) throws IOException {
        List<EngineRecord> records = MAPPER.readValue(output.toFile(), new TypeReference<List<EngineRecord>>() {
        });
        List<RuleOutcome> outcomes = new ArrayList<>(records.size());
        for (EngineRecord record : records) {
            if (record == null) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>(record.getDetails() == null ? Map.of() : record.getDetails());
            OutcomeStatus status = OutcomeStatus.parse(record.getStatus()).orElseGet(() -> {
                details.put("raw_status", record.getStatus());
                return OutcomeStatus.FAILED;
            });
            outcomes.add(RuleOutcome.builder()
                    .ruleId(record.getValidationName())
                    .status(status)
                    .message(record.getMessage() == null ? "" : record.getMessage())
                    .details(details)
                    .params(record.getValidationParams() == null ? Map.of() : record.getValidationParams())
                    .build());
        }
        return outcomes;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EngineRecord {
        @JsonProperty("validation_name")
        private String validationName;
        private String status;
        private String message;
        private Map<String, Object> details;
        @JsonProperty("validation_params")
        private Map<String, Object> validationParams;
    }
}
