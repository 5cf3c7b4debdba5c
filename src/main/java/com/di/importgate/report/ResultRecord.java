package com.di.importgate.report;

import com.di.importgate.pipeline.Severity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of {@code validation_output.json}: a stage finding or a rule outcome.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"validation_name", "stage", "status", "severity", "message", "details", "validation_params", "original_status"})
public class ResultRecord {

    /** Finding code or rule id. */
    @JsonProperty("validation_name")
    private String validationName;

    private String stage;

    private RecordStatus status;

    private Severity severity;

    private String message;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    @JsonProperty("validation_params")
    private Map<String, Object> validationParams;

    /** Status before a warn-only override; absent when never reclassified. */
    @JsonProperty("original_status")
    private String originalStatus;

    @JsonIgnore
    public boolean isFailed() {
        return status == RecordStatus.FAILED;
    }
}
