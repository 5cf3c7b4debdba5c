package com.di.importgate.stage.review;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One issue reported by a {@link SchemaAdvisor}, as it appears in the advisor's JSON output.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AdvisorFinding {

    /** Issue category, e.g. {@code naming} or {@code unit}. */
    private String type;
    private String message;
    private String suggestion;
    /** Advisor's own severity label; informational only. */
    private String severity;
    private Integer line;
    private String file;
}
