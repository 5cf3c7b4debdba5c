package com.di.importgate.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything a run reports: the ordered records, the verdict and, when the run was
 * cut short, where and why.
 *
 * <p>{@code validation_output.json} holds {@link #getRecords()}; {@code validation_result.json}
 * holds the rest.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"verdict", "dataset", "run_id", "aborted_at", "abort_code", "abort_message", "abort_limit",
        "stages", "failed_count", "warning_count", "records"})
public class ResultDocument {

    Verdict verdict;
    String dataset;
    @JsonProperty("run_id")
    String runId;
    /** Stage that aborted the run, or null. */
    @JsonProperty("aborted_at")
    String abortedAt;
    @JsonProperty("abort_code")
    String abortCode;
    @JsonProperty("abort_message")
    String abortMessage;
    @JsonProperty("abort_limit")
    Long abortLimit;
    /** Stage name to final status, in execution order. */
    @Singular
    Map<String, String> stages;
    @Singular
    List<ResultRecord> records;

    @JsonIgnore
    public boolean isAborted() {
        return abortedAt != null;
    }

    @JsonProperty("failed_count")
    public long failedCount() {
        return records.stream().filter(ResultRecord::isFailed).count();
    }

    @JsonProperty("warning_count")
    public long warningCount() {
        return records.stream().filter(r -> r.getStatus() == RecordStatus.WARNING).count();
    }
}
