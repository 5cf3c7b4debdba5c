package com.di.importgate.pipeline;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Result of one rule evaluation. {@code originalStatus} is set only when the
 * outcome has been reclassified by a warn-only override.
 */
@Value
@Builder(toBuilder = true)
public class RuleOutcome {

    String ruleId;
    OutcomeStatus status;
    String message;
    @Builder.Default
    Map<String, Object> details = Collections.emptyMap();
    @Builder.Default
    Map<String, Object> params = Collections.emptyMap();
    OutcomeStatus originalStatus;

    public boolean isFailed() {
        return status == OutcomeStatus.FAILED;
    }

    /** FAILED becomes WARNING, remembering the original status; any other status is returned unchanged. */
    public RuleOutcome downgraded() {
        if (status != OutcomeStatus.FAILED) {
            return this;
        }
        return toBuilder().status(OutcomeStatus.WARNING).originalStatus(status).build();
    }
}
