package com.di.importgate.stage;

import com.di.importgate.config.WarnOnlyPolicy;
import com.di.importgate.pipeline.RuleOutcome;
import com.di.importgate.pipeline.StageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a dataset's warn-only overrides to results that are already final:
 * FAILED rule outcomes named by the policy become WARNING, and a stage whose own
 * policy rule is named is downgraded to advisory.
 *
 * <p>Never mutates its input. Every change keeps the original status for audit.
 */
@Slf4j
@Service
public class OutcomeReclassifier {

    public List<StageResult> reclassify(String dataset, List<StageResult> results, WarnOnlyPolicy policy) {
        List<StageResult> reclassified = new ArrayList<>(results.size());
        int changed = 0;
        for (StageResult result : results) {
            StageResult updated = reclassify(dataset, result, policy);
            if (updated != result) {
                changed++;
            }
            reclassified.add(updated);
        }
        log.info("[RECLASSIFY] dataset={}: {} stage result(s) changed by warn-only overrides", dataset, changed);
        return List.copyOf(reclassified);
    }

    StageResult reclassify(String dataset, StageResult result, WarnOnlyPolicy policy) {
        StageResult current = result;
        String policyRule = result.getPolicyRuleId();
        if (policyRule != null && result.isBlockingFailure() && policy.isWarnOnly(dataset, policyRule)) {
            log.info("[RECLASSIFY] Stage {} downgraded by warn-only rule {}", result.getStage().stageName(), policyRule);
            current = current.downgraded("warn-only override for " + policyRule);
        }

        boolean outcomeChanged = false;
        List<RuleOutcome> outcomes = new ArrayList<>(current.getOutcomes().size());
        for (RuleOutcome outcome : current.getOutcomes()) {
            if (outcome.isFailed() && policy.isWarnOnly(dataset, outcome.getRuleId())) {
                log.info("[RECLASSIFY] Rule {} FAILED -> WARNING", outcome.getRuleId());
                outcomes.add(outcome.downgraded());
                outcomeChanged = true;
            } else {
                outcomes.add(outcome);
            }
        }
        if (outcomeChanged) {
            current = current.toBuilder().clearOutcomes().outcomes(outcomes).build();
        }
        return current;
    }
}
