package com.di.importgate.stage.validation;

import com.di.importgate.config.Rule;
import com.di.importgate.pipeline.RuleOutcome;

import java.nio.file.Path;

/**
 * A validator evaluated in-process instead of by the external rule engine.
 */
public interface LocalValidator {

    /** Validator name as it appears in a rule's {@code validator} field. */
    String validatorName();

    /**
     * @param rule   the rule to evaluate
     * @param report effective structured report, or null when generation produced none
     */
    RuleOutcome evaluate(Rule rule, Path report);
}
