package com.di.importgate.exception;

import com.di.importgate.pipeline.FailureCode;

/**
 * Invalid rule selection: both inclusion and exclusion sets given, an unknown
 * rule id, or a filter that leaves no rules. Reported as a usage error.
 */
public class RuleSelectionException extends ImportGateException {

    public RuleSelectionException(String message) {
        super(FailureCode.USAGE_ERROR, message);
    }
}
