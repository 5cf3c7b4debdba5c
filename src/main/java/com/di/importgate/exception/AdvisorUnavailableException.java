package com.di.importgate.exception;

import com.di.importgate.pipeline.FailureCode;

/**
 * The schema advisor failed to produce output. Never interpreted as "no issues".
 */
public class AdvisorUnavailableException extends ImportGateException {

    public AdvisorUnavailableException(String message) {
        super(FailureCode.REVIEWER_FAILED, message);
    }

    public AdvisorUnavailableException(String message, Throwable cause) {
        super(FailureCode.REVIEWER_FAILED, message, cause);
    }

    /** For failures with a more specific code, e.g. {@link FailureCode#TIMEOUT}. */
    public AdvisorUnavailableException(FailureCode failureCode, String message) {
        super(failureCode, message);
    }
}
