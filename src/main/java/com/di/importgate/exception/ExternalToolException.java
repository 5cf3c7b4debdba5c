package com.di.importgate.exception;

import com.di.importgate.pipeline.FailureCode;

/**
 * An external process could not be launched, or exited without its expected output.
 */
public class ExternalToolException extends ImportGateException {

    public ExternalToolException(FailureCode failureCode, String message) {
        super(failureCode, message);
    }

    public ExternalToolException(FailureCode failureCode, String message, Throwable cause) {
        super(failureCode, message, cause);
    }
}
