package com.di.importgate.exception;

import com.di.importgate.pipeline.FailureCode;
import lombok.Getter;

/**
 * Base unchecked exception for failures that map to a known {@link FailureCode}.
 */
@Getter
public class ImportGateException extends RuntimeException {

    private final FailureCode failureCode;

    public ImportGateException(FailureCode failureCode, String message) {
        super(message);
        this.failureCode = failureCode;
    }

    public ImportGateException(FailureCode failureCode, String message, Throwable cause) {
        super(message, cause);
        this.failureCode = failureCode;
    }
}
