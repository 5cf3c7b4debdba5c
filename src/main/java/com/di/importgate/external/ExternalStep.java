package com.di.importgate.external;

/**
 * Runs an external tool. Implementations never throw for tool failures; they
 * report them through {@link ExternalResult} so that one place,
 * {@link ExternalStepOutcomes}, turns exit status into a stage outcome.
 */
@FunctionalInterface
public interface ExternalStep {

    ExternalResult invoke(ExternalInvocation invocation);
}
