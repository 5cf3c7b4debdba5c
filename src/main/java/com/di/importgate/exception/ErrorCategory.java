package com.di.importgate.exception;

import com.di.importgate.pipeline.FailureCode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Categories for exceptions that escape a stage. The controller uses the category
 * to pick the failure code of the synthesized stage result.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    INPUT_ERROR("Input error", "Missing or malformed input file", FailureCode.MISSING_FILE),
    CONFIGURATION_ERROR("Configuration error", "Rule or override configuration is invalid", FailureCode.CONFIG_INVALID),
    USAGE_ERROR("Usage error", "Conflicting or unknown rule selection", FailureCode.USAGE_ERROR),
    EXTERNAL_TOOL_ERROR("External tool error", "External process failed or produced no output", FailureCode.DATA_PROCESSING_FAILED),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit", FailureCode.TIMEOUT),
    SERIALIZATION_ERROR("Serialization error", "Data serialization or deserialization failure", FailureCode.IO_ERROR),
    IO_ERROR("I/O error", "File system read or write failure", FailureCode.IO_ERROR),
    APPLICATION_ERROR("Application error", "General application error", FailureCode.INTERNAL_ERROR),
    UNKNOWN("Unknown error", "Unclassified or unknown error type", FailureCode.INTERNAL_ERROR);

    private final String name;
    private final String description;
    private final FailureCode failureCode;

    ErrorCategory(String name, String description, FailureCode failureCode) {
        this.name = name;
        this.description = description;
        this.failureCode = failureCode;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public FailureCode getFailureCode() {
        return failureCode;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isUsageError, USAGE_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isExternalToolError, EXTERNAL_TOOL_ERROR);
        MATCHERS.put(ErrorCategory::isInputError, INPUT_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isIoError, IO_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    /**
     * Failure code for an exception: the code it carries when it is an
     * {@link ImportGateException}, otherwise the code of its category.
     */
    public static FailureCode failureCodeOf(Throwable exception) {
        if (exception instanceof ImportGateException gate) {
            return gate.getFailureCode();
        }
        return categorize(exception).getFailureCode();
    }

    // --- Matcher helpers ---

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || (t instanceof ImportGateException g && g.getFailureCode() == FailureCode.TIMEOUT);
    }

    private static boolean isUsageError(Throwable t) {
        return t instanceof RuleSelectionException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof ConfigurationException
                || t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean isExternalToolError(Throwable t) {
        return t instanceof ExternalToolException || t instanceof AdvisorUnavailableException;
    }

    private static boolean isInputError(Throwable t) {
        return t instanceof java.nio.file.NoSuchFileException
                || t instanceof java.io.FileNotFoundException
                || t instanceof java.io.UncheckedIOException u && isInputError(u.getCause());
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || (t instanceof java.io.UncheckedIOException u && u.getCause() instanceof com.fasterxml.jackson.core.JsonProcessingException);
    }

    private static boolean isIoError(Throwable t) {
        return t instanceof java.io.IOException
                || t instanceof java.io.UncheckedIOException
                || t instanceof java.nio.file.FileSystemException;
    }

    @Override
    public String toString() {
        return name();
    }
}
