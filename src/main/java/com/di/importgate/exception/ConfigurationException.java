package com.di.importgate.exception;

import com.di.importgate.pipeline.FailureCode;
import lombok.Getter;

import java.util.List;

/**
 * A rule configuration or warn-only document that cannot be read or does not
 * match the expected template. Carries every problem found, not just the first.
 */
@Getter
public class ConfigurationException extends ImportGateException {

    private final List<String> problems;

    public ConfigurationException(String source, List<String> problems) {
        super(FailureCode.CONFIG_INVALID, String.format("Invalid configuration %s: %s", source, String.join("; ", problems)));
        this.problems = List.copyOf(problems);
    }

    public ConfigurationException(String source, String problem, Throwable cause) {
        super(FailureCode.CONFIG_INVALID, String.format("Invalid configuration %s: %s", source, problem), cause);
        this.problems = List.of(problem);
    }
}
