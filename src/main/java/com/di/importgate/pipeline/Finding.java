package com.di.importgate.pipeline;

import lombok.Builder;
import lombok.Value;

/**
 * One problem found by a checker. Immutable; reclassification produces a copy.
 */
@Value
@Builder(toBuilder = true)
public class Finding {

    String code;
    String message;
    Locator locator;
    /** Threshold that was exceeded, when the finding is a limit breach. */
    Long limit;
    @Builder.Default
    Severity severity = Severity.BLOCKING;
    String suggestion;

    public static Finding blocking(String code, String message, Locator locator) {
        return Finding.builder().code(code).message(message).locator(locator).build();
    }

    public static Finding advisory(String code, String message, Locator locator) {
        return Finding.builder().code(code).message(message).locator(locator).severity(Severity.ADVISORY).build();
    }

    public boolean isBlocking() {
        return severity == Severity.BLOCKING;
    }

    public Finding asAdvisory() {
        return severity == Severity.ADVISORY ? this : toBuilder().severity(Severity.ADVISORY).build();
    }
}
