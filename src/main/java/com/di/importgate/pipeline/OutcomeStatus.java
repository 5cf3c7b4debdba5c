package com.di.importgate.pipeline;

import java.util.Locale;
import java.util.Optional;

/**
 * Status of a single rule evaluated by the validation engine or a local validator.
 */
public enum OutcomeStatus {
    PASSED,
    FAILED,
    WARNING;

    /**
     * Parses an engine status string, case-insensitively.
     *
     * @return empty when the engine reported a status outside this enum (e.g. CONFIG_ERROR)
     */
    public static Optional<OutcomeStatus> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
