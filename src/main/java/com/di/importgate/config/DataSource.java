package com.di.importgate.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Artifact a rule is evaluated against.
 */
public enum DataSource {
    STATS,
    LINT,
    DIFFER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<DataSource> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(d -> d.wireName().equals(value)).findFirst();
    }

    @JsonCreator
    static DataSource fromJson(String value) {
        return fromWireName(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown data_source: " + value));
    }
}
