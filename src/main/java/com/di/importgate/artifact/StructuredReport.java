package com.di.importgate.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Machine-readable report written by the generation tool ({@code report.json}):
 * counters per level plus individual issue entries.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StructuredReport {

    public static final String LEVEL_INFO = "LEVEL_INFO";
    public static final String LEVEL_WARNING = "LEVEL_WARNING";
    public static final String LEVEL_ERROR = "LEVEL_ERROR";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Map<String, LevelSummary> levelSummary = new LinkedHashMap<>();
    private List<Entry> entries = new ArrayList<>();

    public static StructuredReport read(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), StructuredReport.class);
    }

    /** Counter value at a level, if the report has it. */
    public Optional<Long> counter(String level, String key) {
        LevelSummary summary = levelSummary.get(level);
        if (summary == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(summary.getCounters().get(key));
    }

    /** Sum of the counters at a level whose key passes the filter. */
    public long sumCounters(String level, Predicate<String> keyFilter) {
        LevelSummary summary = levelSummary.get(level);
        if (summary == null) {
            return 0;
        }
        return summary.getCounters().entrySet().stream()
                .filter(e -> keyFilter.test(e.getKey()))
                .mapToLong(e -> e.getValue() == null ? 0 : e.getValue())
                .sum();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LevelSummary {
        private Map<String, Long> counters = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {
        private String level;
        private String counterKey;
        private String userMessage;
        private Location location;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Location {
        private String file;
        private Long lineNumber;
    }
}
