package com.di.importgate.stage.review;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of {@link SchemaAdvisor} beans keyed by their type.
 *
 * <p>Types are normalized (trimmed, lower case) for lookup. Two advisors declaring
 * the same type fail startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaAdvisorRegistry {

    private final List<SchemaAdvisor> advisors;

    private Map<String, SchemaAdvisor> advisorsByType;

    @PostConstruct
    void initialize() {
        if (advisors == null || advisors.isEmpty()) {
            log.warn("No SchemaAdvisor beans found. Registry will be empty.");
            advisorsByType = Collections.emptyMap();
            return;
        }
        advisors.forEach(this::validateAdvisorType);
        Map<String, List<SchemaAdvisor>> grouped = advisors.stream()
                .collect(Collectors.groupingBy(a -> normalizeType(a.type())));

        String duplicates = grouped.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(e -> String.format("'%s' -> [%s]", e.getKey(), e.getValue().stream()
                        .map(a -> a.getClass().getName())
                        .collect(Collectors.joining(", "))))
                .collect(Collectors.joining(" ; "));
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("Duplicate SchemaAdvisor type() values detected: " + duplicates);
        }

        advisorsByType = grouped.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().get(0)));
        log.info("Registered {} schema advisor type(s): {}", advisorsByType.size(), advisorsByType.keySet());
    }

    /**
     * @param type advisor type from configuration (case-insensitive)
     * @throws IllegalArgumentException if no advisor is registered for the type
     */
    public SchemaAdvisor getAdvisor(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Advisor type cannot be null or blank");
        }
        SchemaAdvisor advisor = advisorsByType.get(normalizeType(type));
        if (advisor == null) {
            throw new IllegalArgumentException(String.format("Unsupported advisor type: '%s'. Available types: %s",
                    type, advisorsByType.keySet()));
        }
        return advisor;
    }

    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(advisorsByType.keySet());
    }

    public boolean hasAdvisor(String type) {
        return type != null && !type.isBlank() && advisorsByType.containsKey(normalizeType(type));
    }

    private void validateAdvisorType(SchemaAdvisor advisor) {
        String type = advisor.type();
        if (type == null || type.isBlank()) {
            throw new IllegalStateException(String.format(
                    "Advisor %s returned blank type(). Advisor type must be non-null and non-blank.",
                    advisor.getClass().getName()));
        }
    }

    private static String normalizeType(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
