package com.di.importgate.stage.review;

import com.di.importgate.exception.AdvisorUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Reads advisor output: a JSON array of {@link AdvisorFinding}, optionally wrapped in
 * prose or a fenced code block.
 */
public final class AdvisorFindingParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<AdvisorFinding>> FINDINGS = new TypeReference<>() {
    };

    private AdvisorFindingParser() {
    }

    /**
     * @param text        raw advisor output
     * @param maxFindings findings kept; the rest are dropped
     * @throws AdvisorUnavailableException when no JSON array can be read
     */
    public static List<AdvisorFinding> parse(String text, int maxFindings) {
        if (text == null || text.isBlank()) {
            throw new AdvisorUnavailableException("Advisor returned no output");
        }
        String body = stripCodeFence(text.strip());
        int start = body.indexOf('[');
        int end = body.lastIndexOf(']');
        if (start < 0 || end < start) {
            throw new AdvisorUnavailableException("Advisor output is not a JSON array: " + abbreviate(body));
        }
        List<AdvisorFinding> findings;
        try {
            findings = MAPPER.readValue(body.substring(start, end + 1), FINDINGS);
        } catch (JsonProcessingException e) {
            throw new AdvisorUnavailableException("Advisor output is malformed: " + e.getOriginalMessage(), e);
        }
        List<AdvisorFinding> usable = findings.stream()
                .filter(f -> f != null && f.getMessage() != null && !f.getMessage().isBlank())
                .toList();
        return usable.size() <= maxFindings ? usable : usable.subList(0, maxFindings);
    }

    static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).strip();
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
