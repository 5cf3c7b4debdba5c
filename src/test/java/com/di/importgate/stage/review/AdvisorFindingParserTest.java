package com.di.importgate.stage.review;

import com.di.importgate.exception.AdvisorUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for AdvisorFindingParser.
 */
@DisplayName("AdvisorFindingParser Tests")
class AdvisorFindingParserTest {

    @Test
    @DisplayName("Should parse a plain JSON array and ignore unknown fields")
    void testParse_PlainArray() {
        List<AdvisorFinding> findings = AdvisorFindingParser.parse("""
            [{"type": "naming", "message": "Typo in dcs:Count_Persn", "suggestion": "Use dcs:Count_Person",
              "severity": "error", "line": 3, "file": "a.tmcf", "confidence": 0.9}]
            """, 25);
        assertEquals(1, findings.size());
        AdvisorFinding finding = findings.get(0);
        assertEquals("naming", finding.getType());
        assertEquals(3, finding.getLine());
        assertEquals("a.tmcf", finding.getFile());
    }

    @Test
    @DisplayName("Should accept an array wrapped in a code fence or prose")
    void testParse_Wrapped() {
        assertEquals(1, AdvisorFindingParser.parse("```json\n[{\"message\": \"m\"}]\n```", 25).size());
        assertEquals(1, AdvisorFindingParser.parse("Here is my review:\n[{\"message\": \"m\"}]\nThanks.", 25).size());
    }

    @Test
    @DisplayName("Should treat an empty array as no findings")
    void testParse_Empty() {
        assertTrue(AdvisorFindingParser.parse("[]", 25).isEmpty());
    }

    @Test
    @DisplayName("Should drop findings without a message and cap the rest")
    void testParse_FilterAndCap() {
        List<AdvisorFinding> findings = AdvisorFindingParser.parse(
            "[{\"message\": \"a\"}, {\"message\": \" \"}, {\"type\": \"x\"}, {\"message\": \"b\"}, {\"message\": \"c\"}]", 2);
        assertEquals(List.of("a", "b"), findings.stream().map(AdvisorFinding::getMessage).toList());
    }

    @Test
    @DisplayName("Should fail on blank or malformed output rather than report no issues")
    void testParse_Failures() {
        assertThrows(AdvisorUnavailableException.class, () -> AdvisorFindingParser.parse("", 25));
        assertThrows(AdvisorUnavailableException.class, () -> AdvisorFindingParser.parse(null, 25));
        assertThrows(AdvisorUnavailableException.class, () -> AdvisorFindingParser.parse("No issues found.", 25));
        assertThrows(AdvisorUnavailableException.class, () -> AdvisorFindingParser.parse("[{\"message\": ]", 25));
    }

    @Test
    @DisplayName("Should strip only a leading code fence")
    void testStripCodeFence() {
        assertEquals("[]", AdvisorFindingParser.stripCodeFence("```\n[]\n```"));
        assertEquals("text", AdvisorFindingParser.stripCodeFence("text"));
    }
}
