package com.di.importgate.config;

import com.di.importgate.exception.RuleSelectionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for RuleSelector.
 */
@DisplayName("RuleSelector Tests")
class RuleSelectorTest {

    private RuleSelector selector;
    private RuleConfig config;

    @BeforeEach
    void setUp() {
        selector = new RuleSelector();
        config = configOf("check_min_value", "check_unit_consistency", "check_num_places_consistent",
            "check_structural_lint_error_count");
    }

    // ============================================================================
    // Selection Tests
    // ============================================================================

    @Test
    @DisplayName("Should return the config unchanged when no filter is given")
    void testSelect_NoFilter() {
        assertSame(config, selector.select(config, RuleSelection.all()));
        assertSame(config, selector.select(config, null));
    }

    @Test
    @DisplayName("Should keep only included rules in declaration order")
    void testSelect_Include() {
        RuleConfig selected = selector.select(config,
            RuleSelection.of("check_structural_lint_error_count, check_min_value", null));
        assertEquals(List.of("check_min_value", "check_structural_lint_error_count"),
            new ArrayList<>(selected.ruleIds()));
        assertEquals("1.0", selected.getSchemaVersion());
    }

    @Test
    @DisplayName("Should drop excluded rules")
    void testSelect_Exclude() {
        RuleConfig selected = selector.select(config, RuleSelection.of(null, "check_min_value"));
        assertEquals(3, selected.getRules().size());
        assertFalse(selected.ruleIds().contains("check_min_value"));
    }

    @Test
    @DisplayName("Should not modify the input config")
    void testSelect_InputUnchanged() {
        selector.select(config, RuleSelection.of("check_min_value", null));
        assertEquals(4, config.getRules().size());
    }

    // ============================================================================
    // Usage Error Tests
    // ============================================================================

    @Test
    @DisplayName("Should reject inclusion and exclusion together")
    void testSelect_BothSets() {
        RuleSelectionException ex = assertThrows(RuleSelectionException.class,
            () -> selector.select(config, RuleSelection.of("check_min_value", "check_unit_consistency")));
        assertTrue(ex.getMessage().contains("not both"));
    }

    @Test
    @DisplayName("Should reject unknown rule ids and list the valid ones")
    void testSelect_UnknownId() {
        RuleSelectionException ex = assertThrows(RuleSelectionException.class,
            () -> selector.select(config, RuleSelection.of("check_nothing", null)));
        assertTrue(ex.getMessage().contains("check_nothing"));
        assertTrue(ex.getMessage().contains("check_min_value"));
    }

    @Test
    @DisplayName("Should reject a filter that leaves no rules")
    void testSelect_Empty() {
        RuleSelectionException ex = assertThrows(RuleSelectionException.class,
            () -> selector.select(config, RuleSelection.of(null,
                "check_min_value,check_unit_consistency,check_num_places_consistent,check_structural_lint_error_count")));
        assertTrue(ex.getMessage().contains("No rules left"));
    }

    // ============================================================================
    // Property Tests
    // ============================================================================

    @Test
    @DisplayName("Should always return a subset of the input with selected ids matching the filter")
    void testSelect_RandomSubsets() {
        List<String> ids = new ArrayList<>(config.ruleIds());
        Random random = new Random(42);
        for (int i = 0; i < 200; i++) {
            Set<String> picked = new LinkedHashSet<>();
            for (String id : ids) {
                if (random.nextBoolean()) {
                    picked.add(id);
                }
            }
            if (picked.isEmpty()) {
                continue;
            }
            boolean include = random.nextBoolean();
            RuleSelection selection = include ? new RuleSelection(picked, Set.of()) : new RuleSelection(Set.of(), picked);
            if (!include && picked.size() == ids.size()) {
                assertThrows(RuleSelectionException.class, () -> selector.select(config, selection));
                continue;
            }
            RuleConfig selected = selector.select(config, selection);
            assertTrue(config.ruleIds().containsAll(selected.ruleIds()));
            for (String id : selected.ruleIds()) {
                assertEquals(include, picked.contains(id));
            }
            assertEquals(include ? picked.size() : ids.size() - picked.size(), selected.getRules().size());
        }
    }

    @Test
    @DisplayName("Should parse comma-separated ids ignoring blanks")
    void testRuleSelection_Of() {
        RuleSelection selection = RuleSelection.of(" a, ,b ,", "");
        assertEquals(Set.of("a", "b"), selection.include());
        assertTrue(selection.exclude().isEmpty());
        assertTrue(RuleSelection.of(null, " ").isEmpty());
    }

    private static RuleConfig configOf(String... ids) {
        List<Rule> rules = new ArrayList<>();
        for (String id : ids) {
            rules.add(Rule.builder().ruleId(id).description(id).validator("V_" + id.toUpperCase())
                .scope(new RuleScope(DataSource.STATS)).build());
        }
        return new RuleConfig("1.0", rules);
    }
}
