package com.di.importgate.config;

import com.di.importgate.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for RuleConfigLoader.
 */
@DisplayName("RuleConfigLoader Tests")
class RuleConfigLoaderTest {

    @TempDir
    Path tempDir;

    private RuleConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new RuleConfigLoader();
    }

    // ============================================================================
    // Loading Tests
    // ============================================================================

    @Test
    @DisplayName("Should load the bundled rule configuration")
    void testLoad_Bundled() {
        RuleConfig config = loader.load(new ClassPathResource("validation_configs/new_import_config.json"));
        assertTrue(config.ruleIds().contains("check_min_value"));
        assertTrue(config.ruleIds().contains("check_structural_lint_error_count"));
        Rule lint = config.getRules().stream()
            .filter(r -> r.getRuleId().equals("check_structural_lint_error_count")).findFirst().orElseThrow();
        assertEquals(DataSource.LINT, lint.getScope().getDataSource());
        assertEquals(0, ((Number) lint.getParams().get("threshold")).intValue());
    }

    @Test
    @DisplayName("Should load YAML documents by extension")
    void testLoad_Yaml() throws Exception {
        Path yaml = tempDir.resolve("rules.yaml");
        Files.writeString(yaml, """
            schema_version: "1.0"
            rules:
              - rule_id: check_min_value
                description: no negatives
                validator: MIN_VALUE_CHECK
                scope:
                  data_source: stats
                  variables: [Count_Person]
                params:
                  minimum: 0
                enabled: false
            """);
        RuleConfig config = loader.load(new FileSystemResource(yaml));
        Rule rule = config.getRules().get(0);
        assertEquals("MIN_VALUE_CHECK", rule.getValidator());
        assertFalse(rule.isActive());
        assertNotNull(rule.getScope().getFilters().get("variables"));
    }

    @Test
    @DisplayName("Should write a config that loads back with the same rules")
    void testWrite() throws Exception {
        RuleConfig config = loader.load(new ClassPathResource("validation_configs/new_import_config.json"));
        Path target = tempDir.resolve("out").resolve("selected_rules.json");
        loader.write(config, target);
        RuleConfig reloaded = loader.load(new FileSystemResource(target));
        assertEquals(config.ruleIds(), reloaded.ruleIds());
        assertTrue(Files.readString(target).contains("\"data_source\" : \"stats\""));
    }

    // ============================================================================
    // Template Validation Tests
    // ============================================================================

    @Test
    @DisplayName("Should report a missing file")
    void testLoad_Missing() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
            () -> loader.load(new FileSystemResource(tempDir.resolve("absent.json"))));
        assertTrue(ex.getMessage().contains("file not found"));
    }

    @Test
    @DisplayName("Should report unparsable JSON")
    void testLoad_Unparsable() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
            () -> loader.load(json("{ not json")));
        assertTrue(ex.getMessage().contains("unreadable"));
    }

    @Test
    @DisplayName("Should collect every template problem")
    void testLoad_TemplateProblems() {
        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> loader.load(json("""
            {
              "version": 2,
              "rules": [
                {"rule_id": "CheckMin", "description": "d", "validator": "V", "scope": {"data_source": "stats"}, "params": {}},
                {"rule_id": "check_a", "validator": "", "scope": {"data_source": "web"}, "params": [], "extra": 1},
                {"rule_id": "check_a", "description": "d", "validator": "V", "scope": {"data_source": "lint"}, "params": {}, "enabled": "yes"}
              ]
            }
            """)));
        String message = ex.getMessage();
        assertTrue(message.contains("unknown top-level key 'version'"));
        assertTrue(message.contains("should be snake_case"));
        assertTrue(message.contains("missing required key 'description'"));
        assertTrue(message.contains("validator must be a non-empty string"));
        assertTrue(message.contains("scope.data_source must be one of"));
        assertTrue(message.contains("params must be an object"));
        assertTrue(message.contains("unknown rule key 'extra'"));
        assertTrue(message.contains("duplicate rule_id 'check_a'"));
        assertTrue(message.contains("enabled must be a boolean"));
        assertTrue(ex.getProblems().size() >= 9);
    }

    @Test
    @DisplayName("Should require a rules array")
    void testLoad_MissingRules() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
            () -> loader.load(json("{\"schema_version\": \"1.0\"}")));
        assertTrue(ex.getMessage().contains("missing required key 'rules'"));

        ex = assertThrows(ConfigurationException.class, () -> loader.load(json("{\"rules\": {}}")));
        assertTrue(ex.getMessage().contains("'rules' must be an array"));
    }

    private static ByteArrayResource json(String content) {
        return new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8), "inline rules");
    }
}
